package fr.lapetina.tr064.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DescriptorModelTest {

    private static Service service(String serviceId) {
        return new Service("urn:dslforum-org:service:X:1", serviceId, "/ctl", "/evt", "/scpd.xml",
                Map.of(), Map.of());
    }

    private static Device device(List<Service> services, List<Device> devices) {
        return new Device("type", "name", null, null, null, "model", null, null, null, null, services, devices);
    }

    @Test
    @DisplayName("should name a service after the last colon segment of its id")
    void shouldDeriveServiceName() {
        assertThat(service("urn:WANIPConnection-com:serviceId:WANIPConn1").name()).isEqualTo("WANIPConn1");
        assertThat(service("plain").name()).isEqualTo("plain");
    }

    @Test
    @DisplayName("should resolve argument data types through the state variable table")
    void shouldResolveDataType() {
        Argument uptime = new Argument("NewUptime", Argument.Direction.OUT, "Uptime");
        Argument dangling = new Argument("NewOther", Argument.Direction.OUT, "Missing");
        Service loaded = service("urn:x:serviceId:WANIPConn1").withSchema(
                Map.of("GetStatusInfo", new Action("GetStatusInfo", List.of(uptime))),
                Map.of("Uptime", StateVariable.of("Uptime", "ui4")));

        assertThat(loaded.dataTypeOf(uptime)).isEqualTo("ui4");
        assertThat(loaded.dataTypeOf(dangling)).isNull();
        assertThat(loaded.action("GetStatusInfo")).isPresent();
        assertThat(loaded.action("Nope")).isEmpty();
    }

    @Test
    @DisplayName("should split arguments by direction keeping order")
    void shouldSplitArgumentsByDirection() {
        Action action = new Action("GetGenericHostEntry", List.of(
                new Argument("NewIndex", Argument.Direction.IN, "Index"),
                new Argument("NewIPAddress", Argument.Direction.OUT, "IPAddress"),
                new Argument("NewMACAddress", Argument.Direction.OUT, "MACAddress")));

        assertThat(action.inArguments()).extracting(Argument::name).containsExactly("NewIndex");
        assertThat(action.outArguments()).extracting(Argument::name)
                .containsExactly("NewIPAddress", "NewMACAddress");
        assertThat(new Action("Reboot", null).arguments()).isEmpty();
    }

    @Test
    @DisplayName("should parse argument directions leniently")
    void shouldParseDirection() {
        assertThat(Argument.Direction.fromDescriptor("out")).isEqualTo(Argument.Direction.OUT);
        assertThat(Argument.Direction.fromDescriptor(" OUT ")).isEqualTo(Argument.Direction.OUT);
        assertThat(Argument.Direction.fromDescriptor("in")).isEqualTo(Argument.Direction.IN);
        assertThat(Argument.Direction.fromDescriptor(null)).isEqualTo(Argument.Direction.IN);
    }

    @Test
    @DisplayName("should flatten nested devices depth first")
    void shouldFlattenDeviceTree() {
        Service a = service("urn:x:serviceId:A1");
        Service b = service("urn:x:serviceId:B1");
        Service c = service("urn:x:serviceId:C1");
        Service d = service("urn:x:serviceId:D1");
        Device root = device(List.of(a), List.of(
                device(List.of(b), List.of(device(List.of(c), List.of()))),
                device(List.of(d), List.of())));

        assertThat(root.allServices()).extracting(Service::name).containsExactly("A1", "B1", "C1", "D1");
    }

    @Test
    @DisplayName("should map services across the whole tree")
    void shouldMapServices() {
        Device root = device(List.of(service("urn:x:serviceId:A1")),
                List.of(device(List.of(service("urn:x:serviceId:B1")), List.of())));
        DeviceDescription description = new DeviceDescription("1.0", null, root);

        DeviceDescription mapped = description.mapServices(s -> s.withSchema(
                Map.of("Ping", new Action("Ping", List.of())), Map.of()));

        assertThat(mapped.device().allServices()).allSatisfy(s -> assertThat(s.actions()).containsKey("Ping"));
        assertThat(description.device().allServices()).allSatisfy(s -> assertThat(s.actions()).isEmpty());
        assertThat(mapped.systemVersion()).isEqualTo(SystemVersion.UNKNOWN);
        assertThat(mapped.modelName()).isEqualTo("model");
    }

    @Test
    @DisplayName("should format and compare firmware versions")
    void shouldCompareSystemVersions() {
        SystemVersion version = new SystemVersion("226", "154", "07", "29", "91234", "154.07.29");

        assertThat(version.version()).isEqualTo("07.29");
        assertThat(version.isAtLeast(7, 24)).isTrue();
        assertThat(version.isAtLeast(7, 29)).isTrue();
        assertThat(version.isAtLeast(7, 30)).isFalse();
        assertThat(version.isAtLeast(8, 0)).isFalse();
        assertThat(SystemVersion.UNKNOWN.version()).isNull();
        assertThat(SystemVersion.UNKNOWN.isAtLeast(0, 0)).isFalse();
    }
}
