package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.domain.model.Service;
import fr.lapetina.tr064.infrastructure.http.Credentials;
import fr.lapetina.tr064.infrastructure.http.FakeRouter;
import fr.lapetina.tr064.infrastructure.http.RouterHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaBuilderTest {

    /**
     * Serves the classpath fixtures, with per-location overrides, and records what was asked for.
     */
    static class StubFetcher implements DocumentFetcher {
        private final DocumentFetcher fixtures = LocalDocumentFetcher.ofClasspath("descriptors");
        private final Map<String, String> overrides = new HashMap<>();
        private final List<String> fetched = new CopyOnWriteArrayList<>();

        StubFetcher override(String location, String content) {
            overrides.put(location, content);
            return this;
        }

        @Override
        public String fetch(String location) {
            fetched.add(location);
            String override = overrides.get(location);
            return override != null ? override : fixtures.fetch(location);
        }
    }

    @Test
    @DisplayName("should register the services of every nested device")
    void shouldRegisterNestedServices() {
        RouterSchema schema = new SchemaBuilder(new StubFetcher()).discover(false);

        assertThat(schema.registry().getServiceNames()).containsExactly(
                "DeviceInfo1", "DeviceConfig1", "LANConfigSecurity1", "X_AVM-DE_Broken1", "X_AVM-DE_Missing1",
                "WLANConfiguration1", "WLANConfiguration2", "WANIPConn1");
        assertThat(schema.modelName()).isEqualTo("FRITZ!Box 7590");
        assertThat(schema.systemVersion()).isEqualTo("07.29");
        assertThat(schema.systemDisplay()).isEqualTo("154.07.29");
    }

    @Test
    @DisplayName("should load the action schema of every service")
    void shouldLoadActionSchemas() {
        RouterSchema schema = new SchemaBuilder(new StubFetcher()).discover(false);

        Service wan = schema.registry().getService("WANIPConn1").orElseThrow();
        assertThat(wan.actions()).containsKeys("GetStatusInfo", "ForceTermination");
        assertThat(wan.stateVariable("Uptime")).isPresent();
        assertThat(schema.registry().getService("WLANConfiguration2").orElseThrow().actions())
                .containsKey("SetEnable");
    }

    @Test
    @DisplayName("should read secondary descriptors only when authenticated")
    void shouldReadSecondaryDescriptorsWhenAuthenticated() {
        StubFetcher anonymousFetcher = new StubFetcher();
        RouterSchema anonymous = new SchemaBuilder(anonymousFetcher).discover(false);
        StubFetcher authenticatedFetcher = new StubFetcher();
        RouterSchema authenticated = new SchemaBuilder(authenticatedFetcher).discover(true);

        assertThat(anonymousFetcher.fetched).doesNotContain("igddesc.xml");
        assertThat(anonymous.descriptions()).hasSize(1);
        assertThat(authenticated.descriptions()).hasSize(2);
        assertThat(authenticated.registry().getService("L3Fwd1")).isPresent();
        assertThat(authenticated.registry().size()).isEqualTo(anonymous.registry().size() + 2);
    }

    @Test
    @DisplayName("should fail with a hint when the primary descriptor is missing")
    void shouldFailWithoutPrimaryDescriptor() {
        SchemaBuilder builder = new SchemaBuilder(location -> {
            throw new ResourceUnavailableException("Resource not available: " + location);
        });

        assertThatThrownBy(() -> builder.discover(false))
                .isInstanceOf(RouterConnectionException.class)
                .hasMessageContaining("access for applications")
                .hasCauseInstanceOf(ResourceUnavailableException.class);
    }

    @Test
    @DisplayName("should fail when the primary descriptor is malformed")
    void shouldFailOnMalformedPrimaryDescriptor() {
        SchemaBuilder builder = new SchemaBuilder(new StubFetcher().override("tr64desc.xml", "<root>"));

        assertThatThrownBy(() -> builder.discover(false))
                .isInstanceOf(RouterConnectionException.class)
                .hasMessageContaining("tr64desc.xml");
    }

    @Test
    @DisplayName("should propagate transport failures of the primary descriptor")
    void shouldPropagateTransportFailure() {
        SchemaBuilder builder = new SchemaBuilder(location -> {
            throw new RouterConnectionException("Connection refused");
        });

        assertThatThrownBy(() -> builder.discover(true))
                .isInstanceOf(RouterConnectionException.class)
                .hasMessage("Connection refused");
    }

    @Test
    @DisplayName("should skip a secondary descriptor that cannot be loaded")
    void shouldSkipFailingSecondaryDescriptor() {
        SchemaBuilder builder = new SchemaBuilder(new StubFetcher(), "tr64desc.xml",
                List.of("missingdesc.xml", "igddesc.xml"));

        RouterSchema schema = builder.discover(true);

        assertThat(schema.descriptions()).hasSize(2);
        assertThat(schema.registry().getService("L3Fwd1")).isPresent();
    }

    @Test
    @DisplayName("should keep services whose action schema fails with empty tables")
    void shouldKeepServicesWithBrokenSchema() {
        RouterSchema schema = new SchemaBuilder(new StubFetcher()).discover(false);

        Service broken = schema.registry().getService("X_AVM-DE_Broken1").orElseThrow();
        Service missing = schema.registry().getService("X_AVM-DE_Missing1").orElseThrow();
        assertThat(broken.actions()).isEmpty();
        assertThat(broken.stateVariables()).isEmpty();
        assertThat(missing.actions()).isEmpty();
    }

    @Test
    @DisplayName("should replace, not merge, on rediscovery")
    void shouldReplaceOnRediscovery() {
        StubFetcher fetcher = new StubFetcher();
        SchemaBuilder builder = new SchemaBuilder(fetcher);
        RouterSchema first = builder.discover(false);

        fetcher.override("tr64desc.xml", "<root><device><modelName>Other</modelName><serviceList><service>"
                + "<serviceType>urn:dslforum-org:service:Time:1</serviceType>"
                + "<serviceId>urn:Time-com:serviceId:Time1</serviceId>"
                + "<controlURL>/upnp/control/time</controlURL>"
                + "<SCPDURL>/any.xml</SCPDURL>"
                + "</service></serviceList></device></root>");
        RouterSchema second = builder.discover(false);

        assertThat(second).isNotSameAs(first);
        assertThat(second.registry().getServiceNames()).containsExactly("Time1");
        assertThat(first.registry().getService("WANIPConn1")).isPresent();
    }

    @Test
    @DisplayName("should let a later service replace an earlier one with the same name")
    void shouldReplaceDuplicateNames() {
        String duplicate = "<root><device><modelName>IGD</modelName><serviceList><service>"
                + "<serviceType>urn:schemas-upnp-org:service:WANIPConnection:1</serviceType>"
                + "<serviceId>urn:upnp-org:serviceId:WANIPConn1</serviceId>"
                + "<controlURL>/igdupnp/control/WANIPConn1</controlURL>"
                + "<SCPDURL>/wanipconnSCPD.xml</SCPDURL>"
                + "</service></serviceList></device></root>";
        StubFetcher fetcher = new StubFetcher().override("igddesc.xml", duplicate);

        RouterSchema schema = new SchemaBuilder(fetcher).discover(true);

        Service wan = schema.registry().getService("WANIPConn1").orElseThrow();
        assertThat(wan.controlUrl()).isEqualTo("/igdupnp/control/WANIPConn1");
        assertThat(schema.registry().getServiceNames()).filteredOn("WANIPConn1"::equals).hasSize(1);
    }

    @Test
    @DisplayName("should keep a service whose SCPD location is not a valid URI")
    void shouldKeepServiceWithInvalidScpdUrl() throws Exception {
        try (FakeRouter router = new FakeRouter()) {
            router.onDocument("/tr64desc.xml", 200, "text/xml",
                    "<root><device><modelName>FRITZ!Box 7590</modelName><serviceList>"
                            + "<service>"
                            + "<serviceType>urn:dslforum-org:service:DeviceInfo:1</serviceType>"
                            + "<serviceId>urn:DeviceInfo-com:serviceId:DeviceInfo1</serviceId>"
                            + "<controlURL>/upnp/control/deviceinfo</controlURL>"
                            + "<SCPDURL>/device info SCPD.xml</SCPDURL>"
                            + "</service><service>"
                            + "<serviceType>urn:dslforum-org:service:WANIPConnection:1</serviceType>"
                            + "<serviceId>urn:WANIPConnection-com:serviceId:WANIPConn1</serviceId>"
                            + "<controlURL>/upnp/control/wanipconnection1</controlURL>"
                            + "<SCPDURL>/wanipconnSCPD.xml</SCPDURL>"
                            + "</service></serviceList></device></root>");
            RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

            RouterSchema schema = new SchemaBuilder(client).discover(false);

            assertThat(schema.registry().getServiceNames()).containsExactly("DeviceInfo1", "WANIPConn1");
            assertThat(schema.registry().getService("DeviceInfo1").orElseThrow().actions()).isEmpty();
            assertThat(schema.registry().getService("WANIPConn1").orElseThrow().actions())
                    .containsKey("GetStatusInfo");
        }
    }
}
