package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import fr.lapetina.tr064.domain.model.Action;
import fr.lapetina.tr064.domain.model.Argument;
import fr.lapetina.tr064.domain.model.StateVariable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScpdParserTest {

    private final ScpdParser parser = new ScpdParser();
    private final DocumentFetcher fixtures = LocalDocumentFetcher.ofClasspath("descriptors");

    @Test
    @DisplayName("should parse actions with ordered arguments")
    void shouldParseActions() {
        ServiceSchema schema = parser.parse(fixtures.fetch("wanipconnSCPD.xml"));

        assertThat(schema.actions().keySet())
                .containsExactly("GetStatusInfo", "ForceTermination", "GetExternalIPAddress", "GetInfo");
        Action status = schema.actions().get("GetStatusInfo");
        assertThat(status.arguments()).extracting(Argument::name)
                .containsExactly("NewConnectionStatus", "NewLastConnectionError", "NewUptime");
        assertThat(status.arguments()).allMatch(Argument::isOut);
        assertThat(schema.actions().get("ForceTermination").arguments()).isEmpty();
    }

    @Test
    @DisplayName("should parse state variables with allowed values")
    void shouldParseStateVariables() {
        ServiceSchema schema = parser.parse(fixtures.fetch("wanipconnSCPD.xml"));

        StateVariable status = schema.stateVariables().get("ConnectionStatus");
        assertThat(status.dataType()).isEqualTo("string");
        assertThat(status.sendEvents()).isTrue();
        assertThat(status.allowedValues()).containsExactly("Unconfigured", "Connecting", "Connected", "Disconnected");
        assertThat(schema.stateVariables().get("Uptime").dataType()).isEqualTo("ui4");
        assertThat(schema.stateVariables().get("Uptime").sendEvents()).isFalse();
    }

    @Test
    @DisplayName("should parse default value and allowed range")
    void shouldParseRange() {
        StateVariable port = parser.parse(fixtures.fetch("deviceinfoSCPD.xml"))
                .stateVariables().get("X_AVM-DE_SecurityPort");

        assertThat(port.defaultValue()).isEqualTo("49443");
        assertThat(port.allowedValueRange()).isNotNull();
        assertThat(port.allowedValueRange().minimum()).isEqualTo("1");
        assertThat(port.allowedValueRange().maximum()).isEqualTo("65535");
        assertThat(port.allowedValueRange().step()).isEqualTo("1");
    }

    @Test
    @DisplayName("should accept a schema without actions")
    void shouldAcceptEmptySchema() {
        ServiceSchema schema = parser.parse(fixtures.fetch("any.xml"));

        assertThat(schema.actions()).isEmpty();
        assertThat(schema.stateVariables()).isEmpty();
    }

    @Test
    @DisplayName("should reject arguments referencing undeclared state variables")
    void shouldRejectDanglingReference() {
        assertThatThrownBy(() -> parser.parse(fixtures.fetch("brokenSCPD.xml")))
                .isInstanceOf(MalformedDescriptorException.class)
                .hasMessageContaining("Undeclared");
    }

    @Test
    @DisplayName("should reject arguments without a state variable reference")
    void shouldRejectMissingReference() {
        String xml = "<scpd><actionList><action><name>A</name><argumentList>"
                + "<argument><name>X</name><direction>in</direction></argument>"
                + "</argumentList></action></actionList><serviceStateTable/></scpd>";

        assertThatThrownBy(() -> parser.parse(xml)).isInstanceOf(MalformedDescriptorException.class);
    }
}
