package fr.lapetina.tr064.infrastructure.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class RouterResponseTest {

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    @DisplayName("should detect an upper-case html content type under any default locale")
    void shouldDetectHtmlContentTypeIndependentOfLocale() {
        RouterResponse response = new RouterResponse(404, "TEXT/HTML; CHARSET=ISO-8859-1", "not found");

        assertThat(response.isHtml()).isTrue();
    }

    @Test
    @DisplayName("should not treat an xml answer as html")
    void shouldNotTreatXmlAsHtml() {
        RouterResponse response = new RouterResponse(200, "TEXT/XML; CHARSET=\"UTF-8\"", "<root/>");

        assertThat(response.isHtml()).isFalse();
        assertThat(response.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("should detect an html body without content type")
    void shouldDetectHtmlBody() {
        assertThat(new RouterResponse(200, null, "  <!DOCTYPE HTML><html></html>").isHtml()).isTrue();
    }
}
