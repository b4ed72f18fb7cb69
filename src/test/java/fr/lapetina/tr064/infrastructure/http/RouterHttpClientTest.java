package fr.lapetina.tr064.infrastructure.http;

import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterAuthorizationException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterHttpClientTest {

    private FakeRouter router;

    @BeforeEach
    void setUp() throws IOException {
        router = new FakeRouter();
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    @DisplayName("should build base URLs with protocol default ports")
    void shouldBuildBaseUrls() {
        assertThat(RouterHttpClient.buildBaseUrl("192.168.178.1", null, false))
                .isEqualTo("http://192.168.178.1:49000");
        assertThat(RouterHttpClient.buildBaseUrl("192.168.178.1", null, true))
                .isEqualTo("https://192.168.178.1:49443");
        assertThat(RouterHttpClient.buildBaseUrl("fritz.box", 8080, false))
                .isEqualTo("http://fritz.box:8080");
    }

    @Test
    @DisplayName("should replace a scheme given in the address")
    void shouldReplaceScheme() {
        assertThat(RouterHttpClient.buildBaseUrl("http://fritz.box/", null, true))
                .isEqualTo("https://fritz.box:49443");
        assertThat(RouterHttpClient.buildBaseUrl("https://fritz.box", null, false))
                .isEqualTo("http://fritz.box:49000");
    }

    @Test
    @DisplayName("should fetch a descriptor document")
    void shouldFetchDocument() {
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

        String document = client.fetch("tr64desc.xml");

        assertThat(document).contains("<modelName>FRITZ!Box 7590</modelName>");
        assertThat(router.getRequests()).extracting(FakeRouter.RecordedRequest::path)
                .containsExactly("/tr64desc.xml");
    }

    @Test
    @DisplayName("should report an HTML answer as unavailable resource")
    void shouldReportHtmlAsUnavailable() {
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

        assertThatThrownBy(() -> client.fetch("/missing.xml"))
                .isInstanceOf(ResourceUnavailableException.class)
                .hasMessageContaining("/missing.xml");
    }

    @Test
    @DisplayName("should report HTML even when served with status 200")
    void shouldReportHtmlPageWithSuccessStatus() {
        router.onDocument("/tr64desc.xml", 200, "text/html", "<html><body>Login</body></html>");
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

        assertThatThrownBy(() -> client.fetch("tr64desc.xml"))
                .isInstanceOf(ResourceUnavailableException.class);
    }

    @Test
    @DisplayName("should raise an authorization error on 401 for documents")
    void shouldRaiseAuthorizationErrorOnDocument401() {
        router.onDocument("/secret.xml", 401, "text/xml", "<error/>");
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

        assertThatThrownBy(() -> client.fetch("/secret.xml"))
                .isInstanceOf(RouterAuthorizationException.class);
    }

    @Test
    @DisplayName("should answer a digest challenge and retry once")
    void shouldAnswerDigestChallenge() {
        router.requireDigest("admin", "secret")
                .onAction("GetInfo", 200, "<ok/>");
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("admin", "secret"));

        RouterResponse response = client.post("/upnp/control/deviceinfo",
                Map.of("SOAPACTION", "urn:dslforum-org:service:DeviceInfo:1#GetInfo"), "<body/>");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(router.getPosts()).hasSize(2);
        assertThat(router.getPosts().get(0).authorization()).isNull();
        assertThat(router.getPosts().get(1).authorization()).startsWith("Digest ");
    }

    @Test
    @DisplayName("should authorize up front once a challenge is known")
    void shouldAuthorizeUpFront() {
        router.requireDigest("admin", "secret")
                .onAction("GetInfo", 200, "<ok/>");
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("admin", "secret"));
        Map<String, String> headers = Map.of("SOAPACTION", "urn:x#GetInfo");

        client.post("/upnp/control/deviceinfo", headers, "<body/>");
        client.post("/upnp/control/deviceinfo", headers, "<body/>");

        assertThat(router.getPosts()).hasSize(3);
        assertThat(router.getPosts().get(2).authorization()).contains("nc=00000002");
    }

    @Test
    @DisplayName("should return 401 when the credentials are wrong")
    void shouldReturn401ForWrongCredentials() {
        router.requireDigest("admin", "secret");
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("admin", "wrong"));

        RouterResponse response = client.post("/upnp/control/deviceinfo",
                Map.of("SOAPACTION", "urn:x#GetInfo"), "<body/>");

        assertThat(response.statusCode()).isEqualTo(401);
        assertThat(response.isHtml()).isTrue();
    }

    @Test
    @DisplayName("should raise a connection error when nothing listens")
    void shouldRaiseConnectionError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        RouterHttpClient client = new RouterHttpClient("http://127.0.0.1:" + port, new Credentials("", ""),
                Duration.ofSeconds(2), Duration.ofSeconds(2), null, new DigestAuthenticator());

        assertThatThrownBy(() -> client.fetch("tr64desc.xml"))
                .isInstanceOf(RouterConnectionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should resolve absolute and relative locations")
    void shouldResolveLocations() {
        RouterHttpClient client = new RouterHttpClient("http://fritz.box:49000/", new Credentials("", ""));

        assertThat(client.getBaseUrl()).isEqualTo("http://fritz.box:49000");
        assertThat(client.resolve("tr64desc.xml").toString()).isEqualTo("http://fritz.box:49000/tr64desc.xml");
        assertThat(client.resolve("/any.xml").toString()).isEqualTo("http://fritz.box:49000/any.xml");
        assertThat(client.resolve("http://other:1/x.xml").toString()).isEqualTo("http://other:1/x.xml");
    }

    @Test
    @DisplayName("should drop a path and port given in the address")
    void shouldDropPathAndPortFromAddress() {
        assertThat(RouterHttpClient.buildBaseUrl("http://192.168.178.1:49000/", null, false))
                .isEqualTo("http://192.168.178.1:49000");
        assertThat(RouterHttpClient.buildBaseUrl("fritz.box:80/login.lua", 49443, true))
                .isEqualTo("https://fritz.box:49443");
        assertThat(RouterHttpClient.hostOf("https://fritz.box:443/")).isEqualTo("fritz.box");
        assertThat(RouterHttpClient.hostOf("[fe80::1]:49000")).isEqualTo("[fe80::1]");
        assertThat(RouterHttpClient.hostOf("192.168.178.1")).isEqualTo("192.168.178.1");
    }

    @Test
    @DisplayName("should build web interface URLs on the standard ports")
    void shouldBuildWebBaseUrls() {
        assertThat(RouterHttpClient.buildWebBaseUrl("192.168.178.1", null, false))
                .isEqualTo("http://192.168.178.1");
        assertThat(RouterHttpClient.buildWebBaseUrl("http://192.168.178.1:49000/", null, true))
                .isEqualTo("https://192.168.178.1");
        assertThat(RouterHttpClient.buildWebBaseUrl("fritz.box", 8080, false))
                .isEqualTo("http://fritz.box:8080");
    }

    @Test
    @DisplayName("should reject a location that is not a valid URI as a connection error")
    void shouldRejectInvalidLocation() {
        RouterHttpClient client = new RouterHttpClient(router.getBaseUrl(), new Credentials("", ""));

        assertThatThrownBy(() -> client.fetch("/device info SCPD.xml"))
                .isInstanceOf(RouterConnectionException.class)
                .hasMessageContaining("/device info SCPD.xml")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(router.getRequests()).isEmpty();
    }
}
