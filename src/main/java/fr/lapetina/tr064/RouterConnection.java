package fr.lapetina.tr064;

import fr.lapetina.tr064.domain.error.ActionNotFoundException;
import fr.lapetina.tr064.domain.error.RouterException;
import fr.lapetina.tr064.domain.error.ServiceNotFoundException;
import fr.lapetina.tr064.domain.model.Service;
import fr.lapetina.tr064.infrastructure.cache.SchemaCache;
import fr.lapetina.tr064.infrastructure.config.ConfigLoader;
import fr.lapetina.tr064.infrastructure.config.RouterConfig;
import fr.lapetina.tr064.infrastructure.discovery.BoxInfo;
import fr.lapetina.tr064.infrastructure.discovery.DocumentFetcher;
import fr.lapetina.tr064.infrastructure.discovery.RouterSchema;
import fr.lapetina.tr064.infrastructure.discovery.SchemaBuilder;
import fr.lapetina.tr064.infrastructure.discovery.XmlSupport;
import fr.lapetina.tr064.infrastructure.http.Credentials;
import fr.lapetina.tr064.infrastructure.http.DigestAuthenticator;
import fr.lapetina.tr064.infrastructure.http.RouterHttpClient;
import fr.lapetina.tr064.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tr064.infrastructure.soap.SoapActionInvoker;
import fr.lapetina.tr064.monitor.CallMonitor;
import fr.lapetina.tr064.monitor.MonitorOptions;
import fr.lapetina.tr064.monitor.TcpSocketConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import javax.net.ssl.SSLContext;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection to a TR-064 router.
 * This is the primary entry point: it discovers the router's services and
 * calls their actions by name.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterConnection router = RouterConnection.builder()
 *         .address("192.168.178.1")
 *         .password("secret")
 *         .build()) {
 *     Map<String, Object> status = router.callAction("WANIPConn1", "GetStatusInfo");
 *     // status.get("NewUptime") is a Long
 * }
 * }</pre>
 *
 * <p>Discovery runs once during construction; {@link #rediscover()} replaces the
 * schema as a whole. Action calls are synchronous and may be issued from several
 * threads.
 */
public class RouterConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterConnection.class);

    public static final String DEFAULT_ADDRESS = "169.254.1.1";
    public static final String DEFAULT_USER = "dslf-config";

    private final RouterConfig config;
    private final RouterHttpClient httpClient;
    private final DocumentFetcher documentFetcher;
    private final RouterHttpClient webClient;
    private final DocumentFetcher webFetcher;
    private final MetricsRegistry metricsRegistry;
    private final boolean ownsMetricsRegistry;
    private final SchemaBuilder schemaBuilder;
    private final SoapActionInvoker invoker;
    private final SchemaCache schemaCache;
    private final AtomicReference<RouterSchema> schema = new AtomicReference<>();

    protected RouterConnection(Builder builder) {
        this.config = builder.config;
        RouterConfig.RouterEndpointConfig endpoint = config.getRouter();
        log.info("Initializing RouterConnection: address={}, tls={}, user={}",
                endpoint.getAddress(), endpoint.isUseTls(), endpoint.getUser());

        this.ownsMetricsRegistry = builder.metricsRegistry == null && config.getMetrics().isEnabled();
        this.metricsRegistry = ownsMetricsRegistry
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : builder.metricsRegistry;

        this.httpClient = builder.httpClient != null ? builder.httpClient : createHttpClient(builder.sslContext);
        this.documentFetcher = builder.documentFetcher != null ? builder.documentFetcher : httpClient;
        this.webClient = createWebClient(builder.sslContext);
        this.webFetcher = builder.documentFetcher != null ? builder.documentFetcher : webClient;
        this.schemaBuilder = new SchemaBuilder(
                documentFetcher,
                config.getDiscovery().getPrimaryDescriptor(),
                config.getDiscovery().getSecondaryDescriptors());
        this.invoker = new SoapActionInvoker(httpClient, metricsRegistry);
        this.schemaCache = config.getCache().isEnabled() ? createSchemaCache() : null;

        this.schema.set(loadSchema());
        updateServiceGauge();

        resolveDefaultUser();
        log.info("RouterConnection initialized: model={}, version={}, services={}",
                getModelName(), getSystemVersion(), schema.get().registry().size());
    }

    /**
     * Creates a connection from the specified configuration file.
     */
    public static RouterConnection create(String configPath) {
        RouterConfig config = new ConfigLoader(configPath).load();
        return builder().fromConfig(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Calls an action without arguments.
     */
    public Map<String, Object> callAction(String serviceName, String actionName) {
        return callAction(serviceName, actionName, Map.of());
    }

    /**
     * Calls an action.
     *
     * @param serviceName service name, normalized with {@link #normalizeServiceName}
     * @param actionName  action name as listed in the service's schema
     * @param arguments   in-arguments in the order they are sent
     * @return the out-arguments of the response
     * @throws ServiceNotFoundException if no such service was discovered
     * @throws ActionNotFoundException  if the service has no such action; nothing is sent then
     */
    public Map<String, Object> callAction(String serviceName, String actionName, Map<String, ?> arguments) {
        String name = normalizeServiceName(serviceName);
        Service service = schema.get().registry().getService(name)
                .orElseThrow(() -> new ServiceNotFoundException(name));
        if (service.action(actionName).isEmpty()) {
            throw new ActionNotFoundException(name, actionName);
        }
        return invoker.invoke(service, actionName, arguments != null ? arguments : Map.of());
    }

    /**
     * Normalizes a service name: every ':' is removed, and "1" is appended when the
     * result does not end with a digit. "WANIPConnection" becomes "WANIPConnection1",
     * "WLANConfiguration:2" becomes "WLANConfiguration2".
     */
    public static String normalizeServiceName(String serviceName) {
        String name = serviceName == null ? "" : serviceName.replace(":", "");
        if (name.isEmpty() || !Character.isDigit(name.charAt(name.length() - 1))) {
            name = name + "1";
        }
        return name;
    }

    /**
     * Terminates the WAN connection; the router dials in again and usually gets a new external address.
     */
    public void reconnect() {
        log.info("Requesting WAN reconnect");
        callAction("WANIPConn1", "ForceTermination");
    }

    /**
     * Reboots the router.
     */
    public void reboot() {
        log.info("Requesting router reboot");
        callAction("DeviceConfig1", "Reboot");
    }

    /**
     * Returns the router's device description string, e.g. "FRITZ!Box 7590 154.07.29".
     */
    public String getDeviceDescription() {
        Object description = callAction("DeviceInfo1", "GetInfo").get("NewDescription");
        return description != null ? description.toString() : null;
    }

    /**
     * Reads the firmware update-check document from the router's web interface.
     *
     * @return the document's fields, e.g. "Name", "Version", "HW", "Serial", "Lang"
     */
    public Map<String, String> getUpdateCheck() {
        return BoxInfo.read(webFetcher);
    }

    /**
     * Runs discovery again and replaces the current schema.
     */
    public RouterSchema rediscover() {
        RouterSchema discovered = discover();
        schema.set(discovered);
        updateServiceGauge();
        return discovered;
    }

    /**
     * Creates a call monitor for this router, configured from the monitor section.
     */
    public CallMonitor createCallMonitor() {
        MonitorOptions options = MonitorOptions.fromConfig(monitorHost(), config.getMonitor());
        return new CallMonitor(options, new TcpSocketConnector(), metricsRegistry);
    }

    public String getModelName() {
        return schema.get().modelName();
    }

    public String getSystemVersion() {
        return schema.get().systemVersion();
    }

    public List<Service> getServices() {
        return schema.get().services();
    }

    public RouterSchema getSchema() {
        return schema.get();
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public String getBaseUrl() {
        return httpClient.getBaseUrl();
    }

    public String getUser() {
        return httpClient.getCredentials().user();
    }

    private RouterSchema loadSchema() {
        if (schemaCache == null) {
            return discover();
        }
        Optional<RouterSchema> cached = schemaCache.load();
        if (cached.isPresent()) {
            if (!config.getCache().isVerify() || schemaCache.verify(cached.get(), webFetcher)) {
                return cached.get();
            }
        }
        return discover();
    }

    private RouterSchema discover() {
        RouterSchema discovered = schemaBuilder.discover(httpClient.getCredentials().hasPassword());
        if (schemaCache != null) {
            schemaCache.save(discovered);
        }
        return discovered;
    }

    /**
     * Newer firmware (7.24 on) no longer accepts the legacy default user; switch to
     * the user the router reports as last logged in.
     */
    private void resolveDefaultUser() {
        Credentials credentials = httpClient.getCredentials();
        if (!credentials.hasPassword() || !DEFAULT_USER.equals(credentials.user())) {
            return;
        }
        if (!schema.get().primary().systemVersion().isAtLeast(7, 24)) {
            return;
        }
        try {
            Object userList = callAction("LANConfigSecurity1", "X_AVM-DE_GetUserList").get("NewX_AVM-DE_UserList");
            lastUser(userList != null ? userList.toString() : null).ifPresent(user -> {
                log.info("Switching from default user to last logged-in user: user={}", user);
                httpClient.setCredentials(credentials.withUser(user));
            });
        } catch (RouterException e) {
            log.warn("Unable to read the router user list, keeping default user: error={}", e.getMessage());
        }
    }

    static Optional<String> lastUser(String userListXml) {
        return XmlSupport.tryParse(userListXml).flatMap(document -> {
            Element root = document.getDocumentElement();
            for (Element element : XmlSupport.childElements(root, "Username")) {
                if ("1".equals(element.getAttribute("last_user").trim())) {
                    return Optional.of(XmlSupport.text(element));
                }
            }
            return Optional.empty();
        });
    }

    private void updateServiceGauge() {
        if (metricsRegistry != null) {
            metricsRegistry.setDiscoveredServices(schema.get().registry().size());
        }
    }

    private String monitorHost() {
        return RouterHttpClient.hostOf(config.getRouter().getAddress());
    }

    private RouterHttpClient createHttpClient(SSLContext sslContext) {
        RouterConfig.RouterEndpointConfig endpoint = config.getRouter();
        return new RouterHttpClient(
                RouterHttpClient.buildBaseUrl(endpoint.getAddress(), endpoint.getPort(), endpoint.isUseTls()),
                new Credentials(endpoint.getUser(), endpoint.getPassword()),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                sslContext,
                new DigestAuthenticator());
    }

    /**
     * The web interface serves on the standard HTTP(S) port unless configured otherwise.
     */
    private RouterHttpClient createWebClient(SSLContext sslContext) {
        RouterConfig.RouterEndpointConfig endpoint = config.getRouter();
        return new RouterHttpClient(
                RouterHttpClient.buildWebBaseUrl(endpoint.getAddress(), endpoint.getWebPort(), endpoint.isUseTls()),
                new Credentials(endpoint.getUser(), endpoint.getPassword()),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                sslContext,
                new DigestAuthenticator());
    }

    private SchemaCache createSchemaCache() {
        String directory = config.getCache().getDirectory();
        Path path = directory != null && !directory.isBlank()
                ? Paths.get(directory)
                : SchemaCache.defaultDirectory();
        return new SchemaCache(path, config.getRouter().getAddress());
    }

    @Override
    public void close() {
        httpClient.close();
        webClient.close();
        if (ownsMetricsRegistry) {
            metricsRegistry.close();
        }
        log.info("RouterConnection closed");
    }

    /**
     * Builder for {@link RouterConnection}. Values set here override the configuration
     * passed to {@link #fromConfig}, so call that first.
     */
    public static final class Builder {
        private RouterConfig config = new RouterConfig();
        private RouterHttpClient httpClient;
        private DocumentFetcher documentFetcher;
        private MetricsRegistry metricsRegistry;
        private SSLContext sslContext;

        private Builder() {
        }

        public Builder fromConfig(RouterConfig config) {
            this.config = config;
            return this;
        }

        public Builder address(String address) {
            config.getRouter().setAddress(address);
            return this;
        }

        public Builder port(int port) {
            config.getRouter().setPort(port);
            return this;
        }

        /**
         * Port of the web interface serving the box info document; the scheme's standard port when unset.
         */
        public Builder webPort(int webPort) {
            config.getRouter().setWebPort(webPort);
            return this;
        }

        public Builder useTls(boolean useTls) {
            config.getRouter().setUseTls(useTls);
            return this;
        }

        public Builder user(String user) {
            config.getRouter().setUser(user);
            return this;
        }

        public Builder password(String password) {
            config.getRouter().setPassword(password);
            return this;
        }

        public Builder timeout(Duration timeout) {
            config.getTimeouts().setRequestTimeoutMs(timeout.toMillis());
            return this;
        }

        public Builder useCache(boolean useCache) {
            config.getCache().setEnabled(useCache);
            return this;
        }

        public Builder verifyCache(boolean verifyCache) {
            config.getCache().setVerify(verifyCache);
            return this;
        }

        public Builder cacheDirectory(Path directory) {
            config.getCache().setDirectory(directory.toString());
            return this;
        }

        /**
         * SSL context for TLS connections, e.g. one trusting the router's self-signed certificate.
         */
        public Builder sslContext(SSLContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        /**
         * Uses the given client instead of one built from the configuration.
         */
        public Builder httpClient(RouterHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Reads descriptors from the given source instead of the router.
         */
        public Builder documentFetcher(DocumentFetcher documentFetcher) {
            this.documentFetcher = documentFetcher;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public RouterConnection build() {
            return new RouterConnection(this);
        }
    }
}
