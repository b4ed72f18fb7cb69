package fr.lapetina.tr064.infrastructure.soap;

import fr.lapetina.tr064.domain.error.ActionNotFoundException;
import fr.lapetina.tr064.domain.error.ProtocolException;
import fr.lapetina.tr064.domain.error.RouterAuthorizationException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.domain.error.RouterException;
import fr.lapetina.tr064.domain.model.Action;
import fr.lapetina.tr064.domain.model.Argument;
import fr.lapetina.tr064.domain.model.Service;
import fr.lapetina.tr064.infrastructure.discovery.XmlSupport;
import fr.lapetina.tr064.infrastructure.http.RouterHttpClient;
import fr.lapetina.tr064.infrastructure.http.RouterResponse;
import fr.lapetina.tr064.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one action against the router and returns its converted out-arguments.
 *
 * Calls are synchronous and never retried.
 */
public class SoapActionInvoker {

    private static final Logger log = LoggerFactory.getLogger(SoapActionInvoker.class);

    private final RouterHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;

    public SoapActionInvoker(RouterHttpClient httpClient, MetricsRegistry metricsRegistry) {
        this.httpClient = httpClient;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Invokes an action.
     *
     * @param service    the target service, with its action table loaded
     * @param actionName the action name
     * @param arguments  in-arguments, sent in iteration order
     * @return the out-arguments present in the response, in declaration order
     * @throws ActionNotFoundException   if the service has no such action
     * @throws ProtocolException         if the router answers with a fault
     * @throws RouterConnectionException on transport failure or non-XML answers
     */
    public Map<String, Object> invoke(Service service, String actionName, Map<String, ?> arguments) {
        Action action = service.action(actionName)
                .orElseThrow(() -> new ActionNotFoundException(service.name(), actionName));

        String body = SoapEnvelope.build(service.serviceType(), actionName, arguments);
        Instant startTime = Instant.now();

        log.debug("Invoking action: service={}, action={}, controlUrl={}", service.name(), actionName,
                service.controlUrl());
        log.trace("Request body: {}", body);

        RouterResponse response;
        try {
            response = httpClient.post(service.controlUrl(),
                    SoapEnvelope.headers(service.serviceType(), actionName), body);
        } catch (RouterConnectionException e) {
            recordError(service, actionName, e);
            throw e;
        }

        Duration latency = Duration.between(startTime, Instant.now());
        recordLatency(service, actionName, latency);
        log.debug("Response received: service={}, action={}, status={}, latencyMs={}",
                service.name(), actionName, response.statusCode(), latency.toMillis());
        log.trace("Response body: {}", response.body());

        if (!response.isSuccess()) {
            RouterException error = ErrorMapper.toException(response.statusCode(), response.body());
            log.warn("Action failed: service={}, action={}, status={}, error={}",
                    service.name(), actionName, response.statusCode(), error.getMessage());
            recordError(service, actionName, error);
            throw error;
        }

        return parseResult(service, action, response.body());
    }

    private Map<String, Object> parseResult(Service service, Action action, String body) {
        Element root = XmlSupport.tryParse(body)
                .map(document -> document.getDocumentElement())
                .orElseThrow(() -> {
                    RouterConnectionException error = new RouterConnectionException(
                            "Unable to parse response of " + service.name() + "#" + action.name());
                    recordError(service, action.name(), error);
                    return error;
                });

        Map<String, Object> result = new LinkedHashMap<>();
        for (Argument argument : action.outArguments()) {
            Optional<Element> element = XmlSupport.findFirst(root, argument.name());
            element.ifPresent(e -> {
                String text = e.getTextContent() != null ? e.getTextContent() : "";
                result.put(argument.name(), ValueConverter.convert(service.dataTypeOf(argument), text));
            });
        }
        return result;
    }

    private void recordLatency(Service service, String actionName, Duration latency) {
        if (metricsRegistry != null) {
            metricsRegistry.recordActionLatency(service.name(), actionName, latency);
        }
    }

    private void recordError(Service service, String actionName, RouterException error) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementErrorCount(service.name(), actionName, errorType(error));
        }
    }

    private static String errorType(RouterException error) {
        if (error instanceof ProtocolException) {
            return ((ProtocolException) error).getKind().name();
        }
        if (error instanceof RouterAuthorizationException) {
            return "AUTHORIZATION";
        }
        return "CONNECTION";
    }
}
