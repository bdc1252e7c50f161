package in.mechmate.infrastructure.metrics;

import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves the notification engine's registry at {@code GET /metrics}.
 *
 * The exposition format follows the Accept header: OpenMetrics when the scraper asks for
 * {@code application/openmetrics-text}, otherwise text format 0.0.4. Repeated {@code name[]}
 * query parameters restrict the output to those sample names, e.g.
 * {@code /metrics?name[]=notification_checks_total}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);
        Enumeration<MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, samples);
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics");
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
        log.debug("[METRICS] Served {} ({} names requested)", contentType, names.size());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        Set<String> names = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (!value.isBlank()) names.add(value.trim());
            }
        }
        return names;
    }
}
