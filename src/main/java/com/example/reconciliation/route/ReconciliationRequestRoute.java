package com.example.reconciliation.route;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.model.ReconciliationRequest;
import org.apache.camel.LoggingLevel;
import org.apache.camel.builder.RouteBuilder;
import org.apache.camel.model.dataformat.JsonLibrary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Apache Camel route that picks up run requests dropped into an inbox directory.
 *
 * Flow:
 * 1. Poll the inbox for *.json request files
 * 2. Deserialize JSON to ReconciliationRequest
 * 3. Run it via ReconciliationRequestProcessor
 * 4. Move the file to .done, or to .failed after the DLQ route has logged the failure
 *
 * Malformed ledgers are never retried; other failures are retried
 * {@code app.route.max-redeliveries} times.
 */
@Component
public class ReconciliationRequestRoute extends RouteBuilder {

    static final String ROUTE_ID = "reconciliation-inbox";
    static final String DLQ_ROUTE_ID = "reconciliation-dlq-route";

    @Value("${app.route.inbox-dir:./data/inbox}")
    private String inboxDir;

    @Value("${app.route.poll-delay-ms:5000}")
    private long pollDelayMs;

    @Value("${app.route.max-redeliveries:0}")
    private int maxRedeliveries;

    @Value("${app.route.autostart:false}")
    private boolean autoStartRoute;

    @Override
    public void configure() throws Exception {

        // ═══════════════════════════════════════════════════════════════
        // Error handling: log through the DLQ route, keep the exception so
        // the file component moves the request to .failed
        // ═══════════════════════════════════════════════════════════════
        onException(MalformedInputException.class)
                .maximumRedeliveries(0)
                .handled(false)
                .to("direct:dlq");

        onException(Exception.class)
                .maximumRedeliveries(maxRedeliveries)
                .redeliveryDelay(1000)
                .retryAttemptedLogLevel(LoggingLevel.WARN)
                .logRetryAttempted(true)
                .logExhausted(true)
                .handled(false)
                .to("direct:dlq");

        from("direct:dlq")
                .routeId(DLQ_ROUTE_ID)
                .log(LoggingLevel.ERROR, "╔══════════════════════════════════════════════════════════════╗")
                .log(LoggingLevel.ERROR, "║ DLQ: Failed to run reconciliation request ${header.CamelFileName}")
                .log(LoggingLevel.ERROR, "║ Exception: ${exception.message}")
                .log(LoggingLevel.ERROR, "╚══════════════════════════════════════════════════════════════╝")
                .process("deadLetterProcessor");

        // ═══════════════════════════════════════════════════════════════
        // Main inbox route
        // ═══════════════════════════════════════════════════════════════
        from(buildInboxUri())
                .routeId(ROUTE_ID)
                .autoStartup(autoStartRoute)

                // Set up trace ID for logging correlation (MUST be first)
                .process("traceIdProcessor")

                // Ensure trace context is cleared after the exchange completes (success or failure)
                .onCompletion()
                    .process(TraceIdProcessor::clearTraceContext)
                .end()

                .log(LoggingLevel.INFO, "Received reconciliation request file: ${header.CamelFileName}")

                .unmarshal().json(JsonLibrary.Jackson, ReconciliationRequest.class)

                .process("reconciliationRequestProcessor")

                .log(LoggingLevel.INFO, "Completed reconciliation run ${header.runId}: ${header.discrepancies} discrepancies");
    }

    /**
     * Build the file consumer URI with all configuration options.
     */
    String buildInboxUri() {
        return String.format(
                "file:%s?" +
                "include=.*\\.json" +
                "&move=.done" +                      // Processed requests
                "&moveFailed=.failed" +              // Requests whose run failed
                "&readLock=changed" +                // Wait until the writer is done
                "&delay=%d",
                inboxDir,
                pollDelayMs
        );
    }
}
