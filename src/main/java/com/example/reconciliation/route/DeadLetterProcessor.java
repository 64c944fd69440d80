package com.example.reconciliation.route;

import com.example.reconciliation.config.AppMetrics;
import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.model.ReconciliationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.springframework.stereotype.Component;

/**
 * Camel Processor for request files whose run failed.
 * Logs enough detail for an operator to fix the ledger and drop the request again.
 */
@Component("deadLetterProcessor")
@Slf4j
@RequiredArgsConstructor
public class DeadLetterProcessor implements Processor {

    static final String FAILURE_REASON_HEADER = "failureReason";

    private final AppMetrics metrics;

    @Override
    public void process(Exchange exchange) throws Exception {
        Exception cause = exchange.getProperty(Exchange.EXCEPTION_CAUGHT, Exception.class);
        if (cause == null) {
            cause = exchange.getException();
        }
        Object body = exchange.getIn().getBody();
        String fileName = exchange.getIn().getHeader(Exchange.FILE_NAME, String.class);

        log.error("╔══════════════════════════════════════════════════════════════╗");
        log.error("║ DEAD LETTER PROCESSOR                                         ║");
        log.error("║ Request file: {}", fileName);
        log.error("║ Exception: {}", cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "Unknown");
        log.error("╚══════════════════════════════════════════════════════════════╝");

        if (body instanceof ReconciliationRequest request) {
            log.error("Failed run {} | FBA: {} | Storefront: {} | Output: {}",
                    request.runId(), request.fbaLocation(), request.storefrontLocation(), request.outputLocation());
        }

        if (cause instanceof MalformedInputException malformed) {
            log.error("Malformed {} ledger: column={} row={}",
                    malformed.getSource(), malformed.getColumn(), malformed.getRowIndex());
        }

        // Request files never reach the orchestrator when they are not valid JSON
        if (!(body instanceof ReconciliationRequest)) {
            metrics.incrementRunsFailed();
        }

        exchange.getIn().setHeader(FAILURE_REASON_HEADER, cause != null ? cause.getMessage() : "Unknown");
    }
}
