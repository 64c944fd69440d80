package com.example.reconciliation.route;

import com.example.reconciliation.model.ReconciliationRequest;
import com.example.reconciliation.model.ReconciliationRunResult;
import com.example.reconciliation.service.ReconciliationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.springframework.stereotype.Component;

/**
 * Camel Processor for reconciliation request files.
 *
 * Intentionally THIN: it fills in a run id from the file name when the request has none,
 * delegates to {@link ReconciliationOrchestrator}, and publishes the outcome as headers.
 * Failures propagate to the route's error handling.
 */
@Component("reconciliationRequestProcessor")
@Slf4j
@RequiredArgsConstructor
public class ReconciliationRequestProcessor implements Processor {

    static final String RUN_ID_HEADER = "runId";
    static final String DISCREPANCIES_HEADER = "discrepancies";
    static final String OUTPUT_HEADER = "outputLocation";

    private final ReconciliationOrchestrator orchestrator;

    @Override
    public void process(Exchange exchange) throws Exception {
        ReconciliationRequest request = exchange.getIn().getBody(ReconciliationRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("Request file did not contain a reconciliation request");
        }

        if (request.runId() == null || request.runId().isBlank()) {
            String fileName = exchange.getIn().getHeader(Exchange.FILE_NAME_ONLY, String.class);
            request = new ReconciliationRequest(
                    runIdFromFileName(fileName),
                    request.fbaLocation(),
                    request.storefrontLocation(),
                    request.outputLocation());
        }
        log.info("Processing request {} exchangeId: {}", request.runId(), exchange.getExchangeId());

        ReconciliationRunResult result = orchestrator.run(request);

        exchange.getIn().setHeader(RUN_ID_HEADER, result.runId());
        exchange.getIn().setHeader(DISCREPANCIES_HEADER, result.summary().discrepancies());
        exchange.getIn().setHeader(OUTPUT_HEADER, result.outputLocation());
        exchange.getIn().setBody(result);
    }

    static String runIdFromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
