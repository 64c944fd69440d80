package com.example.reconciliation.route;

import com.example.reconciliation.config.TraceContextManager;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Exchange;
import org.apache.camel.Processor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Camel processor that sets up trace IDs for request files and enriches the
 * active span with the Camel exchangeId, so every log line of a run is correlated.
 *
 * Should be added at the start of consumer routes.
 */
@Component("traceIdProcessor")
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class TraceIdProcessor implements Processor {

    static final String CREATED_SPAN = "createdSpan";
    static final String CREATED_SPAN_SCOPE = "createdSpanScope";

    private final Tracer tracer;

    public TraceIdProcessor(@Nullable Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void process(Exchange exchange) throws Exception {
        TraceContextManager.ensureForExchange(exchange);

        String exchangeId = exchange.getExchangeId();
        MDC.put(TraceContextManager.EXCHANGE_ID, exchangeId);
        exchange.setProperty(TraceContextManager.EXCHANGE_ID, exchangeId);

        if (tracer == null) {
            return;
        }
        Span current = tracer.currentSpan();
        if (current != null) {
            current.tag("camel.exchange_id", exchangeId);
        } else {
            // Create a span for this exchange so we can tag it and close it on completion
            Span created = tracer.nextSpan().name("reconciliation.request:" + exchangeId).start();
            created.tag("camel.exchange_id", exchangeId);
            exchange.setProperty(CREATED_SPAN, created);
            exchange.setProperty(CREATED_SPAN_SCOPE, tracer.withSpan(created));
        }
    }

    /**
     * Ends any span created for the exchange and clears MDC.
     */
    public static void clearTraceContext(Exchange exchange) {
        if (exchange != null) {
            Tracer.SpanInScope scope = exchange.getProperty(CREATED_SPAN_SCOPE, Tracer.SpanInScope.class);
            if (scope != null) {
                scope.close();
            }
            Span span = exchange.getProperty(CREATED_SPAN, Span.class);
            if (span != null) {
                span.end();
            }
        }
        TraceContextManager.clear();
    }
}
