package com.example.reconciliation.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TraceIdFilterTest {

    private TraceIdFilter filter;

    @BeforeEach
    void setUp() {
        filter = new TraceIdFilter();
        TraceContextManager.clear();
    }

    @AfterEach
    void tearDown() {
        TraceContextManager.clear();
    }

    @Test
    void doFilter_setsTraceIdAndCleansUp() throws Exception {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);
        FilterChain chain = mock(FilterChain.class);

        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn(null);

        // When the chain is invoked, traceId should be present in MDC
        doAnswer(invocation -> {
            String traceId = MDC.get(TraceContextManager.TRACE_ID);
            assertNotNull(traceId);
            assertEquals(32, traceId.length());
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        // After filter completes, MDC should be cleared
        assertNull(MDC.get(TraceContextManager.TRACE_ID));

        verify(resp).setHeader(eq(TraceContextManager.TRACE_HEADER), anyString());
    }

    @Test
    void doFilter_reusesIncomingTraceHeader() throws Exception {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);
        FilterChain chain = mock(FilterChain.class);

        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn("caller-trace");

        doAnswer(invocation -> {
            assertEquals("caller-trace", MDC.get(TraceContextManager.TRACE_ID));
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        verify(resp).setHeader(TraceContextManager.TRACE_HEADER, "caller-trace");
    }

    @Test
    void doFilter_removesRunIdLeftByTheRequest() throws Exception {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);
        FilterChain chain = mock(FilterChain.class);

        doAnswer(invocation -> {
            TraceContextManager.putRunId("run-123");
            return null;
        }).when(chain).doFilter(req, resp);

        filter.doFilter(req, resp, chain);

        assertNull(MDC.get(TraceContextManager.RUN_ID));
    }
}
