package com.flagship.retail_ledger.observability;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void callerCorrelationIdIsKept() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/accounts");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, " abc-123 ");

        assertEquals("abc-123", CorrelationIdFilter.correlationIdOf(request));
    }

    @Test
    void oversizedOrMissingIdIsReplaced() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/accounts");
        assertEquals(8, CorrelationIdFilter.correlationIdOf(request).length());

        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "x".repeat(65));
        assertEquals(8, CorrelationIdFilter.correlationIdOf(request).length());
    }

    @Test
    void headerIsEchoedAndMdcCleared() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/accounts");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNotNull(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
    }
}
