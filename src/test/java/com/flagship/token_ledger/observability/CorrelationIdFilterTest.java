package com.flagship.token_ledger.observability;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("Incoming correlation ID is put in MDC and echoed in the response")
    void testPropagatesIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/token/transfer");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc12345");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInChain.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                assertEquals("abc12345", CorrelationContext.currentOrGenerate());
                MDC.put(CorrelationContext.CALLER_ADDRESS_MDC_KEY, "0x00000000000000000000000000000000000000c0");
            }
        });

        assertEquals("abc12345", seenInChain.get());
        assertEquals("abc12345", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.CALLER_ADDRESS_MDC_KEY));
        assertTrue(CorrelationContext.current().isEmpty());
    }

    @Test
    @DisplayName("A correlation ID is generated when the header is missing")
    void testGeneratesId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/token");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    @DisplayName("Outside a request each call gets a fresh ID that is not bound")
    void testCurrentOrGenerateOutsideRequest() {
        String first = CorrelationContext.currentOrGenerate();
        String second = CorrelationContext.currentOrGenerate();

        assertNotEquals(first, second);
        assertTrue(CorrelationContext.current().isEmpty());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }
}
