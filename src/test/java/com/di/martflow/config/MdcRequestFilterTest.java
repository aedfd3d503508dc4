package com.di.martflow.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Request id and path are visible during the chain and cleared afterwards")
    void testMdcLifecycle() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/warehouse/etl");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenId = new AtomicReference<>();
        AtomicReference<String> seenPath = new AtomicReference<>();

        new MdcRequestFilter().doFilter(request, response, (req, res) -> {
            seenId.set(MDC.get(MdcRequestFilter.REQUEST_ID));
            seenPath.set(MDC.get(MdcRequestFilter.REQUEST_PATH));
        });

        assertTrue(seenId.get().startsWith("req-"));
        assertEquals("/api/warehouse/etl", seenPath.get());
        assertEquals(seenId.get(), response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }

    @Test
    @DisplayName("An incoming X-Request-Id is reused")
    void testIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/warehouse/state");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "abc-123");
        AtomicReference<String> seenId = new AtomicReference<>();

        new MdcRequestFilter().doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seenId.set(MDC.get(MdcRequestFilter.REQUEST_ID)));

        assertEquals("abc-123", seenId.get());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "id with spaces", "forged\nINFO line", "0123456789012345678901234567890123456789012345678901234567890123456789"})
    @DisplayName("Blank, multi-token or oversized request ids are replaced by a generated one")
    void testResolveRequestId_Rejected(String header) {
        assertTrue(MdcRequestFilter.resolveRequestId(header).startsWith("req-"));
    }

    @Test
    @DisplayName("Values held before the request are restored afterwards")
    void testRestoresOuterValues() throws Exception {
        MDC.put(MdcRequestFilter.REQUEST_ID, "outer");

        new MdcRequestFilter().doFilter(new MockHttpServletRequest("GET", "/api/warehouse/queries"),
                new MockHttpServletResponse(), (req, res) -> assertNotEquals("outer", MDC.get(MdcRequestFilter.REQUEST_ID)));

        assertEquals("outer", MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }
}
