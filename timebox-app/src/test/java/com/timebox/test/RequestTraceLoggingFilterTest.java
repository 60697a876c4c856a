package com.timebox.test;

import com.timebox.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

public class RequestTraceLoggingFilterTest {

    private final RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(3000L);

    @Test
    public void shouldPropagateIncomingTraceIdAndGenerateRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/workflow/tasks/merge");
        request.addHeader("X-Trace-Id", " trace-001 ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        Assertions.assertEquals("trace-001", response.getHeader("X-Trace-Id"));
        Assertions.assertNotNull(response.getHeader("X-Request-Id"));
        Assertions.assertEquals(32, response.getHeader("X-Request-Id").length());
        Assertions.assertNull(MDC.get("traceId"));
        Assertions.assertNull(MDC.get("requestId"));
    }

    @Test
    public void shouldSkipNonApiPaths() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        Assertions.assertNull(response.getHeader("X-Trace-Id"));
        Assertions.assertNull(response.getHeader("X-Request-Id"));
    }
}
