package com.codeops.qr.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    private final Map<String, String> seenInChain = new HashMap<>();

    private final FilterChain recordingChain = (req, res) -> {
        seenInChain.put(RequestCorrelationFilter.CORRELATION_ID_KEY, MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY));
        seenInChain.put(RequestCorrelationFilter.REQUEST_PATH_KEY, MDC.get(RequestCorrelationFilter.REQUEST_PATH_KEY));
        seenInChain.put(RequestCorrelationFilter.REQUEST_METHOD_KEY, MDC.get(RequestCorrelationFilter.REQUEST_METHOD_KEY));
    };

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void qrRequest_withoutHeader_getsFreshUuidInMdcAndResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/qr-code");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilterInternal(request, response, recordingChain);

        String echoed = response.getHeader(AppConstants.CORRELATION_ID_HEADER);
        assertThat(UUID.fromString(echoed).toString()).isEqualTo(echoed);
        assertThat(seenInChain.get(RequestCorrelationFilter.CORRELATION_ID_KEY)).isEqualTo(echoed);
        assertThat(seenInChain.get(RequestCorrelationFilter.REQUEST_PATH_KEY)).isEqualTo("/v1/qr-code");
        assertThat(seenInChain.get(RequestCorrelationFilter.REQUEST_METHOD_KEY)).isEqualTo("POST");
    }

    @Test
    void callerSuppliedId_isKeptAndEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/auth/token");
        request.addHeader(AppConstants.CORRELATION_ID_HEADER, "gateway-7f3a");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilterInternal(request, response, recordingChain);

        assertThat(seenInChain.get(RequestCorrelationFilter.CORRELATION_ID_KEY)).isEqualTo("gateway-7f3a");
        assertThat(response.getHeader(AppConstants.CORRELATION_ID_HEADER)).isEqualTo("gateway-7f3a");
    }

    @Test
    void blankHeader_isReplacedWithGeneratedId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/health");
        request.addHeader(AppConstants.CORRELATION_ID_HEADER, "   ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilterInternal(request, response, recordingChain);

        String echoed = response.getHeader(AppConstants.CORRELATION_ID_HEADER);
        assertThat(echoed).isNotBlank();
        assertThat(UUID.fromString(echoed).toString()).isEqualTo(echoed);
    }

    @Test
    void mdcKeys_areRemovedEvenWhenChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/qr-code");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain failing = (req, res) -> {
            throw new ServletException("render failed");
        };

        assertThatThrownBy(() -> filter.doFilterInternal(request, response, failing))
                .isInstanceOf(ServletException.class);

        assertThat(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY)).isNull();
        assertThat(MDC.get(RequestCorrelationFilter.REQUEST_PATH_KEY)).isNull();
        assertThat(MDC.get(RequestCorrelationFilter.REQUEST_METHOD_KEY)).isNull();
    }

    @Test
    void unrelatedMdcEntries_survive() throws Exception {
        MDC.put("traceFlag", "on");

        filter.doFilterInternal(new MockHttpServletRequest("GET", "/v1/health"),
                new MockHttpServletResponse(), recordingChain);

        assertThat(MDC.get("traceFlag")).isEqualTo("on");
    }
}
