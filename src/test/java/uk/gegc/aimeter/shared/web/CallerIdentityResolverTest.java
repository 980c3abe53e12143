package uk.gegc.aimeter.shared.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.shared.exception.MissingCallerIdentityException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallerIdentityResolverTest {

    private final CallerIdentityResolver resolver = new CallerIdentityResolver();

    private static MockHttpServletRequest identified() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Billing-Account-Id", "acct-1");
        request.addHeader("X-Virtual-Key-Id", "vk-1");
        return request;
    }

    @Test
    @DisplayName("resolve: uses the request id set by the filter and falls back to it for the trace id")
    void resolve_usesRequestAttribute() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Billing-Account-Id", " acct-1 ");
        request.addHeader("X-Virtual-Key-Id", "vk-1");
        request.setAttribute(CorrelationIds.ATTR_REQUEST_ID, "req-1");

        CallerIdentity caller = resolver.resolve(request);

        assertThat(caller).isEqualTo(new CallerIdentity("acct-1", "vk-1", "req-1", "req-1"));
    }

    @Test
    @DisplayName("resolve: keeps a well-formed trace id")
    void resolve_keepsTraceId() {
        MockHttpServletRequest request = identified();
        request.setAttribute(CorrelationIds.ATTR_REQUEST_ID, "req-9");
        request.addHeader("X-Trace-Id", "trace-7");

        CallerIdentity caller = resolver.resolve(request);

        assertThat(caller.requestId()).isEqualTo("req-9");
        assertThat(caller.traceId()).isEqualTo("trace-7");
    }

    @Test
    @DisplayName("resolve: an over-long trace id falls back to the request id")
    void resolve_overLongTraceId() {
        MockHttpServletRequest request = identified();
        request.setAttribute(CorrelationIds.ATTR_REQUEST_ID, "req-9");
        request.addHeader("X-Trace-Id", "t".repeat(65));

        assertThat(resolver.resolve(request).traceId()).isEqualTo("req-9");
    }

    @Test
    @DisplayName("resolve: ignores a raw X-Request-Id header that did not pass the filter")
    void resolve_ignoresUnfilteredHeader() {
        MockHttpServletRequest request = identified();
        request.addHeader("X-Request-Id", "x".repeat(200));

        CallerIdentity caller = resolver.resolve(request);

        assertThat(caller.requestId()).startsWith("req_").hasSizeLessThanOrEqualTo(CorrelationIds.MAX_LENGTH);
        assertThat(request.getAttribute(CorrelationIds.ATTR_REQUEST_ID)).isEqualTo(caller.requestId());
    }

    @Test
    @DisplayName("resolve: blank billing account header is rejected")
    void resolve_blankAccount() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Billing-Account-Id", "  ");
        request.addHeader("X-Virtual-Key-Id", "vk-1");

        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(MissingCallerIdentityException.class)
                .hasMessageContaining("X-Billing-Account-Id");
    }

    @Test
    @DisplayName("resolve: billing account id longer than its column is rejected")
    void resolve_overLongAccount() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Billing-Account-Id", "a".repeat(65));
        request.addHeader("X-Virtual-Key-Id", "vk-1");

        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(MissingCallerIdentityException.class)
                .hasMessage("Invalid X-Billing-Account-Id header");
    }

    @Test
    @DisplayName("resolve: missing virtual key header is rejected")
    void resolve_missingVirtualKey() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Billing-Account-Id", "acct-1");

        assertThatThrownBy(() -> resolver.resolve(request))
                .isInstanceOf(MissingCallerIdentityException.class)
                .hasMessageContaining("X-Virtual-Key-Id");
    }
}
