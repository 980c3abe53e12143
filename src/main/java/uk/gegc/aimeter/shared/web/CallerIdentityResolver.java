package uk.gegc.aimeter.shared.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.shared.exception.MissingCallerIdentityException;

/**
 * Builds the {@link CallerIdentity} from headers set by the upstream authentication gateway.
 */
@Component
public class CallerIdentityResolver {

    public static final String HEADER_BILLING_ACCOUNT_ID = "X-Billing-Account-Id";
    public static final String HEADER_VIRTUAL_KEY_ID = "X-Virtual-Key-Id";
    public static final String HEADER_TRACE_ID = "X-Trace-Id";

    public CallerIdentity resolve(HttpServletRequest request) {
        String billingAccountId = requiredHeader(request, HEADER_BILLING_ACCOUNT_ID);
        String virtualKeyId = requiredHeader(request, HEADER_VIRTUAL_KEY_ID);
        String requestId = CorrelationIds.currentRequestId(request);
        String traceId = request.getHeader(HEADER_TRACE_ID);
        return new CallerIdentity(billingAccountId, virtualKeyId, requestId,
                CorrelationIds.isAcceptable(traceId) ? traceId : requestId);
    }

    // Account and key ids are stored on every receipt, so they must fit their columns
    private static String requiredHeader(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        if (value == null || value.isBlank()) {
            throw new MissingCallerIdentityException("Missing " + name + " header");
        }
        String trimmed = value.trim();
        if (trimmed.length() > CorrelationIds.MAX_LENGTH) {
            throw new MissingCallerIdentityException("Invalid " + name + " header");
        }
        return trimmed;
    }
}
