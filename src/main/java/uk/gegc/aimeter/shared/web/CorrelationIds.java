package uk.gegc.aimeter.shared.web;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request and trace ids that end up in charge receipts and logs.
 * <p>
 * Caller-supplied ids are only accepted when they fit the {@code ingress_request_id} and
 * {@code run_id} columns: at most {@value #MAX_LENGTH} characters of {@code [A-Za-z0-9._:-]}.
 * Anything else is replaced by a generated id so a receipt write can never fail on it.
 */
public final class CorrelationIds {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";
    public static final int MAX_LENGTH = 64;

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1," + MAX_LENGTH + "}");

    private CorrelationIds() {
    }

    public static String generate() {
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static boolean isAcceptable(String candidate) {
        return candidate != null && ACCEPTED.matcher(candidate).matches();
    }

    public static String acceptOrGenerate(String candidate) {
        return isAcceptable(candidate) ? candidate : generate();
    }

    /**
     * The id assigned by {@link RequestIdFilter}. Requests that bypassed the filter get a fresh
     * id, stored on the request so later lookups agree.
     */
    public static String currentRequestId(HttpServletRequest request) {
        if (request.getAttribute(ATTR_REQUEST_ID) instanceof String assigned) {
            return assigned;
        }
        String generated = generate();
        request.setAttribute(ATTR_REQUEST_ID, generated);
        return generated;
    }
}
