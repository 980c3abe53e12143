package uk.gegc.aimeter.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://aimeter.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI MESSAGE_TOO_LONG = URI.create(BASE_URL + "/message-too-long");
    public static final URI INVALID_CONVERSATION = URI.create(BASE_URL + "/invalid-conversation");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");

    // ==================== AI Service Errors ====================
    public static final URI AI_SERVICE_UNAVAILABLE = URI.create(BASE_URL + "/ai-service-unavailable");

    // ==================== Billing Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");
    public static final URI ACCOUNT_NOT_FOUND = URI.create(BASE_URL + "/account-not-found");
    public static final URI INVALID_ACTIVITY_QUERY = URI.create(BASE_URL + "/invalid-activity-query");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
