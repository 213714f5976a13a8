package uk.gegc.imagestudio.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 problem type URIs returned by the API.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://imagestudio.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI UNKNOWN_OPERATION_CLASS = URI.create(BASE_URL + "/unknown-operation-class");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/webhook-invalid-signature");

    // ==================== Admission Errors ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");
    public static final URI POLICY_VIOLATION = URI.create(BASE_URL + "/policy-violation");
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");

    // ==================== Payment Errors ====================
    public static final URI PAYMENT_GATEWAY_ERROR = URI.create(BASE_URL + "/payment-gateway-error");

    // ==================== State Errors ====================
    public static final URI ILLEGAL_STATE = URI.create(BASE_URL + "/illegal-state");

    // ==================== Generic Errors ====================
    public static final URI STORE_UNAVAILABLE = URI.create(BASE_URL + "/store-unavailable");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
