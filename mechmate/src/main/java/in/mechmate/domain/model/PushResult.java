package in.mechmate.domain.model;

/**
 * Outcome of one push attempt to one subscription.
 */
public record PushResult(
        Outcome outcome,
        int statusCode,      // 0 when no HTTP response was received
        String message) {

    public enum Outcome {
        DELIVERED,
        TRANSIENT_FAILURE,
        PERMANENTLY_INVALID
    }

    public static PushResult delivered(int statusCode) {
        return new PushResult(Outcome.DELIVERED, statusCode, null);
    }

    public static PushResult transientFailure(int statusCode, String message) {
        return new PushResult(Outcome.TRANSIENT_FAILURE, statusCode, message);
    }

    public static PushResult permanentlyInvalid(int statusCode, String message) {
        return new PushResult(Outcome.PERMANENTLY_INVALID, statusCode, message);
    }
}
