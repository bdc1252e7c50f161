package in.mechmate.domain.model;

/**
 * Owned equipment (vehicle, mower, boat ...).
 */
public record Equipment(
        long id,
        String name,
        String usageUnit) {
}
