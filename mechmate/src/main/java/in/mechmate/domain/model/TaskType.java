package in.mechmate.domain.model;

/**
 * Kind of maintenance work (oil change, tire rotation ...).
 */
public record TaskType(
        long id,
        String name) {
}
