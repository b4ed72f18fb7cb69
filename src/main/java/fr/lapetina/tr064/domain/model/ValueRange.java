package fr.lapetina.tr064.domain.model;

/**
 * Allowed numeric range of a state variable. Values are kept as reported.
 */
public record ValueRange(
        String minimum,
        String maximum,
        String step
) {
}
