package oscilla.fieldc.compiler.types;

import java.util.Optional;

/**
 * The resolved type of a port. Only the cardinality axis is decided by
 * the cardinality solver, the other axes are carried through as given.
 */
public record CanonicalType(
    Optional<String> payload,
    Optional<String> unit,
    CardinalityValue cardinality,
    Optional<String> temporality,
    Optional<String> binding
) {

    public static CanonicalType of(CardinalityValue cardinality) {
        return new CanonicalType(
            Optional.empty(), Optional.empty(), cardinality,
            Optional.empty(), Optional.empty()
        );
    }

    public CanonicalType withCardinality(CardinalityValue cardinality) {
        return new CanonicalType(
            this.payload, this.unit, cardinality,
            this.temporality, this.binding
        );
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append(this.payload.orElse("_"));
        this.unit.ifPresent(u -> output.append(" [").append(u).append("]"));
        output.append(" ");
        output.append(this.cardinality);
        this.temporality.ifPresent(t -> output.append(" ").append(t));
        this.binding.ifPresent(b -> output.append(" ").append(b));
        return output.toString();
    }

}
