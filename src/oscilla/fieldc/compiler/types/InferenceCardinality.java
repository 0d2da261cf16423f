package oscilla.fieldc.compiler.types;

/**
 * A cardinality decision made by the solver for an equality group.
 * Only exists while solving, see {@link CardinalityValue} for the
 * canonical form.
 */
public sealed interface InferenceCardinality {

    public enum Kind {
        ONE,    // One
        MANY    // Many
    }

    Kind kind();

    public static record One() implements InferenceCardinality {
        @Override public Kind kind() { return Kind.ONE; }
        @Override public String toString() { return "one"; }
    }

    public static record Many(InstanceTerm term) implements InferenceCardinality {
        @Override public Kind kind() { return Kind.MANY; }
        @Override public String toString() {
            return "many(" + this.term + ")";
        }
    }

    public static final InferenceCardinality ONE = new One();

    public static InferenceCardinality many(InstanceTerm term) {
        return new Many(term);
    }

}
