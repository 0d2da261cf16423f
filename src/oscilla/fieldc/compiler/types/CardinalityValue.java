package oscilla.fieldc.compiler.types;

/**
 * A fully resolved cardinality. Never refers to an instance variable.
 */
public sealed interface CardinalityValue {

    public enum Kind {
        ZERO,   // Zero
        ONE,    // One
        MANY    // Many
    }

    Kind kind();

    public static record Zero() implements CardinalityValue {
        @Override public Kind kind() { return Kind.ZERO; }
        @Override public String toString() { return "zero"; }
    }

    public static record One() implements CardinalityValue {
        @Override public Kind kind() { return Kind.ONE; }
        @Override public String toString() { return "one"; }
    }

    public static record Many(InstanceRef instance) implements CardinalityValue {
        @Override public Kind kind() { return Kind.MANY; }
        @Override public String toString() {
            return "many(" + this.instance + ")";
        }
    }

    public static final CardinalityValue ZERO = new Zero();
    public static final CardinalityValue ONE = new One();

    public static CardinalityValue many(InstanceRef instance) {
        return new Many(instance);
    }

}
