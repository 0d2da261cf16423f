package oscilla.fieldc.compiler.types;

/**
 * An instance identity as seen by the solver: either a concrete reference
 * or an existential variable that has to be resolved to one.
 */
public sealed interface InstanceTerm {

    public enum Kind {
        INST,   // Inst
        VAR     // Var
    }

    Kind kind();

    public static record Inst(InstanceRef ref) implements InstanceTerm {
        @Override public Kind kind() { return Kind.INST; }
        @Override public String toString() { return this.ref.toString(); }
    }

    public static record Var(InstanceVarId id) implements InstanceTerm {
        @Override public Kind kind() { return Kind.VAR; }
        @Override public String toString() { return this.id.toString(); }
    }

    public static InstanceTerm of(InstanceRef ref) {
        return new Inst(ref);
    }

    public static InstanceTerm of(InstanceVarId id) {
        return new Var(id);
    }

}
