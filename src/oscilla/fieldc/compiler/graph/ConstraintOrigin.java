package oscilla.fieldc.compiler.graph;

/**
 * Why a constraint was emitted. Not part of the constraint's identity.
 */
public sealed interface ConstraintOrigin {

    public static record FromEdge(String edgeId) implements ConstraintOrigin {
        @Override public String toString() { return "edge '" + this.edgeId + "'"; }
    }

    public static record FromBlockRule(
        int blockIndex, String blockId, String rule
    ) implements ConstraintOrigin {
        @Override public String toString() {
            return this.rule + " rule of block '" + this.blockId + "'";
        }
    }

    public static record FromExistingType(PortKey port) implements ConstraintOrigin {
        @Override public String toString() {
            return "existing type of " + this.port;
        }
    }

}
