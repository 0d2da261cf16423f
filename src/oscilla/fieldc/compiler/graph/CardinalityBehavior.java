package oscilla.fieldc.compiler.graph;

import java.util.List;

/**
 * How a block relates the cardinalities of its ports.
 */
public sealed interface CardinalityBehavior {

    public enum Kind {
        SIGNAL_ONLY,    // SignalOnly
        TRANSFORM,      // Transform
        PRESERVE,       // Preserve
        FIELD_ONLY,     // FieldOnly
        LANES           // Lanes
    }

    public enum BroadcastPolicy {
        STRICT,
        ALLOW_ZIP_SIG
    }

    Kind kind();

    /** Every port is a single value. */
    public static record SignalOnly() implements CardinalityBehavior {
        @Override public Kind kind() { return Kind.SIGNAL_ONLY; }
    }

    /** Outputs are per-instance values of a collection owned by the block. */
    public static record Transform(
        String domainType, BroadcastPolicy broadcast
    ) implements CardinalityBehavior {
        @Override public Kind kind() { return Kind.TRANSFORM; }
    }

    public static record Preserve(
        BroadcastPolicy broadcast
    ) implements CardinalityBehavior {
        @Override public Kind kind() { return Kind.PRESERVE; }
    }

    /** Inputs require some collection, without naming which one. */
    public static record FieldOnly(
        BroadcastPolicy broadcast
    ) implements CardinalityBehavior {
        @Override public Kind kind() { return Kind.FIELD_ONLY; }
    }

    public static record Lanes(
        List<LaneGroup> groups
    ) implements CardinalityBehavior {
        public Lanes {
            groups = List.copyOf(groups);
        }
        @Override public Kind kind() { return Kind.LANES; }
    }

    public static record LaneGroup(Relation relation, List<String> members) {

        public enum Relation {
            ZIP_BROADCAST,
            ALL_EQUAL
        }

        public LaneGroup {
            members = List.copyOf(members);
        }

    }

    public static CardinalityBehavior signalOnly() {
        return new SignalOnly();
    }

    public static CardinalityBehavior transform(String domainType) {
        return new Transform(domainType, BroadcastPolicy.STRICT);
    }

    public static CardinalityBehavior preserve(BroadcastPolicy broadcast) {
        return new Preserve(broadcast);
    }

    public static CardinalityBehavior fieldOnly() {
        return new FieldOnly(BroadcastPolicy.STRICT);
    }

}
