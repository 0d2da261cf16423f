package oscilla.fieldc.compiler.cardinality;

import java.util.List;
import java.util.Optional;

import oscilla.fieldc.compiler.graph.PortKey;

/**
 * A problem found while solving cardinalities. {@code anchor} is the
 * smallest port key of {@code involved}.
 */
public record CardinalityDiagnostic(
    Kind kind,
    PortKey anchor,
    List<PortKey> involved,
    int blockIndex,
    String portName,
    String message,
    Optional<BroadcastMix> broadcastMix
) {

    public enum Kind {
        CARDINALITY_CONFLICT("CardinalityConflict"),
        ZIP_BROADCAST_INSTANCE_MISMATCH("ZipBroadcastInstanceMismatch"),
        UNRESOLVED_INSTANCE_VAR("UnresolvedInstanceVar"),
        UNRESOLVED_CARDINALITY("UnresolvedCardinality");

        public final String code;

        private Kind(String code) {
            this.code = code;
        }
    }

    /**
     * Attached to conflicts where a broadcast set mixes a group decided as
     * one with a group decided as many. The scalar group is not silently
     * kept as one next to the field; the patch has to state the broadcast
     * with an explicit Broadcast adapter between the two, which is what
     * {@link BroadcastAdapterHints} suggests for these diagnostics.
     */
    public static record BroadcastMix(
        List<PortKey> zipPorts, List<PortKey> scalarMembers
    ) {
        public BroadcastMix {
            zipPorts = List.copyOf(zipPorts);
            scalarMembers = List.copyOf(scalarMembers);
        }
    }

    public CardinalityDiagnostic {
        involved = involved.stream().sorted().distinct().toList();
        if(involved.isEmpty() || !involved.get(0).equals(anchor)) {
            throw new IllegalArgumentException(
                "The anchor " + anchor + " needs to be the smallest"
                    + " involved port!"
            );
        }
    }

    public String code() {
        return this.kind.code;
    }

    @Override
    public String toString() {
        return this.kind.code + " at " + this.anchor + ": " + this.message;
    }

}
