package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import oscilla.fieldc.compiler.graph.Edge;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;

/**
 * Finds the edge on which a Broadcast adapter would resolve a conflict
 * between a scalar group and a broadcast set that is many.
 *
 * <p>The scalar group reaches into the broadcast set through an edge whose
 * source and destination are both in the scalar group and whose destination
 * is one of the broadcast ports. Inserting an adapter on that edge breaks
 * the equality that pulled the broadcast port down to one.
 */
public class BroadcastAdapterHints {

    private static final Comparator<Edge> ORDER = Comparator
        .comparing(Edge::fromKey)
        .thenComparing(Edge::toKey)
        .thenComparing(Edge::id);

    private BroadcastAdapterHints() {}

    public static Optional<Edge> boundaryEdge(
        Patch patch, CardinalityDiagnostic diagnostic
    ) {
        if(diagnostic.broadcastMix().isEmpty()) {
            return Optional.empty();
        }
        CardinalityDiagnostic.BroadcastMix mix
            = diagnostic.broadcastMix().get();
        Set<PortKey> scalar = new HashSet<>(mix.scalarMembers());
        Set<PortKey> zip = new HashSet<>(mix.zipPorts());
        List<Edge> candidates = new ArrayList<>();
        for(Edge edge: patch.edges()) {
            if(!scalar.contains(edge.fromKey())) { continue; }
            if(!scalar.contains(edge.toKey())) { continue; }
            if(!zip.contains(edge.toKey())) { continue; }
            candidates.add(edge);
        }
        return candidates.stream().min(ORDER);
    }

}
