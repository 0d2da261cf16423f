package oscilla.fieldc.compiler.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The input of the cardinality solver. Node ids are dense, starting at 0,
 * and assigned in port key order; constraints are kept sorted by
 * {@link CardConstraint#ORDER}.
 */
public record CardinalityConstraintGraph(
    List<CardNode> nodes,
    List<CardConstraint> constraints,
    Map<PortKey, Integer> nodeByPort
) {

    public CardinalityConstraintGraph {
        nodes = List.copyOf(nodes);
        constraints = constraints.stream()
            .sorted(CardConstraint.ORDER)
            .toList();
        nodeByPort = Collections.unmodifiableSortedMap(
            new TreeMap<>(nodeByPort)
        );
        for(int nodeI = 0; nodeI < nodes.size(); nodeI += 1) {
            CardNode node = nodes.get(nodeI);
            if(node.id() != nodeI) {
                throw new IllegalArgumentException(
                    "Node ids need to match their position (node " + node
                        + " is at position " + nodeI + ")!"
                );
            }
            if(!Integer.valueOf(nodeI).equals(nodeByPort.get(node.key()))) {
                throw new IllegalArgumentException(
                    "Node " + node + " is missing from the port mapping!"
                );
            }
        }
        for(CardConstraint constraint: constraints) {
            for(int nodeId: constraint.nodes()) {
                if(nodeId < 0 || nodeId >= nodes.size()) {
                    throw new IllegalArgumentException(
                        "Constraint " + constraint
                            + " refers to unknown node " + nodeId + "!"
                    );
                }
            }
        }
    }

    public CardNode node(int id) {
        return this.nodes.get(id);
    }

    public Optional<CardNode> nodeOf(PortKey port) {
        Integer id = this.nodeByPort.get(port);
        if(id == null) {
            return Optional.empty();
        }
        return Optional.of(this.nodes.get(id));
    }

}
