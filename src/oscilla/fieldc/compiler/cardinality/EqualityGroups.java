package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import oscilla.fieldc.compiler.UnionFind;
import oscilla.fieldc.compiler.graph.CardConstraint;
import oscilla.fieldc.compiler.graph.CardNode;
import oscilla.fieldc.compiler.graph.CardinalityConstraintGraph;
import oscilla.fieldc.compiler.graph.PortKey;

/**
 * Partitions the nodes of a constraint graph into the classes induced by
 * its {@link CardConstraint.Equal} constraints. The partition is fixed once
 * constructed; only the facts of each group change afterwards.
 */
public class EqualityGroups {

    private final CardinalityConstraintGraph graph;
    private final UnionFind<GroupFacts> groups;
    private final Map<Integer, List<Integer>> members;
    private final List<Integer> roots;

    public EqualityGroups(CardinalityConstraintGraph graph) {
        this.graph = graph;
        this.groups = new UnionFind<>();
        for(int nodeI = 0; nodeI < graph.nodes().size(); nodeI += 1) {
            this.groups.add(new GroupFacts());
        }
        for(CardConstraint constraint: graph.constraints()) {
            if(!(constraint instanceof CardConstraint.Equal equal)) {
                continue;
            }
            GroupFacts factsA = this.groups.get(equal.a());
            GroupFacts factsB = this.groups.get(equal.b());
            int root = this.groups.union(equal.a(), equal.b());
            factsA.absorb(factsB);
            this.groups.set(root, factsA);
        }
        // node ids follow port key order, so the first member of every
        // group is also its smallest port key
        Map<Integer, List<Integer>> members = new TreeMap<>();
        for(CardNode node: graph.nodes()) {
            members.computeIfAbsent(
                this.groups.find(node.id()), r -> new ArrayList<>()
            ).add(node.id());
        }
        this.members = members;
        List<Integer> roots = new ArrayList<>(members.keySet());
        roots.sort((a, b) -> Integer.compare(
            members.get(a).get(0), members.get(b).get(0)
        ));
        this.roots = Collections.unmodifiableList(roots);
    }

    public int size() {
        return this.roots.size();
    }

    public int group(int node) {
        return this.groups.find(node);
    }

    public GroupFacts facts(int node) {
        GroupFacts facts = this.groups.get(node);
        if(facts == null) {
            throw new IllegalStateException(
                "Node " + this.graph.node(node) + " has no group facts!"
            );
        }
        return facts;
    }

    /** All group representatives, ordered by their anchor port. */
    public List<Integer> roots() {
        return this.roots;
    }

    public List<Integer> members(int node) {
        return Collections.unmodifiableList(
            this.members.get(this.group(node))
        );
    }

    public List<PortKey> memberPorts(int node) {
        List<PortKey> ports = new ArrayList<>();
        for(int member: this.members(node)) {
            ports.add(this.graph.node(member).key());
        }
        return ports;
    }

    /** The member with the lexicographically smallest port key. */
    public CardNode anchor(int node) {
        return this.graph.node(this.members(node).get(0));
    }

}
