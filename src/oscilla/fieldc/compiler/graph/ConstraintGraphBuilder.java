package oscilla.fieldc.compiler.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceTerm;
import oscilla.fieldc.compiler.types.InstanceVarId;

/**
 * Turns the cardinality behavior of every block and every edge of a patch
 * into a flat list of cardinality constraints over per-port nodes.
 */
public class ConstraintGraphBuilder {

    protected static final Logger logger = LogManager.getLogger();

    private final Patch patch;
    private List<CardNode> nodes;
    private Map<PortKey, Integer> nodeByPort;
    private List<CardConstraint> constraints;

    public ConstraintGraphBuilder(Patch patch) {
        this.patch = patch;
    }

    public static CardinalityConstraintGraph build(Patch patch) {
        return new ConstraintGraphBuilder(patch).build();
    }

    public CardinalityConstraintGraph build() {
        this.nodes = new ArrayList<>();
        this.nodeByPort = new HashMap<>();
        this.constraints = new ArrayList<>();
        this.createNodes();
        List<Block> blocks = this.patch.blocks();
        for(int blockI = 0; blockI < blocks.size(); blockI += 1) {
            this.walkBlock(blockI, blocks.get(blockI));
        }
        for(Edge edge: this.patch.edges()) {
            this.walkEdge(edge);
        }
        logger.debug(
            "Built {} cardinality constraints over {} ports of {} blocks",
            this.constraints.size(), this.nodes.size(), blocks.size()
        );
        return new CardinalityConstraintGraph(
            this.nodes, this.constraints, this.nodeByPort
        );
    }

    private void createNodes() {
        Map<PortKey, Integer> blockIndices = new HashMap<>();
        List<Block> blocks = this.patch.blocks();
        for(int blockI = 0; blockI < blocks.size(); blockI += 1) {
            for(PortKey key: blocks.get(blockI).portKeys()) {
                Integer previous = blockIndices.put(key, blockI);
                if(previous != null) {
                    throw new IllegalArgumentException(
                        "Port " + key + " is declared more than once!"
                    );
                }
            }
        }
        for(PortKey key: new TreeSet<>(blockIndices.keySet())) {
            int id = this.nodes.size();
            this.nodes.add(new CardNode(id, key, blockIndices.get(key)));
            this.nodeByPort.put(key, id);
        }
    }

    private int node(PortKey key) {
        Integer id = this.nodeByPort.get(key);
        if(id == null) {
            throw new IllegalArgumentException(
                "Port " + key + " does not exist in the patch!"
            );
        }
        return id;
    }

    private List<Integer> nodes(List<PortKey> keys) {
        List<Integer> ids = new ArrayList<>();
        for(PortKey key: keys) {
            ids.add(this.node(key));
        }
        return ids;
    }

    private void walkBlock(int blockI, Block block) {
        List<PortKey> ports = new ArrayList<>(new TreeSet<>(block.portKeys()));
        CardinalityBehavior behavior = block.behavior();
        switch(behavior.kind()) {
            case SIGNAL_ONLY: {
                ConstraintOrigin origin = this.rule(blockI, block, "signalOnly");
                for(PortKey port: ports) {
                    this.constraints.add(new CardConstraint.ClampOne(
                        this.node(port), origin
                    ));
                }
            } break;
            case TRANSFORM: {
                CardinalityBehavior.Transform data
                    = (CardinalityBehavior.Transform) behavior;
                ConstraintOrigin origin = this.rule(blockI, block, "transform");
                InstanceTerm produced = InstanceTerm.of(new InstanceRef(
                    data.domainType(), String.valueOf(blockI)
                ));
                for(String output: block.outputs()) {
                    this.constraints.add(new CardConstraint.ForceMany(
                        this.node(PortKey.out(block.id(), output)),
                        produced, origin
                    ));
                }
                this.addBroadcast(blockI, block, ports, data.broadcast());
            } break;
            case PRESERVE: {
                CardinalityBehavior.Preserve data
                    = (CardinalityBehavior.Preserve) behavior;
                switch(data.broadcast()) {
                    case STRICT: {
                        this.addAllEqual(
                            ports, this.rule(blockI, block, "preserve")
                        );
                    } break;
                    case ALLOW_ZIP_SIG: {
                        this.addBroadcast(blockI, block, ports, data.broadcast());
                    } break;
                    default: {
                        throw new RuntimeException("unhandled policy!");
                    }
                }
            } break;
            case FIELD_ONLY: {
                CardinalityBehavior.FieldOnly data
                    = (CardinalityBehavior.FieldOnly) behavior;
                ConstraintOrigin origin = this.rule(blockI, block, "fieldOnly");
                for(String input: block.inputs()) {
                    this.constraints.add(new CardConstraint.ForceMany(
                        this.node(PortKey.in(block.id(), input)),
                        InstanceTerm.of(InstanceVarId.fieldOnly(blockI, input)),
                        origin
                    ));
                }
                this.addBroadcast(blockI, block, ports, data.broadcast());
            } break;
            case LANES: {
                CardinalityBehavior.Lanes data
                    = (CardinalityBehavior.Lanes) behavior;
                for(CardinalityBehavior.LaneGroup group: data.groups()) {
                    this.walkLaneGroup(blockI, block, group);
                }
            } break;
            default: {
                throw new RuntimeException("unhandled behavior!");
            }
        }
    }

    private void walkLaneGroup(
        int blockI, Block block, CardinalityBehavior.LaneGroup group
    ) {
        TreeSet<PortKey> ports = new TreeSet<>();
        for(String member: group.members()) {
            for(PortKey.Direction direction: PortKey.Direction.values()) {
                if(block.hasPort(member, direction)) {
                    ports.add(new PortKey(block.id(), member, direction));
                }
            }
        }
        if(ports.isEmpty()) {
            logger.warn(
                "Lane group {} of block '{}' names no existing port",
                group.members(), block.id()
            );
            return;
        }
        switch(group.relation()) {
            case ZIP_BROADCAST: {
                this.constraints.add(new CardConstraint.ZipBroadcast(
                    this.nodes(new ArrayList<>(ports)),
                    this.rule(blockI, block, "zipBroadcast lane")
                ));
            } break;
            case ALL_EQUAL: {
                this.addAllEqual(
                    new ArrayList<>(ports),
                    this.rule(blockI, block, "allEqual lane")
                );
            } break;
            default: {
                throw new RuntimeException("unhandled lane relation!");
            }
        }
    }

    private void addBroadcast(
        int blockI, Block block, List<PortKey> ports,
        CardinalityBehavior.BroadcastPolicy policy
    ) {
        if(policy != CardinalityBehavior.BroadcastPolicy.ALLOW_ZIP_SIG) {
            return;
        }
        if(ports.isEmpty()) {
            return;
        }
        this.constraints.add(new CardConstraint.ZipBroadcast(
            this.nodes(ports), this.rule(blockI, block, "allowZipSig")
        ));
    }

    // 'ports' is sorted, so every constraint is anchored on the smallest key
    private void addAllEqual(List<PortKey> ports, ConstraintOrigin origin) {
        for(int portI = 1; portI < ports.size(); portI += 1) {
            this.constraints.add(CardConstraint.equal(
                this.node(ports.get(0)), this.node(ports.get(portI)), origin
            ));
        }
    }

    private void walkEdge(Edge edge) {
        int from = this.node(edge.fromKey());
        int to = this.node(edge.toKey());
        this.constraints.add(CardConstraint.equal(
            from, to, new ConstraintOrigin.FromEdge(edge.id())
        ));
    }

    private ConstraintOrigin rule(int blockI, Block block, String rule) {
        return new ConstraintOrigin.FromBlockRule(blockI, block.id(), rule);
    }

}
