package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import oscilla.fieldc.compiler.graph.CardConstraint;
import oscilla.fieldc.compiler.graph.CardNode;
import oscilla.fieldc.compiler.graph.CardinalityConstraintGraph;
import oscilla.fieldc.compiler.graph.ConstraintOrigin;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.CardinalityValue;
import oscilla.fieldc.compiler.types.InferenceCardinality;
import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceTerm;

/**
 * Assigns every port of a constraint graph a concrete cardinality.
 *
 * <p>Solving runs in fixed phases: equality grouping, fact collection,
 * local resolution of each group, the broadcast fixpoint and finally the
 * conversion of every group decision into canonical types. All state lives
 * in one solver instance and is dropped after {@link #solve()}.
 */
public class CardinalitySolver {

    protected static final Logger logger = LogManager.getLogger();

    private final CardinalityConstraintGraph graph;
    private final SortedMap<PortKey, CanonicalType> existing;
    private EqualityGroups groups;
    private InstanceUnifier instances;
    private List<CardinalityDiagnostic> diagnostics;

    public CardinalitySolver(
        CardinalityConstraintGraph graph,
        Map<PortKey, CanonicalType> existingPortTypes
    ) {
        this.graph = graph;
        this.existing = new TreeMap<>(existingPortTypes);
    }

    public static CardinalitySolution solve(
        CardinalityConstraintGraph graph,
        Map<PortKey, CanonicalType> existingPortTypes
    ) {
        return new CardinalitySolver(graph, existingPortTypes).solve();
    }

    public CardinalitySolution solve() {
        this.instances = new InstanceUnifier();
        this.diagnostics = new ArrayList<>();
        logger.debug("Phase 1: grouping {} ports", this.graph.nodes().size());
        this.groups = new EqualityGroups(this.graph);
        logger.debug("Phase 2: collecting facts of {} groups", this.groups.size());
        this.collectFacts();
        logger.debug("Phase 3: local group resolution");
        this.solveGroups();
        logger.debug("Phase 4: broadcast fixpoint");
        this.solveBroadcasts();
        logger.debug("Phase 5: finalization");
        SortedMap<PortKey, CanonicalType> portTypes = this.finish();
        if(!this.diagnostics.isEmpty()) {
            logger.debug(
                "Cardinality solving failed with {} diagnostic(s)",
                this.diagnostics.size()
            );
            return CardinalitySolution.ofDiagnostics(
                this.diagnostics, this.instances.resolvedVars()
            );
        }
        return CardinalitySolution.ofTypes(
            portTypes, this.instances.resolvedVars()
        );
    }

    private void collectFacts() {
        for(CardConstraint constraint: this.graph.constraints()) {
            switch(constraint.kind()) {
                case CLAMP_ONE: {
                    CardConstraint.ClampOne data
                        = (CardConstraint.ClampOne) constraint;
                    this.groups.facts(data.node()).forceOne(data.origin());
                } break;
                case FORCE_MANY: {
                    CardConstraint.ForceMany data
                        = (CardConstraint.ForceMany) constraint;
                    this.instances.register(data.term());
                    this.groups.facts(data.node())
                        .forceMany(data.term(), data.origin());
                } break;
                case EQUAL:
                case ZIP_BROADCAST: {
                    // handled by their own phases
                } break;
                default: {
                    throw new RuntimeException("unhandled constraint kind!");
                }
            }
        }
        // zero only marks a compile-time constant, the solver treats it
        // like one
        for(PortKey port: this.existing.keySet()) {
            Optional<CardNode> node = this.graph.nodeOf(port);
            if(node.isEmpty()) {
                logger.warn("Ignoring existing type of unknown port {}", port);
                continue;
            }
            ConstraintOrigin origin = new ConstraintOrigin.FromExistingType(port);
            GroupFacts facts = this.groups.facts(node.get().id());
            CardinalityValue card = this.existing.get(port).cardinality();
            switch(card.kind()) {
                case ZERO:
                case ONE: {
                    facts.forceOne(origin);
                } break;
                case MANY: {
                    InstanceRef ref = ((CardinalityValue.Many) card).instance();
                    facts.forceMany(InstanceTerm.of(ref), origin);
                } break;
                default: {
                    throw new RuntimeException("unhandled cardinality!");
                }
            }
        }
    }

    private void solveGroups() {
        for(int root: this.groups.roots()) {
            GroupFacts facts = this.groups.facts(root);
            List<InstanceTerm> terms = facts.forcedManyTerms();
            if(facts.isForcedOne() && !terms.isEmpty()) {
                this.report(
                    CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
                    this.groups.memberPorts(root),
                    "ports are required to be one (because of "
                        + describe(facts.clampOneOrigins())
                        + ") and many (because of "
                        + describe(facts.forceManyOrigins()) + ")",
                    Optional.empty()
                );
                facts.taint();
                continue;
            }
            if(facts.isForcedOne()) {
                facts.decide(InferenceCardinality.ONE);
                continue;
            }
            if(terms.isEmpty()) {
                continue;
            }
            boolean conflicting = false;
            for(int termI = 1; termI < terms.size(); termI += 1) {
                InstanceUnifier.Unification unification = this.instances
                    .unifyTerms(terms.get(0), terms.get(termI));
                if(unification.isConflict()) {
                    InstanceUnifier.Conflict conflict
                        = unification.conflict().get();
                    this.report(
                        CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
                        this.groups.memberPorts(root),
                        "connected ports belong to different instances, "
                            + conflict.a() + " and " + conflict.b(),
                        Optional.empty()
                    );
                    conflicting = true;
                    break;
                }
            }
            if(conflicting) {
                facts.taint();
                continue;
            }
            facts.decide(InferenceCardinality.many(terms.get(0)));
        }
    }

    private void solveBroadcasts() {
        List<CardConstraint.ZipBroadcast> broadcasts = new ArrayList<>();
        for(CardConstraint constraint: this.graph.constraints()) {
            if(constraint instanceof CardConstraint.ZipBroadcast zip) {
                broadcasts.add(zip);
            }
        }
        boolean[] failed = new boolean[broadcasts.size()];
        int passes = 0;
        boolean changed = true;
        while(changed) {
            changed = false;
            passes += 1;
            for(int zipI = 0; zipI < broadcasts.size(); zipI += 1) {
                if(failed[zipI]) { continue; }
                BroadcastStep step = this.applyBroadcast(broadcasts.get(zipI));
                changed |= step.changed;
                failed[zipI] = step.failed;
            }
        }
        logger.debug(
            "Broadcast fixpoint over {} constraint(s) reached after {} pass(es)",
            broadcasts.size(), passes
        );
    }

    private static record BroadcastStep(boolean changed, boolean failed) {}

    private BroadcastStep applyBroadcast(CardConstraint.ZipBroadcast zip) {
        Set<Integer> roots = new LinkedHashSet<>();
        for(int node: zip.nodes()) {
            roots.add(this.groups.group(node));
        }
        List<Integer> many = new ArrayList<>();
        List<Integer> one = new ArrayList<>();
        List<Integer> undecided = new ArrayList<>();
        for(int root: this.groups.roots()) {
            if(!roots.contains(root)) { continue; }
            GroupFacts facts = this.groups.facts(root);
            if(facts.isTainted()) { continue; }
            if(facts.isUndecided()) {
                undecided.add(root);
            } else if(facts.isDecided(InferenceCardinality.Kind.MANY)) {
                many.add(root);
            } else {
                one.add(root);
            }
        }
        if(many.isEmpty()) {
            return new BroadcastStep(false, false);
        }
        List<PortKey> zipPorts = zip.nodes().stream()
            .map(n -> this.graph.node(n).key())
            .collect(Collectors.toList());
        if(!one.isEmpty()) {
            int scalar = one.get(0);
            int field = many.get(0);
            this.report(
                CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
                this.memberPorts(roots),
                "the ports of the " + zip.origin() + " are broadcast"
                    + " together, but " + this.groups.anchor(scalar).key()
                    + " is one while " + this.groups.anchor(field).key()
                    + " is many",
                Optional.of(new CardinalityDiagnostic.BroadcastMix(
                    zipPorts, this.groups.memberPorts(scalar)
                ))
            );
            this.taint(roots);
            return new BroadcastStep(false, true);
        }
        InstanceTerm candidate = this.term(many.get(0));
        boolean changed = false;
        for(int manyI = 1; manyI < many.size(); manyI += 1) {
            int other = many.get(manyI);
            InstanceUnifier.Unification unification = this.instances
                .unifyTerms(candidate, this.term(other));
            if(unification.isConflict()) {
                InstanceUnifier.Conflict conflict = unification.conflict().get();
                this.report(
                    CardinalityDiagnostic.Kind.ZIP_BROADCAST_INSTANCE_MISMATCH,
                    this.memberPorts(roots),
                    "the " + zip.origin() + " combines values of "
                        + conflict.a() + " (" + this.source(many.get(0))
                        + ") and " + conflict.b() + " ("
                        + this.source(other) + ")",
                    Optional.empty()
                );
                this.taint(roots);
                return new BroadcastStep(changed, true);
            }
            changed |= unification.changed();
        }
        for(int root: undecided) {
            this.groups.facts(root).decide(InferenceCardinality.many(candidate));
            changed = true;
        }
        return new BroadcastStep(changed, false);
    }

    // where the instance of a many group comes from, and where it is seen
    private String source(int root) {
        return "from " + describe(this.groups.facts(root).forceManyOrigins())
            + ", at " + this.groups.anchor(root).key();
    }

    private InstanceTerm term(int root) {
        InferenceCardinality card = this.groups.facts(root).finalCard().get();
        return ((InferenceCardinality.Many) card).term();
    }

    private List<PortKey> memberPorts(Set<Integer> roots) {
        List<PortKey> ports = new ArrayList<>();
        for(int root: roots) {
            ports.addAll(this.groups.memberPorts(root));
        }
        return ports;
    }

    private void taint(Set<Integer> roots) {
        for(int root: roots) {
            this.groups.facts(root).taint();
        }
    }

    private SortedMap<PortKey, CanonicalType> finish() {
        Map<Integer, CardinalityValue> groupValues = new HashMap<>();
        for(int root: this.groups.roots()) {
            GroupFacts facts = this.groups.facts(root);
            if(facts.isTainted()) {
                continue;
            }
            CardNode anchor = this.groups.anchor(root);
            if(facts.isUndecided()) {
                this.report(
                    CardinalityDiagnostic.Kind.UNRESOLVED_CARDINALITY,
                    this.groups.memberPorts(root),
                    "could not decide whether " + anchor.key()
                        + " is one or many",
                    Optional.empty()
                );
                continue;
            }
            InferenceCardinality card = facts.finalCard().get();
            switch(card.kind()) {
                case ONE: {
                    groupValues.put(root, CardinalityValue.ONE);
                } break;
                case MANY: {
                    InstanceTerm term = this.instances.resolve(
                        ((InferenceCardinality.Many) card).term()
                    );
                    if(term instanceof InstanceTerm.Inst inst) {
                        groupValues.put(root, CardinalityValue.many(inst.ref()));
                        break;
                    }
                    this.report(
                        CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR,
                        this.groups.memberPorts(root),
                        anchor.key() + " is many, but its instance " + term
                            + " is never connected to a concrete instance",
                        Optional.empty()
                    );
                } break;
                default: {
                    throw new RuntimeException("unhandled cardinality!");
                }
            }
        }
        SortedMap<PortKey, CanonicalType> portTypes = new TreeMap<>();
        for(CardNode node: this.graph.nodes()) {
            // every node has facts, even ones that no constraint touches
            this.groups.facts(node.id());
            CardinalityValue value = groupValues.get(this.groups.group(node.id()));
            if(value == null) {
                continue;
            }
            CanonicalType existingType = this.existing.get(node.key());
            if(existingType == null) {
                portTypes.put(node.key(), CanonicalType.of(value));
                continue;
            }
            boolean keepZero = existingType.cardinality().kind()
                    == CardinalityValue.Kind.ZERO
                && value.kind() == CardinalityValue.Kind.ONE;
            portTypes.put(
                node.key(),
                keepZero? existingType : existingType.withCardinality(value)
            );
        }
        return portTypes;
    }

    private void report(
        CardinalityDiagnostic.Kind kind, List<PortKey> involved,
        String message, Optional<CardinalityDiagnostic.BroadcastMix> mix
    ) {
        PortKey anchor = involved.stream().sorted().findFirst().get();
        CardNode anchorNode = this.graph.nodeOf(anchor).get();
        CardinalityDiagnostic diagnostic = new CardinalityDiagnostic(
            kind, anchor, involved,
            anchorNode.blockIndex(), anchorNode.portName(),
            message, mix
        );
        logger.debug("{}", diagnostic);
        this.diagnostics.add(diagnostic);
    }

    private static String describe(List<ConstraintOrigin> origins) {
        return origins.stream()
            .map(Object::toString)
            .distinct()
            .collect(Collectors.joining(", "));
    }

}
