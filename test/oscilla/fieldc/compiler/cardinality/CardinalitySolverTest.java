package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.SortedMap;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import oscilla.fieldc.compiler.PatchFixtures;
import oscilla.fieldc.compiler.graph.CardinalityBehavior;
import oscilla.fieldc.compiler.graph.ConstraintGraphBuilder;
import oscilla.fieldc.compiler.graph.Edge;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.CardinalityValue;
import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceVarId;

class CardinalitySolverTest {

    private static final InstanceRef CIRCLES_0 = new InstanceRef("circle", "0");
    private static final InstanceRef CIRCLES_1 = new InstanceRef("circle", "1");

    private static CardinalitySolution solve(Patch patch) {
        return solve(patch, Map.of());
    }

    private static CardinalitySolution solve(
        Patch patch, Map<PortKey, CanonicalType> existing
    ) {
        return CardinalitySolver.solve(
            ConstraintGraphBuilder.build(patch), existing
        );
    }

    private static CardinalityValue card(
        CardinalitySolution solution, PortKey port
    ) {
        return solution.portTypes().get().get(port).cardinality();
    }

    @Test
    void testArrayPropagatesThroughStrictPreserve() {
        CardinalitySolution solution = solve(PatchFixtures.arrayIntoScale());
        Assertions.assertTrue(solution.isResolved());
        Assertions.assertTrue(solution.diagnostics().isEmpty());
        Assertions.assertEquals(
            CardinalityValue.many(CIRCLES_0),
            card(solution, PortKey.out("scale", "out"))
        );
        Assertions.assertEquals(
            CardinalityValue.ONE, card(solution, PortKey.in("array", "count"))
        );
        Assertions.assertEquals(5, solution.portTypes().get().size());
    }

    @Test
    void testDifferentArraysInOneBroadcastMismatch() {
        CardinalitySolution solution = solve(PatchFixtures.twoArraysIntoZip());
        Assertions.assertFalse(solution.isResolved());
        Assertions.assertTrue(solution.portTypes().isEmpty());
        Assertions.assertEquals(1, solution.diagnostics().size());
        CardinalityDiagnostic diagnostic = solution.diagnostics().get(0);
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.ZIP_BROADCAST_INSTANCE_MISMATCH,
            diagnostic.kind()
        );
        Assertions.assertEquals("ZipBroadcastInstanceMismatch", diagnostic.code());
        // anchored on the smallest port of the whole broadcast set
        Assertions.assertEquals(PortKey.in("add", "a"), diagnostic.anchor());
        Assertions.assertEquals(2, diagnostic.blockIndex());
        Assertions.assertEquals("a", diagnostic.portName());
        Assertions.assertEquals(List.of(
            PortKey.in("add", "a"),
            PortKey.in("add", "b"),
            PortKey.out("add", "out"),
            PortKey.out("array0", "out"),
            PortKey.out("array1", "out")
        ), diagnostic.involved());
        Assertions.assertEquals(
            "the allowZipSig rule of block 'add' combines values of circle#0"
                + " (from transform rule of block 'array0', at add:a:in)"
                + " and circle#1"
                + " (from transform rule of block 'array1', at add:b:in)",
            diagnostic.message()
        );
    }

    @Test
    void testUnconnectedFieldInputIsUnresolved() {
        Patch patch = new PatchFixtures()
            .block("render", CardinalityBehavior.fieldOnly(),
                List.of("pos"), List.of())
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertTrue(solution.portTypes().isEmpty());
        Assertions.assertEquals(1, solution.diagnostics().size());
        CardinalityDiagnostic diagnostic = solution.diagnostics().get(0);
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR,
            diagnostic.kind()
        );
        Assertions.assertEquals(PortKey.in("render", "pos"), diagnostic.anchor());
        Assertions.assertEquals("pos", diagnostic.portName());
    }

    @Test
    void testConnectedFieldInputTakesUpstreamInstance() {
        Patch patch = new PatchFixtures()
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("render", CardinalityBehavior.fieldOnly(),
                List.of("pos"), List.of())
            .edge("array.out", "render.pos")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertTrue(solution.isResolved());
        Assertions.assertEquals(
            CardinalityValue.many(CIRCLES_0),
            card(solution, PortKey.in("render", "pos"))
        );
        Assertions.assertEquals(
            CIRCLES_0,
            solution.instances().get(new InstanceVarId("fieldOnly:1:pos"))
        );
    }

    @Test
    void testScalarBroadcastSettlesAtOne() {
        CardinalitySolution solution = solve(PatchFixtures.constantsIntoZip());
        Assertions.assertTrue(solution.isResolved());
        for(CanonicalType type: solution.portTypes().get().values()) {
            Assertions.assertEquals(CardinalityValue.ONE, type.cardinality());
        }
    }

    @Test
    void testBroadcastWithoutManyDecidesNothing() {
        Patch patch = new PatchFixtures()
            .block("const", CardinalityBehavior.signalOnly(),
                List.of(), List.of("out"))
            .block("add", PatchFixtures.zip(), List.of("a"), List.of("out"))
            .edge("const.out", "add.a")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertEquals(1, solution.diagnostics().size());
        CardinalityDiagnostic diagnostic = solution.diagnostics().get(0);
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.UNRESOLVED_CARDINALITY,
            diagnostic.kind()
        );
        Assertions.assertEquals(PortKey.out("add", "out"), diagnostic.anchor());
    }

    @Test
    void testBroadcastPromotesUndecidedPorts() {
        Patch patch = new PatchFixtures()
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("add", PatchFixtures.zip(), List.of("a", "b"), List.of("out"))
            .edge("array.out", "add.a")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertTrue(solution.isResolved());
        Assertions.assertEquals(
            CardinalityValue.many(CIRCLES_0), card(solution, PortKey.in("add", "b"))
        );
        Assertions.assertEquals(
            CardinalityValue.many(CIRCLES_0),
            card(solution, PortKey.out("add", "out"))
        );
    }

    @Test
    void testBroadcastsReachFixpointAcrossBlocks() {
        // the downstream block sorts first, so it only sees many on a
        // second pass
        Patch patch = new PatchFixtures()
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("down", PatchFixtures.zip(), List.of("a", "b"), List.of("out"))
            .block("up", PatchFixtures.zip(), List.of("a"), List.of("out"))
            .edge("array.out", "up.a")
            .edge("up.out", "down.b")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertTrue(solution.isResolved());
        for(CanonicalType type: solution.portTypes().get().values()) {
            Assertions.assertEquals(
                CardinalityValue.many(CIRCLES_0), type.cardinality()
            );
        }
    }

    @Test
    void testScalarInManyBroadcastConflicts() {
        CardinalitySolution solution = solve(
            PatchFixtures.arrayAndConstantIntoZip()
        );
        Assertions.assertEquals(1, solution.diagnostics().size());
        CardinalityDiagnostic diagnostic = solution.diagnostics().get(0);
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT, diagnostic.kind()
        );
        Assertions.assertEquals(
            List.of(PortKey.in("add", "b"), PortKey.out("const", "out")),
            diagnostic.broadcastMix().get().scalarMembers()
        );
        Assertions.assertEquals(3, diagnostic.broadcastMix().get().zipPorts().size());
    }

    @Test
    void testOneAndManyInOneGroupConflict() {
        Patch patch = new PatchFixtures()
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("print", CardinalityBehavior.signalOnly(),
                List.of("in"), List.of())
            .edge("array.out", "print.in")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertEquals(1, solution.diagnostics().size());
        CardinalityDiagnostic diagnostic = solution.diagnostics().get(0);
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT, diagnostic.kind()
        );
        Assertions.assertEquals(
            List.of(PortKey.out("array", "out"), PortKey.in("print", "in")),
            diagnostic.involved()
        );
        Assertions.assertTrue(
            diagnostic.message().contains("signalOnly rule of block 'print'")
        );
        Assertions.assertTrue(
            diagnostic.message().contains("transform rule of block 'array'")
        );
        Assertions.assertTrue(diagnostic.broadcastMix().isEmpty());
    }

    @Test
    void testDifferentInstancesInOneGroupConflict() {
        Patch patch = new PatchFixtures()
            .block("array0", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("array1", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("mix", new CardinalityBehavior.Lanes(List.of(
                new CardinalityBehavior.LaneGroup(
                    CardinalityBehavior.LaneGroup.Relation.ALL_EQUAL,
                    List.of("a", "b")
                )
            )), List.of("a", "b"), List.of())
            .edge("array0.out", "mix.a")
            .edge("array1.out", "mix.b")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertEquals(1, solution.diagnostics().size());
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
            solution.diagnostics().get(0).kind()
        );
        Assertions.assertTrue(
            solution.diagnostics().get(0).message().contains("circle#1")
        );
    }

    @Test
    void testExistingTypesForceCardinality() {
        Patch patch = new PatchFixtures()
            .block("render", CardinalityBehavior.fieldOnly(),
                List.of("pos"), List.of())
            .block("time", PatchFixtures.strict(), List.of(), List.of("t"))
            .build();
        Map<PortKey, CanonicalType> existing = Map.of(
            PortKey.in("render", "pos"),
            CanonicalType.of(CardinalityValue.many(CIRCLES_1)),
            PortKey.out("time", "t"),
            CanonicalType.of(CardinalityValue.ONE)
        );
        CardinalitySolution solution = solve(patch, existing);
        Assertions.assertTrue(solution.isResolved());
        Assertions.assertEquals(
            CardinalityValue.many(CIRCLES_1),
            card(solution, PortKey.in("render", "pos"))
        );
        Assertions.assertEquals(
            CardinalityValue.ONE, card(solution, PortKey.out("time", "t"))
        );
        Assertions.assertEquals(
            CIRCLES_1,
            solution.instances().get(new InstanceVarId("fieldOnly:0:pos"))
        );
    }

    @Test
    void testExistingTypeContradictingTransformConflicts() {
        Map<PortKey, CanonicalType> existing = Map.of(
            PortKey.out("scale", "out"),
            CanonicalType.of(CardinalityValue.many(CIRCLES_1))
        );
        CardinalitySolution solution = solve(
            PatchFixtures.arrayIntoScale(), existing
        );
        Assertions.assertEquals(1, solution.diagnostics().size());
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
            solution.diagnostics().get(0).kind()
        );
    }

    @Test
    void testZeroAndOtherAxesAreKept() {
        Patch patch = new PatchFixtures()
            .block("const", CardinalityBehavior.signalOnly(),
                List.of(), List.of("out"))
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .build();
        CanonicalType constant = new CanonicalType(
            Optional.of("float"), Optional.of("seconds"),
            CardinalityValue.ZERO, Optional.of("continuous"), Optional.empty()
        );
        CanonicalType scalar = new CanonicalType(
            Optional.of("vec2"), Optional.empty(),
            CardinalityValue.ONE, Optional.empty(), Optional.empty()
        );
        CardinalitySolution solution = solve(patch, Map.of(
            PortKey.out("const", "out"), constant
        ));
        Assertions.assertEquals(
            constant, solution.portTypes().get().get(PortKey.out("const", "out"))
        );
        // an existing one on a transform output contradicts the transform
        CardinalitySolution conflicting = solve(patch, Map.of(
            PortKey.out("const", "out"), constant,
            PortKey.out("array", "out"), scalar
        ));
        Assertions.assertFalse(conflicting.isResolved());
    }

    @Test
    void testOtherAxesPassThroughWithNewCardinality() {
        CanonicalType position = new CanonicalType(
            Optional.of("vec2"), Optional.empty(),
            CardinalityValue.many(CIRCLES_0), Optional.empty(),
            Optional.of("world")
        );
        CardinalitySolution solution = solve(
            PatchFixtures.arrayIntoScale(),
            Map.of(PortKey.in("scale", "in"), position)
        );
        Assertions.assertEquals(
            position, solution.portTypes().get().get(PortKey.in("scale", "in"))
        );
        Assertions.assertEquals(
            CanonicalType.of(CardinalityValue.many(CIRCLES_0)),
            solution.portTypes().get().get(PortKey.out("scale", "out"))
        );
    }

    @Test
    void testSolvingResolvedTypesAgainIsIdentity() {
        Patch patch = PatchFixtures.arrayIntoScale();
        SortedMap<PortKey, CanonicalType> first = solve(patch).portTypes().get();
        CardinalitySolution second = solve(patch, first);
        Assertions.assertTrue(second.diagnostics().isEmpty());
        Assertions.assertEquals(first, second.portTypes().get());
    }

    @Test
    void testExistingTypeOfUnknownPortIsIgnored() {
        CardinalitySolution solution = solve(
            PatchFixtures.constantsIntoZip(),
            Map.of(
                PortKey.out("ghost", "out"),
                CanonicalType.of(CardinalityValue.ONE)
            )
        );
        Assertions.assertTrue(solution.isResolved());
        Assertions.assertFalse(
            solution.portTypes().get().containsKey(PortKey.out("ghost", "out"))
        );
    }

    @Test
    void testEveryBrokenGroupIsReported() {
        // two independent problems, both reported, in port key order
        Patch patch = new PatchFixtures()
            .block("render", CardinalityBehavior.fieldOnly(),
                List.of("pos"), List.of())
            .block("array", CardinalityBehavior.transform("circle"),
                List.of(), List.of("out"))
            .block("print", CardinalityBehavior.signalOnly(),
                List.of("in"), List.of())
            .edge("array.out", "print.in")
            .build();
        CardinalitySolution solution = solve(patch);
        Assertions.assertEquals(2, solution.diagnostics().size());
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.CARDINALITY_CONFLICT,
            solution.diagnostics().get(0).kind()
        );
        Assertions.assertEquals(
            CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR,
            solution.diagnostics().get(1).kind()
        );
    }

    private static Patch shuffled(Patch patch, Random rand) {
        List<Edge> edges = new ArrayList<>(patch.edges());
        Collections.shuffle(edges, rand);
        return new Patch(patch.blocks(), edges);
    }

    private static Map<PortKey, CanonicalType> shuffled(
        Map<PortKey, CanonicalType> existing, Random rand
    ) {
        List<PortKey> keys = new ArrayList<>(existing.keySet());
        Collections.shuffle(keys, rand);
        Map<PortKey, CanonicalType> result = new LinkedHashMap<>();
        for(PortKey key: keys) {
            result.put(key, existing.get(key));
        }
        return result;
    }

    private static Patch mixedPatch() {
        return new PatchFixtures()
            .block("array0", CardinalityBehavior.transform("circle"),
                List.of("count"), List.of("out"))
            .block("array1", CardinalityBehavior.transform("circle"),
                List.of("count"), List.of("out"))
            .block("count", CardinalityBehavior.signalOnly(),
                List.of(), List.of("out"))
            .block("add", PatchFixtures.zip(), List.of("a", "b"), List.of("out"))
            .block("mul", PatchFixtures.zip(), List.of("a", "b"), List.of("out"))
            .block("render", CardinalityBehavior.fieldOnly(),
                List.of("pos", "size"), List.of())
            .edge("count.out", "array0.count")
            .edge("count.out", "array1.count")
            .edge("array0.out", "add.a")
            .edge("array1.out", "add.b")
            .edge("array1.out", "mul.a")
            .edge("mul.out", "render.pos")
            .build();
    }

    private static void checkDeterminism(long seed) {
        Patch patch = mixedPatch();
        Map<PortKey, CanonicalType> existing = new LinkedHashMap<>();
        existing.put(
            PortKey.in("render", "size"),
            CanonicalType.of(CardinalityValue.many(CIRCLES_0))
        );
        existing.put(
            PortKey.in("mul", "b"),
            CanonicalType.of(CardinalityValue.many(CIRCLES_1))
        );
        CardinalitySolution expected = solve(patch, existing);
        Random rand = new Random(seed);
        CardinalitySolution actual = solve(
            shuffled(patch, rand), shuffled(existing, rand)
        );
        Assertions.assertEquals(expected.portTypes(), actual.portTypes());
        Assertions.assertEquals(expected.diagnostics(), actual.diagnostics());
        Assertions.assertEquals(
            expected.diagnostics().toString(), actual.diagnostics().toString()
        );
        Assertions.assertEquals(expected.instances(), actual.instances());
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 42, 68392, -6733423670758169604L})
    void testDeterminism(long seed) {
        checkDeterminism(seed);
    }

    @RepeatedTest(32)
    void testDeterminism_random() {
        long seed = new Random().nextLong();
        try {
            checkDeterminism(seed);
        } catch(Throwable t) {
            System.err.println("FAILED testDeterminism with seed " + seed);
            throw t;
        }
    }

    @Test
    void testMixedPatchDiagnostics() {
        CardinalitySolution solution = solve(mixedPatch());
        Assertions.assertFalse(solution.isResolved());
        List<CardinalityDiagnostic.Kind> kinds = new ArrayList<>();
        for(CardinalityDiagnostic diagnostic: solution.diagnostics()) {
            kinds.add(diagnostic.kind());
        }
        // mul.b is pulled into the field of render.pos, but neither that
        // nor render.size ever meets a concrete instance
        Assertions.assertEquals(List.of(
            CardinalityDiagnostic.Kind.ZIP_BROADCAST_INSTANCE_MISMATCH,
            CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR,
            CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR,
            CardinalityDiagnostic.Kind.UNRESOLVED_INSTANCE_VAR
        ), kinds);
        Assertions.assertEquals(
            PortKey.in("mul", "b"), solution.diagnostics().get(1).anchor()
        );
    }

}
