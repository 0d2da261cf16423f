package oscilla.fieldc.compiler;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CardinalityValue;
import oscilla.fieldc.compiler.types.InstanceRef;

class CompilerTest {

    @Test
    void testResolvedOutput() {
        Result<Compiler.Output> result = Compiler.resolveCardinalities(
            PatchFixtures.arrayIntoScale(), Map.of()
        );
        Assertions.assertTrue(result.isValue());
        Assertions.assertEquals(
            CardinalityValue.many(new InstanceRef("circle", "0")),
            result.getValue().portTypes()
                .get(PortKey.out("scale", "out")).cardinality()
        );
        Assertions.assertTrue(result.getValue().instances().isEmpty());
    }

    @Test
    void testDiagnosticsBecomeErrors() {
        Result<Compiler.Output> result = Compiler.resolveCardinalities(
            PatchFixtures.twoArraysIntoZip(), Map.of()
        );
        Assertions.assertTrue(result.isError());
        List<Error> errors = result.getError();
        Assertions.assertEquals(1, errors.size());
        Error error = errors.get(0);
        Assertions.assertEquals("ZipBroadcastInstanceMismatch", error.code().get());
        // one error marking on the anchor, the other four ports as info
        Assertions.assertEquals(5, error.markings().length);
        Assertions.assertEquals(
            PortKey.in("add", "a"), error.markings()[0].location()
        );
        Assertions.assertEquals(
            PortKey.out("array1", "out"), error.markings()[4].location()
        );
    }

    @Test
    void testBroadcastConflictSuggestsAdapter() {
        Patch patch = PatchFixtures.arrayAndConstantIntoZip();
        Result<Compiler.Output> result = Compiler.resolveCardinalities(
            patch, Map.of()
        );
        Error error = result.getError().get(0);
        Error.Marking last = error.markings()[error.markings().length - 1];
        Assertions.assertTrue(last.isHelp());
        Assertions.assertEquals(PortKey.in("add", "b"), last.location());
        String rendered = error.render(patch, false);
        Assertions.assertTrue(
            rendered.startsWith("error[CardinalityConflict]: "), rendered
        );
        Assertions.assertTrue(rendered.contains(
            "consider inserting a Broadcast adapter on the edge"
                + " const.out -> add.b"
        ), rendered);
        Assertions.assertTrue(rendered.contains("add.b (in) of add #2"), rendered);
        Assertions.assertFalse(rendered.contains("\033["));
    }

    @Test
    void testColoredRendering() {
        Error error = new Error(
            "CardinalityConflict", "broken",
            Error.Marking.error(PortKey.out("nowhere", "out"), "here")
        );
        String rendered = error.render(new Patch(List.of(), List.of()), true);
        Assertions.assertTrue(rendered.contains("\033[0;1;31m"));
        Assertions.assertTrue(rendered.contains("nowhere.out (out) "));
        Assertions.assertEquals(
            "[CardinalityConflict] broken", error.toString()
        );
    }

    @Test
    void testResultRejectsMisuse() {
        Assertions.assertThrows(
            IllegalArgumentException.class, () -> Result.ofError(List.of())
        );
        Result<String> value = Result.ofValue("ok");
        Assertions.assertThrows(IllegalStateException.class, value::getError);
        Assertions.assertEquals(2, (int) value.map(String::length).getValue());
        Result<String> failed = Result.ofError(new Error("nope"));
        Assertions.assertTrue(failed.map(String::length).isError());
    }

}
