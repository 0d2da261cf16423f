package oscilla.fieldc.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import oscilla.fieldc.compiler.cardinality.BroadcastAdapterHints;
import oscilla.fieldc.compiler.cardinality.CardinalityDiagnostic;
import oscilla.fieldc.compiler.cardinality.CardinalitySolution;
import oscilla.fieldc.compiler.cardinality.CardinalitySolver;
import oscilla.fieldc.compiler.graph.CardinalityConstraintGraph;
import oscilla.fieldc.compiler.graph.ConstraintGraphBuilder;
import oscilla.fieldc.compiler.graph.Edge;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceVarId;

public class Compiler {

    protected static final Logger logger = LogManager.getLogger();

    public static record Output(
        SortedMap<PortKey, CanonicalType> portTypes,
        SortedMap<InstanceVarId, InstanceRef> instances
    ) {}

    private Compiler() {}

    public static Result<Output> resolveCardinalities(
        Patch patch, Map<PortKey, CanonicalType> existingPortTypes
    ) {
        CardinalityConstraintGraph graph = ConstraintGraphBuilder.build(patch);
        CardinalitySolution solution = CardinalitySolver.solve(
            graph, existingPortTypes
        );
        if(!solution.isResolved()) {
            List<Error> errors = new ArrayList<>();
            for(CardinalityDiagnostic diagnostic: solution.diagnostics()) {
                errors.add(Compiler.makeError(
                    diagnostic,
                    BroadcastAdapterHints.boundaryEdge(patch, diagnostic)
                ));
            }
            return Result.ofError(errors);
        }
        logger.debug(
            "Resolved the cardinality of {} ports",
            solution.portTypes().get().size()
        );
        return Result.ofValue(new Output(
            solution.portTypes().get(), solution.instances()
        ));
    }

    private static Error makeError(
        CardinalityDiagnostic diagnostic, Optional<Edge> adapterEdge
    ) {
        List<Error.Marking> markings = new ArrayList<>();
        markings.add(Error.Marking.error(
            diagnostic.anchor(), Compiler.describeAnchor(diagnostic.kind())
        ));
        for(PortKey port: diagnostic.involved()) {
            if(port.equals(diagnostic.anchor())) { continue; }
            markings.add(Error.Marking.info(port, "also affected"));
        }
        if(adapterEdge.isPresent()) {
            markings.add(Error.Marking.help(
                adapterEdge.get().toKey(),
                "consider inserting a Broadcast adapter on the edge "
                    + adapterEdge.get()
            ));
        }
        return new Error(
            diagnostic.code(),
            diagnostic.message(),
            markings.toArray(Error.Marking[]::new)
        );
    }

    private static String describeAnchor(CardinalityDiagnostic.Kind kind) {
        switch(kind) {
            case CARDINALITY_CONFLICT:
                return "conflicting cardinality here";
            case ZIP_BROADCAST_INSTANCE_MISMATCH:
                return "mixes different instances here";
            case UNRESOLVED_INSTANCE_VAR:
                return "instance is never determined";
            case UNRESOLVED_CARDINALITY:
                return "cardinality is never determined";
            default:
                throw new RuntimeException("unhandled diagnostic kind!");
        }
    }

}
