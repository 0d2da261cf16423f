package oscilla.fieldc.compiler.cardinality;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.InstanceRef;
import oscilla.fieldc.compiler.types.InstanceVarId;

/**
 * Either a resolved type for every port and no diagnostics, or no port
 * types at all together with every diagnostic that was found.
 */
public class CardinalitySolution {

    private final SortedMap<PortKey, CanonicalType> portTypes;
    private final List<CardinalityDiagnostic> diagnostics;
    private final SortedMap<InstanceVarId, InstanceRef> instances;

    private CardinalitySolution(
        SortedMap<PortKey, CanonicalType> portTypes,
        List<CardinalityDiagnostic> diagnostics,
        SortedMap<InstanceVarId, InstanceRef> instances
    ) {
        this.portTypes = portTypes;
        this.diagnostics = diagnostics;
        this.instances = instances;
    }

    public static CardinalitySolution ofTypes(
        Map<PortKey, CanonicalType> portTypes,
        Map<InstanceVarId, InstanceRef> instances
    ) {
        return new CardinalitySolution(
            Collections.unmodifiableSortedMap(new TreeMap<>(portTypes)),
            List.of(),
            Collections.unmodifiableSortedMap(new TreeMap<>(instances))
        );
    }

    public static CardinalitySolution ofDiagnostics(
        List<CardinalityDiagnostic> diagnostics,
        Map<InstanceVarId, InstanceRef> instances
    ) {
        if(diagnostics.isEmpty()) {
            throw new IllegalArgumentException(
                "A failed solution needs at least one diagnostic!"
            );
        }
        return new CardinalitySolution(
            null,
            List.copyOf(diagnostics),
            Collections.unmodifiableSortedMap(new TreeMap<>(instances))
        );
    }

    public boolean isResolved() {
        return this.portTypes != null;
    }

    /**
     * Empty when solving failed; the caller must not continue to code
     * generation in that case.
     */
    public Optional<SortedMap<PortKey, CanonicalType>> portTypes() {
        return Optional.ofNullable(this.portTypes);
    }

    public List<CardinalityDiagnostic> diagnostics() {
        return this.diagnostics;
    }

    /** Instance variables that were bound to a concrete reference. */
    public SortedMap<InstanceVarId, InstanceRef> instances() {
        return this.instances;
    }

}
