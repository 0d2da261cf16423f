package oscilla.fieldc.compiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import oscilla.fieldc.compiler.graph.Block;
import oscilla.fieldc.compiler.graph.CardinalityBehavior;
import oscilla.fieldc.compiler.graph.Edge;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.CardinalityValue;
import oscilla.fieldc.compiler.types.InstanceRef;

/**
 * Reads a patch and the already known port types from a YAML document.
 * Every problem in the document is collected before giving up.
 */
public class PatchLoader {

    protected static final Logger logger = LogManager.getLogger();

    public static record Loaded(
        Patch patch, Map<PortKey, CanonicalType> existingPortTypes
    ) {}

    private final String fileName;
    private final List<Error> errors;

    private PatchLoader(String fileName) {
        this.fileName = fileName;
        this.errors = new ArrayList<>();
    }

    public static Result<Loaded> load(String fileName, String content) {
        return new PatchLoader(fileName).load(content);
    }

    private Result<Loaded> load(String content) {
        Object document;
        try {
            document = new Yaml().load(content);
        } catch(YAMLException e) {
            return Result.ofError(new Error(
                "'" + this.fileName + "' is not valid YAML: " + e.getMessage()
            ));
        }
        if(!(document instanceof Map)) {
            return Result.ofError(new Error(
                "'" + this.fileName + "' needs to contain a mapping"
                    + " with 'blocks' and 'edges'"
            ));
        }
        Map<?, ?> root = (Map<?, ?>) document;
        List<Block> blocks = new ArrayList<>();
        Set<String> blockIds = new HashSet<>();
        for(Map<?, ?> entry: this.mappings(root.get("blocks"), "blocks")) {
            Optional<Block> block = this.parseBlock(entry);
            if(block.isEmpty()) { continue; }
            if(!blockIds.add(block.get().id())) {
                this.error("block '" + block.get().id() + "' is declared twice");
                continue;
            }
            blocks.add(block.get());
        }
        Patch blocksOnly = new Patch(blocks, List.of());
        List<Edge> edges = new ArrayList<>();
        List<Map<?, ?>> edgeEntries = this.mappings(root.get("edges"), "edges");
        for(int edgeI = 0; edgeI < edgeEntries.size(); edgeI += 1) {
            this.parseEdge(blocksOnly, edgeI, edgeEntries.get(edgeI))
                .ifPresent(edges::add);
        }
        Map<PortKey, CanonicalType> existing = new LinkedHashMap<>();
        for(Map<?, ?> entry: this.mappings(root.get("types"), "types")) {
            this.parseType(blocksOnly, entry).ifPresent(typed -> {
                if(existing.put(typed.port(), typed.type()) != null) {
                    this.error("port " + typed.port() + " is typed twice");
                }
            });
        }
        if(!this.errors.isEmpty()) {
            return Result.ofError(this.errors);
        }
        logger.info(
            "Loaded {} blocks, {} edges and {} port types from '{}'",
            blocks.size(), edges.size(), existing.size(), this.fileName
        );
        return Result.ofValue(new Loaded(new Patch(blocks, edges), existing));
    }

    private void error(String message) {
        this.errors.add(new Error("In '" + this.fileName + "': " + message));
    }

    private List<Map<?, ?>> mappings(Object raw, String what) {
        List<Map<?, ?>> result = new ArrayList<>();
        if(raw == null) {
            return result;
        }
        if(!(raw instanceof List)) {
            this.error("'" + what + "' needs to be a list");
            return result;
        }
        for(Object item: (List<?>) raw) {
            if(item instanceof Map) {
                result.add((Map<?, ?>) item);
            } else {
                this.error("entries of '" + what + "' need to be mappings");
            }
        }
        return result;
    }

    private Optional<String> string(Map<?, ?> entry, String key) {
        Object value = entry.get(key);
        if(value == null) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(value));
    }

    private List<String> names(Map<?, ?> entry, String key, String owner) {
        Object value = entry.get(key);
        List<String> names = new ArrayList<>();
        if(value == null) {
            return names;
        }
        if(!(value instanceof List)) {
            this.error("'" + key + "' of " + owner + " needs to be a list");
            return names;
        }
        for(Object name: (List<?>) value) {
            names.add(String.valueOf(name));
        }
        return names;
    }

    private Optional<Block> parseBlock(Map<?, ?> entry) {
        Optional<String> id = this.string(entry, "id");
        if(id.isEmpty()) {
            this.error("a block is missing its 'id'");
            return Optional.empty();
        }
        String owner = "block '" + id.get() + "'";
        String type = this.string(entry, "type").orElse(id.get());
        List<String> inputs = this.names(entry, "inputs", owner);
        List<String> outputs = this.names(entry, "outputs", owner);
        boolean unique = this.checkUnique(inputs, "input", owner)
            & this.checkUnique(outputs, "output", owner);
        Optional<CardinalityBehavior> behavior = this.parseBehavior(
            entry, owner
        );
        if(behavior.isEmpty() || !unique) {
            return Optional.empty();
        }
        return Optional.of(new Block(
            id.get(), type, behavior.get(), inputs, outputs
        ));
    }

    private boolean checkUnique(
        List<String> names, String what, String owner
    ) {
        Set<String> seen = new HashSet<>();
        boolean unique = true;
        for(String name: names) {
            if(!seen.add(name)) {
                this.error(
                    owner + " declares the " + what + " '" + name
                        + "' more than once"
                );
                unique = false;
            }
        }
        return unique;
    }

    private Optional<CardinalityBehavior.BroadcastPolicy> parsePolicy(
        Map<?, ?> entry, String owner
    ) {
        String raw = this.string(entry, "broadcast").orElse("strict");
        switch(raw) {
            case "strict":
                return Optional.of(CardinalityBehavior.BroadcastPolicy.STRICT);
            case "allowZipSig":
                return Optional.of(
                    CardinalityBehavior.BroadcastPolicy.ALLOW_ZIP_SIG
                );
            default:
                this.error(
                    "'" + raw + "' is not a valid broadcast policy of " + owner
                        + " (expected 'strict' or 'allowZipSig')"
                );
                return Optional.empty();
        }
    }

    private Optional<CardinalityBehavior> parseBehavior(
        Map<?, ?> entry, String owner
    ) {
        Optional<String> raw = this.string(entry, "behavior");
        if(raw.isEmpty()) {
            this.error(owner + " is missing its 'behavior'");
            return Optional.empty();
        }
        switch(raw.get()) {
            case "signalOnly": {
                return Optional.of(new CardinalityBehavior.SignalOnly());
            }
            case "transform": {
                Optional<String> domain = this.string(entry, "domain");
                if(domain.isEmpty()) {
                    this.error(owner + " is a transform but has no 'domain'");
                    return Optional.empty();
                }
                return this.parsePolicy(entry, owner).map(policy ->
                    new CardinalityBehavior.Transform(domain.get(), policy)
                );
            }
            case "preserve": {
                return this.parsePolicy(entry, owner)
                    .map(CardinalityBehavior.Preserve::new);
            }
            case "fieldOnly": {
                return this.parsePolicy(entry, owner)
                    .map(CardinalityBehavior.FieldOnly::new);
            }
            case "lanes": {
                List<CardinalityBehavior.LaneGroup> groups = new ArrayList<>();
                for(Map<?, ?> lane: this.mappings(entry.get("lanes"), "lanes")) {
                    this.parseLane(lane, owner).ifPresent(groups::add);
                }
                return Optional.of(new CardinalityBehavior.Lanes(groups));
            }
            default: {
                this.error(
                    "'" + raw.get() + "' is not a valid behavior of " + owner
                );
                return Optional.empty();
            }
        }
    }

    private Optional<CardinalityBehavior.LaneGroup> parseLane(
        Map<?, ?> lane, String owner
    ) {
        String raw = this.string(lane, "relation").orElse("allEqual");
        CardinalityBehavior.LaneGroup.Relation relation;
        switch(raw) {
            case "zipBroadcast": {
                relation = CardinalityBehavior.LaneGroup.Relation.ZIP_BROADCAST;
            } break;
            case "allEqual":
            case "reducible": {
                relation = CardinalityBehavior.LaneGroup.Relation.ALL_EQUAL;
            } break;
            default: {
                this.error(
                    "'" + raw + "' is not a valid lane relation of " + owner
                );
                return Optional.empty();
            }
        }
        return Optional.of(new CardinalityBehavior.LaneGroup(
            relation, this.names(lane, "members", owner)
        ));
    }

    private Optional<PortKey> parsePort(
        Patch patch, String raw, Optional<PortKey.Direction> direction,
        String owner
    ) {
        int dot = raw.lastIndexOf('.');
        if(dot <= 0 || dot == raw.length() - 1) {
            this.error(
                "'" + raw + "' in " + owner
                    + " is not of the form '<block>.<port>'"
            );
            return Optional.empty();
        }
        String blockId = raw.substring(0, dot);
        String portName = raw.substring(dot + 1);
        Optional<Block> block = patch.block(blockId);
        if(block.isEmpty()) {
            this.error(owner + " refers to unknown block '" + blockId + "'");
            return Optional.empty();
        }
        List<PortKey.Direction> candidates = new ArrayList<>();
        for(PortKey.Direction candidate: PortKey.Direction.values()) {
            if(direction.isPresent() && direction.get() != candidate) {
                continue;
            }
            if(block.get().hasPort(portName, candidate)) {
                candidates.add(candidate);
            }
        }
        if(candidates.isEmpty()) {
            this.error(
                owner + " refers to unknown port '" + portName
                    + "' of block '" + blockId + "'"
            );
            return Optional.empty();
        }
        if(candidates.size() > 1) {
            this.error(
                owner + " refers to '" + raw + "', which is both an input"
                    + " and an output (add 'direction')"
            );
            return Optional.empty();
        }
        return Optional.of(new PortKey(blockId, portName, candidates.get(0)));
    }

    private Optional<Edge> parseEdge(Patch patch, int edgeI, Map<?, ?> entry) {
        String id = this.string(entry, "id").orElse("e" + edgeI);
        String owner = "edge '" + id + "'";
        Optional<String> from = this.string(entry, "from");
        Optional<String> to = this.string(entry, "to");
        if(from.isEmpty() || to.isEmpty()) {
            this.error(owner + " needs both 'from' and 'to'");
            return Optional.empty();
        }
        Optional<PortKey> fromKey = this.parsePort(
            patch, from.get(), Optional.of(PortKey.Direction.OUT), owner
        );
        Optional<PortKey> toKey = this.parsePort(
            patch, to.get(), Optional.of(PortKey.Direction.IN), owner
        );
        if(fromKey.isEmpty() || toKey.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Edge(
            id,
            fromKey.get().blockId(), fromKey.get().portName(),
            toKey.get().blockId(), toKey.get().portName()
        ));
    }

    private static record TypedPort(PortKey port, CanonicalType type) {}

    private Optional<TypedPort> parseType(Patch patch, Map<?, ?> entry) {
        Optional<String> rawPort = this.string(entry, "port");
        if(rawPort.isEmpty()) {
            this.error("a port type is missing its 'port'");
            return Optional.empty();
        }
        String owner = "type of '" + rawPort.get() + "'";
        Optional<PortKey.Direction> direction = Optional.empty();
        Optional<String> rawDirection = this.string(entry, "direction");
        if(rawDirection.isPresent()) {
            for(PortKey.Direction candidate: PortKey.Direction.values()) {
                if(candidate.keyName.equals(rawDirection.get())) {
                    direction = Optional.of(candidate);
                }
            }
            if(direction.isEmpty()) {
                this.error(
                    "'" + rawDirection.get() + "' is not a valid direction of "
                        + owner + " (expected 'in' or 'out')"
                );
                return Optional.empty();
            }
        }
        Optional<PortKey> port = this.parsePort(
            patch, rawPort.get(), direction, owner
        );
        Optional<CardinalityValue> cardinality = this.parseCardinality(
            entry, owner
        );
        if(port.isEmpty() || cardinality.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TypedPort(port.get(), new CanonicalType(
            this.string(entry, "payload"),
            this.string(entry, "unit"),
            cardinality.get(),
            this.string(entry, "temporality"),
            this.string(entry, "binding")
        )));
    }

    private Optional<CardinalityValue> parseCardinality(
        Map<?, ?> entry, String owner
    ) {
        String raw = this.string(entry, "cardinality").orElse("");
        switch(raw) {
            case "zero":
                return Optional.of(CardinalityValue.ZERO);
            case "one":
                return Optional.of(CardinalityValue.ONE);
            case "many": {
                Optional<String> domain = this.string(entry, "domain");
                Optional<String> instance = this.string(entry, "instance");
                if(domain.isEmpty() || instance.isEmpty()) {
                    this.error(
                        owner + " is many but lacks 'domain' or 'instance'"
                    );
                    return Optional.empty();
                }
                return Optional.of(CardinalityValue.many(
                    new InstanceRef(domain.get(), instance.get())
                ));
            }
            default:
                this.error(
                    "'" + raw + "' is not a valid cardinality of " + owner
                        + " (expected 'zero', 'one' or 'many')"
                );
                return Optional.empty();
        }
    }

}
