package oscilla.fieldc.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import oscilla.fieldc.compiler.Compiler;
import oscilla.fieldc.compiler.Error;
import oscilla.fieldc.compiler.PatchLoader;
import oscilla.fieldc.compiler.Result;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;
import oscilla.fieldc.compiler.types.CanonicalType;
import oscilla.fieldc.compiler.types.CardinalityValue;

public class Main {

    protected static final Logger logger = LogManager.getLogger();

    static final Cli.RequiredArgument PATCH = new Cli.RequiredArgument(
        'p', "patch",
        "specifies the YAML file describing the blocks and edges",
        "patch file path"
    );
    static final Cli.OptionalArgument OUTPUT = new Cli.OptionalArgument(
        'o', "output",
        "writes the resolved port types to the given YAML file",
        "output file path"
    );
    static final Cli.Flag TRACE = new Cli.Flag(
        't', "trace", "logs every solver phase"
    );
    static final Cli.Flag NO_COLOR = new Cli.Flag(
        'c', "nocolor", "disables colored output"
    );

    static Cli cli() {
        return new Cli()
            .add(PATCH).add(OUTPUT).add(TRACE).add(NO_COLOR);
    }

    public static void main(String[] args) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        Cli cli = Main.cli();
        Result<Cli.Values> cliParseResult = cli.parse(args);
        if(cliParseResult.isError()) {
            Main.exitWithErrors(
                cliParseResult.getError(), Main.emptyPatch(), !onWindows
            );
            return;
        }
        Cli.Values cliValues = cliParseResult.getValue();
        if(cliValues.helpRequested()) {
            cli.printHelp(System.out);
            System.exit(1);
            return;
        }
        boolean colored = !cliValues.get(NO_COLOR) && !onWindows;
        if(cliValues.get(TRACE)) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        String patchPath = cliValues.get(PATCH);
        String patchContent;
        try {
            patchContent = new String(
                Files.readAllBytes(Paths.get(patchPath)), StandardCharsets.UTF_8
            );
        } catch(IOException e) {
            Main.exitWithErrors(
                List.of(new Error(
                    "Unable to read file '" + patchPath + "': "
                        + "'" + e.getMessage() + "'"
                )),
                Main.emptyPatch(),
                colored
            );
            return;
        }
        Result<PatchLoader.Loaded> loaded = PatchLoader.load(
            patchPath, patchContent
        );
        if(loaded.isError()) {
            Main.exitWithErrors(loaded.getError(), Main.emptyPatch(), colored);
            return;
        }
        Patch patch = loaded.getValue().patch();
        Result<Compiler.Output> resolved = Compiler.resolveCardinalities(
            patch, loaded.getValue().existingPortTypes()
        );
        if(resolved.isError()) {
            Main.exitWithErrors(resolved.getError(), patch, colored);
            return;
        }
        Map<PortKey, CanonicalType> portTypes = resolved.getValue().portTypes();
        if(cliValues.get(OUTPUT).isPresent()) {
            Main.writeFile(
                Main.dumpPortTypes(portTypes), cliValues.get(OUTPUT).get(),
                colored
            );
        } else {
            for(PortKey port: portTypes.keySet()) {
                System.out.println(port + " " + portTypes.get(port));
            }
        }
    }

    /** Dumps the types nested as block id, port name, direction. */
    static String dumpPortTypes(Map<PortKey, CanonicalType> portTypes) {
        Map<String, Map<String, Map<String, Object>>> document
            = new LinkedHashMap<>();
        for(PortKey port: portTypes.keySet()) {
            CanonicalType type = portTypes.get(port);
            Map<String, Object> entry = new LinkedHashMap<>();
            CardinalityValue card = type.cardinality();
            entry.put("cardinality", card.kind().name().toLowerCase());
            if(card instanceof CardinalityValue.Many many) {
                entry.put("domain", many.instance().domainTypeId());
                entry.put("instance", many.instance().instanceId());
            }
            type.payload().ifPresent(p -> entry.put("payload", p));
            type.unit().ifPresent(u -> entry.put("unit", u));
            type.temporality().ifPresent(t -> entry.put("temporality", t));
            type.binding().ifPresent(b -> entry.put("binding", b));
            document
                .computeIfAbsent(port.blockId(), b -> new LinkedHashMap<>())
                .computeIfAbsent(port.portName(), p -> new LinkedHashMap<>())
                .put(port.direction().keyName, entry);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(document);
    }

    private static Patch emptyPatch() {
        return new Patch(List.of(), List.of());
    }

    private static void writeFile(
        String content, String path, boolean errorColored
    ) {
        byte[] contentBytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            Files.write(Paths.get(path), contentBytes);
        } catch(IOException e) {
            Main.exitWithErrors(
                List.of(new Error(
                    "Unable to write to file '" + path + "': "
                        + "'" + e.getMessage() + "'"
                )),
                Main.emptyPatch(),
                errorColored
            );
        }
        logger.info("Wrote resolved port types to '{}'", path);
    }

    private static void exitWithErrors(
        List<Error> errors, Patch patch, boolean colored
    ) {
        for(Error error: errors) {
            System.err.print(error.render(patch, colored));
        }
        System.exit(1);
    }

}
