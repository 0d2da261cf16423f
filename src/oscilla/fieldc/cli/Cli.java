package oscilla.fieldc.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import oscilla.fieldc.compiler.Error;
import oscilla.fieldc.compiler.Result;

/**
 * Command line parser for '-x value', '--name value' and '--name=value'.
 */
public class Cli {

    private sealed interface Argument {
        char shortName();
        String longName();
        String description();
    }

    public static record RequiredArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {}

    public static record OptionalArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {}

    public static record Flag(
        char shortName, String longName, String description
    ) implements Argument {}

    public static final Flag HELP = new Flag(
        'h', "help", "displays a list of all available arguments"
    );

    /** Parsed values, keyed by long name. */
    public static class Values {

        private final Map<String, String> values;

        private Values(Map<String, String> values) {
            this.values = values;
        }

        public String get(RequiredArgument arg) {
            String value = this.values.get(arg.longName());
            if(value == null) {
                throw new IllegalStateException(
                    "'--" + arg.longName() + "' has no value"
                        + " (was help requested?)"
                );
            }
            return value;
        }

        public Optional<String> get(OptionalArgument arg) {
            return Optional.ofNullable(this.values.get(arg.longName()));
        }

        public boolean get(Flag flag) {
            return this.values.containsKey(flag.longName());
        }

        public boolean helpRequested() {
            return this.get(HELP);
        }

    }

    // keyed by "--long" and "-s"
    private final Map<String, Argument> byName;
    private final List<Argument> ordered;

    public Cli() {
        this.byName = new HashMap<>();
        this.ordered = new ArrayList<>();
        this.add(HELP);
    }

    private Cli register(Argument arg) {
        String longKey = "--" + arg.longName();
        String shortKey = "-" + arg.shortName();
        if(this.byName.containsKey(longKey)
                || this.byName.containsKey(shortKey)) {
            throw new IllegalArgumentException(
                "'" + longKey + "' / '" + shortKey + "' clashes with an"
                    + " already registered argument!"
            );
        }
        this.byName.put(longKey, arg);
        this.byName.put(shortKey, arg);
        this.ordered.add(arg);
        return this;
    }

    public Cli add(RequiredArgument arg) {
        return this.register(arg);
    }

    public Cli add(OptionalArgument arg) {
        return this.register(arg);
    }

    public Cli add(Flag flag) {
        return this.register(flag);
    }

    private static Optional<String> valueDescription(Argument arg) {
        if(arg instanceof RequiredArgument required) {
            return Optional.of(required.valueDescription());
        }
        if(arg instanceof OptionalArgument optional) {
            return Optional.of(optional.valueDescription());
        }
        return Optional.empty();
    }

    public void printHelp(PrintStream out) {
        out.println("List of available arguments:");
        out.println("Required:");
        for(Argument arg: this.ordered) {
            if(arg instanceof RequiredArgument) {
                Cli.printArgument(out, arg);
            }
        }
        out.println("Optional:");
        for(Argument arg: this.ordered) {
            if(!(arg instanceof RequiredArgument)) {
                Cli.printArgument(out, arg);
            }
        }
    }

    private static void printArgument(PrintStream out, Argument arg) {
        String value = Cli.valueDescription(arg)
            .map(v -> " <" + v + ">")
            .orElse("");
        out.printf(
            "    -%c, --%s%s%n        %s%n",
            arg.shortName(), arg.longName(), value, arg.description()
        );
    }

    private static Result<Values> failure(String message) {
        return Result.ofError(new Error(message));
    }

    /**
     * Parses the given arguments. Missing required arguments are not an
     * error if help was requested.
     */
    public Result<Values> parse(String[] args) {
        Map<String, String> values = new LinkedHashMap<>();
        int argIdx = 0;
        while(argIdx < args.length) {
            String raw = args[argIdx];
            argIdx += 1;
            String name = raw;
            String inline = null;
            int equals = raw.indexOf('=');
            if(raw.startsWith("--") && equals != -1) {
                name = raw.substring(0, equals);
                inline = raw.substring(equals + 1);
            }
            Argument arg = this.byName.get(name);
            if(arg == null) {
                return Cli.failure("'" + raw + "' is not a valid argument");
            }
            if(arg instanceof Flag) {
                if(inline != null) {
                    return Cli.failure("'" + name + "' does not take a value");
                }
                values.put(arg.longName(), "");
                continue;
            }
            if(inline == null) {
                if(argIdx >= args.length || args[argIdx].startsWith("-")) {
                    return Cli.failure(
                        "'" + raw + "' does not have a value specified"
                    );
                }
                inline = args[argIdx];
                argIdx += 1;
            }
            values.put(arg.longName(), inline);
        }
        if(values.containsKey(HELP.longName())) {
            return Result.ofValue(new Values(values));
        }
        List<Error> missing = new ArrayList<>();
        for(Argument arg: this.ordered) {
            if(arg instanceof RequiredArgument required
                    && !values.containsKey(required.longName())) {
                missing.add(new Error(
                    "The argument ('--" + required.longName() + "' / '-"
                        + required.shortName() + "') ["
                        + required.valueDescription()
                        + "] is required but missing"
                ));
            }
        }
        if(!missing.isEmpty()) {
            return Result.ofError(missing);
        }
        return Result.ofValue(new Values(values));
    }

}
