package oscilla.fieldc.compiler;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import oscilla.fieldc.compiler.graph.Block;
import oscilla.fieldc.compiler.graph.Patch;
import oscilla.fieldc.compiler.graph.PortKey;

public record Error(
    Optional<String> code,
    String message,
    Marking[] markings
) {

    public static record Marking(Type type, PortKey location, String note) {

        private enum Type {
            ERROR('^', Ansi.RED),
            INFO('~', Ansi.BRIGHT_BLUE),
            HELP('*', Ansi.GREEN);

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(PortKey location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(PortKey location, String note) {
            return new Marking(Type.INFO, location, note);
        }

        public static Marking help(PortKey location, String note) {
            return new Marking(Type.HELP, location, note);
        }

        public boolean isHelp() {
            return this.type == Type.HELP;
        }

    }

    private static class Ansi {
        private static final String BOLD = "1";
        private static final String RED = "31";
        private static final String GREEN = "32";
        private static final String GRAY = "90";
        private static final String BRIGHT_BLUE = "94";

        private static String from(boolean colored, String... properties) {
            if(!colored) {
                return "";
            }
            return "\033[0"
                + (properties.length > 0? ";" : "")
                + String.join(";", properties)
                + "m";
        }
    }

    public Error(String message, Marking... markings) {
        this(Optional.empty(), message, markings);
    }

    public Error(String code, String message, Marking... markings) {
        this(Optional.of(code), message, markings);
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.code.equals(other.code)
            && this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.code, this.message, Arrays.hashCode(this.markings)
        );
    }

    @Override
    public String toString() {
        return this.code.map(c -> "[" + c + "] ").orElse("") + this.message;
    }

    /**
     * Renders the error with one line per marked port. Blocks that are not
     * part of the given patch are shown by their id only.
     */
    public String render(Patch patch, boolean colored) {
        StringBuilder output = new StringBuilder();
        output.append(Ansi.from(colored, Ansi.BOLD, Ansi.RED));
        output.append("error");
        if(this.code.isPresent()) {
            output.append("[").append(this.code.get()).append("]");
        }
        output.append(": ");
        output.append(Ansi.from(colored, Ansi.RED));
        output.append(this.message);
        output.append("\n");
        if(this.markings.length == 0) {
            output.append(Ansi.from(colored));
            return output.toString();
        }
        int width = 0;
        String[] locations = new String[this.markings.length];
        for(int markingI = 0; markingI < this.markings.length; markingI += 1) {
            locations[markingI] = Error.describeLocation(
                patch, this.markings[markingI].location
            );
            width = Math.max(width, locations[markingI].length());
        }
        output.append(Ansi.from(colored, Ansi.GRAY));
        output.append("  ╭─\n");
        for(int markingI = 0; markingI < this.markings.length; markingI += 1) {
            Marking marked = this.markings[markingI];
            output.append(Ansi.from(colored, Ansi.GRAY));
            output.append("  │ ");
            output.append(Ansi.from(colored));
            output.append(locations[markingI]);
            output.append(" ".repeat(width - locations[markingI].length()));
            output.append(" ");
            output.append(Ansi.from(colored, marked.type.color));
            output.append(marked.type.marker);
            output.append(" ");
            output.append(marked.note);
            output.append("\n");
        }
        output.append(Ansi.from(colored, Ansi.GRAY));
        output.append("  ╰─\n");
        output.append(Ansi.from(colored));
        return output.toString();
    }

    private static String describeLocation(Patch patch, PortKey port) {
        String portText = port.blockId() + "." + port.portName()
            + " (" + port.direction().keyName + ")";
        Optional<Integer> blockIdx = patch.blockIndex(port.blockId());
        if(blockIdx.isEmpty()) {
            return portText;
        }
        Block block = patch.blocks().get(blockIdx.get());
        return portText + " of " + block.type() + " #" + blockIdx.get();
    }

}
