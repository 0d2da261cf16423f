package oscilla.fieldc.compiler.graph;

import java.util.Comparator;

/**
 * Ports are ordered by block id, then port name, then direction (inputs
 * first). Ids may contain any character, so the ordering never goes
 * through {@link #toString()}.
 */
public record PortKey(
    String blockId, String portName, Direction direction
) implements Comparable<PortKey> {

    public enum Direction {
        IN("in"),
        OUT("out");

        public final String keyName;

        private Direction(String keyName) {
            this.keyName = keyName;
        }
    }

    private static final Comparator<PortKey> ORDER = Comparator
        .comparing(PortKey::blockId)
        .thenComparing(PortKey::portName)
        .thenComparing(PortKey::direction);

    public static PortKey in(String blockId, String portName) {
        return new PortKey(blockId, portName, Direction.IN);
    }

    public static PortKey out(String blockId, String portName) {
        return new PortKey(blockId, portName, Direction.OUT);
    }

    @Override
    public int compareTo(PortKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return this.blockId + ":" + this.portName + ":"
            + this.direction.keyName;
    }

}
