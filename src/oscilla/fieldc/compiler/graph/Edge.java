package oscilla.fieldc.compiler.graph;

public record Edge(
    String id,
    String fromBlock, String fromPort,
    String toBlock, String toPort
) {

    public PortKey fromKey() {
        return PortKey.out(this.fromBlock, this.fromPort);
    }

    public PortKey toKey() {
        return PortKey.in(this.toBlock, this.toPort);
    }

    @Override
    public String toString() {
        return this.fromBlock + "." + this.fromPort
            + " -> " + this.toBlock + "." + this.toPort;
    }

}
