package oscilla.fieldc.compiler.graph;

public record CardNode(int id, PortKey key, int blockIndex) {

    public String portName() {
        return this.key.portName();
    }

    @Override
    public String toString() {
        return "#" + this.id + "(" + this.key + ")";
    }

}
