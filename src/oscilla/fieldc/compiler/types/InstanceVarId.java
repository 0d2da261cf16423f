package oscilla.fieldc.compiler.types;

public record InstanceVarId(String name) implements Comparable<InstanceVarId> {

    public static InstanceVarId fieldOnly(int blockIndex, String portName) {
        return new InstanceVarId("fieldOnly:" + blockIndex + ":" + portName);
    }

    @Override
    public int compareTo(InstanceVarId other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return "?" + this.name;
    }

}
