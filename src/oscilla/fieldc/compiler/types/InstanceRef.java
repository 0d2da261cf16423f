package oscilla.fieldc.compiler.types;

import java.util.Comparator;

public record InstanceRef(
    String domainTypeId, String instanceId
) implements Comparable<InstanceRef> {

    private static final Comparator<InstanceRef> ORDER = Comparator
        .comparing(InstanceRef::domainTypeId)
        .thenComparing(InstanceRef::instanceId);

    public InstanceRef {
        if(domainTypeId == null || instanceId == null) {
            throw new IllegalArgumentException(
                "An instance reference needs a domain type and an instance id!"
            );
        }
    }

    @Override
    public int compareTo(InstanceRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return this.domainTypeId + "#" + this.instanceId;
    }

}
