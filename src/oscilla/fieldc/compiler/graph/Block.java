package oscilla.fieldc.compiler.graph;

import java.util.ArrayList;
import java.util.List;

public record Block(
    String id,
    String type,
    CardinalityBehavior behavior,
    List<String> inputs,
    List<String> outputs
) {

    public Block {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public boolean hasPort(String name, PortKey.Direction direction) {
        switch(direction) {
            case IN: return this.inputs.contains(name);
            case OUT: return this.outputs.contains(name);
            default: throw new RuntimeException("unhandled direction!");
        }
    }

    public List<PortKey> portKeys() {
        List<PortKey> keys = new ArrayList<>();
        for(String input: this.inputs) {
            keys.add(PortKey.in(this.id, input));
        }
        for(String output: this.outputs) {
            keys.add(PortKey.out(this.id, output));
        }
        return keys;
    }

}
