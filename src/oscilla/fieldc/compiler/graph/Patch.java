package oscilla.fieldc.compiler.graph;

import java.util.List;
import java.util.Optional;

/**
 * A normalized block graph. A block's index is its position in
 * {@link #blocks()}.
 */
public record Patch(List<Block> blocks, List<Edge> edges) {

    public Patch {
        blocks = List.copyOf(blocks);
        edges = List.copyOf(edges);
    }

    public Optional<Integer> blockIndex(String blockId) {
        for(int blockI = 0; blockI < this.blocks.size(); blockI += 1) {
            if(this.blocks.get(blockI).id().equals(blockId)) {
                return Optional.of(blockI);
            }
        }
        return Optional.empty();
    }

    public Optional<Block> block(String blockId) {
        return this.blockIndex(blockId).map(this.blocks::get);
    }

}
