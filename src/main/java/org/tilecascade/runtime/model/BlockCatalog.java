package org.tilecascade.runtime.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The block types available in a round, in declaration order.
 */
public final class BlockCatalog {
    private final List<BlockType> types;
    private final Map<String, BlockType> byId;
    private final double totalWeight;

    /**
     * Creates a catalog. When ids repeat, lookups by id return the first declaration.
     * @param types The block types, at least one.
     */
    public BlockCatalog(List<BlockType> types) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("A block catalog needs at least one block type");
        }
        this.types = List.copyOf(types);
        this.byId = new LinkedHashMap<>();
        double sum = 0;
        for (BlockType type : this.types) {
            byId.putIfAbsent(type.id(), type);
            sum += type.spawnWeight();
        }
        this.totalWeight = sum;
    }

    public List<BlockType> types() {
        return types;
    }

    public int size() {
        return types.size();
    }

    public double totalWeight() {
        return totalWeight;
    }

    public BlockType first() {
        return types.get(0);
    }

    public Optional<BlockType> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Counts the distinct colors; matching is by color, so this bounds how many tile kinds can
     * be told apart on the grid.
     * @return The number of distinct colors.
     */
    public int distinctColorCount() {
        return (int) types.stream().mapToInt(BlockType::color).distinct().count();
    }
}
