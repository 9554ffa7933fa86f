package org.tilecascade.runtime.worldgen;

import it.unimi.dsi.fastutil.ints.IntSet;
import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws block types from a catalog with probability proportional to their spawn weight.
 */
public class WeightedBlockPicker implements IBlockTypeSource {

    private final BlockCatalog catalog;
    private final IRandomProvider random;

    /**
     * Creates a picker.
     *
     * @param catalog The round's catalog.
     * @param randomProvider Source of randomness.
     */
    public WeightedBlockPicker(BlockCatalog catalog, IRandomProvider randomProvider) {
        this.catalog = catalog;
        this.random = randomProvider;
    }

    @Override
    public BlockType next(int row, int col) {
        return pick();
    }

    /**
     * Draws one block type.
     * @return The drawn type.
     */
    public BlockType pick() {
        return pickFrom(catalog.types(), catalog.totalWeight());
    }

    /**
     * Draws one block type whose color is not in the given set.
     *
     * @param excludedColors RGB colors that must not be drawn.
     * @return The drawn type, or null if every type has an excluded color.
     */
    public BlockType pickExcluding(IntSet excludedColors) {
        List<BlockType> candidates = new ArrayList<>();
        double total = 0;
        for (BlockType type : catalog.types()) {
            if (!excludedColors.contains(type.color())) {
                candidates.add(type);
                total += type.spawnWeight();
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        return pickFrom(candidates, total);
    }

    private BlockType pickFrom(List<BlockType> types, double totalWeight) {
        double roll = random.nextDouble() * totalWeight;
        double accumulator = 0;
        for (BlockType type : types) {
            accumulator += type.spawnWeight();
            if (roll < accumulator) {
                return type;
            }
        }
        // Floating point rounding can leave roll just above the last boundary.
        return types.get(types.size() - 1);
    }
}
