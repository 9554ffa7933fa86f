package org.tilecascade.runtime.worldgen;

import org.tilecascade.runtime.model.BlockType;

/**
 * Supplies the block type of each new tile during refill.
 */
@FunctionalInterface
public interface IBlockTypeSource {
    /**
     * Chooses the type of the tile about to be created.
     *
     * @param row The row the tile will occupy.
     * @param col The column the tile will occupy.
     * @return The block type, never null.
     */
    BlockType next(int row, int col);
}
