package org.tilecascade.runtime.worldgen;

import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.Tile;

/**
 * Creates tiles with round-unique serial numbers.
 */
public class TileFactory {

    private long nextSerial = 1L;

    /**
     * Creates a new tile of the given type.
     * @param type The block type.
     * @return The tile.
     */
    public Tile create(BlockType type) {
        return new Tile(nextSerial++, type);
    }
}
