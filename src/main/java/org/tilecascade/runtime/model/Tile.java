package org.tilecascade.runtime.model;

/**
 * A live tile. Tiles are values: a destroyed tile is dropped and refill creates new ones.
 * The position of a tile is the cell of the {@link Grid} that holds it.
 *
 * @param serial Creation number, unique within a round.
 * @param type The block type this tile was drawn from.
 */
public record Tile(long serial, BlockType type) {

    public String typeId() {
        return type.id();
    }

    public int color() {
        return type.color();
    }

    public TilePower power() {
        return type.power();
    }

    public int bonusScore() {
        return type.bonusScore();
    }
}
