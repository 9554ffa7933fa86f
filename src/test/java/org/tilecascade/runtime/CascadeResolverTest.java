package org.tilecascade.runtime;

import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TilePower;
import org.tilecascade.runtime.worldgen.IBlockTypeSource;
import org.tilecascade.runtime.worldgen.TileFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CascadeResolverTest {

    private static CascadeResolver resolver(IBlockTypeSource refill) {
        return new CascadeResolver(new MatchScanner(), new SpecialEffectExpander(), refill, new TileFactory());
    }

    @Test
    void singleRunOfFourScoresSixtyInOneCascade() {
        Grid grid = GridFixtures.grid(
                "bcbc",
                "cbcb",
                "bcbc",
                "aaaa");
        RoundSession session = new RoundSession(10, 10);

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result.cascades()).isEqualTo(1);
        assertThat(result.groups()).isEqualTo(1);
        assertThat(result.destroyed()).isEqualTo(4);
        assertThat(result.points()).isEqualTo(60);
        assertThat(session.getScore()).isEqualTo(60);
        assertThat(session.getMatches()).isEqualTo(1);
        assertThat(session.getComboMultiplier()).isEqualTo(1.0);
        assertThat(grid.render()).isEqualTo(String.join("\n",
                "ghgh",
                "bcbc",
                "cbcb",
                "bcbc"));
    }

    @Test
    void fallingTilesTriggerAScaledSecondCascade() {
        Grid grid = GridFixtures.grid(
                "ecec",
                "cece",
                "eddc",
                "bbbd");
        RoundSession session = new RoundSession(10, 10);

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result.cascades()).isEqualTo(2);
        assertThat(result.steps()).extracting(CascadeStep::cascadePoints).containsExactly(45L, 56L);
        assertThat(result.groups()).isEqualTo(2);
        assertThat(result.destroyed()).isEqualTo(6);
        assertThat(result.points()).isEqualTo(101);
        assertThat(result.comboMultiplier()).isEqualTo(1.5);
        assertThat(session.getComboMultiplier()).isEqualTo(1.5);
        assertThat(new MatchScanner().hasMatches(grid)).isFalse();
    }

    private static BlockType powered(String id, TilePower power, int bonusScore) {
        return new BlockType(id, id, GridFixtures.type('a').color(), 1.0, power, bonusScore);
    }

    @Test
    void bombInsideARunDestroysItsNeighborhood() {
        Grid grid = GridFixtures.grid(Map.of('A', powered("bomb", TilePower.BOMB, 10)),
                "bcbc",
                "cbcb",
                "bcbc",
                "aAaa");
        RoundSession session = new RoundSession(10, 10);

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result.cascades()).isEqualTo(1);
        CascadeStep step = result.steps().get(0);
        assertThat(step.matchedCells()).isEqualTo(4);
        assertThat(step.destroyed()).isEqualTo(7);
        assertThat(step.tileBonus()).isEqualTo(10);
        assertThat(step.cascadePoints()).isEqualTo(105);
        assertThat(result.points()).isEqualTo(115);
        assertThat(session.getScore()).isEqualTo(115);
        assertThat(grid.render()).isEqualTo(String.join("\n",
                "ghgh",
                "hghc",
                "bcbb",
                "cbcc"));
    }

    @Test
    void lineTileInsideAVerticalRunClearsItsRow() {
        Grid grid = GridFixtures.grid(Map.of('L', powered("line", TilePower.LINE_HORIZONTAL, 0)),
                "abcb",
                "Lcbc",
                "acbd",
                "dbdc");
        RoundSession session = new RoundSession(10, 10);

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result.cascades()).isEqualTo(1);
        assertThat(result.groups()).isEqualTo(1);
        CascadeStep step = result.steps().get(0);
        assertThat(step.matchedCells()).isEqualTo(3);
        assertThat(step.destroyed()).isEqualTo(6);
        assertThat(result.points()).isEqualTo(90);
        assertThat(grid.render()).isEqualTo(String.join("\n",
                "ghgh",
                "hbcb",
                "gcbd",
                "dbdc"));
    }

    @Test
    void colorClearTileDestroysEveryTileOfItsType() {
        Grid grid = GridFixtures.grid(Map.of('X', powered("clear", TilePower.COLOR_CLEAR, 0)),
                "bcbX",
                "cbcb",
                "bcbc",
                "aXaa");
        RoundSession session = new RoundSession(10, 10);

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result.cascades()).isEqualTo(1);
        CascadeStep step = result.steps().get(0);
        assertThat(step.matchedCells()).isEqualTo(4);
        assertThat(step.destroyed()).isEqualTo(5);
        assertThat(result.points()).isEqualTo(75);
        assertThat(grid.render()).isEqualTo(String.join("\n",
                "ghgh",
                "bcbg",
                "cbcb",
                "bcbc"));
    }

    @Test
    void resolvedGridIsAFixedPoint() {
        Grid grid = GridFixtures.grid(
                "ecec",
                "cece",
                "eddc",
                "bbbd");
        CascadeResolver resolver = resolver(GridFixtures.checkerboardRefill());
        RoundSession session = new RoundSession(10, 10);
        resolver.resolve(grid, session);
        String settled = grid.render();

        CascadeResult second = resolver.resolve(grid, session);

        assertThat(second.hadMatches()).isFalse();
        assertThat(second.points()).isZero();
        assertThat(grid.render()).isEqualTo(settled);
    }

    @Test
    void cascadePointsGrowWithDepth() {
        for (int destroyed = 3; destroyed <= 20; destroyed++) {
            for (int cascade = 1; cascade < 10; cascade++) {
                assertThat(CascadeResolver.cascadePoints(destroyed, cascade + 1))
                        .isGreaterThanOrEqualTo(CascadeResolver.cascadePoints(destroyed, cascade));
            }
        }
        assertThat(CascadeResolver.cascadePoints(3, 1)).isEqualTo(45);
        assertThat(CascadeResolver.cascadePoints(3, 3)).isEqualTo(68);
    }

    @Test
    void comboMultiplierIsRoundedToOneDecimal() {
        assertThat(CascadeResolver.comboMultiplier(1)).isEqualTo(1.0);
        assertThat(CascadeResolver.comboMultiplier(2)).isEqualTo(1.5);
        assertThat(CascadeResolver.comboMultiplier(5)).isEqualTo(3.0);
    }

    @Test
    void scoreBoostTilesAddTheirExtraOnTopOfBonusScore() {
        int color = GridFixtures.type('a').color();
        Tile defaultBoost = new Tile(1, new BlockType("boost", "Boost", color, 1.0, TilePower.SCORE_BOOST, 0));
        Tile smallBoost = new Tile(2, new BlockType("boost", "Boost", color, 1.0, TilePower.SCORE_BOOST, 4));
        Tile bigBoost = new Tile(3, new BlockType("boost", "Boost", color, 1.0, TilePower.SCORE_BOOST, 20));
        Tile plain = new Tile(4, new BlockType("gem", "Gem", color, 1.0, TilePower.NONE, 7));

        assertThat(CascadeResolver.tileBonus(defaultBoost)).isEqualTo(12);
        assertThat(CascadeResolver.tileBonus(smallBoost)).isEqualTo(10);
        assertThat(CascadeResolver.tileBonus(bigBoost)).isEqualTo(40);
        assertThat(CascadeResolver.tileBonus(plain)).isEqualTo(7);
    }

    @Test
    void refillFillsEveryGravitySegment() {
        Grid grid = GridFixtures.grid(
                ".bcd",
                "acdb",
                "#dbc",
                ".bcd");

        resolver(GridFixtures.checkerboardRefill()).refill(grid);

        assertThat(grid.emptyCells()).isEmpty();
        assertThat(grid.tileAt(0, 0).typeId()).isEqualTo("type-g");
        assertThat(grid.tileAt(1, 0).typeId()).isEqualTo("type-a");
        assertThat(grid.tileAt(3, 0).typeId()).isEqualTo("type-h");
        assertThat(grid.isBlocked(2, 0)).isTrue();
    }

    @Test
    void doesNothingOnceTheRoundHasEnded() {
        Grid grid = GridFixtures.grid(
                "bcbc",
                "cbcb",
                "bcbc",
                "aaaa");
        RoundSession session = new RoundSession(1, 1);
        session.end(new RoundOutcome(true, 0, 1, 1, 1));

        CascadeResult result = resolver(GridFixtures.checkerboardRefill()).resolve(grid, session);

        assertThat(result).isEqualTo(CascadeResult.none());
        assertThat(grid.tileAt(3, 0).typeId()).isEqualTo("type-a");
    }

    @Test
    void failsWhenTheRefillSourceKeepsProducingRuns() {
        Grid grid = GridFixtures.grid(
                "aaaa",
                "aaaa",
                "aaaa",
                "aaaa");

        assertThatThrownBy(() -> resolver((row, col) -> GridFixtures.type('a')).resolve(grid, new RoundSession(10, 10)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("did not stabilise");
    }
}
