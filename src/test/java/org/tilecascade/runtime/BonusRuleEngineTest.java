package org.tilecascade.runtime;

import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.BonusReward;
import org.tilecascade.runtime.model.BonusRule;
import org.tilecascade.runtime.model.BonusTriggerType;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.TilePower;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.worldgen.TileFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class BonusRuleEngineTest {

    private static final BlockType BOMB = new BlockType("bomb", "Bomb", 0xff0000, 1.0, TilePower.BOMB, 0);

    @Mock
    private IRandomProvider random;

    private BlockCatalog catalog;
    private Grid grid;

    @BeforeEach
    void setUp() {
        catalog = new BlockCatalog(List.of(GridFixtures.type('a'), GridFixtures.type('b'), GridFixtures.type('c'), BOMB));
        grid = GridFixtures.grid(
                "abca",
                "bcab",
                "cabc",
                "abca");
    }

    private BonusRuleEngine engine(BonusRule... rules) {
        return new BonusRuleEngine(List.of(rules), catalog, new TileFactory(), random);
    }

    private static BonusRule rule(String id, BonusTriggerType trigger, int threshold, BonusReward reward) {
        return new BonusRule(id, id, id, trigger, threshold, reward);
    }

    @Test
    void cascadeRuleFiresOnceWhenThresholdIsReached() {
        BonusRuleEngine engine = engine(rule("chain", BonusTriggerType.CASCADE, 2, new BonusReward(2, 100, null)));
        RoundSession session = new RoundSession(20, 10);

        List<BonusActivation> first = engine.evaluate(new BonusContext(2, 1.5, 3), grid, session);
        List<BonusActivation> second = engine.evaluate(new BonusContext(3, 2.0, 6), grid, session);

        assertThat(first).extracting(a -> a.rule().id()).containsExactly("chain");
        assertThat(first.get(0).summary()).isEqualTo("chain: +2 moves, +100 points");
        assertThat(second).isEmpty();
        assertThat(session.getMovesLeft()).isEqualTo(12);
        assertThat(session.getScore()).isEqualTo(100);
        assertThat(session.getTriggeredBonuses()).containsExactly("chain");
    }

    @Test
    void ruleBelowThresholdDoesNotFire() {
        BonusRuleEngine engine = engine(
                rule("chain", BonusTriggerType.CASCADE, 3, new BonusReward(1, 0, null)),
                rule("combo", BonusTriggerType.COMBO, 3, new BonusReward(0, 50, null)),
                rule("total", BonusTriggerType.TOTAL_MATCHES, 10, new BonusReward(0, 50, null)));
        RoundSession session = new RoundSession(20, 10);

        List<BonusActivation> fired = engine.evaluate(new BonusContext(2, 1.5, 9), grid, session);

        assertThat(fired).isEmpty();
        assertThat(session.getTriggeredBonuses()).isEmpty();
        assertThat(session.getScore()).isZero();
    }

    @Test
    void rulesAreEvaluatedInDeclarationOrder() {
        BonusRuleEngine engine = engine(
                rule("total", BonusTriggerType.TOTAL_MATCHES, 5, new BonusReward(0, 10, null)),
                rule("combo", BonusTriggerType.COMBO, 1, new BonusReward(0, 20, null)));
        RoundSession session = new RoundSession(20, 10);

        List<BonusActivation> fired = engine.evaluate(new BonusContext(1, 1.0, 5), grid, session);

        assertThat(fired).extracting(a -> a.rule().id()).containsExactly("total", "combo");
        assertThat(session.getScore()).isEqualTo(30);
    }

    @Test
    void negativeExtraMovesNeverDropBelowZero() {
        BonusRuleEngine engine = engine(rule("curse", BonusTriggerType.CASCADE, 1, new BonusReward(-5, 0, null)));
        RoundSession session = new RoundSession(20, 3);

        engine.evaluate(new BonusContext(1, 1.0, 1), grid, session);

        assertThat(session.getMovesLeft()).isZero();
    }

    @Test
    void spawnRewardPlacesTheBlockOnARandomEmptyCell() {
        grid.remove(1, 1);
        grid.remove(2, 3);
        when(random.nextInt(2)).thenReturn(1);
        BonusRuleEngine engine = engine(rule("gift", BonusTriggerType.CASCADE, 1, new BonusReward(0, 0, "bomb")));

        List<BonusActivation> fired = engine.evaluate(new BonusContext(1, 1.0, 1), grid, new RoundSession(20, 10));

        assertThat(fired.get(0).spawnedAt()).isEqualTo(new CellCoordinate(2, 3));
        assertThat(grid.tileAt(2, 3).typeId()).isEqualTo("bomb");
        assertThat(grid.isEmpty(1, 1)).isTrue();
    }

    @Test
    void spawnRewardWithUnknownIdUsesTheFirstCatalogType() {
        grid.remove(0, 0);
        when(random.nextInt(1)).thenReturn(0);
        BonusRuleEngine engine = engine(rule("gift", BonusTriggerType.CASCADE, 1, new BonusReward(0, 0, "missing")));

        engine.evaluate(new BonusContext(1, 1.0, 1), grid, new RoundSession(20, 10));

        assertThat(grid.tileAt(0, 0).typeId()).isEqualTo("type-a");
    }

    @Test
    void spawnRewardOnAFullBoardIsSkippedButStillCountsAsFired() {
        BonusRuleEngine engine = engine(rule("gift", BonusTriggerType.CASCADE, 1, new BonusReward(0, 0, "bomb")));
        RoundSession session = new RoundSession(20, 10);
        String before = grid.render();

        List<BonusActivation> fired = engine.evaluate(new BonusContext(1, 1.0, 1), grid, session);

        assertThat(fired).hasSize(1);
        assertThat(fired.get(0).spawnedAt()).isNull();
        assertThat(grid.render()).isEqualTo(before);
        assertThat(session.isTriggered("gift")).isTrue();
        verify(random, never()).nextInt(anyInt());
    }
}
