package org.tilecascade.runtime.worldgen;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.tilecascade.runtime.internal.services.SeededRandomProvider;
import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.TilePower;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class WeightedBlockPickerTest {

    private static final BlockType RUBY = new BlockType("ruby", "Ruby", 0xff0000, 1.0, TilePower.NONE, 0);
    private static final BlockType JADE = new BlockType("jade", "Jade", 0x00ff00, 3.0, TilePower.NONE, 0);
    private static final BlockType OPAL = new BlockType("opal", "Opal", 0x0000ff, 0.5, TilePower.NONE, 0);
    private static final BlockCatalog CATALOG = new BlockCatalog(List.of(RUBY, JADE, OPAL));

    @Test
    void rollsAreMappedOntoCumulativeWeights() {
        IRandomProvider random = mock(IRandomProvider.class);
        // total weight 4.5: ruby [0,1), jade [1,4), opal [4,4.5)
        when(random.nextDouble()).thenReturn(0.1, 0.25, 0.8, 0.95);
        WeightedBlockPicker picker = new WeightedBlockPicker(CATALOG, random);

        assertThat(picker.pick()).isEqualTo(RUBY);
        assertThat(picker.pick()).isEqualTo(JADE);
        assertThat(picker.pick()).isEqualTo(JADE);
        assertThat(picker.pick()).isEqualTo(OPAL);
    }

    @Test
    void excludedColorsAreNeverDrawn() {
        IRandomProvider random = mock(IRandomProvider.class);
        when(random.nextDouble()).thenReturn(0.0, 0.99);
        WeightedBlockPicker picker = new WeightedBlockPicker(CATALOG, random);
        IntSet excluded = new IntOpenHashSet(new int[]{JADE.color()});

        assertThat(picker.pickExcluding(excluded)).isEqualTo(RUBY);
        assertThat(picker.pickExcluding(excluded)).isEqualTo(OPAL);
    }

    @Test
    void excludingEveryColorYieldsNull() {
        WeightedBlockPicker picker = new WeightedBlockPicker(CATALOG, new SeededRandomProvider(1L));
        IntSet excluded = new IntOpenHashSet(new int[]{RUBY.color(), JADE.color(), OPAL.color()});

        assertThat(picker.pickExcluding(excluded)).isNull();
    }

    @Test
    void drawFrequenciesFollowSpawnWeights() {
        WeightedBlockPicker picker = new WeightedBlockPicker(CATALOG, new SeededRandomProvider(42L));
        int draws = 20_000;
        int jade = 0;
        for (int i = 0; i < draws; i++) {
            if (picker.next(0, 0) == JADE) {
                jade++;
            }
        }

        assertThat(jade / (double) draws).isCloseTo(3.0 / 4.5, within(0.02));
    }
}
