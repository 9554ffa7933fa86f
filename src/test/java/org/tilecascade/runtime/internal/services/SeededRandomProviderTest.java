package org.tilecascade.runtime.internal.services;

import org.tilecascade.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    private static List<Integer> draw(IRandomProvider random, int count) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(random.nextInt(1000));
        }
        return values;
    }

    @Test
    void sameSeedProducesSameStream() {
        assertThat(draw(new SeededRandomProvider(77L), 50)).isEqualTo(draw(new SeededRandomProvider(77L), 50));
        assertThat(draw(new SeededRandomProvider(77L), 50)).isNotEqualTo(draw(new SeededRandomProvider(78L), 50));
    }

    @Test
    void derivedStreamsAreStableAndIndependentPerScope() {
        SeededRandomProvider root = new SeededRandomProvider(5L);

        List<Integer> refill = draw(root.deriveFor("refill", 0), 50);
        List<Integer> refillAgain = draw(new SeededRandomProvider(5L).deriveFor("refill", 0), 50);
        List<Integer> bonus = draw(root.deriveFor("bonus", 0), 50);
        List<Integer> refillOtherKey = draw(root.deriveFor("refill", 1), 50);

        assertThat(refill).isEqualTo(refillAgain);
        assertThat(refill).isNotEqualTo(bonus);
        assertThat(refill).isNotEqualTo(refillOtherKey);
    }

    @Test
    void derivingDoesNotAdvanceTheParentStream() {
        SeededRandomProvider parent = new SeededRandomProvider(9L);
        parent.deriveFor("generation", 0).nextDouble();

        assertThat(draw(parent, 10)).isEqualTo(draw(new SeededRandomProvider(9L), 10));
    }

    @Test
    void doublesStayInUnitInterval() {
        IRandomProvider random = new SeededRandomProvider(11L);
        for (int i = 0; i < 1000; i++) {
            assertThat(random.nextDouble()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
        }
    }
}
