package com.gbskill.engine.benchmark.generation;

import com.gbskill.engine.model.CaseDifficulty;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class NoiseInjectorTest {

    private static final String TEXT = "PVC-U管 DN100";

    @Test
    void inject_easy_neverChangesText() {
        NoiseInjector noise = new NoiseInjector(new Random(11));

        for (int i = 0; i < 50; i++) {
            assertThat(noise.inject(TEXT, CaseDifficulty.EASY)).isEqualTo(TEXT);
        }
    }

    @Test
    void inject_drawAtNoiseLevel_unchanged() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.2, 0));

        assertThat(noise.inject(TEXT, CaseDifficulty.MEDIUM)).isEqualTo(TEXT);
    }

    @Test
    void inject_prefix() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.1, 0));

        assertThat(noise.inject(TEXT, CaseDifficulty.MEDIUM)).isEqualTo("采购 PVC-U管 DN100");
    }

    @Test
    void inject_suffix() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.1, 1));

        assertThat(noise.inject(TEXT, CaseDifficulty.MEDIUM)).isEqualTo("PVC-U管 DN100 100根");
    }

    @Test
    void inject_doubledSpace() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.1, 3));

        assertThat(noise.inject(TEXT, CaseDifficulty.HARD)).isEqualTo("PVC-U管 DN100  ");
    }

    @Test
    void inject_templateRulesReplacePrefixes() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.1, 0), Map.of("prefixes", List.of("询价单:")));

        assertThat(noise.inject(TEXT, CaseDifficulty.ADVERSARIAL)).isEqualTo("询价单: PVC-U管 DN100");
    }

    @Test
    void inject_emptyRuleList_keepsDefaults() {
        NoiseInjector noise = new NoiseInjector(new FixedRandom(0.1, 0), Map.of("prefixes", List.of()));

        assertThat(noise.inject(TEXT, CaseDifficulty.ADVERSARIAL)).startsWith("采购 ");
    }

    @Test
    void noiseLevel_risesWithDifficulty() {
        assertThat(NoiseInjector.noiseLevel(CaseDifficulty.EASY)).isZero();
        assertThat(NoiseInjector.noiseLevel(CaseDifficulty.MEDIUM)).isEqualTo(0.2);
        assertThat(NoiseInjector.noiseLevel(CaseDifficulty.HARD)).isEqualTo(0.4);
        assertThat(NoiseInjector.noiseLevel(CaseDifficulty.ADVERSARIAL)).isEqualTo(0.6);
    }
}
