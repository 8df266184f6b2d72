package com.jay.mfses.config;

import com.jay.mfses.model.enums.Horizon;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MfsesConfigTest {

    private static MfsesConfig configFor(String file, MockEnvironment env) {
        MfsesConfig config = new MfsesConfig();
        ReflectionTestUtils.setField(config, "configFile", file);
        ReflectionTestUtils.setField(config, "env", env);
        return config;
    }

    @Test
    void missingFileFallsBackToDefaults() {
        MfsesConfig config = configFor("no-such-config.yaml", new MockEnvironment());
        config.load();

        assertThat(config.watchlist()).hasSize(10);
        assertThat(config.scoring().weights(Horizon.MID)).isEqualTo(ScoringConfig.defaults().weights(Horizon.MID));
    }

    @Test
    void loadsSectionsAndResolvesPlaceholders() {
        MfsesConfig config = configFor("config-sample-only.yaml", new MockEnvironment());
        config.load();

        assertThat(config.watchlist()).containsExactly("MSFT", "AAPL", "ZZZZ");
        assertThat(config.marketData().getProvider()).isEqualTo("sample");
        assertThat(config.marketData().getApiKey()).isEqualTo("fallback-key");
        assertThat(config.marketData().getAaaBondYield()).isEqualTo(5.0);
        assertThat(config.marketData().getHistoryDays()).isEqualTo(30);
        assertThat(config.output().isWriteFeed()).isFalse();
        assertThat(config.scoring()).isNotNull();
    }

    @Test
    void placeholderPrefersEnvironmentValue() {
        MfsesConfig config = configFor("config-sample-only.yaml",
            new MockEnvironment().withProperty("TEST_POLYGON_KEY", "from-env"));
        config.load();

        assertThat(config.marketData().getApiKey()).isEqualTo("from-env");
    }

    @Test
    void inconsistentWeightsStopStartup() {
        MfsesConfig config = configFor("config-broken-weights.yaml", new MockEnvironment());

        assertThatThrownBy(config::load)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("SHORT");
    }
}
