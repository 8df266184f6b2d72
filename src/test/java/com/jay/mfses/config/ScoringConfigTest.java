package com.jay.mfses.config;

import com.jay.mfses.model.SubScores;
import com.jay.mfses.model.enums.Horizon;
import com.jay.mfses.model.enums.Sector;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoringConfigTest {

    @Test
    void defaultsAreValidAndWeightsSumToOne() {
        ScoringConfig config = ScoringConfig.defaults();
        for (Horizon h : Horizon.values()) {
            assertThat(config.weights(h).sum()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void shortHorizonLeansOnSentimentAndValuation() {
        ScoringConfig.HorizonWeights w = ScoringConfig.defaults().weights(Horizon.SHORT);
        assertThat(w.sentiment() + w.valuation()).isGreaterThan(w.moat() + w.balance());
    }

    @Test
    void longHorizonLeansOnMoatAndBalance() {
        ScoringConfig.HorizonWeights w = ScoringConfig.defaults().weights(Horizon.LONG);
        assertThat(w.moat() + w.balance()).isGreaterThan(w.sentiment() + w.growth());
    }

    @Test
    void shippedConfigYamlMatchesBuiltInDefaults() throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
            MfsesConfig.ConfigRoot root = MfsesConfig.readRoot(is);
            ScoringConfig fromYaml = root.getScoring().toScoringConfig();
            ScoringConfig defaults = ScoringConfig.defaults();

            assertThat(fromYaml.horizonWeights()).isEqualTo(defaults.horizonWeights());
            assertThat(fromYaml.moatTable().bands()).isEqualTo(defaults.moatTable().bands());
            assertThat(fromYaml.growthTable().bands()).isEqualTo(defaults.growthTable().bands());
            assertThat(fromYaml.balanceTable().bands()).isEqualTo(defaults.balanceTable().bands());
            assertThat(fromYaml.sentiment().sectorScores()).isEqualTo(defaults.sentiment().sectorScores());
            assertThat(fromYaml.audit().expectedMarketCaps()).containsKeys("AAPL", "CRM");
            assertThat(root.getWatchlist()).hasSize(10);
        }
    }

    @Test
    void weightVectorNotSummingToOneIsRejected() {
        Map<Horizon, ScoringConfig.HorizonWeights> weights = new EnumMap<>(ScoringConfig.defaults().horizonWeights());
        weights.put(Horizon.MID, new ScoringConfig.HorizonWeights(0.2, 0.2, 0.2, 0.2, 0.3));

        assertThatThrownBy(() -> withWeights(weights))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("MID");
    }

    @Test
    void negativeWeightIsRejected() {
        Map<Horizon, ScoringConfig.HorizonWeights> weights = new EnumMap<>(ScoringConfig.defaults().horizonWeights());
        weights.put(Horizon.LONG, new ScoringConfig.HorizonWeights(0.6, 0.2, 0.2, 0.2, -0.2));

        assertThatThrownBy(() -> withWeights(weights))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("non-negative");
    }

    @Test
    void missingHorizonIsRejected() {
        Map<Horizon, ScoringConfig.HorizonWeights> weights = new EnumMap<>(ScoringConfig.defaults().horizonWeights());
        weights.remove(Horizon.SHORT);

        assertThatThrownBy(() -> withWeights(weights))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("SHORT");
    }

    @Test
    void yamlOverrideOfWeightsIsApplied() throws IOException {
        String yaml = """
            scoring:
              composite:
                mid_term: { moat: 0.4, growth: 0.15, balance: 0.15, valuation: 0.15, sentiment: 0.15 }
            """;
        ScoringConfig config = read(yaml).getScoring().toScoringConfig();

        assertThat(config.weights(Horizon.MID).moat()).isEqualTo(0.4);
        assertThat(config.weights(Horizon.SHORT)).isEqualTo(ScoringConfig.defaults().weights(Horizon.SHORT));
        assertThat(config.weights(Horizon.MID).apply(new SubScores(10, 10, 10, 10, 10))).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void yamlWithUnsortedBandsFailsFast() {
        String yaml = """
            scoring:
              growth:
                direction: INCREASING
                base_score: 2
                bands:
                  - { min: 10, score: 12 }
                  - { min: 5,  score: 10 }
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("growth");
    }

    @Test
    void yamlWithUnknownDirectionFailsFast() {
        String yaml = """
            scoring:
              balance:
                direction: SIDEWAYS
                base_score: 20
                bands:
                  - { min: 1, score: 10 }
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("SIDEWAYS");
    }

    @Test
    void sentimentWeightsMustSumToOne() {
        String yaml = """
            scoring:
              sentiment:
                dividend_weight: 0.5
                sector_weight: 0.5
                momentum_weight: 0.5
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("sentiment weights");
    }

    @Test
    void dividendAloneCannotCarrySentiment() {
        String yaml = """
            scoring:
              sentiment:
                dividend_weight: 1.0
                sector_weight: 0.0
                momentum_weight: 0.0
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("dividend weight");
    }

    @Test
    void growthFloorThatMakesTheMultipleNegativeIsRejected() {
        String yaml = """
            scoring:
              valuation:
                growth_floor: -10
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("growth floor");
    }

    @Test
    void negativeGrowthFloorIsAllowedWhileTheMultipleStaysPositive() throws IOException {
        String yaml = """
            scoring:
              valuation:
                growth_floor: -4
            """;
        ScoringConfig.Valuation valuation = read(yaml).getScoring().toScoringConfig().valuation();

        assertThat(valuation.growthFloor()).isEqualTo(-4.0);
        assertThat(valuation.baseMultiple() + valuation.growthMultiplier() * valuation.growthFloor()).isPositive();
    }

    @Test
    void unknownSectorNameInConfigIsRejected() {
        String yaml = """
            scoring:
              sentiment:
                sector_scores:
                  SPACE_MINING_CO: 12
            """;
        assertThatThrownBy(() -> read(yaml).getScoring().toScoringConfig())
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void unlistedSectorFallsBackToDefaultScore() {
        ScoringConfig.Sentiment sentiment = ScoringConfig.defaults().sentiment();
        assertThat(sentiment.sectorScore(Sector.TECHNOLOGY)).isEqualTo(14);
        assertThat(sentiment.sectorScore(Sector.UNKNOWN)).isEqualTo(10);
        assertThat(sentiment.sectorScore(null)).isEqualTo(10);
    }

    private static ScoringConfig withWeights(Map<Horizon, ScoringConfig.HorizonWeights> weights) {
        ScoringConfig d = ScoringConfig.defaults();
        return new ScoringConfig(d.moatTable(), d.growthTable(), d.balanceTable(), d.valuation(),
            d.sentiment(), weights, d.activity(), d.audit());
    }

    private static MfsesConfig.ConfigRoot read(String yaml) throws IOException {
        return MfsesConfig.readRoot(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
