package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.layer2_scoring.InvalidSnapshotException;
import com.jay.mfses.layer2_scoring.MetricNormalizer;
import com.jay.mfses.layer2_scoring.MetricNormalizer.NormalizedMetrics;
import com.jay.mfses.layer2_scoring.SentimentAggregator;
import com.jay.mfses.layer2_scoring.SentimentAggregator.SentimentResult;
import com.jay.mfses.layer2_scoring.SnapshotValidator;
import com.jay.mfses.layer2_scoring.ValuationModel;
import com.jay.mfses.layer2_scoring.ValuationModel.ValuationResult;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.SubScores;
import com.jay.mfses.model.TickerScore;
import com.jay.mfses.model.enums.ScoreStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs a snapshot through the full pipeline:
 *   validate → normalize (moat/growth/balance) → valuation → sentiment
 *   → composites per horizon → activity label → audit.
 *
 * Stateless apart from the immutable {@link ScoringConfig}; safe to share across threads.
 * Invalid snapshots come back as INVALID_SNAPSHOT results rather than exceptions.
 */
@Slf4j
public class ScoringEngine {

    private final ScoringConfig config;
    private final MetricNormalizer normalizer;
    private final ValuationModel valuationModel;
    private final SentimentAggregator sentimentAggregator;
    private final CompositeBuilder compositeBuilder;
    private final ActivityClassifier activityClassifier;
    private final ScoreAuditor auditor;

    public ScoringEngine(ScoringConfig config) {
        this.config = config;
        this.normalizer = new MetricNormalizer(config);
        this.valuationModel = new ValuationModel(config);
        this.sentimentAggregator = new SentimentAggregator(config);
        this.compositeBuilder = new CompositeBuilder(config);
        this.activityClassifier = new ActivityClassifier(config);
        this.auditor = new ScoreAuditor(config);
    }

    public ScoringConfig config() {
        return config;
    }

    public TickerScore score(SecuritySnapshot snapshot) {
        try {
            return evaluate(snapshot);
        } catch (InvalidSnapshotException e) {
            log.warn("[{}] Snapshot rejected: {}", e.getTicker(), e.getMessage());
            return TickerScore.invalid(e.getTicker(), e.getMessage());
        }
    }

    /**
     * Scores a batch in input order. A repeated ticker (case-insensitive) is rejected on
     * every occurrence after the first; other tickers are unaffected by any rejection.
     */
    public List<TickerScore> scoreAll(List<SecuritySnapshot> snapshots) {
        List<TickerScore> results = new ArrayList<>(snapshots.size());
        Set<String> seen = new HashSet<>();
        for (SecuritySnapshot snapshot : snapshots) {
            String ticker = snapshot == null ? null : snapshot.getTicker();
            if (ticker != null && !ticker.isBlank() && !seen.add(ticker.trim().toUpperCase(Locale.ROOT))) {
                log.warn("[{}] Duplicate ticker in batch — rejected", ticker);
                results.add(TickerScore.invalid(ticker, "Duplicate ticker " + ticker + " in batch"));
                continue;
            }
            results.add(score(snapshot));
        }
        return results;
    }

    /** Like {@link #score} but throws {@link InvalidSnapshotException} for a bad snapshot. */
    public TickerScore evaluate(SecuritySnapshot s) {
        SnapshotValidator.validate(s);

        NormalizedMetrics metrics = normalizer.normalize(s);
        ValuationResult valuation = valuationModel.evaluate(s);
        SentimentResult sentiment = sentimentAggregator.evaluate(s);

        SubScores sub = new SubScores(
            metrics.moat().score(),
            metrics.growth().score(),
            metrics.balance().score(),
            valuation.score(),
            sentiment.score());

        log.debug("[{}] {}", s.getTicker(), sub.breakdownString());

        return TickerScore.builder()
            .ticker(s.getTicker())
            .name(s.displayName())
            .status(ScoreStatus.SCORED)
            .price(s.getCurrentPrice())
            .marketCap(s.getMarketCap())
            .sector(s.getSector())
            .subScores(sub)
            .composites(compositeBuilder.build(sub))
            .intrinsicValue(valuation.intrinsicValue())
            .priceToValue(valuation.priceToValue())
            .upsidePct(valuation.upsidePct())
            .degenerateValuation(valuation.degenerate())
            .momentumPct(sentiment.momentumPct())
            .activityState(activityClassifier.classify(s.getRecentPriceHistory()))
            .audit(auditor.audit(s, metrics, valuation, sentiment))
            .build();
    }
}
