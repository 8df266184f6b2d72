package com.jay.mfses.layer3_composite;

import com.jay.mfses.config.MfsesConfig;
import com.jay.mfses.layer1_data.SnapshotIngestionService;
import com.jay.mfses.layer1_data.SnapshotIngestionService.FetchResult;
import com.jay.mfses.layer4_report.ScoreFeedWriter;
import com.jay.mfses.layer4_report.ScoreReportGenerator;
import com.jay.mfses.model.ScoringRun;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.TickerScore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the whole watchlist: fetch each ticker's snapshot and score it, in parallel on a
 * bounded pool, then collect the results in watchlist order. The latest run is kept for
 * the REST layer, written to the JSON feed and logged as a text report.
 */
@Slf4j
@Service
public class BatchScoringService {

    private final MfsesConfig config;
    private final SnapshotIngestionService ingestion;
    private final ScoringEngine engine;
    private final ScoreFeedWriter feedWriter;
    private final ScoreReportGenerator reportGenerator;

    private final ExecutorService executor;
    private final AtomicReference<ScoringRun> latestRun = new AtomicReference<>();

    public BatchScoringService(MfsesConfig config,
                               SnapshotIngestionService ingestion,
                               ScoringEngine engine,
                               ScoreFeedWriter feedWriter,
                               ScoreReportGenerator reportGenerator) {
        this.config = config;
        this.ingestion = ingestion;
        this.engine = engine;
        this.feedWriter = feedWriter;
        this.reportGenerator = reportGenerator;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.marketData().getMaxConcurrentRequests()));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public Optional<ScoringRun> latestRun() {
        return Optional.ofNullable(latestRun.get());
    }

    /** Scores caller-supplied snapshots; no fetching, no side effects. */
    public List<TickerScore> evaluate(List<SecuritySnapshot> snapshots) {
        return engine.scoreAll(snapshots);
    }

    public ScoringRun runWatchlist() {
        List<String> watchlist = config.watchlist();
        log.info("BatchScoringService: scoring {} tickers", watchlist.size());

        Set<String> seen = new HashSet<>();
        List<CompletableFuture<Scored>> futures = new ArrayList<>(watchlist.size());
        for (String raw : watchlist) {
            String ticker = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
            if (ticker.isEmpty()) {
                futures.add(CompletableFuture.completedFuture(
                    new Scored(TickerScore.invalid(raw, "Ticker is missing"), null)));
            } else if (!seen.add(ticker)) {
                futures.add(CompletableFuture.completedFuture(
                    new Scored(TickerScore.invalid(ticker, "Duplicate ticker " + ticker + " in batch"), null)));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> scoreTicker(ticker), executor));
            }
        }

        List<TickerScore> results = new ArrayList<>(futures.size());
        Set<String> sources = new LinkedHashSet<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                Scored scored = futures.get(i).get();
                results.add(scored.score());
                if (scored.source() != null) sources.add(scored.source());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Scoring run interrupted", e);
            } catch (ExecutionException e) {
                log.error("Scoring failed for {}: {}", watchlist.get(i), e.getCause().getMessage());
                results.add(TickerScore.invalid(watchlist.get(i), "Scoring failed: " + e.getCause().getMessage()));
            }
        }

        ScoringRun run = ScoringRun.builder()
            .completedAt(LocalDateTime.now(ZoneOffset.UTC))
            .source(sources.isEmpty() ? "none" : String.join("+", sources))
            .results(List.copyOf(results))
            .build();
        latestRun.set(run);
        log.info("BatchScoringService: run complete — {} scored, {} failed (source: {})",
            run.scoredCount(), run.failedCount(), run.getSource());

        publish(run);
        return run;
    }

    private record Scored(TickerScore score, String source) {}

    private Scored scoreTicker(String ticker) {
        FetchResult fetched = ingestion.fetch(ticker);
        if (!fetched.isOk()) {
            log.warn("[{}] {}", ticker, fetched.error());
            return new Scored(TickerScore.invalid(ticker, fetched.error()), null);
        }
        return new Scored(engine.score(fetched.snapshot()), fetched.source());
    }

    private void publish(ScoringRun run) {
        MfsesConfig.Output output = config.output();
        if (output.isWriteFeed()) {
            try {
                feedWriter.write(run, Path.of(output.getFeedPath()));
            } catch (IOException e) {
                log.error("Failed to write score feed to {}: {}", output.getFeedPath(), e.getMessage());
            }
        }
        if (output.isLogReport()) {
            log.info("\n{}", reportGenerator.generate(run));
        }
    }
}
