package com.jay.mfses.controller;

import com.jay.mfses.config.MfsesConfig;
import com.jay.mfses.config.ScoringConfig;
import com.jay.mfses.layer3_composite.BatchScoringService;
import com.jay.mfses.model.ScoringRun;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.TickerScore;
import com.jay.mfses.model.enums.Horizon;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API — scores and engine status.
 *
 * Endpoints:
 *   GET  /api/scores           — Latest run (404 before the first run)
 *   GET  /api/scores/{ticker}  — One ticker from the latest run
 *   POST /api/scores/run       — Score the watchlist now
 *   POST /api/scores/evaluate  — Score caller-supplied snapshots (no fetching)
 *   GET  /api/config/weights   — Horizon weight vectors
 *   GET  /api/status           — Engine status and configuration summary
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScoreController {

    private final MfsesConfig config;
    private final BatchScoringService batchScoringService;

    // ── GET /api/scores ────────────────────────────────────────────────────────

    @GetMapping("/scores")
    public ResponseEntity<ScoringRun> latestRun() {
        return ResponseEntity.of(batchScoringService.latestRun());
    }

    // ── GET /api/scores/{ticker} ───────────────────────────────────────────────

    @GetMapping("/scores/{ticker}")
    public ResponseEntity<TickerScore> tickerScore(@PathVariable String ticker) {
        return ResponseEntity.of(batchScoringService.latestRun().flatMap(run -> run.find(ticker)));
    }

    // ── POST /api/scores/run ───────────────────────────────────────────────────

    @PostMapping("/scores/run")
    public ResponseEntity<ScoringRun> runNow() {
        return ResponseEntity.ok(batchScoringService.runWatchlist());
    }

    // ── POST /api/scores/evaluate ──────────────────────────────────────────────

    @PostMapping("/scores/evaluate")
    public ResponseEntity<List<TickerScore>> evaluate(@RequestBody List<SecuritySnapshot> snapshots) {
        return ResponseEntity.ok(batchScoringService.evaluate(snapshots));
    }

    // ── GET /api/config/weights ────────────────────────────────────────────────

    @GetMapping("/config/weights")
    public ResponseEntity<Map<Horizon, ScoringConfig.HorizonWeights>> weights() {
        return ResponseEntity.ok(config.scoring().horizonWeights());
    }

    // ── GET /api/status ────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "RUNNING");
        status.put("timestamp", LocalDateTime.now().toString());
        status.put("provider", config.marketData().getProvider());
        status.put("fallbackToSample", config.marketData().isFallbackToSample());
        status.put("watchlistSize", config.watchlist().size());
        batchScoringService.latestRun().ifPresent(run -> {
            status.put("lastRun", run.getCompletedAt().toString());
            status.put("lastRunSource", run.getSource());
            status.put("lastRunScored", run.scoredCount());
            status.put("lastRunFailed", run.failedCount());
        });
        return ResponseEntity.ok(status);
    }
}
