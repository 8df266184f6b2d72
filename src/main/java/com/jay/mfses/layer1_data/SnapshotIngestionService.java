package com.jay.mfses.layer1_data;

import com.jay.mfses.config.MfsesConfig;
import com.jay.mfses.model.SecuritySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Layer 1 — resolves one ticker to a snapshot.
 * Uses the live provider first; falls back to the bundled sample data when the live call
 * fails or returns an unusable snapshot (zero market cap or price, or no debt-to-equity
 * because the financials call degraded). A ticker neither
 * source can supply comes back as a failed {@link FetchResult}, never an exception.
 */
@Slf4j
@Service
public class SnapshotIngestionService {

    private final MfsesConfig config;
    private final PolygonMarketDataProvider polygon;
    private final SampleMarketDataProvider sample;
    private final AtomicBoolean missingKeyLogged = new AtomicBoolean(false);

    public SnapshotIngestionService(MfsesConfig config,
                                    PolygonMarketDataProvider polygon,
                                    SampleMarketDataProvider sample) {
        this.config = config;
        this.polygon = polygon;
        this.sample = sample;
    }

    /** Outcome of fetching one ticker: either a snapshot with its source, or an error. */
    public record FetchResult(String ticker, SecuritySnapshot snapshot, String source, String error) {

        public static FetchResult ok(String ticker, SecuritySnapshot snapshot, String source) {
            return new FetchResult(ticker, snapshot, source, null);
        }

        public static FetchResult failed(String ticker, String error) {
            return new FetchResult(ticker, null, null, error);
        }

        public boolean isOk() {
            return snapshot != null;
        }
    }

    public FetchResult fetch(String ticker) {
        MfsesConfig.MarketData md = config.marketData();

        if ("sample".equalsIgnoreCase(md.getProvider())) {
            return fromSample(ticker, "sample provider selected");
        }

        if (!polygon.isConfigured()) {
            if (missingKeyLogged.compareAndSet(false, true)) {
                log.warn("Polygon API key not set — using sample data where available");
            }
            return fallback(ticker, "Polygon API key not configured");
        }

        String reason;
        try {
            SecuritySnapshot snapshot = polygon.fetch(ticker);
            if (isUsable(snapshot)) {
                return FetchResult.ok(ticker, snapshot, polygon.name());
            }
            reason = snapshot != null && snapshot.getDebtToEquity() == null
                ? "Polygon returned no debt-to-equity (financials unavailable)"
                : "Polygon returned zero market cap or price";
        } catch (MarketDataException e) {
            reason = e.getMessage();
        }
        log.warn("[{}] Live data unusable: {}", ticker, reason);
        return fallback(ticker, reason);
    }

    static boolean isUsable(SecuritySnapshot s) {
        return s != null
            && s.getMarketCap() != null && s.getMarketCap() > 0
            && s.getCurrentPrice() != null && s.getCurrentPrice() > 0
            && s.getDebtToEquity() != null;
    }

    private FetchResult fallback(String ticker, String reason) {
        if (!config.marketData().isFallbackToSample()) {
            return FetchResult.failed(ticker, "No market data: " + reason);
        }
        return fromSample(ticker, reason);
    }

    private FetchResult fromSample(String ticker, String reason) {
        if (!sample.has(ticker)) {
            return FetchResult.failed(ticker, "No market data: " + reason + "; no sample data for " + ticker);
        }
        log.info("[{}] Using sample data", ticker);
        return FetchResult.ok(ticker, sample.fetch(ticker), sample.name());
    }
}
