package com.jay.mfses.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.mfses.config.MfsesConfig;
import com.jay.mfses.model.PricePoint;
import com.jay.mfses.model.SecuritySnapshot;
import com.jay.mfses.model.enums.Sector;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1 — Polygon.io REST client.
 * Builds a snapshot from five calls per ticker, directly via OkHttp (no SDK dependency):
 *   prev aggregate      → current price
 *   ticker details      → name, market cap, SIC description, shares outstanding
 *   quarterly financials→ annualized EPS, same-quarter year-ago EPS growth, debt/equity
 *   dividends           → trailing annual yield from the last four payments
 *   daily range         → recent price history
 *
 * Price and details are required; the other calls degrade to defaults when they fail.
 * A failed financials call leaves debt/equity unset, which ingestion treats as unusable.
 * API base: https://api.polygon.io
 */
@Slf4j
@Component
public class PolygonMarketDataProvider implements MarketDataProvider {

    private final MfsesConfig.MarketData settings;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OkHttpClient http;

    @Autowired
    public PolygonMarketDataProvider(MfsesConfig config) {
        this(config.marketData());
    }

    PolygonMarketDataProvider(MfsesConfig.MarketData settings) {
        this.settings = settings;
        this.http = new OkHttpClient.Builder()
            .connectTimeout(settings.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(settings.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
    }

    @Override
    public String name() {
        return "polygon";
    }

    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public SecuritySnapshot fetch(String ticker) {
        double price = previousClose(ticker);
        JsonNode details = tickerDetails(ticker);
        long shares = details.path("share_class_shares_outstanding").asLong(0);
        if (shares == 0) shares = details.path("weighted_shares_outstanding").asLong(0);

        Financials fin = financials(ticker, shares);

        return SecuritySnapshot.builder()
            .ticker(ticker)
            .name(details.path("name").asText(ticker))
            .marketCap(details.path("market_cap").asDouble(0))
            .epsGrowthRate(fin.epsGrowth())
            .debtToEquity(fin.debtToEquity())
            .trailingEps(fin.eps())
            .expectedGrowthRate(fin.epsGrowth())
            .currentPrice(price)
            .dividendYield(dividendYield(ticker, price))
            .sector(Sector.fromDescription(details.path("sic_description").asText(null)))
            .bondYield(settings.getAaaBondYield())
            .recentPriceHistory(priceHistory(ticker))
            .build();
    }

    // ── Price ──────────────────────────────────────────────────────────────────

    double previousClose(String ticker) {
        JsonNode results = get("/v2/aggs/ticker/" + ticker + "/prev", Map.of()).path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw new MarketDataException("No previous-day aggregate for " + ticker);
        }
        return results.get(0).path("c").asDouble(0);
    }

    JsonNode tickerDetails(String ticker) {
        JsonNode results = get("/v3/reference/tickers/" + ticker, Map.of()).path("results");
        if (results.isMissingNode() || results.isNull()) {
            throw new MarketDataException("No ticker details for " + ticker);
        }
        return results;
    }

    // ── Financials ─────────────────────────────────────────────────────────────

    record Financials(double eps, double epsGrowth, Double debtToEquity) {}

    /**
     * EPS is the latest quarter's net income annualized (×4) over shares outstanding.
     * Growth compares against the same fiscal quarter one year earlier. D/E uses financial
     * debt (long-term + current debt); when neither is reported, non-current liabilities
     * capped at half of total liabilities stand in. D/E is null without positive equity.
     */
    Financials financials(String ticker, long shares) {
        JsonNode filings;
        try {
            filings = get("/vX/reference/financials", Map.of(
                "ticker", ticker,
                "limit", "5",
                "timeframe", "quarterly",
                "sort", "filing_date",
                "order", "desc")).path("results");
        } catch (MarketDataException e) {
            log.warn("[{}] Financials unavailable: {}", ticker, e.getMessage());
            return new Financials(0, 0, null);
        }
        if (!filings.isArray() || filings.isEmpty()) {
            log.warn("[{}] No quarterly filings returned", ticker);
            return new Financials(0, 0, null);
        }

        JsonNode latest = filings.get(0);
        double netIncome = value(latest.path("financials").path("income_statement"), "net_income_loss");
        double eps = annualizedEps(netIncome, shares);

        JsonNode balance = latest.path("financials").path("balance_sheet");
        double debt = value(balance, "long_term_debt") + value(balance, "current_debt");
        if (debt == 0) {
            double noncurrent = value(balance, "noncurrent_liabilities");
            debt = noncurrent > 0 ? Math.min(noncurrent, value(balance, "liabilities") * 0.5) : 0;
        }
        double equity = value(balance, "equity");
        if (equity == 0) equity = value(balance, "stockholders_equity");
        Double debtToEquity = equity > 0 ? debt / equity : null;

        double growth = 0;
        String period = latest.path("fiscal_period").asText("");
        int targetYear = latest.path("fiscal_year").asInt(0) - 1;
        for (JsonNode filing : filings) {
            if (period.equals(filing.path("fiscal_period").asText()) && filing.path("fiscal_year").asInt(0) == targetYear) {
                double yearAgoEps = annualizedEps(
                    value(filing.path("financials").path("income_statement"), "net_income_loss"), shares);
                if (yearAgoEps != 0) {
                    growth = (eps - yearAgoEps) / Math.abs(yearAgoEps) * 100;
                }
                break;
            }
        }
        return new Financials(eps, growth, debtToEquity);
    }

    private static double annualizedEps(double quarterlyNetIncome, long shares) {
        return shares > 0 ? quarterlyNetIncome * 4 / shares : 0;
    }

    private static double value(JsonNode section, String field) {
        return section.path(field).path("value").asDouble(0);
    }

    // ── Dividends ──────────────────────────────────────────────────────────────

    double dividendYield(String ticker, double price) {
        try {
            JsonNode results = get("/v3/reference/dividends", Map.of(
                "ticker", ticker, "limit", "4", "order", "desc")).path("results");
            double annual = 0;
            for (JsonNode d : results) {
                annual += d.path("cash_amount").asDouble(0);
            }
            return price > 0 ? annual / price * 100 : 0;
        } catch (MarketDataException e) {
            log.warn("[{}] Dividends unavailable: {}", ticker, e.getMessage());
            return 0;
        }
    }

    // ── History ────────────────────────────────────────────────────────────────

    List<PricePoint> priceHistory(String ticker) {
        LocalDate to = LocalDate.now(ZoneOffset.UTC);
        LocalDate from = to.minusDays(settings.getHistoryDays());
        List<PricePoint> history = new ArrayList<>();
        try {
            JsonNode results = get("/v2/aggs/ticker/" + ticker + "/range/1/day/" + from + "/" + to, Map.of(
                "adjusted", "true", "sort", "asc", "limit", "5000")).path("results");
            for (JsonNode bar : results) {
                double close = bar.path("c").asDouble(0);
                if (close <= 0) continue;
                LocalDateTime ts = LocalDateTime.ofInstant(Instant.ofEpochMilli(bar.path("t").asLong()), ZoneOffset.UTC);
                history.add(new PricePoint(ts, close, bar.path("v").asLong(0)));
            }
        } catch (MarketDataException e) {
            log.warn("[{}] Price history unavailable: {}", ticker, e.getMessage());
        }
        return history;
    }

    // ── HTTP helper ────────────────────────────────────────────────────────────

    private JsonNode get(String path, Map<String, String> params) {
        HttpUrl base = HttpUrl.parse(settings.getBaseUrl() + path);
        if (base == null) {
            throw new MarketDataException("Invalid Polygon URL: " + settings.getBaseUrl() + path);
        }
        HttpUrl.Builder url = base.newBuilder();
        params.forEach(url::addQueryParameter);
        url.addQueryParameter("apiKey", settings.getApiKey());

        Request request = new Request.Builder()
            .url(url.build())
            .get()
            .addHeader("Accept", "application/json")
            .build();

        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new MarketDataException("HTTP " + response.code() + " for " + path);
            }
            String body = response.body() != null ? response.body().string() : "{}";
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new MarketDataException("Request failed for " + path + ": " + e.getMessage(), e);
        }
    }
}
