package com.jay.mfses.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One full pass over the watchlist. Results keep watchlist order; nothing is re-sorted.
 */
@Data
@Builder
public class ScoringRun {

    private LocalDateTime     completedAt;
    private String            source;        // provider label, e.g. "polygon", "sample", "polygon+sample"
    private List<TickerScore> results;

    @JsonProperty("scoredCount")
    public long scoredCount() {
        return results.stream().filter(TickerScore::isScored).count();
    }

    @JsonProperty("failedCount")
    public long failedCount() {
        return results.size() - scoredCount();
    }

    public Optional<TickerScore> find(String ticker) {
        return results.stream()
            .filter(r -> r.getTicker() != null && r.getTicker().equalsIgnoreCase(ticker))
            .findFirst();
    }
}
