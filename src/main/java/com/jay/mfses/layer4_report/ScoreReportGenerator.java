package com.jay.mfses.layer4_report;

import com.jay.mfses.model.FactorAudit;
import com.jay.mfses.model.ScoreAudit;
import com.jay.mfses.model.ScoringRun;
import com.jay.mfses.model.TickerScore;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;

/**
 * Layer 4 — Score Report Generator.
 * Human-readable fact-check report for a run: one block per ticker with the raw inputs,
 * matched brackets, composites and data-quality warnings.
 */
@Component
public class ScoreReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter FMT = DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm");

    public String generate(ScoringRun run) {
        String timestamp = run.getCompletedAt() != null ? run.getCompletedAt().format(FMT) : "NOW";

        StringBuilder sb = new StringBuilder();
        sb.append("📊 MFSES SCORE REPORT  —  ").append(timestamp).append("\n");
        sb.append(String.format("SOURCE            :  %s%n", run.getSource()));
        sb.append(String.format("TICKERS           :  %d scored, %d failed%n", run.scoredCount(), run.failedCount()));
        sb.append(DIVIDER).append("\n");
        run.getResults().forEach(r -> sb.append(generate(r)));
        return sb.toString();
    }

    public String generate(TickerScore r) {
        StringBuilder sb = new StringBuilder();
        if (!r.isScored()) {
            sb.append(String.format("❌ %-6s  INVALID  :  %s%n", r.getTicker(), r.getErrorMessage()));
            sb.append(DIVIDER).append("\n");
            return sb.toString();
        }

        var c = r.getComposites();
        sb.append(String.format("%s  —  %s  (%s)%n", r.getTicker(), r.getName(), r.getSector()));
        sb.append(String.format("PRICE             :  $%.2f%n", r.getPrice()));
        sb.append(String.format("SUB-SCORES        :  %s%n", r.getSubScores().breakdownString()));
        sb.append(String.format("COMPOSITES        :  Short %.2f | Mid %.2f | Long %.2f%n",
            c.shortTerm(), c.midTerm(), c.longTerm()));
        if (r.getIntrinsicValue() != null) {
            sb.append(String.format("INTRINSIC VALUE   :  $%.2f  (upside %+.1f%%)%n", r.getIntrinsicValue(), r.getUpsidePct()));
        } else {
            sb.append("INTRINSIC VALUE   :  n/a (EPS ≤ 0)\n");
        }
        sb.append(String.format("ACTIVITY          :  %s%n", r.getActivityState()));

        ScoreAudit audit = r.getAudit();
        if (audit != null) {
            sb.append(line("MOAT", audit.moat()));
            sb.append(line("GROWTH", audit.growth()));
            sb.append(line("BALANCE", audit.balance()));
            sb.append(line("VALUATION", audit.valuation()));
            sb.append(line("SENTIMENT", audit.sentiment()));
            if (!audit.warnings().isEmpty()) {
                sb.append("⚠️  DATA WARNINGS:\n");
                audit.warnings().forEach(w -> sb.append("   • ").append(w).append("\n"));
            }
        }
        sb.append(DIVIDER).append("\n");
        return sb.toString();
    }

    private static String line(String label, FactorAudit f) {
        return String.format("  %-10s %2d  %s  →  %s%n", label, f.score(), f.input(), f.bracket());
    }
}
