package com.jay.mfses.layer4_report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.mfses.model.ScoringRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Layer 4 — writes the run as a static JSON feed ({@code {updated, source, stocks}}) for
 * the dashboard. The file is written to a temp sibling first and then moved into place.
 */
@Slf4j
@Component
public class ScoreFeedWriter {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toFeed(ScoringRun run) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("updated", run.getCompletedAt() != null ? run.getCompletedAt().toString() : null);
        root.put("source", run.getSource());
        root.put("scored", run.scoredCount());
        root.put("failed", run.failedCount());
        root.set("stocks", objectMapper.valueToTree(run.getResults()));
        return root;
    }

    public Path write(ScoringRun run, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writeValue(tmp.toFile(), toFeed(run));
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Score feed written to {} ({} tickers)", target, run.getResults().size());
        return target;
    }
}
