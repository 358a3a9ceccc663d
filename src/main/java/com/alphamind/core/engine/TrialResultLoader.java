package com.alphamind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the result files trials leave behind. Every read is best effort: a missing or
 * malformed file yields no metrics, never an error.
 */
@Component
public class TrialResultLoader {

    private static final Logger log = LoggerFactory.getLogger(TrialResultLoader.class);

    static final String BACKTEST_METRICS_SUFFIX = "_backtest_metrics.json";

    private final ObjectMapper objectMapper;

    public TrialResultLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Numeric entries of the {@code metrics} object in the newest backtest metrics file of
     * {@code outputDir} written at or after {@code notBefore}.
     */
    public Map<String, Double> backtestMetrics(Path outputDir, Instant notBefore) {
        Optional<Path> newest = newestMetricsFile(outputDir, notBefore);
        if (newest.isEmpty()) {
            log.debug("No backtest metrics file in {} newer than {}", outputDir, notBefore);
            return Map.of();
        }
        try {
            JsonNode metrics = objectMapper.readTree(newest.get().toFile()).path("metrics");
            Map<String, Double> values = numericFields(metrics);
            log.info("Loaded {} backtest metrics from {}", values.size(), newest.get().getFileName());
            return values;
        } catch (IOException e) {
            log.warn("Could not read backtest metrics {}: {}", newest.get(), e.getMessage());
            return Map.of();
        }
    }

    /**
     * Number of factors in the mining factor library {@code all_factors_library[_suffix].json}
     * under {@code projectRoot}, if the library exists.
     */
    public Optional<Integer> factorCount(Path projectRoot, String librarySuffix) {
        String name = librarySuffix != null && !librarySuffix.isBlank()
                ? "all_factors_library_" + librarySuffix + ".json"
                : "all_factors_library.json";
        Path library = projectRoot.resolve(name);
        if (!Files.isRegularFile(library)) {
            return Optional.empty();
        }
        try {
            JsonNode factors = objectMapper.readTree(library.toFile()).path("factors");
            return factors.isObject() ? Optional.of(factors.size()) : Optional.empty();
        } catch (IOException e) {
            log.warn("Could not read factor library {}: {}", library, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> newestMetricsFile(Path dir, Instant notBefore) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(BACKTEST_METRICS_SUFFIX))
                    .filter(p -> !modifiedAt(p).toInstant().isBefore(notBefore))
                    .max(Comparator.comparing(TrialResultLoader::modifiedAt));
        } catch (IOException e) {
            log.warn("Could not list {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private static FileTime modifiedAt(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static Map<String, Double> numericFields(JsonNode node) {
        Map<String, Double> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber() && Double.isFinite(field.getValue().doubleValue())) {
                values.put(field.getKey(), field.getValue().doubleValue());
            }
        }
        return values;
    }
}
