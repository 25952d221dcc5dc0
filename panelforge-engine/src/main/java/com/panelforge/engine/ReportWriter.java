package com.panelforge.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.panelforge.quality.QaReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the two run reports. Both are serialized before anything touches disk, written to temp
 * files, then moved into place, so a failure never leaves one report without the other half-written.
 */
final class ReportWriter {

    static final String QA_REPORT = "qa_report.json";
    static final String PROMOTION_SUMMARY = "promotion_summary.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * @return paths of the written qa report and summary
     * @throws UncheckedIOException when serialization or the file system fails
     */
    List<Path> write(Path outputDir, QaReport qaReport, PromotionSummary summary) {
        byte[] qa = serialize(qaReport);
        byte[] promotion = serialize(summary);
        Path qaPath = outputDir.resolve(QA_REPORT);
        Path summaryPath = outputDir.resolve(PROMOTION_SUMMARY);
        Path qaTmp = outputDir.resolve(QA_REPORT + ".tmp");
        Path summaryTmp = outputDir.resolve(PROMOTION_SUMMARY + ".tmp");
        try {
            Files.write(qaTmp, qa);
            Files.write(summaryTmp, promotion);
            Files.move(qaTmp, qaPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.move(summaryTmp, summaryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write reports to " + outputDir, e);
        }
        return List.of(qaPath, summaryPath);
    }

    static byte[] serialize(Object report) {
        try {
            return MAPPER.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize " + report.getClass().getSimpleName(), e);
        }
    }
}
