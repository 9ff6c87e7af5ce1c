package com.skilltrace.report;

import com.skilltrace.config.SkillAnalyticsProperties;
import com.skilltrace.report.ReportModels.SkillReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
public class ReportFileWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportFileWriter.class);

    private final Path directory;

    public ReportFileWriter(SkillAnalyticsProperties properties) {
        this.directory = Paths.get(properties.reportDirectory());
    }

    public Path write(String learnerId, SkillReport report) {
        Path target = directory.resolve(fileName(learnerId));
        try {
            Files.createDirectories(directory);
            Files.writeString(target, report.markdown(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write skill report to " + target, e);
        }
        log.info("Skill report for {} written to {}", learnerId, target.toAbsolutePath());
        return target;
    }

    private String fileName(String learnerId) {
        return "skill_fingerprint_" + learnerId.replaceAll("[^A-Za-z0-9._-]", "_") + ".md";
    }
}
