package com.skilltrace.session;

import com.skilltrace.analysis.PatternTag;
import com.skilltrace.analysis.SubmissionModels.ErrorKind;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public class SessionModels {
    public record SessionRecord(String sessionId,
                                String learnerId,
                                String moduleId,
                                String workshopId,
                                int score,
                                int maxScore,
                                int timeSeconds,
                                int hintsUsed,
                                Set<PatternTag> detectedPatterns,
                                ErrorKind errorKind,
                                String feedback,
                                Instant timestamp) {
        public SessionRecord {
            detectedPatterns = detectedPatterns == null
                    ? Set.of()
                    : Collections.unmodifiableSet(new TreeSet<>(detectedPatterns));
        }

        public double normalizedScore() {
            if (maxScore <= 0) return 0.0;
            return Math.max(0.0, Math.min(100.0, score * 100.0 / maxScore));
        }
    }

    public record SessionStatistics(int totalSessions,
                                    long totalTimeSeconds,
                                    double averageScore,
                                    double averageTimeSeconds,
                                    double averageHints,
                                    int distinctModules,
                                    int distinctWorkshops) {}
}
