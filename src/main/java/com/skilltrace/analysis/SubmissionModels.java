package com.skilltrace.analysis;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public class SubmissionModels {
    public enum ErrorKind { NONE, SYNTAX, LOGIC, TIMEOUT }

    public record ExecutionOutcome(boolean syntaxError, boolean timeoutError) {
        public static ExecutionOutcome clean() {
            return new ExecutionOutcome(false, false);
        }
    }

    public record GradedSubmission(String code,
                                   String workshopId,
                                   String moduleId,
                                   int score,
                                   int maxScore,
                                   int timeSeconds,
                                   int hintsUsed,
                                   ExecutionOutcome executionOutcome) {}

    public record SubmissionAnalysis(String workshopId,
                                     String moduleId,
                                     ErrorKind errorKind,
                                     Set<PatternTag> detectedPatterns,
                                     String feedback,
                                     Instant timestamp) {
        public SubmissionAnalysis {
            detectedPatterns = detectedPatterns == null
                    ? Set.of()
                    : Collections.unmodifiableSet(new TreeSet<>(detectedPatterns));
        }
    }
}
