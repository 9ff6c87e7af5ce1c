package com.skilltrace.analysis;

import com.skilltrace.analysis.SubmissionModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class SubmissionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SubmissionAnalyzer.class);

    private final PythonSourceScanner scanner;
    private final PatternCatalog catalog;
    private final Clock clock;

    public SubmissionAnalyzer(PythonSourceScanner scanner, PatternCatalog catalog, Clock clock) {
        this.scanner = scanner;
        this.catalog = catalog;
        this.clock = clock;
    }

    public SubmissionAnalysis analyze(GradedSubmission submission) {
        return analyze(submission.code(), submission.workshopId(), submission.moduleId(),
                submission.score(), submission.maxScore(), submission.timeSeconds(), submission.hintsUsed(),
                submission.executionOutcome());
    }

    public SubmissionAnalysis analyze(String code,
                                      String workshopId,
                                      String moduleId,
                                      int score,
                                      int maxScore,
                                      int timeSeconds,
                                      int hintsUsed,
                                      ExecutionOutcome executionOutcome) {
        ExecutionOutcome outcome = executionOutcome == null ? ExecutionOutcome.clean() : executionOutcome;
        ScannedSource source = scanQuietly(code);

        ErrorKind errorKind = classify(source, score, maxScore, outcome);
        Set<PatternTag> patterns = source.parsed() ? catalog.detect(source) : Set.of();
        String feedback = feedbackFor(errorKind, ratio(score, maxScore), patterns, source);

        log.debug("Analyzed {}/{}: errorKind={}, patterns={}, time={}s, hints={}",
                moduleId, workshopId, errorKind, patterns.size(), timeSeconds, hintsUsed);
        return new SubmissionAnalysis(workshopId, moduleId, errorKind, patterns, feedback, clock.instant());
    }

    private ScannedSource scanQuietly(String code) {
        try {
            return scanner.scan(code);
        } catch (RuntimeException e) {
            log.warn("Source scan failed unexpectedly: {}", e.toString());
            return new ScannedSource(true, null, 0, List.of(), List.of(), Map.of());
        }
    }

    ErrorKind classify(ScannedSource source, int score, int maxScore, ExecutionOutcome outcome) {
        if (outcome.timeoutError()) return ErrorKind.TIMEOUT;
        if (!source.parsed()) return ErrorKind.SYNTAX;
        if (score == 0 && outcome.syntaxError()) return ErrorKind.SYNTAX;
        if (score < maxScore) return ErrorKind.LOGIC;
        return ErrorKind.NONE;
    }

    private double ratio(int score, int maxScore) {
        if (maxScore <= 0) return 0.0;
        return Math.max(0.0, Math.min(1.0, (double) score / maxScore));
    }

    private String feedbackFor(ErrorKind kind, double ratio, Set<PatternTag> patterns, ScannedSource source) {
        String base = switch (kind) {
            case TIMEOUT -> "Execution timed out. Look for loops that never finish or work repeated on every iteration.";
            case SYNTAX -> source.parsed()
                    ? "Syntax error reported by the grader. Fix the code so it parses before checking the logic."
                    : source.errorLine() > 0
                    ? String.format("Syntax error on line %d: %s.", source.errorLine(), source.error())
                    : "Syntax error: " + source.error() + ".";
            case LOGIC -> {
                if (ratio < 0.5) yield "Significant logic errors detected. Review the problem requirements.";
                if (ratio < 0.7) yield "Some logic errors detected. Check edge cases and requirements.";
                yield "Good attempt! Minor improvements needed for full marks.";
            }
            case NONE -> "Excellent work!";
        };
        if (patterns.isEmpty()) return base;
        return base + " Constructs used: " + patterns.stream().map(PatternTag::label).collect(Collectors.joining(", ")) + ".";
    }
}
