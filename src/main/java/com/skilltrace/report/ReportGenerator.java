package com.skilltrace.report;

import com.skilltrace.config.SkillAnalyticsProperties;
import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.fingerprint.FingerprintModels.TopicStats;
import com.skilltrace.fingerprint.SkillFingerprintAggregator;
import com.skilltrace.gap.GapDetector;
import com.skilltrace.gap.GapModels.Severity;
import com.skilltrace.gap.GapModels.SkillGap;
import com.skilltrace.gap.GapModels.WorkshopRecommendation;
import com.skilltrace.report.ReportModels.*;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionModels.SessionStatistics;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class ReportGenerator {
    public static final String READY = "ready";
    public static final String NOT_YET_READY = "not yet ready";
    public static final int RECENT_SESSIONS = 10;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final GapDetector gapDetector;
    private final SkillAnalyticsProperties properties;

    public ReportGenerator(GapDetector gapDetector, SkillAnalyticsProperties properties) {
        this.gapDetector = gapDetector;
        this.properties = properties;
    }

    public SkillReport skillFingerprintReport(SkillFingerprint fingerprint, List<SkillGap> gaps) {
        return skillFingerprintReport(fingerprint, gaps, properties.masteryThreshold());
    }

    public SkillReport skillFingerprintReport(SkillFingerprint fingerprint, List<SkillGap> gaps, double masteryThreshold) {
        List<SkillGap> gapList = gaps == null ? List.of() : List.copyOf(gaps);

        ExecutiveSummary summary = new ExecutiveSummary(
                fingerprint.totalSessions(),
                fingerprint.overallAverageScore(),
                fingerprint.overallAverageTimeSeconds(),
                fingerprint.overallAverageHints(),
                fingerprint.perTopic().size(),
                gapList.size(),
                assessment(fingerprint));

        List<TopicRow> topics = fingerprint.perTopic().entrySet().stream()
                .map(e -> toRow(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(TopicRow::averageScore).reversed().thenComparing(TopicRow::topicId))
                .toList();

        List<String> strengths = topics.stream()
                .filter(t -> t.averageScore() >= masteryThreshold)
                .map(TopicRow::topicId)
                .toList();

        List<WorkshopRecommendation> nextSteps = gapDetector.prioritizeNextWorkshops(gapList, properties.maxRecommendations());
        List<String> insights = insights(fingerprint);

        String markdown = renderReport(summary, topics, strengths, gapList, nextSteps, insights, masteryThreshold);
        return new SkillReport(summary, topics, strengths, gapList, nextSteps, insights, masteryThreshold, markdown);
    }

    /**
     * Feedback for one session, compared with the learner's best on the same topic before it.
     *
     * @param priorFingerprint fingerprint of the history preceding {@code session}
     */
    public QuickFeedback quickFeedback(SessionRecord session, SkillFingerprint priorFingerprint) {
        String topicId = SkillFingerprintAggregator.topicOf(session.moduleId());
        double score = session.normalizedScore();
        TopicStats prior = priorFingerprint == null ? null : priorFingerprint.topic(topicId);

        List<String> parts = new ArrayList<>();
        if (session.feedback() != null && !session.feedback().isBlank()) {
            parts.add(session.feedback());
        }

        Double previousBest = prior == null ? null : prior.bestScore();
        boolean personalBest = previousBest != null && score > previousBest;
        if (previousBest == null) {
            parts.add(fmt("First recorded attempt on %s: %.0f%%.", topicId, score));
        } else if (personalBest) {
            parts.add(fmt("New personal best on %s: %.0f%% (previous best %.0f%%).", topicId, score, previousBest));
        } else if (score == previousBest) {
            parts.add(fmt("Matched your best of %.0f%% on %s.", previousBest, topicId));
        } else {
            parts.add(fmt("Below your best of %.0f%% on %s by %.0f points.", previousBest, topicId, previousBest - score));
        }

        String remark = scoreRemark(score);
        if (session.feedback() == null || !session.feedback().startsWith(remark)) {
            parts.add(remark);
        }
        if (session.timeSeconds() < 180) {
            parts.add("Great speed!");
        } else if (session.timeSeconds() > 600) {
            parts.add("Take your time, but try to be more efficient.");
        }
        if (session.hintsUsed() == 0) {
            parts.add("Solved independently!");
        } else if (session.hintsUsed() > 2) {
            parts.add("Try to use fewer hints next time.");
        }

        return new QuickFeedback(session.sessionId(), topicId, score, previousBest, personalBest, String.join(" ", parts));
    }

    public ProgressReport progressReport(List<SessionRecord> sessions, SessionStatistics statistics) {
        List<SessionRecord> all = sessions == null ? List.of() : sessions;
        List<SessionRecord> recent = List.copyOf(all.subList(Math.max(0, all.size() - RECENT_SESSIONS), all.size()));

        Map<String, List<SessionRecord>> byModule = all.stream()
                .collect(Collectors.groupingBy(r -> SkillFingerprintAggregator.topicOf(r.moduleId()),
                        LinkedHashMap::new, Collectors.toList()));
        List<ModuleProgress> modules = byModule.entrySet().stream()
                .map(e -> new ModuleProgress(e.getKey(), e.getValue().size(),
                        e.getValue().stream().mapToDouble(SessionRecord::normalizedScore).average().orElse(0.0),
                        e.getValue().stream().mapToDouble(SessionRecord::timeSeconds).average().orElse(0.0),
                        e.getValue().stream().mapToDouble(SessionRecord::hintsUsed).average().orElse(0.0)))
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("# Learning Progress\n\n");
        sb.append("## Overall Statistics\n\n");
        sb.append(fmt("- **Total sessions**: %d\n", statistics.totalSessions()));
        sb.append(fmt("- **Total time**: %.1f minutes\n", statistics.totalTimeSeconds() / 60.0));
        sb.append(fmt("- **Average score**: %.1f%%\n", statistics.averageScore()));
        sb.append(fmt("- **Average time per session**: %.0f seconds\n", statistics.averageTimeSeconds()));
        sb.append(fmt("- **Average hints used**: %.1f\n", statistics.averageHints()));
        sb.append(fmt("- **Modules attempted**: %d\n", statistics.distinctModules()));
        sb.append(fmt("- **Workshops attempted**: %d\n\n", statistics.distinctWorkshops()));

        if (!recent.isEmpty()) {
            sb.append("## Recent Sessions\n\n");
            sb.append("| Timestamp | Module | Workshop | Score | Time | Hints |\n");
            sb.append("|-----------|--------|----------|-------|------|-------|\n");
            for (SessionRecord r : recent) {
                sb.append(fmt("| %s | %s | %s | %d/%d | %ds | %d |\n",
                        r.timestamp() == null ? "" : TIMESTAMP.format(r.timestamp()),
                        SkillFingerprintAggregator.topicOf(r.moduleId()), r.workshopId(),
                        r.score(), r.maxScore(), r.timeSeconds(), r.hintsUsed()));
            }
            sb.append("\n");

            sb.append("## Performance by Module\n\n");
            for (ModuleProgress m : modules) {
                sb.append("### ").append(m.moduleId()).append("\n\n");
                sb.append(fmt("- Attempts: %d\n", m.attempts()));
                sb.append(fmt("- Avg score: %.1f%%\n", m.averageScore()));
                sb.append(fmt("- Avg time: %.0fs\n", m.averageTimeSeconds()));
                sb.append(fmt("- Avg hints: %.1f\n\n", m.averageHints()));
            }
        }
        return new ProgressReport(statistics, recent, modules, sb.toString());
    }

    public ReadinessAssessment readinessAssessment(SkillFingerprint fingerprint, List<SkillGap> gaps) {
        return readinessAssessment(fingerprint, gaps, properties.masteryThreshold());
    }

    public ReadinessAssessment readinessAssessment(SkillFingerprint fingerprint, List<SkillGap> gaps, double masteryThreshold) {
        List<SkillGap> gapList = gaps == null ? List.of() : gaps;
        int critical = (int) gapList.stream().filter(g -> g.severity() == Severity.CRITICAL).count();
        double overall = fingerprint.overallAverageScore();
        boolean ready = critical == 0 && overall >= masteryThreshold;

        List<SkillGap> blocking = ready ? List.of() : gapList.stream()
                .filter(g -> g.severity() == Severity.CRITICAL || g.severity() == Severity.HIGH)
                .toList();

        StringBuilder sb = new StringBuilder();
        sb.append("# Readiness Assessment\n\n");
        sb.append(fmt("**Verdict**: %s\n\n", ready ? READY : NOT_YET_READY));
        sb.append(fmt("- Overall average: %.1f%% (threshold %.0f%%)\n", overall, masteryThreshold));
        sb.append(fmt("- Critical gaps: %d\n\n", critical));
        if (!blocking.isEmpty()) {
            sb.append("## Gaps to close first\n\n");
            blocking.forEach(g -> sb.append(fmt("- **%s** (%s): %.1f%% of %.0f%% - %s\n",
                    g.topicId(), label(g.severity()), g.currentScore(), g.targetScore(), g.recommendation())));
            sb.append("\n");
        }
        return new ReadinessAssessment(ready, ready ? READY : NOT_YET_READY, overall, masteryThreshold, critical, blocking, sb.toString());
    }

    public String gapReport(List<SkillGap> gaps, double masteryThreshold) {
        if (gaps == null || gaps.isEmpty()) {
            return "No gaps detected. All target topics are at or above their target level.\n\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(fmt("Mastery threshold: %.0f%%\n\n", masteryThreshold));
        sb.append(fmt("Total gaps detected: %d\n\n", gaps.size()));
        Map<Severity, List<SkillGap>> bySeverity = gaps.stream()
                .collect(Collectors.groupingBy(SkillGap::severity, () -> new EnumMap<>(Severity.class), Collectors.toList()));
        bySeverity.forEach((severity, list) -> {
            sb.append("### ").append(label(severity)).append(" priority\n\n");
            for (SkillGap g : list) {
                sb.append("#### ").append(g.topicId()).append("\n\n");
                sb.append(fmt("- Current score: %.1f%%\n", g.currentScore()));
                sb.append(fmt("- Target score: %.1f%%\n", g.targetScore()));
                sb.append(fmt("- Gap: %.1f points\n", g.gapSize()));
                sb.append(fmt("- Attempts: %d\n", g.attempts()));
                if (g.attempts() > 0) {
                    sb.append(fmt("- Avg time: %.0fs\n", g.averageTimeSeconds()));
                    sb.append(fmt("- Avg hints: %.1f\n", g.averageHints()));
                }
                sb.append("- **Recommendation**: ").append(g.recommendation()).append("\n\n");
            }
        });
        return sb.toString();
    }

    private String renderReport(ExecutiveSummary summary,
                                List<TopicRow> topics,
                                List<String> strengths,
                                List<SkillGap> gaps,
                                List<WorkshopRecommendation> nextSteps,
                                List<String> insights,
                                double masteryThreshold) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Skill Fingerprint Report\n\n");

        sb.append("## Executive Summary\n\n");
        sb.append(fmt("- **Total sessions**: %d\n", summary.totalSessions()));
        sb.append(fmt("- **Overall average score**: %.1f%%\n", summary.overallAverageScore()));
        sb.append(fmt("- **Average time per session**: %.0f seconds\n", summary.averageTimeSeconds()));
        sb.append(fmt("- **Average hints used**: %.1f\n", summary.averageHints()));
        sb.append(fmt("- **Topics attempted**: %d\n", summary.topicsAttempted()));
        sb.append(fmt("- **Skill gaps detected**: %d\n\n", summary.gapsDetected()));
        sb.append("**Overall assessment**: ").append(summary.assessment()).append("\n\n");

        sb.append("## Topic Mastery\n\n");
        if (topics.isEmpty()) {
            sb.append("No topics attempted yet.\n\n");
        } else {
            sb.append("| Topic | Attempts | Average | Best | Latest | Avg time | Avg hints | Trend |\n");
            sb.append("|-------|----------|---------|------|--------|----------|-----------|-------|\n");
            for (TopicRow t : topics) {
                sb.append(fmt("| %s | %d | %.1f%% | %.0f%% | %.0f%% | %.0fs | %.1f | %s |\n",
                        t.topicId(), t.attempts(), t.averageScore(), t.bestScore(), t.latestScore(),
                        t.averageTimeSeconds(), t.averageHints(), t.trend().arrow()));
            }
            sb.append("\n");
        }

        sb.append("## Strengths\n\n");
        if (strengths.isEmpty()) {
            sb.append(fmt("No topics at or above %.0f%% yet.\n\n", masteryThreshold));
        } else {
            Map<String, TopicRow> byId = topics.stream().collect(Collectors.toMap(TopicRow::topicId, t -> t));
            strengths.forEach(s -> sb.append(fmt("- **%s**: %.1f%% average\n", s, byId.get(s).averageScore())));
            sb.append("\n");
        }

        sb.append("## Areas for Improvement\n\n");
        sb.append(gapReport(gaps, masteryThreshold));

        sb.append("## Next Steps\n\n");
        if (nextSteps.isEmpty()) {
            sb.append("All target topics are mastered. Consider the mock screening test or real-world projects.\n\n");
        } else {
            for (int i = 0; i < nextSteps.size(); i++) {
                WorkshopRecommendation r = nextSteps.get(i);
                sb.append(fmt("%d. **%s**: %s\n", i + 1, r.topicId(), r.message()));
            }
            sb.append("\n");
        }

        if (!insights.isEmpty()) {
            sb.append("## Learning Insights\n\n");
            insights.forEach(i -> sb.append("- ").append(i).append("\n"));
            sb.append("\n");
        }
        return sb.toString();
    }

    private TopicRow toRow(String topicId, TopicStats s) {
        return new TopicRow(topicId, s.attempts(), s.averageScore(), s.bestScore(), s.latestScore(),
                s.averageTimeSeconds(), s.averageHints(), s.learningVelocity(), Trend.fromVelocity(s.learningVelocity()));
    }

    private String scoreRemark(double score) {
        if (score >= 90) return "Excellent work!";
        if (score >= 75) return "Good job!";
        if (score >= 60) return "Keep practicing!";
        return "Don't give up! Review the material and try again.";
    }

    private String assessment(SkillFingerprint fingerprint) {
        if (fingerprint.isEmpty()) return "No sessions yet";
        double score = fingerprint.overallAverageScore();
        if (score >= 85) return "Excellent - performing very well";
        if (score >= 75) return "Good - solid progress, some areas need attention";
        if (score >= 60) return "Fair - significant improvement needed";
        return "Needs work - focus on fundamentals";
    }

    private List<String> insights(SkillFingerprint fingerprint) {
        if (fingerprint.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        if (fingerprint.overallAverageHints() > 2) {
            out.add("Hint usage: hints are used frequently. Try to solve problems independently first.");
        } else if (fingerprint.overallAverageHints() < 1) {
            out.add("Hint usage: most problems are solved independently.");
        }
        if (fingerprint.overallAverageTimeSeconds() > 600) {
            out.add("Time management: average time is high. Practice for speed and efficiency.");
        } else if (fingerprint.overallAverageTimeSeconds() < 300) {
            out.add("Time management: fast completion. Make sure problems are not rushed.");
        }
        if (fingerprint.totalSessions() < 5) {
            out.add("Practice volume: complete more workshops to build consistency.");
        } else if (fingerprint.totalSessions() >= 20) {
            out.add("Practice volume: steady practice across many sessions.");
        }
        return out;
    }

    private String label(Severity severity) {
        return severity.name().charAt(0) + severity.name().substring(1).toLowerCase(Locale.ROOT);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
