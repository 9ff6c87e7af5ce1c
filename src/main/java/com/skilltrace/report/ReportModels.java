package com.skilltrace.report;

import com.skilltrace.gap.GapModels.SkillGap;
import com.skilltrace.gap.GapModels.WorkshopRecommendation;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionModels.SessionStatistics;

import java.util.List;

public class ReportModels {
    public enum Trend {
        IMPROVING("↑"), STABLE("→"), DECLINING("↓");

        private final String arrow;

        Trend(String arrow) {
            this.arrow = arrow;
        }

        public String arrow() {
            return arrow;
        }

        public static Trend fromVelocity(double velocity) {
            if (velocity > 0) return IMPROVING;
            if (velocity < 0) return DECLINING;
            return STABLE;
        }
    }

    public record ExecutiveSummary(int totalSessions,
                                   double overallAverageScore,
                                   double averageTimeSeconds,
                                   double averageHints,
                                   int topicsAttempted,
                                   int gapsDetected,
                                   String assessment) {}

    public record TopicRow(String topicId,
                           int attempts,
                           double averageScore,
                           double bestScore,
                           double latestScore,
                           double averageTimeSeconds,
                           double averageHints,
                           double learningVelocity,
                           Trend trend) {}

    public record SkillReport(ExecutiveSummary summary,
                              List<TopicRow> topics,
                              List<String> strengths,
                              List<SkillGap> areasForImprovement,
                              List<WorkshopRecommendation> nextSteps,
                              List<String> insights,
                              double masteryThreshold,
                              String markdown) {}

    /**
     * @param previousBest best normalized score on the topic before this session, {@code null} on a first attempt
     */
    public record QuickFeedback(String sessionId,
                                String topicId,
                                double score,
                                Double previousBest,
                                boolean personalBest,
                                String message) {}

    public record ReadinessAssessment(boolean ready,
                                      String verdict,
                                      double overallAverageScore,
                                      double masteryThreshold,
                                      int criticalGaps,
                                      List<SkillGap> blockingGaps,
                                      String summary) {}

    public record ModuleProgress(String moduleId,
                                 int attempts,
                                 double averageScore,
                                 double averageTimeSeconds,
                                 double averageHints) {}

    public record ProgressReport(SessionStatistics statistics,
                                 List<SessionRecord> recentSessions,
                                 List<ModuleProgress> modules,
                                 String markdown) {}
}
