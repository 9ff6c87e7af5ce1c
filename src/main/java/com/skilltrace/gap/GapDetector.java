package com.skilltrace.gap;

import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.fingerprint.FingerprintModels.TopicStats;
import com.skilltrace.gap.GapModels.*;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class GapDetector {
    static final double HIGH_HINT_USAGE = 2.0;
    static final double LOW_SCORE = 50.0;
    static final double SLOW_COMPLETION_SECONDS = 600.0;

    public static final Comparator<SkillGap> RANKING = Comparator
            .comparing(SkillGap::severity)
            .thenComparing(Comparator.comparingDouble(SkillGap::gapSize).reversed())
            .thenComparing(SkillGap::topicId);

    /**
     * Gaps for every topic of {@code target}; topics the profile does not mention are ignored.
     * Returns an empty list for an empty profile: callers must tell that apart from "no gaps".
     */
    public List<SkillGap> detectGaps(SkillFingerprint fingerprint, TargetProfile target) {
        if (target == null || target.isEmpty()) return List.of();
        SkillFingerprint fp = fingerprint == null ? SkillFingerprint.empty() : fingerprint;

        List<SkillGap> gaps = new ArrayList<>();
        for (var entry : target.perTopic().entrySet()) {
            String topicId = entry.getKey();
            TopicTarget topicTarget = entry.getValue();
            TopicStats stats = fp.topic(topicId);

            double current = stats == null ? 0.0 : stats.averageScore();
            double gapSize = topicTarget.targetScore() - current;
            boolean criticalShortfall = topicTarget.importance() == Importance.CRITICAL && current < topicTarget.targetScore();
            if (gapSize <= 0 && !criticalShortfall) continue;

            int attempts = stats == null ? 0 : stats.attempts();
            double avgTime = stats == null ? 0.0 : stats.averageTimeSeconds();
            double avgHints = stats == null ? 0.0 : stats.averageHints();
            gaps.add(new SkillGap(topicId, current, topicTarget.targetScore(), gapSize,
                    severity(gapSize, topicTarget.importance(), current, topicTarget.targetScore()),
                    topicTarget.importance(), attempts, avgTime, avgHints,
                    recommendation(topicId, current, gapSize, attempts, avgTime, avgHints)));
        }
        gaps.sort(RANKING);
        return List.copyOf(gaps);
    }

    public Severity severity(double gapSize, Importance importance, double currentScore, double targetScore) {
        if (gapSize >= 40 || (importance == Importance.CRITICAL && currentScore < targetScore)) return Severity.CRITICAL;
        if (gapSize >= 25 || importance == Importance.HIGH) return Severity.HIGH;
        if (gapSize >= 15) return Severity.MEDIUM;
        return Severity.LOW;
    }

    public List<WorkshopRecommendation> prioritizeNextWorkshops(List<SkillGap> gaps, int maxRecommendations) {
        if (gaps == null || maxRecommendations <= 0) return List.of();
        return gaps.stream()
                .limit(maxRecommendations)
                .map(g -> new WorkshopRecommendation(g.topicId(), g.severity(), g.recommendation()))
                .toList();
    }

    public List<String> identifyWeakAreas(SkillFingerprint fingerprint, double threshold) {
        return fingerprint.perTopic().entrySet().stream()
                .filter(e -> e.getValue().averageScore() < threshold)
                .sorted(Comparator.comparingDouble((Map.Entry<String, TopicStats> e) -> e.getValue().averageScore())
                        .thenComparing(e -> e.getKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private String recommendation(String topicId, double current, double gapSize, int attempts, double avgTime, double avgHints) {
        if (attempts == 0) {
            return String.format(Locale.US, "Start with %s - not yet attempted", topicId);
        }
        if (avgHints > HIGH_HINT_USAGE) {
            return String.format(Locale.US, "Review %s fundamentals before retrying - averaging %.1f hints per attempt", topicId, avgHints);
        }
        if (attempts >= 2 && current < LOW_SCORE) {
            return String.format(Locale.US, "Retry %s workshops - %d attempts averaging %.0f%%", topicId, attempts, current);
        }
        if (avgTime > SLOW_COMPLETION_SECONDS) {
            return String.format(Locale.US, "Practice %s for speed - currently taking %.1f min on average", topicId, avgTime / 60);
        }
        return String.format(Locale.US, "Focus on %s - %.0f points below target", topicId, gapSize);
    }
}
