package com.skilltrace.gap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public class GapModels {
    public enum Importance { CRITICAL, HIGH, MEDIUM, LOW }

    public enum Severity { CRITICAL, HIGH, MEDIUM, LOW }

    public record TopicTarget(double targetScore, Importance importance) {
        public TopicTarget {
            if (Double.isNaN(targetScore) || targetScore < 0 || targetScore > 100) {
                throw new IllegalArgumentException("targetScore must be within 0..100, got " + targetScore);
            }
            if (importance == null) {
                importance = Importance.MEDIUM;
            }
        }
    }

    public record TargetProfile(Map<String, TopicTarget> perTopic) {
        public TargetProfile {
            perTopic = perTopic == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new TreeMap<>(perTopic));
        }

        public static TargetProfile empty() {
            return new TargetProfile(Map.of());
        }

        public boolean isEmpty() {
            return perTopic.isEmpty();
        }

        public TargetProfile with(String topicId, double targetScore, Importance importance) {
            Map<String, TopicTarget> next = new LinkedHashMap<>(perTopic);
            next.put(topicId, new TopicTarget(targetScore, importance));
            return new TargetProfile(next);
        }
    }

    public record SkillGap(String topicId,
                           double currentScore,
                           double targetScore,
                           double gapSize,
                           Severity severity,
                           Importance importance,
                           int attempts,
                           double averageTimeSeconds,
                           double averageHints,
                           String recommendation) {}

    public record WorkshopRecommendation(String topicId, Severity severity, String message) {}
}
