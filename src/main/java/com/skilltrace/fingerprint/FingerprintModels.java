package com.skilltrace.fingerprint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class FingerprintModels {
    public record TopicStats(int attempts,
                             double averageScore,
                             double bestScore,
                             double latestScore,
                             double averageTimeSeconds,
                             double averageHints,
                             double learningVelocity) {}

    public record SkillFingerprint(Map<String, TopicStats> perTopic,
                                   int totalSessions,
                                   double overallAverageScore,
                                   double overallAverageTimeSeconds,
                                   double overallAverageHints) {
        public SkillFingerprint {
            perTopic = Collections.unmodifiableMap(new LinkedHashMap<>(perTopic));
        }

        public static SkillFingerprint empty() {
            return new SkillFingerprint(Map.of(), 0, 0.0, 0.0, 0.0);
        }

        public boolean isEmpty() {
            return perTopic.isEmpty();
        }

        public TopicStats topic(String topicId) {
            return perTopic.get(topicId);
        }
    }
}
