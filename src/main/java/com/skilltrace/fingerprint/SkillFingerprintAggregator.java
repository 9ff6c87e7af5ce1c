package com.skilltrace.fingerprint;

import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.fingerprint.FingerprintModels.TopicStats;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionModels.SessionStatistics;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

@Service
public class SkillFingerprintAggregator {
    public static final String UNKNOWN_TOPIC = "unknown";

    public SkillFingerprint buildFingerprint(List<SessionRecord> sessions) {
        if (sessions == null || sessions.isEmpty()) return SkillFingerprint.empty();

        Map<String, List<SessionRecord>> byTopic = sessions.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(r -> topicOf(r.moduleId()), LinkedHashMap::new, Collectors.toList()));
        if (byTopic.isEmpty()) return SkillFingerprint.empty();

        Map<String, TopicStats> perTopic = new LinkedHashMap<>();
        byTopic.forEach((topic, rows) -> perTopic.put(topic, topicStats(rows)));

        List<SessionRecord> all = byTopic.values().stream().flatMap(List::stream).toList();
        return new SkillFingerprint(perTopic, all.size(),
                avg(all, SessionRecord::normalizedScore),
                avg(all, SessionRecord::timeSeconds),
                avg(all, SessionRecord::hintsUsed));
    }

    /**
     * Estimated score gain per attempt: mean of the later half minus mean of the earlier half,
     * divided by the attempt count. With an odd count the middle attempt is left out of both halves,
     * so a reversed sequence gives exactly the negated value.
     */
    public double learningVelocity(List<Double> scores) {
        int n = scores.size();
        if (n < 2) return 0.0;
        int half = n / 2;
        double early = scores.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double late = scores.subList(n - half, n).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return (late - early) / n;
    }

    public SessionStatistics statistics(List<SessionRecord> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return new SessionStatistics(0, 0, 0.0, 0.0, 0.0, 0, 0);
        }
        long totalTime = sessions.stream().mapToLong(SessionRecord::timeSeconds).sum();
        int modules = (int) sessions.stream().map(SessionRecord::moduleId).filter(Objects::nonNull).distinct().count();
        int workshops = (int) sessions.stream().map(SessionRecord::workshopId).filter(Objects::nonNull).distinct().count();
        return new SessionStatistics(sessions.size(), totalTime,
                avg(sessions, SessionRecord::normalizedScore),
                (double) totalTime / sessions.size(),
                avg(sessions, SessionRecord::hintsUsed),
                modules, workshops);
    }

    private TopicStats topicStats(List<SessionRecord> rows) {
        List<Double> scores = rows.stream().map(SessionRecord::normalizedScore).toList();
        return new TopicStats(
                rows.size(),
                scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0),
                scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0),
                scores.get(scores.size() - 1),
                avg(rows, SessionRecord::timeSeconds),
                avg(rows, SessionRecord::hintsUsed),
                learningVelocity(scores));
    }

    public static String topicOf(String moduleId) {
        return moduleId == null || moduleId.isBlank() ? UNKNOWN_TOPIC : moduleId;
    }

    private double avg(List<SessionRecord> rows, ToDoubleFunction<SessionRecord> fn) {
        return rows.stream().mapToDouble(fn).average().orElse(0.0);
    }
}
