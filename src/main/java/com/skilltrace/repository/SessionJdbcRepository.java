package com.skilltrace.repository;

import com.skilltrace.analysis.PatternTag;
import com.skilltrace.analysis.SubmissionModels.ErrorKind;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class SessionJdbcRepository implements SessionStore {
    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(SessionRecord r) {
        jdbcTemplate.update(
                "INSERT INTO learning_sessions(session_id, learner_id, module_id, workshop_id, score, max_score, time_seconds, hints_used, detected_patterns, error_kind, feedback, ts) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
                r.sessionId(), r.learnerId(), r.moduleId(), r.workshopId(),
                r.score(), r.maxScore(), r.timeSeconds(), r.hintsUsed(),
                toPatternString(r.detectedPatterns()), r.errorKind().name(), r.feedback(),
                (r.timestamp() == null ? Instant.now() : r.timestamp()).toString());
    }

    @Override
    public List<SessionRecord> readAll(String learnerId) {
        return jdbcTemplate.query(
                "SELECT session_id, learner_id, module_id, workshop_id, score, max_score, time_seconds, hints_used, detected_patterns, error_kind, feedback, ts FROM learning_sessions WHERE learner_id = ? ORDER BY seq",
                (rs, n) -> new SessionRecord(
                        rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getInt(5), rs.getInt(6), rs.getInt(7), rs.getInt(8),
                        parsePatterns(rs.getString(9)), ErrorKind.valueOf(rs.getString(10)), rs.getString(11),
                        Instant.parse(rs.getString(12))
                ),
                learnerId);
    }

    private String toPatternString(Set<PatternTag> patterns) {
        return patterns.stream().map(PatternTag::id).sorted().collect(Collectors.joining(","));
    }

    private Set<PatternTag> parsePatterns(String value) {
        if (value == null || value.isBlank()) return Set.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(PatternTag::new)
                .collect(Collectors.toSet());
    }
}
