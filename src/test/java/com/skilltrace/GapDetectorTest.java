package com.skilltrace;

import com.skilltrace.analysis.SubmissionModels.ErrorKind;
import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.fingerprint.SkillFingerprintAggregator;
import com.skilltrace.gap.GapDetector;
import com.skilltrace.gap.GapModels.Importance;
import com.skilltrace.gap.GapModels.Severity;
import com.skilltrace.gap.GapModels.SkillGap;
import com.skilltrace.gap.GapModels.TargetProfile;
import com.skilltrace.session.SessionModels.SessionRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GapDetectorTest {
    private final SkillFingerprintAggregator aggregator = new SkillFingerprintAggregator();
    private final GapDetector detector = new GapDetector();

    private SkillFingerprint fingerprint(Object... moduleAndScores) {
        List<SessionRecord> sessions = new ArrayList<>();
        for (int i = 0; i < moduleAndScores.length; i += 2) {
            String module = (String) moduleAndScores[i];
            for (int score : (int[]) moduleAndScores[i + 1]) {
                sessions.add(new SessionRecord("s-" + sessions.size(), "learner-1", module, "w-1",
                        score, 100, 240, 1, Set.of(), ErrorKind.NONE, "", Instant.EPOCH));
            }
        }
        return aggregator.buildFingerprint(sessions);
    }

    @Test
    void averageBelowHighImportanceTargetIsHighGap() {
        var fp = fingerprint("oop_fundamentals", new int[]{50, 60});
        var target = TargetProfile.empty().with("oop_fundamentals", 80, Importance.HIGH);

        List<SkillGap> gaps = detector.detectGaps(fp, target);

        assertEquals(1, gaps.size());
        SkillGap gap = gaps.get(0);
        assertEquals("oop_fundamentals", gap.topicId());
        assertEquals(55.0, gap.currentScore(), 1e-9);
        assertEquals(25.0, gap.gapSize(), 1e-9);
        assertEquals(Severity.HIGH, gap.severity());
        assertEquals(2, gap.attempts());
        assertEquals("Focus on oop_fundamentals - 25 points below target", gap.recommendation());
    }

    @Test
    void topicAboveTargetProducesNoGap() {
        var fp = fingerprint("flask_intro", new int[]{90, 94});
        var target = TargetProfile.empty().with("flask_intro", 80, Importance.LOW);
        assertTrue(detector.detectGaps(fp, target).isEmpty());
    }

    @Test
    void criticalTopicJustBelowTargetIsCritical() {
        var fp = fingerprint("python_basics", new int[]{78});
        var target = TargetProfile.empty().with("python_basics", 80, Importance.CRITICAL);
        var gaps = detector.detectGaps(fp, target);
        assertEquals(1, gaps.size());
        assertEquals(Severity.CRITICAL, gaps.get(0).severity());
        assertEquals(2.0, gaps.get(0).gapSize(), 1e-9);
    }

    @Test
    void severityBandsByGapSize() {
        assertEquals(Severity.CRITICAL, detector.severity(45, Importance.LOW, 35, 80));
        assertEquals(Severity.CRITICAL, detector.severity(40, Importance.MEDIUM, 40, 80));
        assertEquals(Severity.HIGH, detector.severity(30, Importance.MEDIUM, 50, 80));
        assertEquals(Severity.HIGH, detector.severity(5, Importance.HIGH, 75, 80));
        assertEquals(Severity.MEDIUM, detector.severity(15, Importance.MEDIUM, 65, 80));
        assertEquals(Severity.LOW, detector.severity(10, Importance.MEDIUM, 70, 80));
        assertEquals(Severity.LOW, detector.severity(1, Importance.LOW, 79, 80));
    }

    @Test
    void gapsAreRankedBySeverityThenSizeThenTopic() {
        var fp = fingerprint(
                "a_topic", new int[]{70},
                "b_topic", new int[]{65},
                "c_topic", new int[]{65},
                "d_topic", new int[]{30},
                "e_topic", new int[]{79});
        var target = TargetProfile.empty()
                .with("a_topic", 80, Importance.MEDIUM)
                .with("b_topic", 80, Importance.MEDIUM)
                .with("c_topic", 80, Importance.MEDIUM)
                .with("d_topic", 80, Importance.LOW)
                .with("e_topic", 80, Importance.HIGH);

        List<String> order = detector.detectGaps(fp, target).stream().map(SkillGap::topicId).toList();

        assertEquals(List.of("d_topic", "e_topic", "b_topic", "c_topic", "a_topic"), order);
    }

    @Test
    void neverReportsTopicsAtOrAboveTarget() {
        var fp = fingerprint(
                "python_basics", new int[]{80},
                "numpy_intro", new int[]{100},
                "flask_intro", new int[]{60});
        var target = TargetProfile.empty()
                .with("python_basics", 80, Importance.CRITICAL)
                .with("numpy_intro", 90, Importance.HIGH)
                .with("flask_intro", 80, Importance.MEDIUM);

        var gaps = detector.detectGaps(fp, target);

        assertEquals(List.of("flask_intro"), gaps.stream().map(SkillGap::topicId).toList());
        assertTrue(gaps.stream().allMatch(g -> g.gapSize() > 0));
    }

    @Test
    void unattemptedTargetTopicIsFullGap() {
        var gaps = detector.detectGaps(SkillFingerprint.empty(),
                TargetProfile.empty().with("errors_and_debugging", 80, Importance.HIGH));
        assertEquals(1, gaps.size());
        SkillGap gap = gaps.get(0);
        assertEquals(0, gap.attempts());
        assertEquals(80.0, gap.gapSize(), 1e-9);
        assertEquals(Severity.CRITICAL, gap.severity());
        assertEquals("Start with errors_and_debugging - not yet attempted", gap.recommendation());
    }

    @Test
    void recommendationReflectsHowTheTopicWasAttempted() {
        List<SessionRecord> sessions = List.of(
                new SessionRecord("1", "l", "hints", "w", 60, 100, 100, 4, Set.of(), ErrorKind.LOGIC, "", Instant.EPOCH),
                new SessionRecord("2", "l", "retry", "w", 30, 100, 100, 0, Set.of(), ErrorKind.LOGIC, "", Instant.EPOCH),
                new SessionRecord("3", "l", "retry", "w", 40, 100, 100, 0, Set.of(), ErrorKind.LOGIC, "", Instant.EPOCH),
                new SessionRecord("4", "l", "slow", "w", 70, 100, 900, 0, Set.of(), ErrorKind.LOGIC, "", Instant.EPOCH));
        var target = TargetProfile.empty()
                .with("hints", 80, Importance.MEDIUM)
                .with("retry", 80, Importance.MEDIUM)
                .with("slow", 80, Importance.MEDIUM);

        var byTopic = detector.detectGaps(aggregator.buildFingerprint(sessions), target).stream()
                .collect(Collectors.toMap(SkillGap::topicId, SkillGap::recommendation));

        assertTrue(byTopic.get("hints").startsWith("Review hints fundamentals before retrying"));
        assertEquals("Retry retry workshops - 2 attempts averaging 35%", byTopic.get("retry"));
        assertEquals("Practice slow for speed - currently taking 15.0 min on average", byTopic.get("slow"));
    }

    @Test
    void emptyProfileYieldsNoGaps() {
        var fp = fingerprint("python_basics", new int[]{10});
        assertTrue(detector.detectGaps(fp, TargetProfile.empty()).isEmpty());
    }

    @Test
    void prioritizesTopRankedGaps() {
        var fp = fingerprint("a", new int[]{10}, "b", new int[]{50}, "c", new int[]{70});
        var target = TargetProfile.empty()
                .with("a", 80, Importance.MEDIUM)
                .with("b", 80, Importance.MEDIUM)
                .with("c", 80, Importance.MEDIUM);
        var gaps = detector.detectGaps(fp, target);

        var next = detector.prioritizeNextWorkshops(gaps, 2);
        assertEquals(2, next.size());
        assertEquals("a", next.get(0).topicId());
        assertEquals(Severity.CRITICAL, next.get(0).severity());
        assertEquals(gaps.get(0).recommendation(), next.get(0).message());
        assertEquals("b", next.get(1).topicId());

        assertTrue(detector.prioritizeNextWorkshops(gaps, 0).isEmpty());
        assertEquals(3, detector.prioritizeNextWorkshops(gaps, 10).size());
    }

    @Test
    void weakAreasAreWeakestFirst() {
        var fp = fingerprint("a", new int[]{70}, "b", new int[]{40}, "c", new int[]{95});
        assertEquals(List.of("b", "a"), detector.identifyWeakAreas(fp, 80));
        assertTrue(detector.identifyWeakAreas(fp, 30).isEmpty());
    }
}
