package com.skilltrace.service;

import com.skilltrace.analysis.SubmissionAnalyzer;
import com.skilltrace.analysis.SubmissionModels.GradedSubmission;
import com.skilltrace.analysis.SubmissionModels.SubmissionAnalysis;
import com.skilltrace.config.SkillAnalyticsProperties;
import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.fingerprint.SkillFingerprintAggregator;
import com.skilltrace.gap.GapDetector;
import com.skilltrace.gap.GapModels.SkillGap;
import com.skilltrace.gap.GapModels.TargetProfile;
import com.skilltrace.gap.GapModels.WorkshopRecommendation;
import com.skilltrace.gap.TargetProfileNotConfiguredException;
import com.skilltrace.report.ReportFileWriter;
import com.skilltrace.report.ReportGenerator;
import com.skilltrace.report.ReportModels.ProgressReport;
import com.skilltrace.report.ReportModels.QuickFeedback;
import com.skilltrace.report.ReportModels.ReadinessAssessment;
import com.skilltrace.report.ReportModels.SkillReport;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionModels.SessionStatistics;
import com.skilltrace.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class LearnerAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(LearnerAnalyticsService.class);

    private final SubmissionAnalyzer analyzer;
    private final SessionStore store;
    private final SkillFingerprintAggregator aggregator;
    private final GapDetector gapDetector;
    private final ReportGenerator reportGenerator;
    private final ReportFileWriter reportFileWriter;
    private final SkillAnalyticsProperties properties;

    private final LearnerLocks learnerLocks = new LearnerLocks(LearnerLocks.DEFAULT_STRIPES);

    public LearnerAnalyticsService(SubmissionAnalyzer analyzer,
                                   SessionStore store,
                                   SkillFingerprintAggregator aggregator,
                                   GapDetector gapDetector,
                                   ReportGenerator reportGenerator,
                                   ReportFileWriter reportFileWriter,
                                   SkillAnalyticsProperties properties) {
        this.analyzer = analyzer;
        this.store = store;
        this.aggregator = aggregator;
        this.gapDetector = gapDetector;
        this.reportGenerator = reportGenerator;
        this.reportFileWriter = reportFileWriter;
        this.properties = properties;
    }

    public SubmissionResult submit(String learnerId, GradedSubmission submission) {
        requireLearner(learnerId);
        if (submission == null) {
            throw new IllegalArgumentException("submission is required");
        }
        SubmissionAnalysis analysis = analyzer.analyze(submission);

        ReentrantLock lock = learnerLocks.lockFor(learnerId);
        lock.lock();
        try {
            SkillFingerprint prior = aggregator.buildFingerprint(store.readAll(learnerId));
            SessionRecord record = new SessionRecord(
                    UUID.randomUUID().toString(), learnerId,
                    submission.moduleId(), submission.workshopId(),
                    submission.score(), submission.maxScore(), submission.timeSeconds(), submission.hintsUsed(),
                    analysis.detectedPatterns(), analysis.errorKind(), analysis.feedback(), analysis.timestamp());
            store.append(record);
            log.info("Recorded session {} for learner {} on {}/{}: score={}/{}, errorKind={}",
                    record.sessionId(), learnerId, record.moduleId(), record.workshopId(),
                    record.score(), record.maxScore(), record.errorKind());
            return new SubmissionResult(analysis, record, reportGenerator.quickFeedback(record, prior));
        } finally {
            lock.unlock();
        }
    }

    public List<SessionRecord> sessions(String learnerId, String moduleId, String workshopId) {
        requireLearner(learnerId);
        return store.readAll(learnerId).stream()
                .filter(s -> moduleId == null || moduleId.isBlank() || moduleId.equals(s.moduleId()))
                .filter(s -> workshopId == null || workshopId.isBlank() || workshopId.equals(s.workshopId()))
                .toList();
    }

    public SessionStatistics statistics(String learnerId) {
        requireLearner(learnerId);
        return aggregator.statistics(store.readAll(learnerId));
    }

    public ProgressReport progress(String learnerId) {
        requireLearner(learnerId);
        List<SessionRecord> sessions = store.readAll(learnerId);
        return reportGenerator.progressReport(sessions, aggregator.statistics(sessions));
    }

    public SkillFingerprint fingerprint(String learnerId) {
        requireLearner(learnerId);
        SkillFingerprint fingerprint = aggregator.buildFingerprint(store.readAll(learnerId));
        log.debug("Fingerprint for {}: {} topics over {} sessions", learnerId, fingerprint.perTopic().size(), fingerprint.totalSessions());
        return fingerprint;
    }

    public List<String> weakAreas(String learnerId, Double threshold) {
        return gapDetector.identifyWeakAreas(fingerprint(learnerId), threshold == null ? properties.masteryThreshold() : threshold);
    }

    public List<SkillGap> gaps(String learnerId) {
        return gaps(learnerId, properties.defaultTargetProfile());
    }

    public List<SkillGap> gaps(String learnerId, TargetProfile target) {
        return detect(fingerprint(learnerId), target);
    }

    public List<WorkshopRecommendation> nextWorkshops(String learnerId, Integer max) {
        int limit = max == null ? properties.maxRecommendations() : max;
        return gapDetector.prioritizeNextWorkshops(gaps(learnerId), limit);
    }

    public SkillReport skillReport(String learnerId) {
        SkillFingerprint fingerprint = fingerprint(learnerId);
        return reportGenerator.skillFingerprintReport(fingerprint, detect(fingerprint, properties.defaultTargetProfile()));
    }

    public ReadinessAssessment readiness(String learnerId) {
        SkillFingerprint fingerprint = fingerprint(learnerId);
        return reportGenerator.readinessAssessment(fingerprint, detect(fingerprint, properties.defaultTargetProfile()));
    }

    public Path exportSkillReport(String learnerId) {
        return reportFileWriter.write(learnerId, skillReport(learnerId));
    }

    private List<SkillGap> detect(SkillFingerprint fingerprint, TargetProfile target) {
        if (target == null || target.isEmpty()) {
            throw new TargetProfileNotConfiguredException("No target topics configured; cannot tell gaps from mastery");
        }
        return gapDetector.detectGaps(fingerprint, target);
    }

    private void requireLearner(String learnerId) {
        if (learnerId == null || learnerId.isBlank()) {
            throw new IllegalArgumentException("learnerId is required");
        }
    }

    public record SubmissionResult(SubmissionAnalysis analysis, SessionRecord session, QuickFeedback quickFeedback) {}
}
