package com.skilltrace.api;

import com.skilltrace.analysis.SubmissionModels.ExecutionOutcome;
import com.skilltrace.analysis.SubmissionModels.GradedSubmission;
import com.skilltrace.report.ReportModels.ProgressReport;
import com.skilltrace.service.LearnerAnalyticsService;
import com.skilltrace.session.SessionModels.SessionRecord;
import com.skilltrace.session.SessionModels.SessionStatistics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/learners/{learnerId}")
public class SubmissionController {
    private final LearnerAnalyticsService analyticsService;

    public SubmissionController(LearnerAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping("/submissions")
    public ResponseEntity<LearnerAnalyticsService.SubmissionResult> submit(@PathVariable String learnerId,
                                                                           @RequestBody SubmissionRequest request) {
        return ResponseEntity.ok(analyticsService.submit(learnerId, request.toSubmission()));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionRecord>> sessions(@PathVariable String learnerId,
                                                        @RequestParam(required = false) String moduleId,
                                                        @RequestParam(required = false) String workshopId) {
        return ResponseEntity.ok(analyticsService.sessions(learnerId, moduleId, workshopId));
    }

    @GetMapping("/statistics")
    public ResponseEntity<SessionStatistics> statistics(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.statistics(learnerId));
    }

    @GetMapping("/progress")
    public ResponseEntity<ProgressReport> progress(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.progress(learnerId));
    }

    public record SubmissionRequest(String code,
                                    String workshopId,
                                    String moduleId,
                                    int score,
                                    int maxScore,
                                    int timeSeconds,
                                    int hintsUsed,
                                    ExecutionOutcome executionOutcome) {
        GradedSubmission toSubmission() {
            return new GradedSubmission(code, workshopId, moduleId, score, maxScore, timeSeconds, hintsUsed, executionOutcome);
        }
    }
}
