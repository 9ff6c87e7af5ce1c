package com.skilltrace.api;

import com.skilltrace.fingerprint.FingerprintModels.SkillFingerprint;
import com.skilltrace.gap.GapModels.Importance;
import com.skilltrace.gap.GapModels.SkillGap;
import com.skilltrace.gap.GapModels.TargetProfile;
import com.skilltrace.gap.GapModels.TopicTarget;
import com.skilltrace.gap.GapModels.WorkshopRecommendation;
import com.skilltrace.report.ReportModels.ReadinessAssessment;
import com.skilltrace.report.ReportModels.SkillReport;
import com.skilltrace.service.LearnerAnalyticsService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/learners/{learnerId}")
public class SkillController {
    private final LearnerAnalyticsService analyticsService;

    public SkillController(LearnerAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/fingerprint")
    public ResponseEntity<SkillFingerprint> fingerprint(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.fingerprint(learnerId));
    }

    @GetMapping("/weak-areas")
    public ResponseEntity<List<String>> weakAreas(@PathVariable String learnerId,
                                                  @RequestParam(required = false) Double threshold) {
        return ResponseEntity.ok(analyticsService.weakAreas(learnerId, threshold));
    }

    @GetMapping("/gaps")
    public ResponseEntity<List<SkillGap>> gaps(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.gaps(learnerId));
    }

    @PostMapping("/gaps")
    public ResponseEntity<List<SkillGap>> gapsForProfile(@PathVariable String learnerId,
                                                         @RequestBody TargetProfileRequest request) {
        return ResponseEntity.ok(analyticsService.gaps(learnerId, request.toProfile()));
    }

    @GetMapping("/next-workshops")
    public ResponseEntity<List<WorkshopRecommendation>> nextWorkshops(@PathVariable String learnerId,
                                                                      @RequestParam(required = false) Integer max) {
        return ResponseEntity.ok(analyticsService.nextWorkshops(learnerId, max));
    }

    @GetMapping("/report")
    public ResponseEntity<SkillReport> report(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.skillReport(learnerId));
    }

    @GetMapping(value = "/report.md", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> reportMarkdown(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.skillReport(learnerId).markdown());
    }

    @PostMapping("/report/export")
    public ResponseEntity<Map<String, String>> exportReport(@PathVariable String learnerId) {
        return ResponseEntity.ok(Map.of("path", analyticsService.exportSkillReport(learnerId).toString()));
    }

    @GetMapping("/readiness")
    public ResponseEntity<ReadinessAssessment> readiness(@PathVariable String learnerId) {
        return ResponseEntity.ok(analyticsService.readiness(learnerId));
    }

    public record TopicTargetRequest(Double targetScore, String importance) {}

    public record TargetProfileRequest(Map<String, TopicTargetRequest> topics) {
        TargetProfile toProfile() {
            if (topics == null) return TargetProfile.empty();
            Map<String, TopicTarget> out = new LinkedHashMap<>();
            topics.forEach((topic, t) -> {
                if (t == null || t.targetScore() == null) {
                    throw new IllegalArgumentException("targetScore is required for topic " + topic);
                }
                out.put(topic, new TopicTarget(t.targetScore(), parseImportance(t.importance())));
            });
            return new TargetProfile(out);
        }

        private static Importance parseImportance(String value) {
            if (value == null || value.isBlank()) return Importance.MEDIUM;
            try {
                return Importance.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown importance: " + value, e);
            }
        }
    }
}
