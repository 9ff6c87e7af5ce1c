package com.skilltrace.config;

import com.skilltrace.gap.GapModels.Importance;
import com.skilltrace.gap.GapModels.TargetProfile;
import com.skilltrace.gap.GapModels.TopicTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "skills")
public record SkillAnalyticsProperties(
        @DefaultValue("80") double masteryThreshold,
        @DefaultValue("3") int maxRecommendations,
        @DefaultValue("reports") String reportDirectory,
        Map<String, Target> targetProfile
) {

    public SkillAnalyticsProperties {
        targetProfile = targetProfile == null ? Map.of() : Map.copyOf(targetProfile);
    }

    public record Target(@DefaultValue("80") double targetScore, @DefaultValue("medium") Importance importance) {}

    public TargetProfile defaultTargetProfile() {
        Map<String, TopicTarget> topics = new LinkedHashMap<>();
        targetProfile.forEach((topic, t) -> topics.put(topic, new TopicTarget(t.targetScore(), t.importance())));
        return new TargetProfile(topics);
    }
}
