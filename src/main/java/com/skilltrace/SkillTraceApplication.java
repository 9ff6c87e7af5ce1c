package com.skilltrace;

import com.skilltrace.config.SkillAnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SkillAnalyticsProperties.class)
public class SkillTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillTraceApplication.class, args);
    }
}
