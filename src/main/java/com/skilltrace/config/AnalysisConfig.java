package com.skilltrace.config;

import com.skilltrace.analysis.PatternCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalysisConfig {

    @Bean
    public PatternCatalog patternCatalog() {
        return PatternCatalog.defaultCatalog();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
