package com.boundgen.infrastructure.ai.validation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ValidationProperties.class)
public class ValidationConfig {

    @Bean
    public RuleGroupTable ruleGroupTable(ValidationProperties properties) {
        return RuleGroupTable.from(properties);
    }
}
