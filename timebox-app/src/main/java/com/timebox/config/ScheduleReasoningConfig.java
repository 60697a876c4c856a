package com.timebox.config;

import com.timebox.infrastructure.ai.config.ScheduleReasoningProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 排程推理配置装配，启动时提示凭据缺失。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScheduleReasoningProperties.class)
public class ScheduleReasoningConfig {

    @Bean
    public ApplicationRunner scheduleReasoningStartupCheck(ScheduleReasoningProperties properties) {
        return args -> {
            if (StringUtils.isBlank(properties.getApiKey())) {
                log.warn("SCHEDULE_REASONING_DISABLED reason=api key not configured, weekly generation will return 503");
            } else {
                log.info("SCHEDULE_REASONING_READY model={}", properties.getModel());
            }
        };
    }
}
