package com.timebox.infrastructure.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 排程推理调用配置。
 */
@Data
@ConfigurationProperties(prefix = "schedule.reasoning")
public class ScheduleReasoningProperties {

    /**
     * 推理服务凭据；为空时视为服务未配置。
     */
    private String apiKey;

    private String model = "gpt-4o-mini";

    private Double temperature = 0.3D;
}
