package com.timebox.domain.task.model.entity;

import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 工时记录实体，endTime 为空表示计时仍在进行。
 */
@Data
public class TimeEntryEntity {

    private Long id;

    private Long taskId;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    /**
     * 显式时长（分钟），为空时由起止时间推导
     */
    private Integer durationMinutes;

    private String note;

    private LocalDateTime createdAt;

    public boolean isCompleted() {
        return endTime != null;
    }

    /**
     * 解析有效时长：优先使用显式时长，其次由起止时间推导，进行中的记录为 0。
     */
    public int resolveDurationMinutes() {
        if (durationMinutes != null) {
            return Math.max(durationMinutes, 0);
        }
        if (startTime == null || endTime == null) {
            return 0;
        }
        long minutes = Duration.between(startTime, endTime).toMinutes();
        return (int) Math.max(minutes, 0L);
    }
}
