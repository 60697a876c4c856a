package com.timebox.domain.schedule.model.entity;

import com.timebox.types.enums.ScheduleStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 排程块实体
 */
@Data
public class ScheduleBlockEntity {

    private Long id;

    private Long taskId;

    private LocalDate scheduledDate;

    /**
     * 开始时刻，可为空
     */
    private LocalTime startTime;

    /**
     * 结束时刻，可为空；跨到次日零点时保存为 00:00
     */
    private LocalTime endTime;

    /**
     * 分配工时（小时，保留两位小数）
     */
    private BigDecimal allocatedHours;

    private Boolean generatedByAi;

    private ScheduleStatusEnum status;

    private LocalDateTime createdAt;

    public boolean isAiGenerated() {
        return Boolean.TRUE.equals(generatedByAi);
    }
}
