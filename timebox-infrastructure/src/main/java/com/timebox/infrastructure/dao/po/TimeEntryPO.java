package com.timebox.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工时记录 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeEntryPO {

    private Long id;
    private Long taskId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Integer durationMinutes;
    private String note;
    private LocalDateTime createdAt;
}
