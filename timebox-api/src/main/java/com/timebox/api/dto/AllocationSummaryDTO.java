package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 拆分时工时分配汇总 DTO
 */
@Data
public class AllocationSummaryDTO {

    private Integer timeEntriesAllocated;
    private Integer schedulesAllocated;
    private Long totalTimeMinutesAllocated;
    private Long unallocatedTimeMinutes;
    private BigDecimal totalScheduleHoursAllocated;
}
