package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务拆分响应 DTO
 */
@Data
public class TaskBreakdownResponseDTO {

    private TaskSummaryDTO originalTask;
    private List<TaskSummaryDTO> createdTasks;
    private Integer dependenciesTransferred;
    private AllocationSummaryDTO allocationSummary;
    private String reason;
}
