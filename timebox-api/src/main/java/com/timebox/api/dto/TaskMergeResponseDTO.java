package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务合并响应 DTO
 */
@Data
public class TaskMergeResponseDTO {

    private TaskSummaryDTO mergedTask;
    private List<Long> archivedTasks;
    private Integer timeEntriesTransferred;
    private Integer schedulesTransferred;
    private Integer dependenciesMerged;
    private String reason;
}
