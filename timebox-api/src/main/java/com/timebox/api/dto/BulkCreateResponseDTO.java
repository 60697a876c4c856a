package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 批量创建任务响应 DTO
 */
@Data
public class BulkCreateResponseDTO {

    private List<TaskSummaryDTO> createdTasks;
    private Integer dependenciesCreated;
}
