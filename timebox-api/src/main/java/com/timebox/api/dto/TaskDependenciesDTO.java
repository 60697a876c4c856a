package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务直接依赖关系 DTO
 */
@Data
public class TaskDependenciesDTO {

    private Long taskId;

    /**
     * 当前任务直接依赖的任务
     */
    private List<TaskSummaryDTO> dependsOn;

    /**
     * 直接依赖当前任务（被当前任务阻塞）的任务
     */
    private List<TaskSummaryDTO> blocking;
}
