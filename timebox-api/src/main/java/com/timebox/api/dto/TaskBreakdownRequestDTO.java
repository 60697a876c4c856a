package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务拆分请求 DTO
 */
@Data
public class TaskBreakdownRequestDTO {

    private Long taskId;

    private List<SubtaskSpecDTO> subtasks;

    private String reason;

    /**
     * 是否归档原任务，默认 true
     */
    private Boolean archiveOriginal;
}
