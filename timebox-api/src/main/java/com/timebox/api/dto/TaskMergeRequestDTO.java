package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务合并请求 DTO
 */
@Data
public class TaskMergeRequestDTO {

    private List<Long> taskIds;

    private TaskSpecDTO mergedTask;

    private String reason;
}
