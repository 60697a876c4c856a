package com.timebox.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 批量创建任务请求 DTO
 */
@Data
public class BulkCreateRequestDTO {

    private Long projectId;

    private List<TaskSpecDTO> tasks;
}
