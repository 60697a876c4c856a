package com.timebox.api.dto;

import lombok.Data;

/**
 * 新增依赖请求 DTO
 */
@Data
public class DependencyCreateRequestDTO {

    /**
     * 被依赖（需先完成）的任务 ID
     */
    private Long dependsOnTaskId;
}
