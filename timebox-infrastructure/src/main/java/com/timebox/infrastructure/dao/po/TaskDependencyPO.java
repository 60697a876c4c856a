package com.timebox.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务依赖边 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDependencyPO {

    private Long taskId;
    private Long dependsOnTaskId;
    private LocalDateTime createdAt;
}
