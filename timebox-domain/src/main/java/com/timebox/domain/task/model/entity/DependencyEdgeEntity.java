package com.timebox.domain.task.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 依赖边：taskId 依赖 dependsOnTaskId，即 dependsOnTaskId 完成后 taskId 才能推进。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DependencyEdgeEntity {

    private Long taskId;

    private Long dependsOnTaskId;

    private LocalDateTime createdAt;

    public static DependencyEdgeEntity of(Long taskId, Long dependsOnTaskId) {
        return new DependencyEdgeEntity(taskId, dependsOnTaskId, null);
    }
}
