package com.timebox.domain.task.adapter.repository;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.types.enums.TaskStatusEnum;

import java.util.Collection;
import java.util.List;

/**
 * 任务仓储接口
 */
public interface ITaskRepository {

    /**
     * 新增任务，回填主键。
     */
    TaskEntity save(TaskEntity entity);

    /**
     * 全量更新可变字段。
     */
    boolean update(TaskEntity entity);

    TaskEntity findById(Long id);

    /**
     * 批量查询，结果顺序不保证与入参一致。
     */
    List<TaskEntity> findByIds(Collection<Long> ids);

    List<TaskEntity> findByStatuses(Collection<TaskStatusEnum> statuses);

    boolean hasChildren(Long parentTaskId);

    int updateStatusByIds(Collection<Long> ids, TaskStatusEnum status);
}
