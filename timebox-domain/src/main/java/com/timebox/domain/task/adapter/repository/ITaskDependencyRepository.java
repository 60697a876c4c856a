package com.timebox.domain.task.adapter.repository;

import com.timebox.domain.task.model.entity.DependencyEdgeEntity;

import java.util.Collection;
import java.util.List;

/**
 * 任务依赖边仓储接口
 */
public interface ITaskDependencyRepository {

    void save(DependencyEdgeEntity edge);

    boolean exists(Long taskId, Long dependsOnTaskId);

    boolean delete(Long taskId, Long dependsOnTaskId);

    /**
     * 查询 taskId 的直接前置依赖边（taskId 依赖谁）。
     */
    List<DependencyEdgeEntity> findByTaskId(Long taskId);

    /**
     * 查询被 dependsOnTaskId 直接阻塞的依赖边（谁依赖 dependsOnTaskId）。
     */
    List<DependencyEdgeEntity> findByDependsOnTaskId(Long dependsOnTaskId);

    /**
     * 查询两端都在给定集合内的依赖边。
     */
    List<DependencyEdgeEntity> findWithin(Collection<Long> taskIds);
}
