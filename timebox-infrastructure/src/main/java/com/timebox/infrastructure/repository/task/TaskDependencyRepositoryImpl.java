package com.timebox.infrastructure.repository.task;

import com.timebox.domain.task.adapter.repository.ITaskDependencyRepository;
import com.timebox.domain.task.model.entity.DependencyEdgeEntity;
import com.timebox.infrastructure.dao.TaskDependencyDao;
import com.timebox.infrastructure.dao.po.TaskDependencyPO;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务依赖边仓储实现。
 */
@Repository
public class TaskDependencyRepositoryImpl implements ITaskDependencyRepository {

    private final TaskDependencyDao taskDependencyDao;

    public TaskDependencyRepositoryImpl(TaskDependencyDao taskDependencyDao) {
        this.taskDependencyDao = taskDependencyDao;
    }

    @Override
    public void save(DependencyEdgeEntity edge) {
        taskDependencyDao.insert(TaskDependencyPO.builder()
                .taskId(edge.getTaskId())
                .dependsOnTaskId(edge.getDependsOnTaskId())
                .build());
    }

    @Override
    public boolean exists(Long taskId, Long dependsOnTaskId) {
        return taskDependencyDao.count(taskId, dependsOnTaskId) > 0;
    }

    @Override
    public boolean delete(Long taskId, Long dependsOnTaskId) {
        return taskDependencyDao.delete(taskId, dependsOnTaskId) > 0;
    }

    @Override
    public List<DependencyEdgeEntity> findByTaskId(Long taskId) {
        return toEntities(taskDependencyDao.selectByTaskId(taskId));
    }

    @Override
    public List<DependencyEdgeEntity> findByDependsOnTaskId(Long dependsOnTaskId) {
        return toEntities(taskDependencyDao.selectByDependsOnTaskId(dependsOnTaskId));
    }

    @Override
    public List<DependencyEdgeEntity> findWithin(Collection<Long> taskIds) {
        if (taskIds == null || taskIds.isEmpty()) {
            return Collections.emptyList();
        }
        return toEntities(taskDependencyDao.selectWithin(taskIds));
    }

    private List<DependencyEdgeEntity> toEntities(List<TaskDependencyPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream()
                .map(po -> new DependencyEdgeEntity(po.getTaskId(), po.getDependsOnTaskId(), po.getCreatedAt()))
                .collect(Collectors.toList());
    }
}
