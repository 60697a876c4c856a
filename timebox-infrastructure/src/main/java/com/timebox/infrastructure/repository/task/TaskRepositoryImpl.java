package com.timebox.infrastructure.repository.task;

import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.infrastructure.dao.TaskDao;
import com.timebox.infrastructure.dao.po.TaskPO;
import com.timebox.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务仓储实现。
 */
@Repository
public class TaskRepositoryImpl implements ITaskRepository {

    private final TaskDao taskDao;

    public TaskRepositoryImpl(TaskDao taskDao) {
        this.taskDao = taskDao;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        TaskPO po = toPO(entity);
        taskDao.insert(po);
        entity.setId(po.getId());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    @Override
    public boolean update(TaskEntity entity) {
        return taskDao.update(toPO(entity)) > 0;
    }

    @Override
    public TaskEntity findById(Long id) {
        TaskPO po = taskDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<TaskEntity> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return toEntities(taskDao.selectByIds(ids));
    }

    @Override
    public List<TaskEntity> findByStatuses(Collection<TaskStatusEnum> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> codes = statuses.stream().map(TaskStatusEnum::getCode).collect(Collectors.toList());
        return toEntities(taskDao.selectByStatuses(codes));
    }

    @Override
    public boolean hasChildren(Long parentTaskId) {
        return taskDao.countChildren(parentTaskId) > 0;
    }

    @Override
    public int updateStatusByIds(Collection<Long> ids, TaskStatusEnum status) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return taskDao.updateStatusByIds(ids, status.getCode());
    }

    private List<TaskEntity> toEntities(List<TaskPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TaskEntity toEntity(TaskPO po) {
        if (po == null) {
            return null;
        }
        TaskEntity entity = new TaskEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setProjectId(po.getProjectId());
        entity.setGenreId(po.getGenreId());
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        entity.setDeadline(po.getDeadline());
        entity.setEstimatedHours(po.getEstimatedHours());
        entity.setPriority(po.getPriority());
        entity.setWantLevel(po.getWantLevel());
        entity.setSplittable(po.getIsSplittable());
        entity.setMinWorkUnit(po.getMinWorkUnit());
        entity.setParentTaskId(po.getParentTaskId());
        entity.setDecompositionLevel(po.getDecompositionLevel());
        entity.setNote(po.getNote());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private TaskPO toPO(TaskEntity entity) {
        if (entity == null) {
            return null;
        }
        return TaskPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .projectId(entity.getProjectId())
                .genreId(entity.getGenreId())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .deadline(entity.getDeadline())
                .estimatedHours(entity.getEstimatedHours())
                .priority(entity.getPriority())
                .wantLevel(entity.getWantLevel())
                .isSplittable(entity.getSplittable())
                .minWorkUnit(entity.getMinWorkUnit())
                .parentTaskId(entity.getParentTaskId())
                .decompositionLevel(entity.getDecompositionLevel())
                .note(entity.getNote())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
