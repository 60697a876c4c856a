package com.timebox.trigger.application.command;

import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskPatch;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 任务局部更新写用例。
 */
@Slf4j
@Service
public class TaskUpdateApplicationService {

    private final ITaskRepository taskRepository;

    public TaskUpdateApplicationService(ITaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskEntity patch(Long taskId, TaskPatch patch) {
        TaskEntity task = taskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        if (task.isArchived()) {
            throw new AppException(ResponseCode.ALREADY_ARCHIVED, "任务已归档，不能修改: " + taskId);
        }
        if (patch == null || patch.isEmpty()) {
            return task;
        }
        if (patch.getName() != null && StringUtils.isBlank(patch.getName())) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "任务名称不能为空");
        }
        if (patch.getEstimatedHours() != null && patch.getEstimatedHours().signum() < 0) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "预估工时不能为负数");
        }
        if (patch.getMinWorkUnit() != null && patch.getMinWorkUnit().signum() <= 0) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "最小工作单元必须大于 0");
        }
        TaskPatch.ClearableField conflict = patch.conflictingField();
        if (conflict != null) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "字段不能同时赋值与置空: " + conflict.getCode());
        }
        int changed = patch.applyTo(task);
        taskRepository.update(task);
        log.info("TASK_PATCHED taskId={}, changedFields={}, status={}", taskId, changed, task.getStatus());
        return task;
    }
}
