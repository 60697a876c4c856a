package com.timebox.trigger.application.command;

import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.trigger.application.common.TaskDraftSupport;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量建任务：同一项目下一次性创建多条任务，并按下标建立彼此之间的依赖。
 */
@Slf4j
@Service
public class TaskBulkCreateApplicationService {

    private final ITaskRepository taskRepository;
    private final TaskDraftSupport taskDraftSupport;

    public TaskBulkCreateApplicationService(ITaskRepository taskRepository, TaskDraftSupport taskDraftSupport) {
        this.taskRepository = taskRepository;
        this.taskDraftSupport = taskDraftSupport;
    }

    @Transactional(rollbackFor = Exception.class)
    public BulkCreateResult bulkCreate(Long projectId, List<TaskDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new AppException(ResponseCode.EMPTY_INPUT, "任务列表不能为空");
        }
        if (projectId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "projectId 不能为空");
        }
        taskDraftSupport.validateFields(drafts);
        taskDraftSupport.validateIndexReferences(drafts);

        List<TaskEntity> created = new ArrayList<>(drafts.size());
        for (TaskDraft draft : drafts) {
            created.add(taskRepository.save(taskDraftSupport.newTask(draft, projectId, null)));
        }
        int dependenciesCreated = taskDraftSupport.linkIndexedDependencies(drafts, created);
        log.info("TASK_BULK_CREATE_DONE projectId={}, created={}, dependenciesCreated={}",
                projectId, created.size(), dependenciesCreated);
        return new BulkCreateResult(created, dependenciesCreated);
    }

    public record BulkCreateResult(List<TaskEntity> createdTasks, int dependenciesCreated) {
    }
}
