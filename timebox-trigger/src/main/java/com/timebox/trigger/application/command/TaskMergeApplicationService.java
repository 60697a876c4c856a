package com.timebox.trigger.application.command;

import com.timebox.domain.schedule.adapter.repository.IScheduleBlockRepository;
import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.adapter.repository.ITimeEntryRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.trigger.application.common.TaskDraftSupport;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 任务合并写用例：新建合并任务，整体改挂来源任务的工时与排程，汇总依赖后归档来源任务。
 */
@Slf4j
@Service
public class TaskMergeApplicationService {

    private final ITaskRepository taskRepository;
    private final ITimeEntryRepository timeEntryRepository;
    private final IScheduleBlockRepository scheduleBlockRepository;
    private final TaskDependencyGraphApplicationService dependencyGraphService;
    private final TaskDraftSupport taskDraftSupport;

    public TaskMergeApplicationService(ITaskRepository taskRepository,
                                       ITimeEntryRepository timeEntryRepository,
                                       IScheduleBlockRepository scheduleBlockRepository,
                                       TaskDependencyGraphApplicationService dependencyGraphService,
                                       TaskDraftSupport taskDraftSupport) {
        this.taskRepository = taskRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.scheduleBlockRepository = scheduleBlockRepository;
        this.dependencyGraphService = dependencyGraphService;
        this.taskDraftSupport = taskDraftSupport;
    }

    @Transactional(rollbackFor = Exception.class)
    public MergeResult merge(List<Long> taskIds, TaskDraft mergedTask, String reason) {
        List<Long> sourceIds = taskIds == null
                ? Collections.emptyList()
                : new ArrayList<>(new LinkedHashSet<>(taskIds.stream().filter(Objects::nonNull).collect(Collectors.toList())));
        if (sourceIds.size() < 2) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "合并至少需要 2 个不同的任务");
        }
        if (mergedTask == null) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "缺少合并后的任务信息");
        }
        taskDraftSupport.validateFields(Collections.singletonList(mergedTask));

        List<TaskEntity> sources = loadAll(sourceIds);
        Long projectId = sources.get(0).getProjectId();
        for (TaskEntity source : sources) {
            if (!Objects.equals(projectId, source.getProjectId())) {
                throw new AppException(ResponseCode.PROJECT_MISMATCH,
                        "只能合并同一项目下的任务: " + source.getId() + " 属于项目 " + source.getProjectId());
            }
        }

        TaskEntity merged = taskRepository.save(taskDraftSupport.newTask(mergedTask, projectId, null));
        int timeEntriesTransferred = timeEntryRepository.reassignTask(sourceIds, merged.getId());
        int schedulesTransferred = scheduleBlockRepository.reassignTask(sourceIds, merged.getId());
        int dependenciesMerged = dependencyGraphService.mergeDependencies(sourceIds, merged.getId());
        taskRepository.updateStatusByIds(sourceIds, TaskStatusEnum.ARCHIVE);

        log.info("TASK_MERGE_DONE sourceTaskIds={}, mergedTaskId={}, timeEntriesTransferred={}, schedulesTransferred={}, dependenciesMerged={}",
                sourceIds, merged.getId(), timeEntriesTransferred, schedulesTransferred, dependenciesMerged);
        return new MergeResult(merged, sourceIds, timeEntriesTransferred, schedulesTransferred, dependenciesMerged, reason);
    }

    private List<TaskEntity> loadAll(List<Long> ids) {
        Map<Long, TaskEntity> byId = taskRepository.findByIds(ids).stream()
                .collect(Collectors.toMap(TaskEntity::getId, Function.identity(), (left, right) -> left));
        List<TaskEntity> ordered = new ArrayList<>(ids.size());
        for (Long id : ids) {
            TaskEntity task = byId.get(id);
            if (task == null) {
                throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + id);
            }
            ordered.add(task);
        }
        return ordered;
    }

    public record MergeResult(TaskEntity mergedTask,
                              List<Long> archivedTaskIds,
                              int timeEntriesTransferred,
                              int schedulesTransferred,
                              int dependenciesMerged,
                              String reason) {
    }
}
