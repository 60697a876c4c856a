package com.timebox.trigger.application.command;

import com.timebox.domain.task.adapter.repository.ITaskDependencyRepository;
import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.model.entity.DependencyEdgeEntity;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.service.DependencyCycleDomainService;
import com.timebox.types.enums.DependencyTransferModeEnum;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 任务依赖图写用例：所有依赖边的增删与迁移都经过这里，保证边集始终无环。
 */
@Slf4j
@Service
public class TaskDependencyGraphApplicationService {

    private final ITaskRepository taskRepository;
    private final ITaskDependencyRepository taskDependencyRepository;
    private final DependencyCycleDomainService dependencyCycleDomainService;

    public TaskDependencyGraphApplicationService(ITaskRepository taskRepository,
                                                 ITaskDependencyRepository taskDependencyRepository,
                                                 DependencyCycleDomainService dependencyCycleDomainService) {
        this.taskRepository = taskRepository;
        this.taskDependencyRepository = taskDependencyRepository;
        this.dependencyCycleDomainService = dependencyCycleDomainService;
    }

    /**
     * 新增依赖：taskId 依赖 dependsOnTaskId。
     */
    @Transactional(rollbackFor = Exception.class)
    public DependencyEdgeEntity addDependency(Long taskId, Long dependsOnTaskId) {
        if (taskId == null || dependsOnTaskId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "taskId 与 dependsOnTaskId 不能为空");
        }
        if (Objects.equals(taskId, dependsOnTaskId)) {
            throw new AppException(ResponseCode.SELF_REFERENCE, "任务不能依赖自身: " + taskId);
        }
        requireTask(taskId);
        requireTask(dependsOnTaskId);
        if (taskDependencyRepository.exists(taskId, dependsOnTaskId)) {
            throw new AppException(ResponseCode.DEPENDENCY_EXISTS,
                    "依赖已存在: " + taskId + " -> " + dependsOnTaskId);
        }
        DependencyEdgeEntity edge = insertChecked(taskId, dependsOnTaskId);
        log.info("DEPENDENCY_ADDED taskId={}, dependsOnTaskId={}", taskId, dependsOnTaskId);
        return edge;
    }

    @Transactional(rollbackFor = Exception.class)
    public void removeDependency(Long taskId, Long dependsOnTaskId) {
        if (!taskDependencyRepository.delete(taskId, dependsOnTaskId)) {
            throw new AppException(ResponseCode.NOT_FOUND,
                    "依赖不存在: " + taskId + " -> " + dependsOnTaskId);
        }
        log.info("DEPENDENCY_REMOVED taskId={}, dependsOnTaskId={}", taskId, dependsOnTaskId);
    }

    /**
     * 查询直接依赖与直接阻塞的任务，不做传递闭包。
     */
    public DependencyView getDependencies(Long taskId) {
        TaskEntity task = requireTask(taskId);
        List<Long> dependsOnIds = taskDependencyRepository.findByTaskId(taskId).stream()
                .map(DependencyEdgeEntity::getDependsOnTaskId)
                .collect(Collectors.toList());
        List<Long> blockingIds = taskDependencyRepository.findByDependsOnTaskId(taskId).stream()
                .map(DependencyEdgeEntity::getTaskId)
                .collect(Collectors.toList());
        return new DependencyView(task, loadOrdered(dependsOnIds), loadOrdered(blockingIds));
    }

    /**
     * 候选依赖是否会闭合环路，供批量流程在写入前预检。
     */
    public boolean checkCycle(Long taskId, Collection<Long> candidateDependsOnIds) {
        if (candidateDependsOnIds == null || candidateDependsOnIds.isEmpty()) {
            return false;
        }
        for (Long candidate : candidateDependsOnIds) {
            if (dependencyCycleDomainService.wouldCreateCycle(taskId, candidate, dependencyLookup())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 拆分时迁移依赖：原任务的前置依赖复制给每个子任务；
     * 被原任务阻塞的任务按迁移模式改由最后一个子任务或全部子任务阻塞。
     */
    @Transactional(rollbackFor = Exception.class)
    public int transferDependencies(Long fromTaskId, List<Long> toTaskIds, DependencyTransferModeEnum mode) {
        if (toTaskIds == null || toTaskIds.isEmpty()) {
            return 0;
        }
        DependencyTransferModeEnum resolvedMode = mode == null ? DependencyTransferModeEnum.TO_LAST : mode;
        int created = 0;
        for (DependencyEdgeEntity prerequisite : taskDependencyRepository.findByTaskId(fromTaskId)) {
            for (Long subtaskId : toTaskIds) {
                if (linkIfAbsent(subtaskId, prerequisite.getDependsOnTaskId())) {
                    created++;
                }
            }
        }
        List<Long> blockers = resolvedMode == DependencyTransferModeEnum.TO_ALL
                ? toTaskIds
                : Collections.singletonList(toTaskIds.get(toTaskIds.size() - 1));
        for (DependencyEdgeEntity blocked : taskDependencyRepository.findByDependsOnTaskId(fromTaskId)) {
            for (Long blockerId : blockers) {
                if (linkIfAbsent(blocked.getTaskId(), blockerId)) {
                    created++;
                }
            }
        }
        log.info("DEPENDENCY_TRANSFERRED fromTaskId={}, toTaskIds={}, mode={}, created={}",
                fromTaskId, toTaskIds, resolvedMode, created);
        return created;
    }

    /**
     * 合并时汇总来源任务的内外依赖到目标任务，来源任务之间的依赖与指向目标自身的依赖不迁移。
     */
    @Transactional(rollbackFor = Exception.class)
    public int mergeDependencies(Collection<Long> fromTaskIds, Long toTaskId) {
        if (fromTaskIds == null || fromTaskIds.isEmpty()) {
            return 0;
        }
        Set<Long> sources = new HashSet<>(fromTaskIds);
        Set<Long> prerequisites = new LinkedHashSet<>();
        Set<Long> dependents = new LinkedHashSet<>();
        for (Long sourceId : fromTaskIds) {
            for (DependencyEdgeEntity edge : taskDependencyRepository.findByTaskId(sourceId)) {
                prerequisites.add(edge.getDependsOnTaskId());
            }
            for (DependencyEdgeEntity edge : taskDependencyRepository.findByDependsOnTaskId(sourceId)) {
                dependents.add(edge.getTaskId());
            }
        }
        prerequisites.removeAll(sources);
        prerequisites.remove(toTaskId);
        dependents.removeAll(sources);
        dependents.remove(toTaskId);

        int created = 0;
        for (Long prerequisiteId : prerequisites) {
            if (linkIfAbsent(toTaskId, prerequisiteId)) {
                created++;
            }
        }
        for (Long dependentId : dependents) {
            if (linkIfAbsent(dependentId, toTaskId)) {
                created++;
            }
        }
        log.info("DEPENDENCY_MERGED fromTaskIds={}, toTaskId={}, created={}", fromTaskIds, toTaskId, created);
        return created;
    }

    /**
     * 边不存在时写入（写入前做环检测），返回是否新建；自依赖直接忽略。
     */
    public boolean linkIfAbsent(Long taskId, Long dependsOnTaskId) {
        if (Objects.equals(taskId, dependsOnTaskId) || taskDependencyRepository.exists(taskId, dependsOnTaskId)) {
            return false;
        }
        insertChecked(taskId, dependsOnTaskId);
        return true;
    }

    private DependencyEdgeEntity insertChecked(Long taskId, Long dependsOnTaskId) {
        if (dependencyCycleDomainService.wouldCreateCycle(taskId, dependsOnTaskId, dependencyLookup())) {
            log.warn("DEPENDENCY_CYCLE_REJECTED taskId={}, dependsOnTaskId={}", taskId, dependsOnTaskId);
            throw new AppException(ResponseCode.DEPENDENCY_CYCLE,
                    "新增依赖会形成环: " + taskId + " -> " + dependsOnTaskId);
        }
        DependencyEdgeEntity edge = DependencyEdgeEntity.of(taskId, dependsOnTaskId);
        taskDependencyRepository.save(edge);
        return edge;
    }

    private Function<Long, List<Long>> dependencyLookup() {
        return id -> taskDependencyRepository.findByTaskId(id).stream()
                .map(DependencyEdgeEntity::getDependsOnTaskId)
                .collect(Collectors.toList());
    }

    private TaskEntity requireTask(Long taskId) {
        TaskEntity task = taskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        return task;
    }

    private List<TaskEntity> loadOrdered(List<Long> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, TaskEntity> byId = taskRepository.findByIds(ids).stream()
                .collect(Collectors.toMap(TaskEntity::getId, Function.identity(), (left, right) -> left));
        List<TaskEntity> ordered = new ArrayList<>(ids.size());
        for (Long id : ids) {
            TaskEntity task = byId.get(id);
            if (task != null) {
                ordered.add(task);
            }
        }
        return ordered;
    }

    public record DependencyView(TaskEntity task, List<TaskEntity> dependsOn, List<TaskEntity> blocking) {
    }
}
