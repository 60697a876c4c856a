package com.timebox.trigger.application.common;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.domain.task.service.DependencyCycleDomainService;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService;
import com.timebox.types.common.Constants;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 任务草稿的校验与落地：默认值填充、批次内下标依赖的校验与写入。
 */
@Component
public class TaskDraftSupport {

    private final DependencyCycleDomainService dependencyCycleDomainService;
    private final TaskDependencyGraphApplicationService dependencyGraphService;

    public TaskDraftSupport(DependencyCycleDomainService dependencyCycleDomainService,
                            TaskDependencyGraphApplicationService dependencyGraphService) {
        this.dependencyCycleDomainService = dependencyCycleDomainService;
        this.dependencyGraphService = dependencyGraphService;
    }

    public void validateFields(List<TaskDraft> drafts) {
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraft draft = drafts.get(i);
            if (draft == null || StringUtils.isBlank(draft.getName())) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "第 " + i + " 个任务缺少名称");
            }
            if (draft.getEstimatedHours() != null && draft.getEstimatedHours().signum() < 0) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "第 " + i + " 个任务的预估工时不能为负数");
            }
        }
    }

    /**
     * 校验批次内的下标引用：越界、自引用与成环都在写库之前拒绝。
     */
    public void validateIndexReferences(List<TaskDraft> drafts) {
        Map<Integer, List<Integer>> adjacency = new LinkedHashMap<>();
        for (int i = 0; i < drafts.size(); i++) {
            List<Integer> indices = drafts.get(i).getDependsOnIndices();
            List<Integer> targets = new ArrayList<>();
            if (indices != null) {
                for (Integer index : indices) {
                    if (index == null || index < 0 || index >= drafts.size()) {
                        throw new AppException(ResponseCode.INDEX_OUT_OF_RANGE,
                                "第 " + i + " 个任务的依赖下标越界: " + index);
                    }
                    if (index == i) {
                        throw new AppException(ResponseCode.SELF_REFERENCE, "第 " + i + " 个任务不能依赖自身");
                    }
                    targets.add(index);
                }
            }
            adjacency.put(i, targets);
        }
        if (dependencyCycleDomainService.hasCycle(adjacency)) {
            throw new AppException(ResponseCode.DEPENDENCY_CYCLE, "任务之间的依赖关系存在环");
        }
    }

    /**
     * 按草稿生成新任务实体（未持久化）。parent 不为空时继承其类别与截止日期，并记录拆分层级。
     */
    public TaskEntity newTask(TaskDraft draft, Long projectId, TaskEntity parent) {
        TaskEntity task = new TaskEntity();
        task.setName(draft.getName().trim());
        task.setProjectId(projectId);
        task.setGenreId(draft.getGenreId());
        task.setDeadline(draft.getDeadline());
        task.setStatus(TaskStatusEnum.TODO);
        task.setEstimatedHours(draft.getEstimatedHours());
        task.setPriority(StringUtils.defaultIfBlank(draft.getPriority(), Constants.DEFAULT_PRIORITY));
        task.setWantLevel(StringUtils.defaultIfBlank(draft.getWantLevel(), Constants.DEFAULT_WANT_LEVEL));
        task.setSplittable(draft.getSplittable() == null ? Boolean.TRUE : draft.getSplittable());
        task.setMinWorkUnit(draft.getMinWorkUnit() == null ? Constants.DEFAULT_MIN_WORK_UNIT : draft.getMinWorkUnit());
        task.setNote(draft.getNote());
        task.setDecompositionLevel(0);
        if (parent != null) {
            if (task.getGenreId() == null) {
                task.setGenreId(parent.getGenreId());
            }
            if (task.getDeadline() == null) {
                task.setDeadline(parent.getDeadline());
            }
            task.setParentTaskId(parent.getId());
            task.setDecompositionLevel(parent.resolveDecompositionLevel() + 1);
        }
        return task;
    }

    /**
     * 把下标依赖落成依赖边，返回新建边数。drafts 与 created 一一对应。
     */
    public int linkIndexedDependencies(List<TaskDraft> drafts, List<TaskEntity> created) {
        int linked = 0;
        for (int i = 0; i < drafts.size(); i++) {
            List<Integer> indices = drafts.get(i).getDependsOnIndices();
            if (indices == null || indices.isEmpty()) {
                continue;
            }
            for (Integer index : new LinkedHashSet<>(indices)) {
                if (dependencyGraphService.linkIfAbsent(created.get(i).getId(), created.get(index).getId())) {
                    linked++;
                }
            }
        }
        return linked;
    }
}
