package com.timebox.domain.schedule.service;

import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.task.model.entity.DependencyEdgeEntity;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.types.common.Constants;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 可排程子图领域服务：筛选可排程任务并把依赖边限制在该任务集合内。
 */
@Service
public class SchedulableTaskDomainService {

    /** 未填写预估工时的任务按 1 小时计 */
    static final BigDecimal DEFAULT_ESTIMATED_HOURS = BigDecimal.ONE;

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    public List<SchedulableTask> selectSchedulable(List<TaskEntity> tasks,
                                                   Map<Long, Long> loggedMinutesByTask,
                                                   Map<Long, String> projectNames,
                                                   Map<Long, String> genreNames) {
        List<SchedulableTask> result = new ArrayList<>();
        if (tasks == null) {
            return result;
        }
        for (TaskEntity task : tasks) {
            if (task.getStatus() == null || !task.getStatus().isSchedulable()) {
                continue;
            }
            long minutes = loggedMinutesByTask == null ? 0L : loggedMinutesByTask.getOrDefault(task.getId(), 0L);
            BigDecimal actual = BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
            BigDecimal estimated = task.getEstimatedHours() == null ? DEFAULT_ESTIMATED_HOURS : task.getEstimatedHours();
            BigDecimal remaining = estimated.subtract(actual).max(BigDecimal.ZERO);
            if (remaining.signum() <= 0) {
                continue;
            }
            result.add(SchedulableTask.builder()
                    .id(task.getId())
                    .name(task.getName())
                    .projectId(task.getProjectId())
                    .projectName(lookup(projectNames, task.getProjectId()))
                    .genreId(task.getGenreId())
                    .genreName(lookup(genreNames, task.getGenreId()))
                    .priority(task.getPriority() == null ? Constants.DEFAULT_PRIORITY : task.getPriority())
                    .wantLevel(task.getWantLevel() == null ? Constants.DEFAULT_WANT_LEVEL : task.getWantLevel())
                    .deadline(task.getDeadline())
                    .estimatedHours(estimated)
                    .actualHours(actual)
                    .remainingHours(remaining)
                    .splittable(!Boolean.FALSE.equals(task.getSplittable()))
                    .minWorkUnit(task.getMinWorkUnit() == null ? Constants.DEFAULT_MIN_WORK_UNIT : task.getMinWorkUnit())
                    .build());
        }
        return result;
    }

    /**
     * 构造 taskId → 直接依赖 ID 列表，只保留两端都在 taskIds 中的边；每个任务都有一个（可能为空的）列表。
     */
    public Map<Long, List<Long>> restrictDependencies(Collection<Long> taskIds, List<DependencyEdgeEntity> edges) {
        Map<Long, List<Long>> dependencies = new LinkedHashMap<>();
        if (taskIds == null) {
            return dependencies;
        }
        for (Long taskId : taskIds) {
            dependencies.put(taskId, new ArrayList<>());
        }
        Set<Long> ids = dependencies.keySet();
        if (edges == null) {
            return dependencies;
        }
        for (DependencyEdgeEntity edge : edges) {
            if (ids.contains(edge.getTaskId()) && ids.contains(edge.getDependsOnTaskId())) {
                dependencies.get(edge.getTaskId()).add(edge.getDependsOnTaskId());
            }
        }
        return dependencies;
    }

    private String lookup(Map<Long, String> names, Long id) {
        if (names == null || id == null) {
            return null;
        }
        return names.get(id);
    }
}
