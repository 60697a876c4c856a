package com.timebox.domain.schedule.service;

import com.timebox.domain.schedule.model.valobj.ProposedScheduleEntry;
import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.domain.schedule.model.valobj.ScheduleSummary;
import com.timebox.types.common.Constants;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 周排程约束校验领域服务。
 * <p>
 * 所有检查结果都是警告，不阻止持久化：推理服务的提案仅供参考。
 * </p>
 */
@Service
public class ScheduleValidationDomainService {

    public static final String NO_SCHEDULABLE_TASKS_WARNING = "没有可排程的任务";

    public List<String> validate(List<ProposedScheduleEntry> entries,
                                 List<SchedulableTask> tasks,
                                 SchedulePreferences preferences,
                                 Map<Long, List<Long>> dependencies) {
        List<String> warnings = new ArrayList<>();
        List<ProposedScheduleEntry> safeEntries = entries == null ? List.of() : entries;
        List<SchedulableTask> safeTasks = tasks == null ? List.of() : tasks;
        SchedulePreferences prefs = preferences == null ? SchedulePreferences.defaults() : preferences;

        checkDailyCapacity(safeEntries, prefs, warnings);

        Map<Long, SchedulableTask> taskById = new HashMap<>();
        for (SchedulableTask task : safeTasks) {
            taskById.put(task.getId(), task);
        }
        Map<Long, BigDecimal> hoursByTask = new HashMap<>();
        Map<Long, LocalDate> firstDateByTask = new HashMap<>();
        Map<Long, LocalDate> lastDateByTask = new HashMap<>();
        for (ProposedScheduleEntry entry : safeEntries) {
            hoursByTask.merge(entry.taskId(), entry.allocatedHours(), BigDecimal::add);
            firstDateByTask.merge(entry.taskId(), entry.date(), (a, b) -> a.isBefore(b) ? a : b);
            lastDateByTask.merge(entry.taskId(), entry.date(), (a, b) -> a.isAfter(b) ? a : b);
        }

        checkShortfall(safeTasks, hoursByTask, warnings);
        checkDependencyOrder(dependencies, firstDateByTask, taskById, warnings);
        checkDeadlines(safeTasks, lastDateByTask, warnings);
        return warnings;
    }

    /**
     * 按项目、类别汇总计划工时，未归属分组统一标记为“未分类”。
     */
    public ScheduleSummary summarize(List<ProposedScheduleEntry> entries, List<SchedulableTask> tasks) {
        if (entries == null || entries.isEmpty()) {
            return ScheduleSummary.empty();
        }
        Map<Long, SchedulableTask> taskById = new HashMap<>();
        if (tasks != null) {
            for (SchedulableTask task : tasks) {
                taskById.put(task.getId(), task);
            }
        }
        BigDecimal total = BigDecimal.ZERO;
        Map<Long, BucketAccumulator> byProject = new LinkedHashMap<>();
        Map<Long, BucketAccumulator> byGenre = new LinkedHashMap<>();
        for (ProposedScheduleEntry entry : entries) {
            total = total.add(entry.allocatedHours());
            SchedulableTask task = taskById.get(entry.taskId());
            Long projectId = task == null ? null : task.getProjectId();
            String projectName = task == null ? null : task.getProjectName();
            Long genreId = task == null ? null : task.getGenreId();
            String genreName = task == null ? null : task.getGenreName();
            byProject.computeIfAbsent(projectId, key -> new BucketAccumulator(key, projectName))
                    .add(entry.allocatedHours());
            byGenre.computeIfAbsent(genreId, key -> new BucketAccumulator(key, genreName))
                    .add(entry.allocatedHours());
        }
        return new ScheduleSummary(total, toBuckets(byProject), toBuckets(byGenre));
    }

    private void checkDailyCapacity(List<ProposedScheduleEntry> entries,
                                    SchedulePreferences prefs,
                                    List<String> warnings) {
        Map<LocalDate, BigDecimal> hoursByDate = new TreeMap<>();
        for (ProposedScheduleEntry entry : entries) {
            hoursByDate.merge(entry.date(), entry.allocatedHours(), BigDecimal::add);
        }
        for (Map.Entry<LocalDate, BigDecimal> day : hoursByDate.entrySet()) {
            BigDecimal limit = prefs.capacityOf(day.getKey());
            if (day.getValue().compareTo(limit) > 0) {
                warnings.add(day.getKey() + " 的计划工时 " + plain(day.getValue())
                        + " 小时超过可用上限 " + plain(limit) + " 小时");
            }
        }
    }

    private void checkShortfall(List<SchedulableTask> tasks,
                                Map<Long, BigDecimal> hoursByTask,
                                List<String> warnings) {
        for (SchedulableTask task : tasks) {
            BigDecimal remaining = task.getRemainingHours() == null ? BigDecimal.ZERO : task.getRemainingHours();
            BigDecimal scheduled = hoursByTask.getOrDefault(task.getId(), BigDecimal.ZERO);
            if (scheduled.compareTo(remaining) < 0) {
                BigDecimal deficit = remaining.subtract(scheduled).setScale(1, RoundingMode.HALF_UP);
                warnings.add("任务「" + task.getName() + "」还有 " + deficit.toPlainString() + " 小时未排程");
            }
        }
    }

    /**
     * 简化的依赖顺序检查：只比较双方最早排程日期，依赖方必须严格晚于前置任务。
     */
    private void checkDependencyOrder(Map<Long, List<Long>> dependencies,
                                      Map<Long, LocalDate> firstDateByTask,
                                      Map<Long, SchedulableTask> taskById,
                                      List<String> warnings) {
        if (dependencies == null) {
            return;
        }
        for (Map.Entry<Long, List<Long>> edge : dependencies.entrySet()) {
            LocalDate taskFirst = firstDateByTask.get(edge.getKey());
            if (taskFirst == null || edge.getValue() == null) {
                continue;
            }
            for (Long prerequisiteId : edge.getValue()) {
                LocalDate prerequisiteFirst = firstDateByTask.get(prerequisiteId);
                if (prerequisiteFirst != null && !taskFirst.isAfter(prerequisiteFirst)) {
                    warnings.add("依赖顺序冲突: 「" + nameOf(taskById, edge.getKey())
                            + "」应在「" + nameOf(taskById, prerequisiteId) + "」完成后开始");
                }
            }
        }
    }

    private void checkDeadlines(List<SchedulableTask> tasks,
                                Map<Long, LocalDate> lastDateByTask,
                                List<String> warnings) {
        for (SchedulableTask task : tasks) {
            LocalDate last = lastDateByTask.get(task.getId());
            if (task.getDeadline() != null && last != null && last.isAfter(task.getDeadline())) {
                warnings.add("任务「" + task.getName() + "」的排程超过截止日期(" + task.getDeadline() + ")");
            }
        }
    }

    private String nameOf(Map<Long, SchedulableTask> taskById, Long taskId) {
        SchedulableTask task = taskById.get(taskId);
        return task == null ? String.valueOf(taskId) : task.getName();
    }

    private List<ScheduleSummary.HoursBucket> toBuckets(Map<Long, BucketAccumulator> accumulators) {
        List<ScheduleSummary.HoursBucket> buckets = new ArrayList<>();
        for (BucketAccumulator accumulator : accumulators.values()) {
            String name = Objects.requireNonNullElse(accumulator.name, Constants.UNCATEGORIZED);
            buckets.add(new ScheduleSummary.HoursBucket(accumulator.id, name, accumulator.hours));
        }
        return buckets;
    }

    private String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static final class BucketAccumulator {
        private final Long id;
        private final String name;
        private BigDecimal hours = BigDecimal.ZERO;

        private BucketAccumulator(Long id, String name) {
            this.id = id;
            this.name = name;
        }

        private void add(BigDecimal value) {
            hours = hours.add(value);
        }
    }
}
