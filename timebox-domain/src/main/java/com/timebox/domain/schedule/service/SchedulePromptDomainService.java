package com.timebox.domain.schedule.service;

import com.timebox.domain.schedule.model.valobj.FixedEvent;
import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.domain.schedule.model.valobj.ScheduleReasoningRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 周排程提示词领域服务：把可排程任务、依赖与偏好序列化为推理服务请求。
 */
@Service
public class SchedulePromptDomainService {

    private static final String[] DAY_LABELS = {"周一", "周二", "周三", "周四", "周五", "周六", "周日"};

    private static final String SYSTEM_INSTRUCTIONS = "你是研究时间管理助手，负责生成一周的时间盒排程。\n"
            + "只输出一个合法的 JSON 数组，不要输出任何解释文字。\n\n"
            + "排程规则：\n"
            + "1. 每天的计划工时不超过当天可用工时\n"
            + "2. 优先安排优先级为“高”的任务\n"
            + "3. 遵守依赖关系：前置任务完成后再安排依赖它的任务\n"
            + "4. 截止日期临近的任务优先\n"
            + "5. 尽量减少上下文切换，同一项目的任务集中安排\n"
            + "6. 避开固定日程占用的时间段\n"
            + "7. 单次分配不少于任务的 min_work_unit\n"
            + "8. 尽量让每个任务的 remaining_hours 全部排完\n\n"
            + "输出格式（仅 JSON 数组）：\n"
            + "[{\"task_id\": 1, \"date\": \"2025-01-13\", \"start_time\": \"09:00\", \"end_time\": \"12:00\", "
            + "\"allocated_hours\": 3.0, \"reasoning\": \"优先级高且临近截止\"}]";

    public ScheduleReasoningRequest buildRequest(LocalDate weekStart,
                                                 LocalDate weekEnd,
                                                 List<SchedulableTask> tasks,
                                                 Map<Long, List<Long>> dependencies,
                                                 SchedulePreferences preferences,
                                                 List<FixedEvent> fixedEvents,
                                                 Function<Object, String> serializer) {
        return new ScheduleReasoningRequest(SYSTEM_INSTRUCTIONS,
                buildContext(weekStart, weekEnd, tasks, dependencies, preferences, fixedEvents, serializer));
    }

    String buildContext(LocalDate weekStart,
                        LocalDate weekEnd,
                        List<SchedulableTask> tasks,
                        Map<Long, List<Long>> dependencies,
                        SchedulePreferences preferences,
                        List<FixedEvent> fixedEvents,
                        Function<Object, String> serializer) {
        SchedulePreferences prefs = preferences == null ? SchedulePreferences.defaults() : preferences;
        StringBuilder context = new StringBuilder();
        context.append("请生成一周排程。\n\n");
        context.append("## 周期\n")
                .append(weekStart).append("（周一）至 ").append(weekEnd).append("（周日）\n\n");

        context.append("## 每日可用工时\n");
        DayOfWeek[] days = DayOfWeek.values();
        for (int i = 0; i < days.length; i++) {
            context.append("- ").append(DAY_LABELS[i]).append(": ")
                    .append(prefs.capacityOf(days[i]).stripTrailingZeros().toPlainString()).append(" 小时\n");
        }

        context.append("\n## 固定日程（不可占用）\n");
        if (fixedEvents == null || fixedEvents.isEmpty()) {
            context.append("无\n");
        } else {
            for (FixedEvent event : fixedEvents) {
                context.append("- ").append(event.getDate()).append(' ')
                        .append(safeText(event.getStartTime())).append('-').append(safeText(event.getEndTime()))
                        .append(": ").append(safeText(event.getTitle())).append('\n');
            }
        }

        context.append("\n## 任务列表\n").append(serialize(serializer, toTaskPayload(tasks))).append('\n');

        context.append("\n## 依赖关系（task_id: [依赖的 task_id]）\n")
                .append(serialize(serializer, toDependencyPayload(dependencies))).append('\n');

        context.append("\n## 其他设置\n");
        context.append("- 单任务单日最多: ").append(plain(prefs.getMaxHoursPerTaskPerDay())).append(" 小时\n");
        context.append("- 减少上下文切换: ").append(prefs.isAvoidContextSwitch() ? "是" : "否").append('\n');
        if (prefs.getFocusProjectId() != null) {
            context.append("- 重点项目: ID=").append(prefs.getFocusProjectId()).append('\n');
        }
        context.append("\n只输出 JSON 数组。");
        return context.toString();
    }

    private List<Map<String, Object>> toTaskPayload(List<SchedulableTask> tasks) {
        List<Map<String, Object>> payload = new ArrayList<>();
        if (tasks == null) {
            return payload;
        }
        for (SchedulableTask task : tasks) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", task.getId());
            item.put("name", task.getName());
            item.put("project", task.getProjectName());
            item.put("genre", task.getGenreName());
            item.put("priority", task.getPriority());
            item.put("want_level", task.getWantLevel());
            item.put("deadline", task.getDeadline() == null ? null : task.getDeadline().toString());
            item.put("remaining_hours", task.getRemainingHours());
            item.put("is_splittable", task.isSplittable());
            item.put("min_work_unit", task.getMinWorkUnit());
            payload.add(item);
        }
        return payload;
    }

    private Map<String, List<Long>> toDependencyPayload(Map<Long, List<Long>> dependencies) {
        Map<String, List<Long>> payload = new LinkedHashMap<>();
        if (dependencies == null) {
            return payload;
        }
        for (Map.Entry<Long, List<Long>> entry : dependencies.entrySet()) {
            if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                payload.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return payload;
    }

    private String serialize(Function<Object, String> serializer, Object value) {
        if (serializer == null) {
            return String.valueOf(value);
        }
        try {
            String json = serializer.apply(value);
            return json == null ? String.valueOf(value) : json;
        } catch (RuntimeException ex) {
            return String.valueOf(value);
        }
    }

    private String plain(BigDecimal value) {
        return value == null ? "-" : value.stripTrailingZeros().toPlainString();
    }

    private String safeText(String value) {
        return value == null ? "" : value;
    }
}
