package com.timebox.test.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timebox.domain.schedule.model.valobj.FixedEvent;
import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.domain.schedule.model.valobj.ScheduleReasoningRequest;
import com.timebox.domain.schedule.service.SchedulePromptDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class SchedulePromptDomainServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 13);

    private final SchedulePromptDomainService service = new SchedulePromptDomainService();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void shouldRenderTasksDependenciesAndPreferences() {
        SchedulableTask task = SchedulableTask.builder()
                .id(7L)
                .name("整理实验数据")
                .projectName("论文")
                .priority("高")
                .wantLevel("中")
                .remainingHours(new BigDecimal("3"))
                .splittable(true)
                .minWorkUnit(new BigDecimal("0.5"))
                .build();
        SchedulePreferences preferences = SchedulePreferences.defaults();
        preferences.setFocusProjectId(10L);

        ScheduleReasoningRequest request = service.buildRequest(MONDAY, MONDAY.plusDays(6), List.of(task),
                Map.of(7L, List.of(3L)), preferences,
                List.of(new FixedEvent(MONDAY, "10:00", "11:00", "组会")), serializer());

        Assertions.assertTrue(request.systemInstructions().contains("JSON 数组"));
        String context = request.context();
        Assertions.assertTrue(context.contains("2025-01-13（周一）至 2025-01-19（周日）"));
        Assertions.assertTrue(context.contains("- 周一: 6 小时"));
        Assertions.assertTrue(context.contains("- 周六: 0 小时"));
        Assertions.assertTrue(context.contains("2025-01-13 10:00-11:00: 组会"));
        Assertions.assertTrue(context.contains("\"name\":\"整理实验数据\""));
        Assertions.assertTrue(context.contains("\"7\":[3]"));
        Assertions.assertTrue(context.contains("单任务单日最多: 4 小时"));
        Assertions.assertTrue(context.contains("重点项目: ID=10"));
    }

    @Test
    public void shouldRenderPlaceholderWithoutFixedEvents() {
        ScheduleReasoningRequest request = service.buildRequest(MONDAY, MONDAY.plusDays(6), List.of(),
                Map.of(), null, null, serializer());

        Assertions.assertTrue(request.context().contains("## 固定日程（不可占用）\n无"));
        Assertions.assertTrue(request.context().contains("减少上下文切换: 是"));
    }

    private Function<Object, String> serializer() {
        return value -> {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException(ex);
            }
        };
    }
}
