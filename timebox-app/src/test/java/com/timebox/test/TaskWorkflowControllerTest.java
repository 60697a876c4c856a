package com.timebox.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.test.support.TaskWorkflowFixture;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.trigger.http.GlobalApiExceptionHandler;
import com.timebox.trigger.http.TaskWorkflowController;
import com.timebox.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TaskWorkflowControllerTest {

    private MockMvc mockMvc;
    private TaskWorkflowFixture fixture;
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        this.fixture = new TaskWorkflowFixture();
        this.objectMapper = new ObjectMapper();
        TaskWorkflowController controller = new TaskWorkflowController(
                fixture.breakdownService(),
                fixture.mergeService(),
                fixture.bulkCreateService(),
                new TaskWorkflowViewAssembler());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldBreakdownTaskAndReportAllocation() throws Exception {
        TaskEntity parent = fixture.task("写论文", 1L, "6");
        fixture.completedEntry(parent.getId(), LocalDateTime.of(2025, 1, 6, 9, 0), 90);

        String payload = objectMapper.writeValueAsString(Map.of(
                "taskId", parent.getId(),
                "reason", "太大了",
                "subtasks", List.of(
                        Map.of("name", "文献调研", "estimatedHours", 2),
                        Map.of("name", "撰写初稿", "estimatedHours", 4, "dependsOnIndices", List.of(0)))
        ));

        mockMvc.perform(post("/api/workflow/tasks/breakdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.originalTask.status").value("archive"))
                .andExpect(jsonPath("$.data.createdTasks.length()").value(2))
                .andExpect(jsonPath("$.data.createdTasks[0].parentTaskId").value(parent.getId()))
                .andExpect(jsonPath("$.data.createdTasks[0].decompositionLevel").value(1))
                .andExpect(jsonPath("$.data.dependenciesTransferred").value(1))
                .andExpect(jsonPath("$.data.allocationSummary.timeEntriesAllocated").value(2))
                .andExpect(jsonPath("$.data.allocationSummary.totalTimeMinutesAllocated").value(90))
                .andExpect(jsonPath("$.data.reason").value("太大了"));
    }

    @Test
    public void shouldKeepOriginalWhenArchiveOriginalIsFalse() throws Exception {
        TaskEntity parent = fixture.task("写论文", 1L, "4");

        String payload = objectMapper.writeValueAsString(Map.of(
                "taskId", parent.getId(),
                "archiveOriginal", false,
                "subtasks", List.of(Map.of("name", "A"), Map.of("name", "B"))
        ));

        mockMvc.perform(post("/api/workflow/tasks/breakdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.originalTask.status").value("todo"));
    }

    @Test
    public void shouldReturn422WhenTaskHasChildren() throws Exception {
        TaskEntity parent = fixture.task("父任务", 1L, "4");
        TaskEntity child = fixture.task("子任务", 1L, "1");
        child.setParentTaskId(parent.getId());

        String payload = objectMapper.writeValueAsString(Map.of(
                "taskId", parent.getId(),
                "subtasks", List.of(Map.of("name", "A"))
        ));

        mockMvc.perform(post("/api/workflow/tasks/breakdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("1005"));
    }

    @Test
    public void shouldReturn404WhenBreakdownTargetMissing() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "taskId", 404,
                "subtasks", List.of(Map.of("name", "A"))
        ));

        mockMvc.perform(post("/api/workflow/tasks/breakdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("0404"));
    }

    @Test
    public void shouldMergeTasks() throws Exception {
        TaskEntity x = fixture.task("X", 3L, "1");
        TaskEntity y = fixture.task("Y", 3L, "1");

        String payload = objectMapper.writeValueAsString(Map.of(
                "taskIds", List.of(x.getId(), y.getId()),
                "mergedTask", Map.of("name", "XY", "estimatedHours", 2),
                "reason", "重复"
        ));

        mockMvc.perform(post("/api/workflow/tasks/merge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mergedTask.name").value("XY"))
                .andExpect(jsonPath("$.data.mergedTask.projectId").value(3))
                .andExpect(jsonPath("$.data.archivedTasks.length()").value(2))
                .andExpect(jsonPath("$.data.reason").value("重复"));

        Assertions.assertEquals(TaskStatusEnum.ARCHIVE, x.getStatus());
    }

    @Test
    public void shouldReturn422OnProjectMismatch() throws Exception {
        TaskEntity x = fixture.task("X", 1L, "1");
        TaskEntity y = fixture.task("Y", 2L, "1");

        String payload = objectMapper.writeValueAsString(Map.of(
                "taskIds", List.of(x.getId(), y.getId()),
                "mergedTask", Map.of("name", "XY")
        ));

        mockMvc.perform(post("/api/workflow/tasks/merge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("1006"));

        Assertions.assertEquals(2, fixture.taskRepository.size());
    }

    @Test
    public void shouldBulkCreateWithCreatedStatus() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "projectId", 9,
                "tasks", List.of(
                        Map.of("name", "收集"),
                        Map.of("name", "分析", "dependsOnIndices", List.of(0)))
        ));

        mockMvc.perform(post("/api/workflow/tasks/bulk-create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.createdTasks.length()").value(2))
                .andExpect(jsonPath("$.data.createdTasks[1].status").value("todo"))
                .andExpect(jsonPath("$.data.dependenciesCreated").value(1));
    }

    @Test
    public void shouldReturn422ForEmptyBulkCreate() throws Exception {
        mockMvc.perform(post("/api/workflow/tasks/bulk-create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\": 9, \"tasks\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("1008"));
    }

    @Test
    public void shouldReturn400ForMalformedBody() throws Exception {
        mockMvc.perform(post("/api/workflow/tasks/bulk-create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectId\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("0002"));
    }
}
