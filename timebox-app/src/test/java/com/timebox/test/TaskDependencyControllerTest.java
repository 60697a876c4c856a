package com.timebox.test;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.test.support.TaskWorkflowFixture;
import com.timebox.trigger.application.common.TaskWorkflowViewAssembler;
import com.timebox.trigger.http.GlobalApiExceptionHandler;
import com.timebox.trigger.http.TaskDependencyController;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TaskDependencyControllerTest {

    private MockMvc mockMvc;
    private TaskWorkflowFixture fixture;

    @BeforeEach
    public void setUp() {
        this.fixture = new TaskWorkflowFixture();
        TaskDependencyController controller = new TaskDependencyController(fixture.graphService,
                new TaskWorkflowViewAssembler());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldAddDependencyAndReturnBothDirections() throws Exception {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");

        mockMvc.perform(post("/api/tasks/{id}/dependencies", b.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dependsOnTaskId\": " + a.getId() + "}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.taskId").value(b.getId()))
                .andExpect(jsonPath("$.data.dependsOn[0].id").value(a.getId()))
                .andExpect(jsonPath("$.data.blocking.length()").value(0));

        mockMvc.perform(get("/api/tasks/{id}/dependencies", a.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dependsOn.length()").value(0))
                .andExpect(jsonPath("$.data.blocking[0].id").value(b.getId()));
    }

    @Test
    public void shouldRejectCycleWith422() throws Exception {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");
        fixture.dependencyRepository.seed(b.getId(), a.getId());

        mockMvc.perform(post("/api/tasks/{id}/dependencies", a.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dependsOnTaskId\": " + b.getId() + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("1002"));

        Assertions.assertEquals(1, fixture.dependencyRepository.size());
    }

    @Test
    public void shouldRejectSelfReferenceWith422() throws Exception {
        TaskEntity a = fixture.task("A", 1L, "1");

        mockMvc.perform(post("/api/tasks/{id}/dependencies", a.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dependsOnTaskId\": " + a.getId() + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("1001"));
    }

    @Test
    public void shouldRemoveDependency() throws Exception {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");
        fixture.dependencyRepository.seed(b.getId(), a.getId());

        mockMvc.perform(delete("/api/tasks/{id}/dependencies/{dependsOnId}", b.getId(), a.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"));

        Assertions.assertEquals(0, fixture.dependencyRepository.size());
    }

    @Test
    public void shouldReturn404WhenRemovingMissingDependency() throws Exception {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");

        mockMvc.perform(delete("/api/tasks/{id}/dependencies/{dependsOnId}", b.getId(), a.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("0404"));
    }

    @Test
    public void shouldReturn400ForNonNumericTaskId() throws Exception {
        mockMvc.perform(get("/api/tasks/{id}/dependencies", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("0002"));
    }
}
