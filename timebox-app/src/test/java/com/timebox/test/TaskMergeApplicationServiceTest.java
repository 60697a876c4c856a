package com.timebox.test;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.test.support.TaskWorkflowFixture;
import com.timebox.trigger.application.command.TaskMergeApplicationService.MergeResult;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

public class TaskMergeApplicationServiceTest {

    private TaskWorkflowFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new TaskWorkflowFixture();
    }

    @Test
    public void shouldReassignAllRowsAndArchiveSources() {
        TaskEntity x = fixture.task("读论文 A", 1L, "1");
        TaskEntity y = fixture.task("读论文 B", 1L, "1");
        fixture.completedEntry(x.getId(), LocalDateTime.of(2025, 1, 6, 9, 0), 45);
        fixture.completedEntry(y.getId(), LocalDateTime.of(2025, 1, 7, 9, 0), 30);
        fixture.completedEntry(y.getId(), LocalDateTime.of(2025, 1, 8, 9, 0), 15);
        fixture.scheduleBlock(x.getId(), LocalDate.of(2025, 1, 13), "1", false);

        MergeResult result = fixture.mergeService().merge(List.of(x.getId(), y.getId()),
                draft("读论文"), "合并同类任务");

        TaskEntity merged = result.mergedTask();
        Assertions.assertEquals(1L, merged.getProjectId());
        Assertions.assertNull(merged.getParentTaskId());
        Assertions.assertEquals(3, result.timeEntriesTransferred());
        Assertions.assertEquals(1, result.schedulesTransferred());
        Assertions.assertEquals(3, fixture.timeEntryRepository.findByTaskId(merged.getId()).size());
        Assertions.assertTrue(fixture.timeEntryRepository.findByTaskId(x.getId()).isEmpty());
        Assertions.assertEquals(new BigDecimal("1"),
                fixture.scheduleBlockRepository.findByTaskId(merged.getId()).get(0).getAllocatedHours());
        Assertions.assertEquals(List.of(x.getId(), y.getId()), result.archivedTaskIds());
        Assertions.assertEquals(TaskStatusEnum.ARCHIVE, fixture.taskRepository.findById(x.getId()).getStatus());
        Assertions.assertEquals(TaskStatusEnum.ARCHIVE, fixture.taskRepository.findById(y.getId()).getStatus());
        Assertions.assertEquals("合并同类任务", result.reason());
    }

    @Test
    public void shouldMergeExternalDependencies() {
        TaskEntity upstream = fixture.task("上游", 1L, "1");
        TaskEntity x = fixture.task("X", 1L, "1");
        TaskEntity y = fixture.task("Y", 1L, "1");
        TaskEntity downstream = fixture.task("下游", 1L, "1");
        fixture.dependencyRepository.seed(x.getId(), upstream.getId());
        fixture.dependencyRepository.seed(y.getId(), x.getId());
        fixture.dependencyRepository.seed(downstream.getId(), y.getId());

        MergeResult result = fixture.mergeService().merge(List.of(x.getId(), y.getId()), draft("XY"), null);

        Long mergedId = result.mergedTask().getId();
        Assertions.assertEquals(2, result.dependenciesMerged());
        Assertions.assertTrue(fixture.dependencyRepository.exists(mergedId, upstream.getId()));
        Assertions.assertTrue(fixture.dependencyRepository.exists(downstream.getId(), mergedId));
    }

    @Test
    public void shouldRejectProjectMismatchWithoutSideEffects() {
        TaskEntity x = fixture.task("X", 1L, "1");
        TaskEntity y = fixture.task("Y", 2L, "1");
        fixture.completedEntry(x.getId(), LocalDateTime.of(2025, 1, 6, 9, 0), 30);
        int before = fixture.taskRepository.size();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.mergeService().merge(List.of(x.getId(), y.getId()), draft("XY"), null));

        Assertions.assertTrue(ex.is(ResponseCode.PROJECT_MISMATCH));
        Assertions.assertEquals(before, fixture.taskRepository.size());
        Assertions.assertEquals(1, fixture.timeEntryRepository.findByTaskId(x.getId()).size());
        Assertions.assertEquals(TaskStatusEnum.TODO, x.getStatus());
        Assertions.assertEquals(TaskStatusEnum.TODO, y.getStatus());
    }

    @Test
    public void shouldRequireAtLeastTwoDistinctTasks() {
        TaskEntity x = fixture.task("X", 1L, "1");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.mergeService().merge(Arrays.asList(x.getId(), x.getId(), null), draft("X"), null));

        Assertions.assertTrue(ex.is(ResponseCode.VALIDATION_FAILED));
    }

    @Test
    public void shouldRejectUnknownSourceTask() {
        TaskEntity x = fixture.task("X", 1L, "1");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.mergeService().merge(List.of(x.getId(), 404L), draft("X"), null));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    private TaskDraft draft(String name) {
        return TaskDraft.builder().name(name).estimatedHours(new BigDecimal("2")).build();
    }
}
