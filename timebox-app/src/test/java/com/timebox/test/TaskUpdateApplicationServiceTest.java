package com.timebox.test;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskPatch;
import com.timebox.test.support.TaskWorkflowFixture;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;

public class TaskUpdateApplicationServiceTest {

    private TaskWorkflowFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new TaskWorkflowFixture();
    }

    @Test
    public void shouldApplyOnlyPresentFields() {
        TaskEntity task = fixture.task("写论文", 1L, "4");

        TaskEntity updated = fixture.updateService().patch(task.getId(), TaskPatch.builder()
                .status(TaskStatusEnum.DOING)
                .deadline(LocalDate.of(2025, 3, 1))
                .build());

        Assertions.assertEquals(TaskStatusEnum.DOING, updated.getStatus());
        Assertions.assertEquals(LocalDate.of(2025, 3, 1), updated.getDeadline());
        Assertions.assertEquals("写论文", updated.getName());
        Assertions.assertEquals(0, new BigDecimal("4").compareTo(updated.getEstimatedHours()));
    }

    @Test
    public void shouldReturnTaskUnchangedForEmptyPatch() {
        TaskEntity task = fixture.task("写论文", 1L, "4");

        TaskEntity updated = fixture.updateService().patch(task.getId(), TaskPatch.builder().build());

        Assertions.assertSame(task, updated);
        Assertions.assertEquals(TaskStatusEnum.TODO, updated.getStatus());
    }

    @Test
    public void shouldRejectArchivedTask() {
        TaskEntity task = fixture.task("旧任务", 1L, "4");
        task.setStatus(TaskStatusEnum.ARCHIVE);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.updateService().patch(task.getId(), TaskPatch.builder().name("新名字").build()));

        Assertions.assertTrue(ex.is(ResponseCode.ALREADY_ARCHIVED));
        Assertions.assertEquals("旧任务", task.getName());
    }

    @Test
    public void shouldRejectInvalidValues() {
        TaskEntity task = fixture.task("写论文", 1L, "4");

        AppException negative = Assertions.assertThrows(AppException.class, () -> fixture.updateService()
                .patch(task.getId(), TaskPatch.builder().estimatedHours(new BigDecimal("-1")).build()));
        AppException zeroUnit = Assertions.assertThrows(AppException.class, () -> fixture.updateService()
                .patch(task.getId(), TaskPatch.builder().minWorkUnit(BigDecimal.ZERO).build()));
        AppException missing = Assertions.assertThrows(AppException.class, () -> fixture.updateService()
                .patch(404L, TaskPatch.builder().name("x").build()));

        Assertions.assertTrue(negative.is(ResponseCode.VALIDATION_FAILED));
        Assertions.assertTrue(zeroUnit.is(ResponseCode.VALIDATION_FAILED));
        Assertions.assertTrue(missing.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldClearNullableFieldsOnRequest() {
        TaskEntity task = fixture.task("写论文", 1L, "4");
        task.setGenreId(7L);
        task.setDeadline(LocalDate.of(2025, 3, 1));
        task.setNote("导师意见");

        TaskEntity updated = fixture.updateService().patch(task.getId(), TaskPatch.builder()
                .clearFields(EnumSet.of(TaskPatch.ClearableField.DEADLINE, TaskPatch.ClearableField.ESTIMATED_HOURS))
                .build());

        Assertions.assertNull(updated.getDeadline());
        Assertions.assertNull(updated.getEstimatedHours());
        Assertions.assertEquals(7L, updated.getGenreId());
        Assertions.assertEquals("导师意见", updated.getNote());
    }

    @Test
    public void shouldRejectSettingAndClearingSameField() {
        TaskEntity task = fixture.task("写论文", 1L, "4");

        AppException ex = Assertions.assertThrows(AppException.class, () -> fixture.updateService()
                .patch(task.getId(), TaskPatch.builder()
                        .note("新备注")
                        .clearFields(EnumSet.of(TaskPatch.ClearableField.NOTE))
                        .build()));

        Assertions.assertTrue(ex.is(ResponseCode.VALIDATION_FAILED));
        Assertions.assertNull(task.getNote());
    }
}
