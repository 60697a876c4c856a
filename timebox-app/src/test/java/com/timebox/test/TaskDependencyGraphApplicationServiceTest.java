package com.timebox.test;

import com.timebox.domain.task.model.entity.DependencyEdgeEntity;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.test.support.TaskWorkflowFixture;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService.DependencyView;
import com.timebox.types.enums.DependencyTransferModeEnum;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

public class TaskDependencyGraphApplicationServiceTest {

    private TaskWorkflowFixture fixture;
    private TaskDependencyGraphApplicationService service;

    @BeforeEach
    public void setUp() {
        fixture = new TaskWorkflowFixture();
        service = fixture.graphService;
    }

    @Test
    public void shouldAddDependencyAndExposeBothDirections() {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");

        service.addDependency(b.getId(), a.getId());

        DependencyView viewOfB = service.getDependencies(b.getId());
        Assertions.assertEquals(List.of(a.getId()), ids(viewOfB.dependsOn()));
        Assertions.assertTrue(viewOfB.blocking().isEmpty());
        DependencyView viewOfA = service.getDependencies(a.getId());
        Assertions.assertEquals(List.of(b.getId()), ids(viewOfA.blocking()));
    }

    @Test
    public void shouldRejectSelfReference() {
        TaskEntity a = fixture.task("A", 1L, "1");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.addDependency(a.getId(), a.getId()));

        Assertions.assertTrue(ex.is(ResponseCode.SELF_REFERENCE));
        Assertions.assertEquals(0, fixture.dependencyRepository.size());
    }

    @Test
    public void shouldRejectUnknownTask() {
        TaskEntity a = fixture.task("A", 1L, "1");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.addDependency(a.getId(), 404L));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldRejectDuplicateEdge() {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");
        service.addDependency(b.getId(), a.getId());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.addDependency(b.getId(), a.getId()));

        Assertions.assertTrue(ex.is(ResponseCode.DEPENDENCY_EXISTS));
        Assertions.assertEquals(1, fixture.dependencyRepository.size());
    }

    @Test
    public void shouldRejectEdgeClosingChainAndKeepEdgeSetUnchanged() {
        // C 依赖 B，B 依赖 A；再让 A 依赖 C 会成环
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");
        TaskEntity c = fixture.task("C", 1L, "1");
        service.addDependency(b.getId(), a.getId());
        service.addDependency(c.getId(), b.getId());
        List<DependencyEdgeEntity> before = fixture.dependencyRepository.findAll();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.addDependency(a.getId(), c.getId()));

        Assertions.assertTrue(ex.is(ResponseCode.DEPENDENCY_CYCLE));
        Assertions.assertEquals(before, fixture.dependencyRepository.findAll());
        Assertions.assertTrue(service.checkCycle(a.getId(), List.of(c.getId())));
        Assertions.assertFalse(service.checkCycle(c.getId(), List.of(a.getId())));
    }

    @Test
    public void shouldRemoveDependencyOrReportMissingEdge() {
        TaskEntity a = fixture.task("A", 1L, "1");
        TaskEntity b = fixture.task("B", 1L, "1");
        service.addDependency(b.getId(), a.getId());

        service.removeDependency(b.getId(), a.getId());

        Assertions.assertEquals(0, fixture.dependencyRepository.size());
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.removeDependency(b.getId(), a.getId()));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldTransferDependenciesToLastSubtask() {
        TaskEntity upstream = fixture.task("上游", 1L, "1");
        TaskEntity original = fixture.task("原任务", 1L, "2");
        TaskEntity downstream = fixture.task("下游", 1L, "1");
        TaskEntity s1 = fixture.task("子1", 1L, "1");
        TaskEntity s2 = fixture.task("子2", 1L, "1");
        fixture.dependencyRepository.seed(original.getId(), upstream.getId());
        fixture.dependencyRepository.seed(downstream.getId(), original.getId());

        int created = service.transferDependencies(original.getId(), List.of(s1.getId(), s2.getId()),
                DependencyTransferModeEnum.TO_LAST);

        Assertions.assertEquals(3, created);
        Assertions.assertTrue(fixture.dependencyRepository.exists(s1.getId(), upstream.getId()));
        Assertions.assertTrue(fixture.dependencyRepository.exists(s2.getId(), upstream.getId()));
        Assertions.assertTrue(fixture.dependencyRepository.exists(downstream.getId(), s2.getId()));
        Assertions.assertFalse(fixture.dependencyRepository.exists(downstream.getId(), s1.getId()));
    }

    @Test
    public void shouldTransferBlockedTasksToEverySubtaskWhenConfigured() {
        TaskEntity original = fixture.task("原任务", 1L, "2");
        TaskEntity downstream = fixture.task("下游", 1L, "1");
        TaskEntity s1 = fixture.task("子1", 1L, "1");
        TaskEntity s2 = fixture.task("子2", 1L, "1");
        fixture.dependencyRepository.seed(downstream.getId(), original.getId());

        int created = service.transferDependencies(original.getId(), List.of(s1.getId(), s2.getId()),
                DependencyTransferModeEnum.TO_ALL);

        Assertions.assertEquals(2, created);
        Assertions.assertTrue(fixture.dependencyRepository.exists(downstream.getId(), s1.getId()));
        Assertions.assertTrue(fixture.dependencyRepository.exists(downstream.getId(), s2.getId()));
    }

    @Test
    public void shouldMergeExternalDependenciesAndSkipInternalOnes() {
        TaskEntity upstream = fixture.task("上游", 1L, "1");
        TaskEntity x = fixture.task("X", 1L, "1");
        TaskEntity y = fixture.task("Y", 1L, "1");
        TaskEntity downstream = fixture.task("下游", 1L, "1");
        TaskEntity merged = fixture.task("合并", 1L, "2");
        fixture.dependencyRepository.seed(x.getId(), upstream.getId());
        fixture.dependencyRepository.seed(y.getId(), x.getId());
        fixture.dependencyRepository.seed(downstream.getId(), y.getId());
        fixture.dependencyRepository.seed(downstream.getId(), x.getId());

        int created = service.mergeDependencies(List.of(x.getId(), y.getId()), merged.getId());

        Assertions.assertEquals(2, created);
        Assertions.assertTrue(fixture.dependencyRepository.exists(merged.getId(), upstream.getId()));
        Assertions.assertTrue(fixture.dependencyRepository.exists(downstream.getId(), merged.getId()));
        Assertions.assertFalse(fixture.dependencyRepository.exists(merged.getId(), merged.getId()));
    }

    private List<Long> ids(List<TaskEntity> tasks) {
        return tasks.stream().map(TaskEntity::getId).collect(Collectors.toList());
    }
}
