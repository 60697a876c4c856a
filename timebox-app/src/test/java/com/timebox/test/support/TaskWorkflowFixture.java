package com.timebox.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;
import com.timebox.domain.schedule.service.SchedulableTaskDomainService;
import com.timebox.domain.schedule.service.SchedulePromptDomainService;
import com.timebox.domain.schedule.service.ScheduleProposalDomainService;
import com.timebox.domain.schedule.service.ScheduleValidationDomainService;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.entity.TimeEntryEntity;
import com.timebox.domain.task.service.DependencyCycleDomainService;
import com.timebox.domain.task.service.TaskAllocationDomainService;
import com.timebox.trigger.application.command.TaskBreakdownApplicationService;
import com.timebox.trigger.application.command.TaskBulkCreateApplicationService;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService;
import com.timebox.trigger.application.command.TaskMergeApplicationService;
import com.timebox.trigger.application.command.TaskUpdateApplicationService;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService;
import com.timebox.trigger.application.common.TaskDraftSupport;
import com.timebox.types.enums.ScheduleStatusEnum;
import com.timebox.types.enums.TaskStatusEnum;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 用内存仓储装配全部写用例，便于在不启动 Spring 容器的情况下验证工作流。
 */
public class TaskWorkflowFixture {

    public final InMemoryTaskRepository taskRepository = new InMemoryTaskRepository();
    public final InMemoryTaskDependencyRepository dependencyRepository = new InMemoryTaskDependencyRepository();
    public final InMemoryTimeEntryRepository timeEntryRepository = new InMemoryTimeEntryRepository();
    public final InMemoryScheduleBlockRepository scheduleBlockRepository = new InMemoryScheduleBlockRepository();
    public final InMemoryTaskCatalogRepository catalogRepository = new InMemoryTaskCatalogRepository();
    public final ScriptedReasoningGateway reasoningGateway = new ScriptedReasoningGateway();
    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    public final DependencyCycleDomainService cycleDomainService = new DependencyCycleDomainService();
    public final TaskAllocationDomainService allocationDomainService = new TaskAllocationDomainService();
    public final TaskDependencyGraphApplicationService graphService =
            new TaskDependencyGraphApplicationService(taskRepository, dependencyRepository, cycleDomainService);
    public final TaskDraftSupport draftSupport = new TaskDraftSupport(cycleDomainService, graphService);

    public TaskBreakdownApplicationService breakdownService() {
        return breakdownService("to_last", "discard");
    }

    public TaskBreakdownApplicationService breakdownService(String outgoingTransferMode, String remainderPolicy) {
        return new TaskBreakdownApplicationService(taskRepository, timeEntryRepository, scheduleBlockRepository,
                graphService, allocationDomainService, draftSupport, outgoingTransferMode, remainderPolicy);
    }

    public TaskMergeApplicationService mergeService() {
        return new TaskMergeApplicationService(taskRepository, timeEntryRepository, scheduleBlockRepository,
                graphService, draftSupport);
    }

    public TaskBulkCreateApplicationService bulkCreateService() {
        return new TaskBulkCreateApplicationService(taskRepository, draftSupport);
    }

    public TaskUpdateApplicationService updateService() {
        return new TaskUpdateApplicationService(taskRepository);
    }

    public WeeklyScheduleApplicationService weeklyScheduleService(int maxAttempts) {
        return weeklyScheduleService(maxAttempts, 0L);
    }

    public WeeklyScheduleApplicationService weeklyScheduleService(int maxAttempts, long baseBackoffMs) {
        return new WeeklyScheduleApplicationService(taskRepository, timeEntryRepository, dependencyRepository,
                catalogRepository, scheduleBlockRepository, reasoningGateway,
                new SchedulableTaskDomainService(), new SchedulePromptDomainService(),
                new ScheduleProposalDomainService(), new ScheduleValidationDomainService(),
                objectMapper, maxAttempts, baseBackoffMs);
    }

    public TaskEntity task(String name, Long projectId, String estimatedHours) {
        TaskEntity task = new TaskEntity();
        task.setName(name);
        task.setProjectId(projectId);
        task.setStatus(TaskStatusEnum.TODO);
        task.setEstimatedHours(estimatedHours == null ? null : new BigDecimal(estimatedHours));
        task.setPriority("中");
        task.setWantLevel("中");
        task.setSplittable(Boolean.TRUE);
        task.setMinWorkUnit(new BigDecimal("0.5"));
        task.setDecompositionLevel(0);
        return taskRepository.save(task);
    }

    public TimeEntryEntity completedEntry(Long taskId, LocalDateTime start, int minutes) {
        TimeEntryEntity entry = new TimeEntryEntity();
        entry.setTaskId(taskId);
        entry.setStartTime(start);
        entry.setEndTime(start.plusMinutes(minutes));
        entry.setDurationMinutes(minutes);
        return timeEntryRepository.save(entry);
    }

    public ScheduleBlockEntity scheduleBlock(Long taskId, LocalDate date, String hours, boolean generatedByAi) {
        ScheduleBlockEntity block = new ScheduleBlockEntity();
        block.setTaskId(taskId);
        block.setScheduledDate(date);
        block.setStartTime(LocalTime.of(9, 0));
        block.setEndTime(LocalTime.of(12, 0));
        block.setAllocatedHours(new BigDecimal(hours));
        block.setGeneratedByAi(generatedByAi);
        block.setStatus(ScheduleStatusEnum.SCHEDULED);
        return scheduleBlockRepository.save(block);
    }
}
