package com.timebox.trigger.application.command;

import com.timebox.domain.schedule.adapter.repository.IScheduleBlockRepository;
import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;
import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.adapter.repository.ITimeEntryRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.entity.TimeEntryEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.domain.task.service.TaskAllocationDomainService;
import com.timebox.domain.task.service.TaskAllocationDomainService.AllocationShare;
import com.timebox.domain.task.service.TaskAllocationDomainService.MinuteAllocation;
import com.timebox.domain.task.service.TaskAllocationDomainService.ShareInput;
import com.timebox.trigger.application.common.TaskDraftSupport;
import com.timebox.types.enums.AllocationRemainderPolicyEnum;
import com.timebox.types.enums.DependencyTransferModeEnum;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.ScheduleStatusEnum;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务拆分写用例：按比例把父任务的工时记录与排程块分摊给子任务，并迁移依赖。
 */
@Slf4j
@Service
public class TaskBreakdownApplicationService {

    static final String ALLOCATION_NOTE_PREFIX = "按分解比例分配自父任务";

    private final ITaskRepository taskRepository;
    private final ITimeEntryRepository timeEntryRepository;
    private final IScheduleBlockRepository scheduleBlockRepository;
    private final TaskDependencyGraphApplicationService dependencyGraphService;
    private final TaskAllocationDomainService allocationDomainService;
    private final TaskDraftSupport taskDraftSupport;
    private final DependencyTransferModeEnum outgoingTransferMode;
    private final AllocationRemainderPolicyEnum remainderPolicy;

    public TaskBreakdownApplicationService(ITaskRepository taskRepository,
                                           ITimeEntryRepository timeEntryRepository,
                                           IScheduleBlockRepository scheduleBlockRepository,
                                           TaskDependencyGraphApplicationService dependencyGraphService,
                                           TaskAllocationDomainService allocationDomainService,
                                           TaskDraftSupport taskDraftSupport,
                                           @Value("${workflow.breakdown.outgoing-transfer-mode:to_last}") String outgoingTransferMode,
                                           @Value("${workflow.breakdown.remainder-policy:discard}") String remainderPolicy) {
        this.taskRepository = taskRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.scheduleBlockRepository = scheduleBlockRepository;
        this.dependencyGraphService = dependencyGraphService;
        this.allocationDomainService = allocationDomainService;
        this.taskDraftSupport = taskDraftSupport;
        DependencyTransferModeEnum mode = DependencyTransferModeEnum.fromCode(outgoingTransferMode);
        this.outgoingTransferMode = mode == null ? DependencyTransferModeEnum.TO_LAST : mode;
        this.remainderPolicy = AllocationRemainderPolicyEnum.fromName(remainderPolicy);
    }

    @Transactional(rollbackFor = Exception.class)
    public BreakdownResult breakdown(Long taskId, List<TaskDraft> subtasks, String reason, boolean archiveOriginal) {
        if (taskId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "taskId 不能为空");
        }
        TaskEntity original = taskRepository.findById(taskId);
        if (original == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        if (original.isArchived()) {
            throw new AppException(ResponseCode.ALREADY_ARCHIVED, "任务已归档，不能拆分: " + taskId);
        }
        if (taskRepository.hasChildren(taskId)) {
            throw new AppException(ResponseCode.HAS_CHILDREN, "任务已有子任务，只能拆分叶子任务: " + taskId);
        }
        if (subtasks == null || subtasks.isEmpty()) {
            throw new AppException(ResponseCode.VALIDATION_FAILED, "子任务列表不能为空");
        }
        taskDraftSupport.validateFields(subtasks);
        taskDraftSupport.validateIndexReferences(subtasks);
        List<AllocationShare> shares = allocationDomainService.calculateShares(subtasks.stream()
                .map(draft -> new ShareInput(draft.getAllocatedHours(), draft.getEstimatedHours()))
                .collect(Collectors.toList()));

        List<TaskEntity> created = new ArrayList<>(subtasks.size());
        for (TaskDraft draft : subtasks) {
            created.add(taskRepository.save(taskDraftSupport.newTask(draft, original.getProjectId(), original)));
        }
        List<Long> createdIds = created.stream().map(TaskEntity::getId).collect(Collectors.toList());

        TimeAllocation timeAllocation = allocateTimeEntries(original, created, shares);
        ScheduleAllocation scheduleAllocation = allocateScheduleBlocks(original, created, shares);

        int transferred = dependencyGraphService.transferDependencies(taskId, createdIds, outgoingTransferMode);
        transferred += taskDraftSupport.linkIndexedDependencies(subtasks, created);

        if (archiveOriginal) {
            original.setStatus(TaskStatusEnum.ARCHIVE);
            taskRepository.update(original);
        }

        AllocationSummary summary = new AllocationSummary(
                timeAllocation.entriesCreated(),
                scheduleAllocation.blocksCreated(),
                timeAllocation.allocation().allocatedMinutes(),
                timeAllocation.allocation().unallocatedMinutes(),
                scheduleAllocation.totalHours());
        log.info("TASK_BREAKDOWN_DONE taskId={}, subtasks={}, dependenciesTransferred={}, minutesAllocated={}, minutesUnallocated={}, schedulesAllocated={}, archived={}",
                taskId, createdIds, transferred, summary.totalTimeMinutesAllocated(),
                summary.unallocatedTimeMinutes(), summary.schedulesAllocated(), archiveOriginal);
        return new BreakdownResult(original, created, transferred, summary, reason);
    }

    private TimeAllocation allocateTimeEntries(TaskEntity original,
                                               List<TaskEntity> created,
                                               List<AllocationShare> shares) {
        long totalMinutes = 0L;
        LocalDateTime earliestStart = null;
        LocalDateTime latestEnd = null;
        for (TimeEntryEntity entry : timeEntryRepository.findByTaskId(original.getId())) {
            if (!entry.isCompleted()) {
                continue;
            }
            totalMinutes += entry.resolveDurationMinutes();
            if (entry.getStartTime() != null && (earliestStart == null || entry.getStartTime().isBefore(earliestStart))) {
                earliestStart = entry.getStartTime();
            }
            if (latestEnd == null || entry.getEndTime().isAfter(latestEnd)) {
                latestEnd = entry.getEndTime();
            }
        }
        MinuteAllocation allocation = allocationDomainService.allocateMinutes(totalMinutes, shares, remainderPolicy);
        int entriesCreated = 0;
        for (int i = 0; i < created.size(); i++) {
            long minutes = allocation.minutes().get(i);
            if (minutes <= 0) {
                continue;
            }
            TimeEntryEntity entry = new TimeEntryEntity();
            entry.setTaskId(created.get(i).getId());
            entry.setStartTime(earliestStart);
            entry.setEndTime(latestEnd);
            entry.setDurationMinutes(Math.toIntExact(minutes));
            entry.setNote(ALLOCATION_NOTE_PREFIX + " (" + shares.get(i).percentLabel() + ")");
            timeEntryRepository.save(entry);
            entriesCreated++;
        }
        return new TimeAllocation(allocation, entriesCreated);
    }

    private ScheduleAllocation allocateScheduleBlocks(TaskEntity original,
                                                      List<TaskEntity> created,
                                                      List<AllocationShare> shares) {
        int blocksCreated = 0;
        BigDecimal totalHours = BigDecimal.ZERO;
        for (ScheduleBlockEntity block : scheduleBlockRepository.findByTaskId(original.getId())) {
            List<BigDecimal> hours = allocationDomainService.allocateHours(block.getAllocatedHours(), shares, remainderPolicy);
            for (int i = 0; i < created.size(); i++) {
                BigDecimal allocated = hours.get(i);
                if (allocated.signum() <= 0) {
                    continue;
                }
                ScheduleBlockEntity copy = new ScheduleBlockEntity();
                copy.setTaskId(created.get(i).getId());
                copy.setScheduledDate(block.getScheduledDate());
                copy.setStartTime(block.getStartTime());
                copy.setEndTime(block.getEndTime());
                copy.setAllocatedHours(allocated);
                copy.setGeneratedByAi(block.isAiGenerated());
                copy.setStatus(ScheduleStatusEnum.SCHEDULED);
                scheduleBlockRepository.save(copy);
                blocksCreated++;
                totalHours = totalHours.add(allocated);
            }
        }
        return new ScheduleAllocation(blocksCreated, totalHours);
    }

    private record TimeAllocation(MinuteAllocation allocation, int entriesCreated) {
    }

    private record ScheduleAllocation(int blocksCreated, BigDecimal totalHours) {
    }

    public record AllocationSummary(int timeEntriesAllocated,
                                    int schedulesAllocated,
                                    long totalTimeMinutesAllocated,
                                    long unallocatedTimeMinutes,
                                    BigDecimal totalScheduleHoursAllocated) {
    }

    public record BreakdownResult(TaskEntity originalTask,
                                  List<TaskEntity> createdTasks,
                                  int dependenciesTransferred,
                                  AllocationSummary allocationSummary,
                                  String reason) {
    }
}
