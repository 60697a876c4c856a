package com.timebox.trigger.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timebox.domain.schedule.adapter.gateway.IScheduleReasoningGateway;
import com.timebox.domain.schedule.adapter.repository.IScheduleBlockRepository;
import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;
import com.timebox.domain.schedule.model.valobj.FixedEvent;
import com.timebox.domain.schedule.model.valobj.ProposedScheduleEntry;
import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.domain.schedule.model.valobj.ScheduleReasoningRequest;
import com.timebox.domain.schedule.model.valobj.ScheduleSummary;
import com.timebox.domain.schedule.service.SchedulableTaskDomainService;
import com.timebox.domain.schedule.service.SchedulePromptDomainService;
import com.timebox.domain.schedule.service.ScheduleProposalDomainService;
import com.timebox.domain.schedule.service.ScheduleProposalDomainService.ProposalParseResult;
import com.timebox.domain.schedule.service.ScheduleValidationDomainService;
import com.timebox.domain.task.adapter.repository.ITaskCatalogRepository;
import com.timebox.domain.task.adapter.repository.ITaskDependencyRepository;
import com.timebox.domain.task.adapter.repository.ITaskRepository;
import com.timebox.domain.task.adapter.repository.ITimeEntryRepository;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.ScheduleStatusEnum;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 周排程生成用例：收集可排程任务，请求推理服务给出方案，解析、校验后落库。
 * <p>
 * 校验结果只作为提示返回，不阻止落库；推理服务的限流与网络错误按指数退避重试。
 * </p>
 */
@Slf4j
@Service
public class WeeklyScheduleApplicationService {

    static final String METRIC_REASONING_ATTEMPT_TOTAL = "timebox.schedule.reasoning.attempt.total";
    static final String METRIC_ENTRIES_DROPPED_TOTAL = "timebox.schedule.entries.dropped.total";
    private static final long MAX_BACKOFF_MS = 60_000L;
    private static final int MAX_BACKOFF_SHIFT = 30;

    private static final int WEEK_SPAN_DAYS = 6;

    private final ITaskRepository taskRepository;
    private final ITimeEntryRepository timeEntryRepository;
    private final ITaskDependencyRepository taskDependencyRepository;
    private final ITaskCatalogRepository taskCatalogRepository;
    private final IScheduleBlockRepository scheduleBlockRepository;
    private final IScheduleReasoningGateway reasoningGateway;
    private final SchedulableTaskDomainService schedulableTaskDomainService;
    private final SchedulePromptDomainService promptDomainService;
    private final ScheduleProposalDomainService proposalDomainService;
    private final ScheduleValidationDomainService validationDomainService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final long baseBackoffMs;

    public WeeklyScheduleApplicationService(ITaskRepository taskRepository,
                                            ITimeEntryRepository timeEntryRepository,
                                            ITaskDependencyRepository taskDependencyRepository,
                                            ITaskCatalogRepository taskCatalogRepository,
                                            IScheduleBlockRepository scheduleBlockRepository,
                                            IScheduleReasoningGateway reasoningGateway,
                                            SchedulableTaskDomainService schedulableTaskDomainService,
                                            SchedulePromptDomainService promptDomainService,
                                            ScheduleProposalDomainService proposalDomainService,
                                            ScheduleValidationDomainService validationDomainService,
                                            ObjectMapper objectMapper,
                                            @Value("${schedule.reasoning.retry.max-attempts:3}") int maxAttempts,
                                            @Value("${schedule.reasoning.retry.base-backoff-ms:2000}") long baseBackoffMs) {
        this.taskRepository = taskRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.taskDependencyRepository = taskDependencyRepository;
        this.taskCatalogRepository = taskCatalogRepository;
        this.scheduleBlockRepository = scheduleBlockRepository;
        this.reasoningGateway = reasoningGateway;
        this.schedulableTaskDomainService = schedulableTaskDomainService;
        this.promptDomainService = promptDomainService;
        this.proposalDomainService = proposalDomainService;
        this.validationDomainService = validationDomainService;
        this.objectMapper = objectMapper;
        this.meterRegistry = Metrics.globalRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
    }

    @Transactional(rollbackFor = Exception.class)
    public WeeklyScheduleResult generateWeekly(LocalDate weekStart,
                                               SchedulePreferences preferences,
                                               List<FixedEvent> fixedEvents,
                                               boolean clearExisting) {
        if (weekStart == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "weekStart 不能为空");
        }
        LocalDate weekEnd = weekStart.plusDays(WEEK_SPAN_DAYS);
        SchedulePreferences prefs = preferences == null ? SchedulePreferences.defaults() : preferences;

        if (clearExisting) {
            int cleared = scheduleBlockRepository.deleteGeneratedScheduledBetween(weekStart, weekEnd);
            log.info("WEEKLY_SCHEDULE_CLEARED weekStart={}, weekEnd={}, cleared={}", weekStart, weekEnd, cleared);
        }

        List<SchedulableTask> tasks = loadSchedulableTasks();
        if (tasks.isEmpty()) {
            log.info("WEEKLY_SCHEDULE_SKIPPED weekStart={}, reason=NO_SCHEDULABLE_TASKS", weekStart);
            return new WeeklyScheduleResult(weekStart, weekEnd, Collections.emptyList(), ScheduleSummary.empty(),
                    Collections.singletonList(ScheduleValidationDomainService.NO_SCHEDULABLE_TASKS_WARNING));
        }
        Set<Long> taskIds = tasks.stream().map(SchedulableTask::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<Long, List<Long>> dependencies = schedulableTaskDomainService.restrictDependencies(
                taskIds, taskDependencyRepository.findWithin(taskIds));

        ScheduleReasoningRequest request = promptDomainService.buildRequest(
                weekStart, weekEnd, tasks, dependencies, prefs, fixedEvents, this::writeJson);
        String rawText = requestWithRetry(request, weekStart);

        ProposalParseResult parsed = proposalDomainService.parse(rawText, taskIds, this::readJson);
        for (String reason : parsed.droppedReasons()) {
            log.warn("SCHEDULE_ENTRY_DROPPED weekStart={}, reason={}", weekStart, reason);
            meterRegistry.counter(METRIC_ENTRIES_DROPPED_TOTAL).increment();
        }
        List<ProposedScheduleEntry> entries = parsed.entries();
        List<String> warnings = validationDomainService.validate(entries, tasks, prefs, dependencies);

        Map<Long, SchedulableTask> taskById = tasks.stream()
                .collect(Collectors.toMap(SchedulableTask::getId, Function.identity()));
        List<GeneratedBlock> blocks = new ArrayList<>(entries.size());
        for (ProposedScheduleEntry entry : entries) {
            ScheduleBlockEntity block = new ScheduleBlockEntity();
            block.setTaskId(entry.taskId());
            block.setScheduledDate(entry.date());
            block.setStartTime(entry.startTime());
            block.setEndTime(entry.endTime());
            block.setAllocatedHours(entry.allocatedHours());
            block.setGeneratedByAi(Boolean.TRUE);
            block.setStatus(ScheduleStatusEnum.SCHEDULED);
            scheduleBlockRepository.save(block);
            blocks.add(new GeneratedBlock(block, taskById.get(entry.taskId()), entry.reasoning()));
        }
        ScheduleSummary summary = validationDomainService.summarize(entries, tasks);
        log.info("WEEKLY_SCHEDULE_DONE weekStart={}, weekEnd={}, tasks={}, blocks={}, dropped={}, warnings={}, plannedHours={}",
                weekStart, weekEnd, tasks.size(), blocks.size(), parsed.droppedReasons().size(),
                warnings.size(), summary.totalPlannedHours());
        return new WeeklyScheduleResult(weekStart, weekEnd, blocks, summary, warnings);
    }

    private List<SchedulableTask> loadSchedulableTasks() {
        List<TaskEntity> candidates = taskRepository.findByStatuses(
                EnumSet.of(TaskStatusEnum.TODO, TaskStatusEnum.DOING, TaskStatusEnum.WAITING));
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> ids = candidates.stream().map(TaskEntity::getId).collect(Collectors.toList());
        Set<Long> projectIds = candidates.stream().map(TaskEntity::getProjectId)
                .filter(Objects::nonNull).collect(Collectors.toSet());
        Set<Long> genreIds = candidates.stream().map(TaskEntity::getGenreId)
                .filter(Objects::nonNull).collect(Collectors.toSet());
        return schedulableTaskDomainService.selectSchedulable(
                candidates,
                timeEntryRepository.sumDurationMinutesByTaskIds(ids),
                taskCatalogRepository.findProjectNames(projectIds),
                taskCatalogRepository.findGenreNames(genreIds));
    }

    private String requestWithRetry(ScheduleReasoningRequest request, LocalDate weekStart) {
        AppException lastTransient = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String rawText = reasoningGateway.generate(request);
                recordAttempt("success");
                return rawText;
            } catch (AppException ex) {
                if (!ex.is(ResponseCode.AI_SERVICE_TRANSIENT)) {
                    recordAttempt(ex.is(ResponseCode.AI_SERVICE_UNAVAILABLE) ? "unavailable" : "error");
                    throw ex;
                }
                recordAttempt("transient");
                lastTransient = ex;
                log.warn("SCHEDULE_REASONING_RETRY weekStart={}, attempt={}/{}, reason={}",
                        weekStart, attempt, maxAttempts, ex.getInfo());
                if (attempt < maxAttempts) {
                    sleepBackoff(attempt);
                }
            }
        }
        log.error("SCHEDULE_REASONING_EXHAUSTED weekStart={}, attempts={}", weekStart, maxAttempts);
        throw new AppException(ResponseCode.AI_SERVICE_ERROR,
                "推理服务重试 " + maxAttempts + " 次后仍失败: " + lastTransient.getInfo(), lastTransient);
    }

    /**
     * 第 attempt 次失败后的等待时长：base * 2^(attempt-1)，上限 {@value #MAX_BACKOFF_MS} 毫秒。
     */
    public long backoffDelayMs(int attempt) {
        if (baseBackoffMs <= 0L) {
            return 0L;
        }
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_BACKOFF_SHIFT);
        if (baseBackoffMs > (MAX_BACKOFF_MS >> shift)) {
            return MAX_BACKOFF_MS;
        }
        return Math.min(baseBackoffMs << shift, MAX_BACKOFF_MS);
    }

    private void sleepBackoff(int attempt) {
        long delay = backoffDelayMs(attempt);
        if (delay <= 0L) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.AI_SERVICE_ERROR, "等待重试时被中断", ex);
        }
    }

    private void recordAttempt(String outcome) {
        meterRegistry.counter(METRIC_REASONING_ATTEMPT_TOTAL, "outcome", outcome).increment();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json", ex);
        }
    }

    private Object readJson(String text) {
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Failed to parse json: " + ex.getOriginalMessage(), ex);
        }
    }

    public record GeneratedBlock(ScheduleBlockEntity block, SchedulableTask task, String reasoning) {
    }

    public record WeeklyScheduleResult(LocalDate weekStart,
                                       LocalDate weekEnd,
                                       List<GeneratedBlock> schedules,
                                       ScheduleSummary summary,
                                       List<String> warnings) {
    }
}
