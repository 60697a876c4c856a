package com.timebox.trigger.application.common;

import com.timebox.api.dto.AllocationSummaryDTO;
import com.timebox.api.dto.BulkCreateResponseDTO;
import com.timebox.api.dto.ScheduleEntryDTO;
import com.timebox.api.dto.ScheduleSummaryDTO;
import com.timebox.api.dto.SubtaskSpecDTO;
import com.timebox.api.dto.TaskBreakdownResponseDTO;
import com.timebox.api.dto.TaskDependenciesDTO;
import com.timebox.api.dto.TaskMergeResponseDTO;
import com.timebox.api.dto.TaskPatchRequestDTO;
import com.timebox.api.dto.TaskSpecDTO;
import com.timebox.api.dto.TaskSummaryDTO;
import com.timebox.api.dto.WeeklyScheduleRequestDTO;
import com.timebox.api.dto.WeeklyScheduleResponseDTO;
import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;
import com.timebox.domain.schedule.model.valobj.FixedEvent;
import com.timebox.domain.schedule.model.valobj.SchedulableTask;
import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.domain.schedule.model.valobj.ScheduleSummary;
import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.domain.task.model.valobj.TaskDraft;
import com.timebox.domain.task.model.valobj.TaskPatch;
import com.timebox.trigger.application.command.TaskBreakdownApplicationService.BreakdownResult;
import com.timebox.trigger.application.command.TaskBulkCreateApplicationService.BulkCreateResult;
import com.timebox.trigger.application.command.TaskDependencyGraphApplicationService.DependencyView;
import com.timebox.trigger.application.command.TaskMergeApplicationService.MergeResult;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService.GeneratedBlock;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService.WeeklyScheduleResult;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.enums.TaskStatusEnum;
import com.timebox.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作流接口的出入参映射：DTO 与领域对象互转。
 */
@Component
public class TaskWorkflowViewAssembler {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final String END_OF_DAY = "24:00";

    public TaskSummaryDTO toTaskSummaryDTO(TaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskSummaryDTO dto = new TaskSummaryDTO();
        dto.setId(task.getId());
        dto.setName(task.getName());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setProjectId(task.getProjectId());
        dto.setGenreId(task.getGenreId());
        dto.setParentTaskId(task.getParentTaskId());
        dto.setDecompositionLevel(task.getDecompositionLevel());
        dto.setEstimatedHours(task.getEstimatedHours());
        dto.setDeadline(task.getDeadline());
        return dto;
    }

    public List<TaskSummaryDTO> toTaskSummaryDTOs(List<TaskEntity> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return Collections.emptyList();
        }
        return tasks.stream().map(this::toTaskSummaryDTO).collect(Collectors.toList());
    }

    public TaskDependenciesDTO toDependenciesDTO(DependencyView view) {
        TaskDependenciesDTO dto = new TaskDependenciesDTO();
        dto.setTaskId(view.task().getId());
        dto.setDependsOn(toTaskSummaryDTOs(view.dependsOn()));
        dto.setBlocking(toTaskSummaryDTOs(view.blocking()));
        return dto;
    }

    public TaskDraft toDraft(SubtaskSpecDTO spec) {
        if (spec == null) {
            return null;
        }
        return TaskDraft.builder()
                .name(spec.getName())
                .genreId(spec.getGenreId())
                .estimatedHours(spec.getEstimatedHours())
                .allocatedHours(spec.getAllocatedHours())
                .priority(spec.getPriority())
                .wantLevel(spec.getWantLevel())
                .deadline(spec.getDeadline())
                .splittable(spec.getSplittable())
                .minWorkUnit(spec.getMinWorkUnit())
                .note(spec.getNote())
                .dependsOnIndices(spec.getDependsOnIndices())
                .build();
    }

    public TaskDraft toDraft(TaskSpecDTO spec) {
        if (spec == null) {
            return null;
        }
        return TaskDraft.builder()
                .name(spec.getName())
                .genreId(spec.getGenreId())
                .estimatedHours(spec.getEstimatedHours())
                .priority(spec.getPriority())
                .wantLevel(spec.getWantLevel())
                .deadline(spec.getDeadline())
                .splittable(spec.getSplittable())
                .minWorkUnit(spec.getMinWorkUnit())
                .note(spec.getNote())
                .dependsOnIndices(spec.getDependsOnIndices())
                .build();
    }

    public List<TaskDraft> toSubtaskDrafts(List<SubtaskSpecDTO> specs) {
        if (specs == null) {
            return Collections.emptyList();
        }
        return specs.stream().map(this::toDraft).collect(Collectors.toList());
    }

    public List<TaskDraft> toTaskDrafts(List<TaskSpecDTO> specs) {
        if (specs == null) {
            return Collections.emptyList();
        }
        return specs.stream().map(this::toDraft).collect(Collectors.toList());
    }

    /**
     * 合并时不使用批次下标依赖，直接丢弃。
     */
    public TaskDraft toMergedDraft(TaskSpecDTO spec) {
        TaskDraft draft = toDraft(spec);
        if (draft != null) {
            draft.setDependsOnIndices(null);
        }
        return draft;
    }

    public TaskPatch toPatch(TaskPatchRequestDTO request) {
        if (request == null) {
            return TaskPatch.builder().build();
        }
        TaskStatusEnum status = null;
        if (request.getStatus() != null) {
            try {
                status = TaskStatusEnum.fromCode(request.getStatus());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "未知的任务状态: " + request.getStatus());
            }
        }
        return TaskPatch.builder()
                .name(request.getName())
                .genreId(request.getGenreId())
                .status(status)
                .deadline(request.getDeadline())
                .estimatedHours(request.getEstimatedHours())
                .priority(request.getPriority())
                .wantLevel(request.getWantLevel())
                .splittable(request.getSplittable())
                .minWorkUnit(request.getMinWorkUnit())
                .note(request.getNote())
                .clearFields(toClearFields(request.getClearFields()))
                .build();
    }

    private Set<TaskPatch.ClearableField> toClearFields(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return Collections.emptySet();
        }
        Set<TaskPatch.ClearableField> fields = EnumSet.noneOf(TaskPatch.ClearableField.class);
        for (String code : codes) {
            try {
                fields.add(TaskPatch.ClearableField.fromCode(StringUtils.trimToEmpty(code)));
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "字段不能置空: " + code);
            }
        }
        return fields;
    }

    public TaskBreakdownResponseDTO toBreakdownResponseDTO(BreakdownResult result) {
        TaskBreakdownResponseDTO dto = new TaskBreakdownResponseDTO();
        dto.setOriginalTask(toTaskSummaryDTO(result.originalTask()));
        dto.setCreatedTasks(toTaskSummaryDTOs(result.createdTasks()));
        dto.setDependenciesTransferred(result.dependenciesTransferred());
        AllocationSummaryDTO summary = new AllocationSummaryDTO();
        summary.setTimeEntriesAllocated(result.allocationSummary().timeEntriesAllocated());
        summary.setSchedulesAllocated(result.allocationSummary().schedulesAllocated());
        summary.setTotalTimeMinutesAllocated(result.allocationSummary().totalTimeMinutesAllocated());
        summary.setUnallocatedTimeMinutes(result.allocationSummary().unallocatedTimeMinutes());
        summary.setTotalScheduleHoursAllocated(result.allocationSummary().totalScheduleHoursAllocated());
        dto.setAllocationSummary(summary);
        dto.setReason(result.reason());
        return dto;
    }

    public TaskMergeResponseDTO toMergeResponseDTO(MergeResult result) {
        TaskMergeResponseDTO dto = new TaskMergeResponseDTO();
        dto.setMergedTask(toTaskSummaryDTO(result.mergedTask()));
        dto.setArchivedTasks(result.archivedTaskIds());
        dto.setTimeEntriesTransferred(result.timeEntriesTransferred());
        dto.setSchedulesTransferred(result.schedulesTransferred());
        dto.setDependenciesMerged(result.dependenciesMerged());
        dto.setReason(result.reason());
        return dto;
    }

    public BulkCreateResponseDTO toBulkCreateResponseDTO(BulkCreateResult result) {
        BulkCreateResponseDTO dto = new BulkCreateResponseDTO();
        dto.setCreatedTasks(toTaskSummaryDTOs(result.createdTasks()));
        dto.setDependenciesCreated(result.dependenciesCreated());
        return dto;
    }

    /**
     * 未提供的偏好项沿用默认值。
     */
    public SchedulePreferences toPreferences(WeeklyScheduleRequestDTO.Preferences request) {
        SchedulePreferences preferences = SchedulePreferences.defaults();
        if (request == null) {
            return preferences;
        }
        WeeklyScheduleRequestDTO.DailyHours daily = request.getDailyHours();
        if (daily != null) {
            Map<DayOfWeek, BigDecimal> hours = new EnumMap<>(preferences.getDailyHours());
            putIfPresent(hours, DayOfWeek.MONDAY, daily.getMon());
            putIfPresent(hours, DayOfWeek.TUESDAY, daily.getTue());
            putIfPresent(hours, DayOfWeek.WEDNESDAY, daily.getWed());
            putIfPresent(hours, DayOfWeek.THURSDAY, daily.getThu());
            putIfPresent(hours, DayOfWeek.FRIDAY, daily.getFri());
            putIfPresent(hours, DayOfWeek.SATURDAY, daily.getSat());
            putIfPresent(hours, DayOfWeek.SUNDAY, daily.getSun());
            preferences.setDailyHours(hours);
        }
        if (request.getMaxHoursPerTaskPerDay() != null) {
            preferences.setMaxHoursPerTaskPerDay(request.getMaxHoursPerTaskPerDay());
        }
        if (request.getAvoidContextSwitch() != null) {
            preferences.setAvoidContextSwitch(request.getAvoidContextSwitch());
        }
        preferences.setFocusProjectId(request.getFocusProjectId());
        return preferences;
    }

    public List<FixedEvent> toFixedEvents(List<WeeklyScheduleRequestDTO.FixedEvent> events) {
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        List<FixedEvent> result = new ArrayList<>(events.size());
        for (WeeklyScheduleRequestDTO.FixedEvent event : events) {
            if (event != null) {
                result.add(new FixedEvent(event.getDate(), event.getStartTime(), event.getEndTime(), event.getTitle()));
            }
        }
        return result;
    }

    public WeeklyScheduleResponseDTO toWeeklyScheduleResponseDTO(WeeklyScheduleResult result) {
        WeeklyScheduleResponseDTO dto = new WeeklyScheduleResponseDTO();
        dto.setWeekStart(result.weekStart());
        dto.setWeekEnd(result.weekEnd());
        dto.setSchedules(result.schedules().stream().map(this::toScheduleEntryDTO).collect(Collectors.toList()));
        dto.setSummary(toScheduleSummaryDTO(result.summary()));
        dto.setWarnings(result.warnings());
        return dto;
    }

    private ScheduleEntryDTO toScheduleEntryDTO(GeneratedBlock generated) {
        ScheduleBlockEntity block = generated.block();
        SchedulableTask task = generated.task();
        ScheduleEntryDTO dto = new ScheduleEntryDTO();
        dto.setId(block.getId());
        dto.setTaskId(block.getTaskId());
        if (task != null) {
            dto.setTaskName(task.getName());
            dto.setProjectName(task.getProjectName());
            dto.setGenreName(task.getGenreName());
        }
        dto.setDate(block.getScheduledDate());
        dto.setStartTime(block.getStartTime() == null ? null : block.getStartTime().format(TIME_FORMAT));
        dto.setEndTime(formatEndTime(block.getEndTime()));
        dto.setAllocatedHours(block.getAllocatedHours());
        dto.setGeneratedByAi(block.isAiGenerated());
        dto.setReasoning(generated.reasoning());
        return dto;
    }

    private ScheduleSummaryDTO toScheduleSummaryDTO(ScheduleSummary summary) {
        ScheduleSummaryDTO dto = new ScheduleSummaryDTO();
        dto.setTotalPlannedHours(summary.totalPlannedHours());
        dto.setByProject(toBuckets(summary.byProject()));
        dto.setByGenre(toBuckets(summary.byGenre()));
        return dto;
    }

    private List<ScheduleSummaryDTO.HoursBucket> toBuckets(List<ScheduleSummary.HoursBucket> buckets) {
        if (buckets == null) {
            return Collections.emptyList();
        }
        List<ScheduleSummaryDTO.HoursBucket> result = new ArrayList<>(buckets.size());
        for (ScheduleSummary.HoursBucket bucket : buckets) {
            ScheduleSummaryDTO.HoursBucket dto = new ScheduleSummaryDTO.HoursBucket();
            dto.setId(bucket.id());
            dto.setName(bucket.name());
            dto.setHours(bucket.hours());
            result.add(dto);
        }
        return result;
    }

    // 结束时间 00:00 表示当天结束
    private String formatEndTime(LocalTime endTime) {
        if (endTime == null) {
            return null;
        }
        return LocalTime.MIDNIGHT.equals(endTime) ? END_OF_DAY : endTime.format(TIME_FORMAT);
    }

    private void putIfPresent(Map<DayOfWeek, BigDecimal> hours, DayOfWeek day, BigDecimal value) {
        if (value != null) {
            hours.put(day, value);
        }
    }
}
