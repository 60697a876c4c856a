package com.timebox.infrastructure.repository.task;

import com.timebox.domain.task.adapter.repository.ITimeEntryRepository;
import com.timebox.domain.task.model.entity.TimeEntryEntity;
import com.timebox.infrastructure.dao.TimeEntryDao;
import com.timebox.infrastructure.dao.po.TaskDurationStatPO;
import com.timebox.infrastructure.dao.po.TimeEntryPO;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 工时记录仓储实现。
 */
@Repository
public class TimeEntryRepositoryImpl implements ITimeEntryRepository {

    private final TimeEntryDao timeEntryDao;

    public TimeEntryRepositoryImpl(TimeEntryDao timeEntryDao) {
        this.timeEntryDao = timeEntryDao;
    }

    @Override
    public TimeEntryEntity save(TimeEntryEntity entity) {
        TimeEntryPO po = toPO(entity);
        timeEntryDao.insert(po);
        entity.setId(po.getId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    @Override
    public List<TimeEntryEntity> findByTaskId(Long taskId) {
        List<TimeEntryPO> rows = timeEntryDao.selectByTaskId(taskId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public Map<Long, Long> sumDurationMinutesByTaskIds(Collection<Long> taskIds) {
        Map<Long, Long> result = new HashMap<>();
        if (taskIds == null || taskIds.isEmpty()) {
            return result;
        }
        List<TaskDurationStatPO> rows = timeEntryDao.sumDurationByTaskIds(taskIds);
        if (rows == null) {
            return result;
        }
        for (TaskDurationStatPO row : rows) {
            if (row.getTaskId() != null) {
                result.put(row.getTaskId(), row.getTotalMinutes() == null ? 0L : row.getTotalMinutes());
            }
        }
        return result;
    }

    @Override
    public int reassignTask(Collection<Long> fromTaskIds, Long toTaskId) {
        if (fromTaskIds == null || fromTaskIds.isEmpty()) {
            return 0;
        }
        return timeEntryDao.reassignTask(fromTaskIds, toTaskId);
    }

    private TimeEntryEntity toEntity(TimeEntryPO po) {
        TimeEntryEntity entity = new TimeEntryEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setStartTime(po.getStartTime());
        entity.setEndTime(po.getEndTime());
        entity.setDurationMinutes(po.getDurationMinutes());
        entity.setNote(po.getNote());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private TimeEntryPO toPO(TimeEntryEntity entity) {
        return TimeEntryPO.builder()
                .id(entity.getId())
                .taskId(entity.getTaskId())
                .startTime(entity.getStartTime())
                .endTime(entity.getEndTime())
                .durationMinutes(entity.getDurationMinutes())
                .note(entity.getNote())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
