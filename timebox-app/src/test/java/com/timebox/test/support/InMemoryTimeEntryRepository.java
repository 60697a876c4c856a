package com.timebox.test.support;

import com.timebox.domain.task.adapter.repository.ITimeEntryRepository;
import com.timebox.domain.task.model.entity.TimeEntryEntity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存工时记录仓储。
 */
public class InMemoryTimeEntryRepository implements ITimeEntryRepository {

    private final List<TimeEntryEntity> entries = new ArrayList<>();
    private long nextId = 1;

    @Override
    public TimeEntryEntity save(TimeEntryEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        entries.add(entity);
        return entity;
    }

    @Override
    public List<TimeEntryEntity> findByTaskId(Long taskId) {
        return entries.stream()
                .filter(entry -> Objects.equals(taskId, entry.getTaskId()))
                .collect(Collectors.toList());
    }

    @Override
    public Map<Long, Long> sumDurationMinutesByTaskIds(Collection<Long> taskIds) {
        Map<Long, Long> minutes = new HashMap<>();
        for (TimeEntryEntity entry : entries) {
            if (taskIds.contains(entry.getTaskId())) {
                minutes.merge(entry.getTaskId(), (long) entry.resolveDurationMinutes(), Long::sum);
            }
        }
        return minutes;
    }

    @Override
    public int reassignTask(Collection<Long> fromTaskIds, Long toTaskId) {
        int moved = 0;
        for (TimeEntryEntity entry : entries) {
            if (fromTaskIds.contains(entry.getTaskId())) {
                entry.setTaskId(toTaskId);
                moved++;
            }
        }
        return moved;
    }

    public List<TimeEntryEntity> findAll() {
        return new ArrayList<>(entries);
    }
}
