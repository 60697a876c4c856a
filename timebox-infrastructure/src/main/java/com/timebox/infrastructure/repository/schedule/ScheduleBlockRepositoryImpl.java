package com.timebox.infrastructure.repository.schedule;

import com.timebox.domain.schedule.adapter.repository.IScheduleBlockRepository;
import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;
import com.timebox.infrastructure.dao.ScheduleBlockDao;
import com.timebox.infrastructure.dao.po.ScheduleBlockPO;
import com.timebox.types.enums.ScheduleStatusEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 排程块仓储实现。
 */
@Repository
public class ScheduleBlockRepositoryImpl implements IScheduleBlockRepository {

    private final ScheduleBlockDao scheduleBlockDao;

    public ScheduleBlockRepositoryImpl(ScheduleBlockDao scheduleBlockDao) {
        this.scheduleBlockDao = scheduleBlockDao;
    }

    @Override
    public ScheduleBlockEntity save(ScheduleBlockEntity entity) {
        ScheduleBlockPO po = toPO(entity);
        scheduleBlockDao.insert(po);
        entity.setId(po.getId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    @Override
    public List<ScheduleBlockEntity> findByTaskId(Long taskId) {
        List<ScheduleBlockPO> rows = scheduleBlockDao.selectByTaskId(taskId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public int reassignTask(Collection<Long> fromTaskIds, Long toTaskId) {
        if (fromTaskIds == null || fromTaskIds.isEmpty()) {
            return 0;
        }
        return scheduleBlockDao.reassignTask(fromTaskIds, toTaskId);
    }

    @Override
    public int deleteGeneratedScheduledBetween(LocalDate from, LocalDate to) {
        return scheduleBlockDao.deleteGeneratedScheduledBetween(from, to);
    }

    private ScheduleBlockEntity toEntity(ScheduleBlockPO po) {
        ScheduleBlockEntity entity = new ScheduleBlockEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setScheduledDate(po.getScheduledDate());
        entity.setStartTime(po.getStartTime());
        entity.setEndTime(po.getEndTime());
        entity.setAllocatedHours(po.getAllocatedHours());
        entity.setGeneratedByAi(po.getIsGeneratedByAi());
        entity.setStatus(ScheduleStatusEnum.fromCode(po.getStatus()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private ScheduleBlockPO toPO(ScheduleBlockEntity entity) {
        return ScheduleBlockPO.builder()
                .id(entity.getId())
                .taskId(entity.getTaskId())
                .scheduledDate(entity.getScheduledDate())
                .startTime(entity.getStartTime())
                .endTime(entity.getEndTime())
                .allocatedHours(entity.getAllocatedHours())
                .isGeneratedByAi(entity.getGeneratedByAi())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
