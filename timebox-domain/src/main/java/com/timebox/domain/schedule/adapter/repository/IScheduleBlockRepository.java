package com.timebox.domain.schedule.adapter.repository;

import com.timebox.domain.schedule.model.entity.ScheduleBlockEntity;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * 排程块仓储接口
 */
public interface IScheduleBlockRepository {

    ScheduleBlockEntity save(ScheduleBlockEntity entity);

    List<ScheduleBlockEntity> findByTaskId(Long taskId);

    int reassignTask(Collection<Long> fromTaskIds, Long toTaskId);

    /**
     * 删除日期区间 [from, to] 内由 AI 生成且仍为 scheduled 状态的排程块。
     */
    int deleteGeneratedScheduledBetween(LocalDate from, LocalDate to);
}
