package com.timebox.domain.task.adapter.repository;

import com.timebox.domain.task.model.entity.TimeEntryEntity;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 工时记录仓储接口
 */
public interface ITimeEntryRepository {

    TimeEntryEntity save(TimeEntryEntity entity);

    List<TimeEntryEntity> findByTaskId(Long taskId);

    /**
     * 统计各任务累计工时（分钟），无记录的任务不出现在结果中。
     */
    Map<Long, Long> sumDurationMinutesByTaskIds(Collection<Long> taskIds);

    /**
     * 将来源任务下的全部工时记录整体改挂到目标任务。
     */
    int reassignTask(Collection<Long> fromTaskIds, Long toTaskId);
}
