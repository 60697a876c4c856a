package com.timebox.infrastructure.dao;

import com.timebox.infrastructure.dao.po.TaskDurationStatPO;
import com.timebox.infrastructure.dao.po.TimeEntryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 工时记录 DAO。
 */
@Mapper
public interface TimeEntryDao {

    int insert(TimeEntryPO po);

    List<TimeEntryPO> selectByTaskId(@Param("taskId") Long taskId);

    List<TaskDurationStatPO> sumDurationByTaskIds(@Param("taskIds") Collection<Long> taskIds);

    int reassignTask(@Param("fromTaskIds") Collection<Long> fromTaskIds,
                     @Param("toTaskId") Long toTaskId);
}
