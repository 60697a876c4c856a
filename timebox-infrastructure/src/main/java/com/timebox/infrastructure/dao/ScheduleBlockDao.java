package com.timebox.infrastructure.dao;

import com.timebox.infrastructure.dao.po.ScheduleBlockPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * 排程块 DAO。
 */
@Mapper
public interface ScheduleBlockDao {

    int insert(ScheduleBlockPO po);

    List<ScheduleBlockPO> selectByTaskId(@Param("taskId") Long taskId);

    int reassignTask(@Param("fromTaskIds") Collection<Long> fromTaskIds,
                     @Param("toTaskId") Long toTaskId);

    int deleteGeneratedScheduledBetween(@Param("fromDate") LocalDate fromDate,
                                        @Param("toDate") LocalDate toDate);
}
