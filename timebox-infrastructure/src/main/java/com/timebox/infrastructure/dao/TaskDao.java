package com.timebox.infrastructure.dao;

import com.timebox.infrastructure.dao.po.TaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 任务 DAO。
 */
@Mapper
public interface TaskDao {

    int insert(TaskPO po);

    int update(TaskPO po);

    TaskPO selectById(@Param("id") Long id);

    List<TaskPO> selectByIds(@Param("ids") Collection<Long> ids);

    List<TaskPO> selectByStatuses(@Param("statuses") Collection<String> statuses);

    int countChildren(@Param("parentTaskId") Long parentTaskId);

    int updateStatusByIds(@Param("ids") Collection<Long> ids,
                          @Param("status") String status);
}
