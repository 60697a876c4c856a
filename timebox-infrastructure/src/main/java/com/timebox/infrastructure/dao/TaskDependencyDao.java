package com.timebox.infrastructure.dao;

import com.timebox.infrastructure.dao.po.TaskDependencyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 任务依赖边 DAO。
 */
@Mapper
public interface TaskDependencyDao {

    int insert(TaskDependencyPO po);

    int count(@Param("taskId") Long taskId,
              @Param("dependsOnTaskId") Long dependsOnTaskId);

    int delete(@Param("taskId") Long taskId,
               @Param("dependsOnTaskId") Long dependsOnTaskId);

    List<TaskDependencyPO> selectByTaskId(@Param("taskId") Long taskId);

    List<TaskDependencyPO> selectByDependsOnTaskId(@Param("dependsOnTaskId") Long dependsOnTaskId);

    List<TaskDependencyPO> selectWithin(@Param("taskIds") Collection<Long> taskIds);
}
