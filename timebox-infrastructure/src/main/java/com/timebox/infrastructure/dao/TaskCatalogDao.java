package com.timebox.infrastructure.dao;

import com.timebox.infrastructure.dao.po.CatalogNamePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 项目/类别名称只读 DAO。
 */
@Mapper
public interface TaskCatalogDao {

    List<CatalogNamePO> selectProjectNames(@Param("ids") Collection<Long> ids);

    List<CatalogNamePO> selectGenreNames(@Param("ids") Collection<Long> ids);
}
