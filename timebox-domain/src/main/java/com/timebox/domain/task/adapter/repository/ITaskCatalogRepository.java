package com.timebox.domain.task.adapter.repository;

import java.util.Collection;
import java.util.Map;

/**
 * 项目与类别名称的只读查询接口。
 */
public interface ITaskCatalogRepository {

    Map<Long, String> findProjectNames(Collection<Long> projectIds);

    Map<Long, String> findGenreNames(Collection<Long> genreIds);
}
