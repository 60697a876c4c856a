package com.timebox.infrastructure.repository.task;

import com.google.common.cache.Cache;
import com.timebox.domain.task.adapter.repository.ITaskCatalogRepository;
import com.timebox.infrastructure.dao.TaskCatalogDao;
import com.timebox.infrastructure.dao.po.CatalogNamePO;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 项目/类别名称仓储实现，名称经本地缓存短暂复用。
 */
@Repository
public class TaskCatalogRepositoryImpl implements ITaskCatalogRepository {

    private static final String PROJECT_PREFIX = "project:";
    private static final String GENRE_PREFIX = "genre:";

    private final TaskCatalogDao taskCatalogDao;
    private final Cache<String, String> catalogNameCache;

    public TaskCatalogRepositoryImpl(TaskCatalogDao taskCatalogDao,
                                     @Qualifier("catalogNameCache") Cache<String, String> catalogNameCache) {
        this.taskCatalogDao = taskCatalogDao;
        this.catalogNameCache = catalogNameCache;
    }

    @Override
    public Map<Long, String> findProjectNames(Collection<Long> projectIds) {
        return resolve(projectIds, PROJECT_PREFIX, taskCatalogDao::selectProjectNames);
    }

    @Override
    public Map<Long, String> findGenreNames(Collection<Long> genreIds) {
        return resolve(genreIds, GENRE_PREFIX, taskCatalogDao::selectGenreNames);
    }

    private Map<Long, String> resolve(Collection<Long> ids,
                                      String prefix,
                                      Function<Collection<Long>, List<CatalogNamePO>> loader) {
        Map<Long, String> result = new HashMap<>();
        if (ids == null || ids.isEmpty()) {
            return result;
        }
        Set<Long> missing = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id == null) {
                continue;
            }
            String cached = catalogNameCache.getIfPresent(prefix + id);
            if (cached != null) {
                result.put(id, cached);
            } else {
                missing.add(id);
            }
        }
        if (missing.isEmpty()) {
            return result;
        }
        List<CatalogNamePO> rows = loader.apply(missing);
        if (rows == null) {
            return result;
        }
        for (CatalogNamePO row : rows) {
            if (row.getId() == null || row.getName() == null) {
                continue;
            }
            result.put(row.getId(), row.getName());
            catalogNameCache.put(prefix + row.getId(), row.getName());
        }
        return result;
    }
}
