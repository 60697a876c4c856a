package com.timebox.test.support;

import com.timebox.domain.task.adapter.repository.ITaskDependencyRepository;
import com.timebox.domain.task.model.entity.DependencyEdgeEntity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存依赖边仓储，按写入顺序保存。
 */
public class InMemoryTaskDependencyRepository implements ITaskDependencyRepository {

    private final List<DependencyEdgeEntity> edges = new ArrayList<>();

    @Override
    public void save(DependencyEdgeEntity edge) {
        if (exists(edge.getTaskId(), edge.getDependsOnTaskId())) {
            throw new IllegalStateException("duplicate edge " + edge.getTaskId() + " -> " + edge.getDependsOnTaskId());
        }
        edges.add(new DependencyEdgeEntity(edge.getTaskId(), edge.getDependsOnTaskId(), LocalDateTime.now()));
    }

    @Override
    public boolean exists(Long taskId, Long dependsOnTaskId) {
        return edges.stream().anyMatch(edge -> matches(edge, taskId, dependsOnTaskId));
    }

    @Override
    public boolean delete(Long taskId, Long dependsOnTaskId) {
        return edges.removeIf(edge -> matches(edge, taskId, dependsOnTaskId));
    }

    @Override
    public List<DependencyEdgeEntity> findByTaskId(Long taskId) {
        return edges.stream()
                .filter(edge -> Objects.equals(taskId, edge.getTaskId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<DependencyEdgeEntity> findByDependsOnTaskId(Long dependsOnTaskId) {
        return edges.stream()
                .filter(edge -> Objects.equals(dependsOnTaskId, edge.getDependsOnTaskId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<DependencyEdgeEntity> findWithin(Collection<Long> taskIds) {
        return edges.stream()
                .filter(edge -> taskIds.contains(edge.getTaskId()) && taskIds.contains(edge.getDependsOnTaskId()))
                .collect(Collectors.toList());
    }

    /**
     * 直接写入一条边，不做任何校验，用于准备测试数据。
     */
    public void seed(Long taskId, Long dependsOnTaskId) {
        edges.add(DependencyEdgeEntity.of(taskId, dependsOnTaskId));
    }

    public List<DependencyEdgeEntity> findAll() {
        return new ArrayList<>(edges);
    }

    public int size() {
        return edges.size();
    }

    private boolean matches(DependencyEdgeEntity edge, Long taskId, Long dependsOnTaskId) {
        return Objects.equals(taskId, edge.getTaskId()) && Objects.equals(dependsOnTaskId, edge.getDependsOnTaskId());
    }
}
