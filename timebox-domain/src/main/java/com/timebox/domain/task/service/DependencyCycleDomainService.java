package com.timebox.domain.task.service;

import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 依赖图环检测领域服务。
 * <p>
 * 依赖边方向为 task → dependsOn。所有遍历都使用显式栈的迭代 DFS，
 * 配合 visited 与 onPath 两个集合，长依赖链不会触发栈溢出。
 * </p>
 */
@Service
public class DependencyCycleDomainService {

    /**
     * 判断新增 taskId → dependsOnTaskId 是否会闭合环路：
     * 从 dependsOnTaskId 出发沿既有依赖边向外遍历，若能到达 taskId 则拒绝。
     *
     * @param dependencyLookup 返回某任务直接依赖的任务 ID
     */
    public boolean wouldCreateCycle(Long taskId,
                                    Long dependsOnTaskId,
                                    Function<Long, ? extends Collection<Long>> dependencyLookup) {
        if (taskId == null || dependsOnTaskId == null) {
            return false;
        }
        if (Objects.equals(taskId, dependsOnTaskId)) {
            return true;
        }
        return traverse(dependsOnTaskId, taskId, dependencyLookup, new HashSet<>()).targetReached;
    }

    /**
     * 判断整张图（例如按下标引用的子任务依赖）是否含环。
     *
     * @param adjacency 节点 → 其直接依赖节点
     */
    public <T> boolean hasCycle(Map<T, ? extends Collection<T>> adjacency) {
        if (adjacency == null || adjacency.isEmpty()) {
            return false;
        }
        Function<T, Collection<T>> lookup = node -> {
            Collection<T> next = adjacency.get(node);
            return next == null ? Collections.emptyList() : next;
        };
        Set<T> visited = new HashSet<>();
        for (T start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            if (traverse(start, null, lookup, visited).backEdgeFound) {
                return true;
            }
        }
        return false;
    }

    private <T> TraversalResult traverse(T start,
                                         T target,
                                         Function<T, ? extends Collection<T>> lookup,
                                         Set<T> visited) {
        Set<T> onPath = new HashSet<>();
        Deque<Frame<T>> stack = new ArrayDeque<>();
        boolean backEdgeFound = false;

        visited.add(start);
        onPath.add(start);
        stack.push(new Frame<>(start, neighbours(lookup, start)));

        while (!stack.isEmpty()) {
            Frame<T> frame = stack.peek();
            if (!frame.next.hasNext()) {
                onPath.remove(frame.node);
                stack.pop();
                continue;
            }
            T next = frame.next.next();
            if (next == null) {
                continue;
            }
            if (target != null && target.equals(next)) {
                return new TraversalResult(true, backEdgeFound);
            }
            if (onPath.contains(next)) {
                backEdgeFound = true;
                if (target == null) {
                    return new TraversalResult(false, true);
                }
                continue;
            }
            if (visited.add(next)) {
                onPath.add(next);
                stack.push(new Frame<>(next, neighbours(lookup, next)));
            }
        }
        return new TraversalResult(false, backEdgeFound);
    }

    private <T> Iterator<T> neighbours(Function<T, ? extends Collection<T>> lookup, T node) {
        Collection<T> next = lookup.apply(node);
        return next == null ? Collections.emptyIterator() : next.iterator();
    }

    private static final class Frame<T> {
        private final T node;
        private final Iterator<T> next;

        private Frame(T node, Iterator<T> next) {
            this.node = node;
            this.next = next;
        }
    }

    private record TraversalResult(boolean targetReached, boolean backEdgeFound) {
    }
}
