/**
 * 任务领域：任务、依赖边与工时记录，以及依赖图环检测和拆分比例分配的纯领域规则。
 * <p>
 * 仓储端口位于 {@code adapter.repository}，由基础设施层实现；领域服务不直接访问仓储。
 * </p>
 */
package com.timebox.domain.task;
