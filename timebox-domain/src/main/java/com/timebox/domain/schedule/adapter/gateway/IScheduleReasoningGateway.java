package com.timebox.domain.schedule.adapter.gateway;

import com.timebox.domain.schedule.model.valobj.ScheduleReasoningRequest;

/**
 * 外部推理服务网关：提交排程请求，返回未经解析的原始文本。
 * <p>
 * 失败时抛出 AppException：未配置凭据为 AI_SERVICE_UNAVAILABLE，
 * 限流或网络类可重试错误为 AI_SERVICE_TRANSIENT，其余为 AI_SERVICE_ERROR。
 * </p>
 */
public interface IScheduleReasoningGateway {

    String generate(ScheduleReasoningRequest request);
}
