package com.timebox.domain.schedule.model.valobj;

/**
 * 发往外部推理服务的请求：系统指令与结构化上下文。
 */
public record ScheduleReasoningRequest(String systemInstructions, String context) {
}
