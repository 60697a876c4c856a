/**
 * 排程领域：排程块、周排程偏好，以及外部推理服务提示词构建、返回解析与约束校验。
 */
package com.timebox.domain.schedule;
