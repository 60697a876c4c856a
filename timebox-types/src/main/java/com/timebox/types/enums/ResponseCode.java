package com.timebox.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 每个响应码同时绑定对外暴露的 HTTP 状态码：未找到为 404，业务校验失败为 422，
 * 外部推理服务未配置为 503，外部推理服务异常为 502。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", 200),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", 500),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数", 400),

    /** 资源不存在 */
    NOT_FOUND("0404", "资源不存在", 404),

    /** 通用业务校验失败 */
    VALIDATION_FAILED("1000", "校验失败", 422),

    /** 任务不能依赖自身 */
    SELF_REFERENCE("1001", "任务不能依赖自身", 422),

    /** 依赖关系会形成环 */
    DEPENDENCY_CYCLE("1002", "依赖关系会形成环", 422),

    /** 依赖关系已存在 */
    DEPENDENCY_EXISTS("1003", "依赖关系已存在", 422),

    /** 任务已归档 */
    ALREADY_ARCHIVED("1004", "任务已归档", 422),

    /** 任务已存在子任务 */
    HAS_CHILDREN("1005", "任务已存在子任务", 422),

    /** 任务不属于同一项目 */
    PROJECT_MISMATCH("1006", "任务不属于同一项目", 422),

    /** 下标越界 */
    INDEX_OUT_OF_RANGE("1007", "依赖下标越界", 422),

    /** 输入为空 */
    EMPTY_INPUT("1008", "输入为空", 422),

    /** AI 返回无法解析 */
    UNPARSABLE_AI_RESPONSE("1009", "AI 返回结果无法解析", 422),

    /** AI 服务未配置 */
    AI_SERVICE_UNAVAILABLE("2001", "AI 服务未配置", 503),

    /** AI 服务暂时不可用，可重试 */
    AI_SERVICE_TRANSIENT("2002", "AI 服务暂时不可用", 502),

    /** AI 服务调用失败 */
    AI_SERVICE_ERROR("2003", "AI 服务调用失败", 502);

    private final String code;
    private final String info;
    private final int httpStatus;

    ResponseCode(String code, String info, int httpStatus) {
        this.code = code;
        this.info = info;
        this.httpStatus = httpStatus;
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return UN_ERROR;
        }
        for (ResponseCode value : ResponseCode.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return UN_ERROR;
    }

}
