package com.timebox.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 */
public enum TaskStatusEnum {

    /**
     * 待办
     */
    TODO("todo"),

    /**
     * 进行中
     */
    DOING("doing"),

    /**
     * 等待中 - 等待外部条件或前置任务
     */
    WAITING("waiting"),

    /**
     * 已完成
     */
    DONE("done"),

    /**
     * 已归档 - 除作为依赖/合并来源外不可再修改
     */
    ARCHIVE("archive");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否可参与周排程。
     */
    public boolean isSchedulable() {
        return this == TODO || this == DOING || this == WAITING;
    }

    @JsonCreator
    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
