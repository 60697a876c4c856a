package com.timebox.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 排程块状态枚举
 */
public enum ScheduleStatusEnum {

    /** 已排程 */
    SCHEDULED("scheduled"),

    /** 已完成 */
    COMPLETED("completed"),

    /** 已跳过 */
    SKIPPED("skipped");

    private final String code;

    ScheduleStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ScheduleStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ScheduleStatusEnum status : ScheduleStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown schedule status code: " + code);
    }
}
