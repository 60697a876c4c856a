package com.timebox.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务拆分时后继依赖（原任务阻塞的任务）的转移策略。
 * <p>
 * 前置依赖总是扇出到全部子任务；该枚举只决定后继依赖由哪些子任务承接。
 * </p>
 */
public enum DependencyTransferModeEnum {

    /**
     * 仅由最后一个子任务阻塞后继任务，子任务视为顺序执行。
     */
    TO_LAST("to_last"),

    /**
     * 每个子任务都阻塞后继任务。
     */
    TO_ALL("to_all");

    private final String code;

    DependencyTransferModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DependencyTransferModeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (DependencyTransferModeEnum mode : DependencyTransferModeEnum.values()) {
            if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown dependency transfer mode: " + code);
    }
}
