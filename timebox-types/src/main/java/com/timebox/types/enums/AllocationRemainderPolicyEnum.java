package com.timebox.types.enums;

/**
 * 按比例分配时截断余数的处理策略。
 */
public enum AllocationRemainderPolicyEnum {

    /**
     * 各子任务向下取整，余数不分配给任何子任务，只在结果中报告。
     */
    DISCARD,

    /**
     * 余数补给最后一个获得分配的子任务，分配总和与原值相等。
     */
    ASSIGN_TO_LAST;

    public static AllocationRemainderPolicyEnum fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return DISCARD;
        }
        for (AllocationRemainderPolicyEnum policy : values()) {
            if (policy.name().equalsIgnoreCase(name.trim().replace('-', '_'))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown allocation remainder policy: " + name);
    }
}
