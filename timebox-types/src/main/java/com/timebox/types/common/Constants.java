package com.timebox.types.common;

import java.math.BigDecimal;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 任务优先级默认值 */
    public final static String DEFAULT_PRIORITY = "中";

    /** 任务意愿度默认值 */
    public final static String DEFAULT_WANT_LEVEL = "中";

    /** 最小工作单元默认值（小时） */
    public final static BigDecimal DEFAULT_MIN_WORK_UNIT = new BigDecimal("0.5");

    /** 未归属项目/类别时的汇总标签 */
    public final static String UNCATEGORIZED = "未分类";

}
