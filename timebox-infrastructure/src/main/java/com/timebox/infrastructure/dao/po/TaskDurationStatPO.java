package com.timebox.infrastructure.dao.po;

import lombok.Data;

/**
 * 任务累计工时统计 PO。
 */
@Data
public class TaskDurationStatPO {

    private Long taskId;
    private Long totalMinutes;
}
