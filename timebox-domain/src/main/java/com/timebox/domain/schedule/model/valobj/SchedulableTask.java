package com.timebox.domain.schedule.model.valobj;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 可排程任务快照：非终态且剩余工时大于 0 的任务。
 */
@Data
@Builder
public class SchedulableTask {

    private Long id;
    private String name;
    private Long projectId;
    private String projectName;
    private Long genreId;
    private String genreName;
    private String priority;
    private String wantLevel;
    private LocalDate deadline;
    private BigDecimal estimatedHours;
    private BigDecimal actualHours;
    private BigDecimal remainingHours;
    private boolean splittable;
    private BigDecimal minWorkUnit;
}
