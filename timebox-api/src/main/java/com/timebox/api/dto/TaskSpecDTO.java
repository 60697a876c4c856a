package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 任务规格 DTO，用于合并后的新任务与批量创建。
 */
@Data
public class TaskSpecDTO {

    private String name;
    private Long genreId;
    private BigDecimal estimatedHours;
    private String priority;
    private String wantLevel;
    private LocalDate deadline;
    private Boolean splittable;
    private BigDecimal minWorkUnit;
    private String note;

    /**
     * 批量创建时依赖的同批次任务下标，合并时忽略
     */
    private List<Integer> dependsOnIndices;
}
