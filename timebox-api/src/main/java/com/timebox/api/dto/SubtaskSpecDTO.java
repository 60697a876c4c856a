package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 拆分子任务规格 DTO
 */
@Data
public class SubtaskSpecDTO {

    private String name;

    private BigDecimal estimatedHours;

    /**
     * 手动指定的分配工时，优先于 estimatedHours 参与比例计算
     */
    private BigDecimal allocatedHours;

    /**
     * 为空时继承父任务
     */
    private Long genreId;

    private String priority;

    private String wantLevel;

    /**
     * 为空时继承父任务
     */
    private LocalDate deadline;

    private Boolean splittable;

    private BigDecimal minWorkUnit;

    private String note;

    /**
     * 同批次内依赖的子任务下标
     */
    private List<Integer> dependsOnIndices;
}
