package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 任务局部更新请求 DTO，未提供的字段保持不变。
 */
@Data
public class TaskPatchRequestDTO {

    private String name;
    private Long genreId;
    private String status;
    private LocalDate deadline;
    private BigDecimal estimatedHours;
    private String priority;
    private String wantLevel;
    private Boolean splittable;
    private BigDecimal minWorkUnit;
    private String note;

    /**
     * 需要置空的可空字段：genreId、deadline、estimatedHours、note
     */
    private List<String> clearFields;
}
