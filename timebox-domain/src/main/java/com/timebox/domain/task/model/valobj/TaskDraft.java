package com.timebox.domain.task.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 待创建任务的描述，用于拆分、合并与批量创建。
 * <p>
 * dependsOnIndices 指向同一批次内其他草稿的下标；allocatedHours 仅在拆分时作为比例覆盖值。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDraft {

    private String name;

    private Long genreId;

    private BigDecimal estimatedHours;

    private BigDecimal allocatedHours;

    private String priority;

    private String wantLevel;

    private LocalDate deadline;

    private Boolean splittable;

    private BigDecimal minWorkUnit;

    private String note;

    private List<Integer> dependsOnIndices;
}
