package com.timebox.domain.task.model.entity;

import com.timebox.types.enums.TaskStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 任务领域实体
 */
@Data
public class TaskEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 任务名称
     */
    private String name;

    /**
     * 所属项目 ID
     */
    private Long projectId;

    /**
     * 类别 ID
     */
    private Long genreId;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 截止日期
     */
    private LocalDate deadline;

    /**
     * 预估工时（小时）
     */
    private BigDecimal estimatedHours;

    /**
     * 优先级（高/中/低）
     */
    private String priority;

    /**
     * 意愿度（高/中/低）
     */
    private String wantLevel;

    /**
     * 是否可拆分到多个时间段
     */
    private Boolean splittable;

    /**
     * 最小工作单元（小时）
     */
    private BigDecimal minWorkUnit;

    /**
     * 父任务 ID，由拆分流程写入
     */
    private Long parentTaskId;

    /**
     * 拆分层级，根任务为 0
     */
    private Integer decompositionLevel;

    /**
     * 备注
     */
    private String note;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 项目名称（只读，查询时关联填充）
     */
    private String projectName;

    /**
     * 类别名称（只读，查询时关联填充）
     */
    private String genreName;

    public boolean isArchived() {
        return status == TaskStatusEnum.ARCHIVE;
    }

    public int resolveDecompositionLevel() {
        return decompositionLevel == null ? 0 : decompositionLevel;
    }
}
