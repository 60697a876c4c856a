package com.timebox.domain.task.model.valobj;

import com.timebox.domain.task.model.entity.TaskEntity;
import com.timebox.types.enums.TaskStatusEnum;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * 任务局部更新。字段为 null 表示调用方未提供，合并时保持原值；
 * 可空字段需要置空时放入 clearFields。
 */
@Getter
@Builder
public class TaskPatch {

    private final String name;
    private final Long genreId;
    private final TaskStatusEnum status;
    private final LocalDate deadline;
    private final BigDecimal estimatedHours;
    private final String priority;
    private final String wantLevel;
    private final Boolean splittable;
    private final BigDecimal minWorkUnit;
    private final String note;
    private final Set<ClearableField> clearFields;

    public boolean isEmpty() {
        return name == null && genreId == null && status == null && deadline == null
                && estimatedHours == null && priority == null && wantLevel == null
                && splittable == null && minWorkUnit == null && note == null
                && (clearFields == null || clearFields.isEmpty());
    }

    public boolean clears(ClearableField field) {
        return clearFields != null && clearFields.contains(field);
    }

    /**
     * 同一字段既赋值又置空时返回该字段，否则返回 null。
     */
    public ClearableField conflictingField() {
        if (clears(ClearableField.GENRE) && genreId != null) {
            return ClearableField.GENRE;
        }
        if (clears(ClearableField.DEADLINE) && deadline != null) {
            return ClearableField.DEADLINE;
        }
        if (clears(ClearableField.ESTIMATED_HOURS) && estimatedHours != null) {
            return ClearableField.ESTIMATED_HOURS;
        }
        if (clears(ClearableField.NOTE) && note != null) {
            return ClearableField.NOTE;
        }
        return null;
    }

    /**
     * 将已提供的字段逐一合并到实体上，返回实际变更的字段数。
     */
    public int applyTo(TaskEntity task) {
        int changed = 0;
        if (name != null) {
            task.setName(name);
            changed++;
        }
        if (genreId != null) {
            task.setGenreId(genreId);
            changed++;
        }
        if (status != null) {
            task.setStatus(status);
            changed++;
        }
        if (deadline != null) {
            task.setDeadline(deadline);
            changed++;
        }
        if (estimatedHours != null) {
            task.setEstimatedHours(estimatedHours);
            changed++;
        }
        if (priority != null) {
            task.setPriority(priority);
            changed++;
        }
        if (wantLevel != null) {
            task.setWantLevel(wantLevel);
            changed++;
        }
        if (splittable != null) {
            task.setSplittable(splittable);
            changed++;
        }
        if (minWorkUnit != null) {
            task.setMinWorkUnit(minWorkUnit);
            changed++;
        }
        if (note != null) {
            task.setNote(note);
            changed++;
        }
        if (clears(ClearableField.GENRE)) {
            task.setGenreId(null);
            changed++;
        }
        if (clears(ClearableField.DEADLINE)) {
            task.setDeadline(null);
            changed++;
        }
        if (clears(ClearableField.ESTIMATED_HOURS)) {
            task.setEstimatedHours(null);
            changed++;
        }
        if (clears(ClearableField.NOTE)) {
            task.setNote(null);
            changed++;
        }
        return changed;
    }

    /**
     * 允许置空的字段，code 与请求体中的字段名一致。
     */
    @Getter
    public enum ClearableField {

        GENRE("genreId"),
        DEADLINE("deadline"),
        ESTIMATED_HOURS("estimatedHours"),
        NOTE("note");

        private final String code;

        ClearableField(String code) {
            this.code = code;
        }

        public static ClearableField fromCode(String code) {
            for (ClearableField field : values()) {
                if (field.code.equals(code)) {
                    return field;
                }
            }
            throw new IllegalArgumentException("Unknown clearable field: " + code);
        }
    }
}
