package com.timebox.domain.schedule.model.valobj;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 从推理服务返回中解析出的单条排程建议。
 *
 * @param startTime 可为空
 * @param endTime 可为空；"24:00" 解析为 00:00，表示当天结束
 */
public record ProposedScheduleEntry(Long taskId,
                                    LocalDate date,
                                    LocalTime startTime,
                                    LocalTime endTime,
                                    BigDecimal allocatedHours,
                                    String reasoning) {
}
