package com.timebox.domain.schedule.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 固定日程：排程时需要避开的时间段，时间格式为 HH:mm。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedEvent {

    private LocalDate date;

    private String startTime;

    private String endTime;

    private String title;
}
