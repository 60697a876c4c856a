package com.timebox.domain.schedule.service;

import com.timebox.domain.schedule.model.valobj.ProposedScheduleEntry;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 推理服务返回解析领域服务：先解码再逐条校验。
 * <p>
 * 只容忍一层外层 Markdown 代码块包裹；整体必须是 JSON 数组，否则视为无法解析。
 * 数组中的单条元素不合法时只丢弃该条并记录原因，不影响其余元素。
 * </p>
 */
@Service
public class ScheduleProposalDomainService {

    private static final String FENCE = "```";
    private static final String JSON_FENCE = "```json";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");
    private static final String END_OF_DAY = "24:00";

    public ProposalParseResult parse(String rawText,
                                     Set<Long> knownTaskIds,
                                     Function<String, Object> jsonParser) {
        if (rawText == null || rawText.trim().isEmpty()) {
            throw new AppException(ResponseCode.UNPARSABLE_AI_RESPONSE, "AI 返回为空");
        }
        String payload = stripFence(rawText.trim());
        Object decoded;
        try {
            decoded = jsonParser.apply(payload);
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.UNPARSABLE_AI_RESPONSE,
                    "AI 返回不是合法 JSON: " + ex.getMessage(), ex);
        }
        if (!(decoded instanceof List<?> items)) {
            throw new AppException(ResponseCode.UNPARSABLE_AI_RESPONSE, "AI 返回不是 JSON 数组");
        }

        List<ProposedScheduleEntry> entries = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            try {
                entries.add(toEntry(item, knownTaskIds));
            } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException ex) {
                dropped.add("#" + i + " " + ex.getMessage());
            }
        }
        return new ProposalParseResult(entries, dropped);
    }

    /**
     * 去掉一层外层代码块标记，优先识别 ```json。
     */
    String stripFence(String text) {
        int start;
        if (text.contains(JSON_FENCE)) {
            start = text.indexOf(JSON_FENCE) + JSON_FENCE.length();
        } else if (text.contains(FENCE)) {
            start = text.indexOf(FENCE) + FENCE.length();
        } else {
            return text;
        }
        int end = text.indexOf(FENCE, start);
        String inner = end < 0 ? text.substring(start) : text.substring(start, end);
        return inner.trim();
    }

    private ProposedScheduleEntry toEntry(Object item, Set<Long> knownTaskIds) {
        if (!(item instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("element is not an object");
        }
        Long taskId = toTaskId(map.get("task_id"));
        if (knownTaskIds == null || !knownTaskIds.contains(taskId)) {
            throw new IllegalArgumentException("unknown task_id=" + taskId);
        }
        LocalDate date = toDate(map.get("date"));
        BigDecimal hours = toHours(map.get("allocated_hours"));
        LocalTime start = toTime(map.get("start_time"), "start_time");
        LocalTime end = toTime(map.get("end_time"), "end_time");
        Object reasoning = map.get("reasoning");
        return new ProposedScheduleEntry(taskId, date, start, end, hours,
                reasoning == null ? null : String.valueOf(reasoning));
    }

    private Long toTaskId(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            BigDecimal decimal = new BigDecimal(number.toString());
            if (decimal.stripTrailingZeros().scale() <= 0) {
                return decimal.longValueExact();
            }
        }
        throw new IllegalArgumentException("task_id is missing or not an integer: " + value);
    }

    private LocalDate toDate(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new IllegalArgumentException("date is missing");
        }
        String trimmed = text.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
            return LocalDateTime.parse(trimmed).toLocalDate();
        }
        return LocalDate.parse(trimmed);
    }

    private BigDecimal toHours(Object value) {
        BigDecimal hours;
        if (value instanceof Number number) {
            hours = new BigDecimal(number.toString());
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                hours = new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("allocated_hours is not numeric: " + text);
            }
        } else {
            throw new IllegalArgumentException("allocated_hours is missing");
        }
        // 超出日容量的大值保留，交给校验阶段给出告警；只拒绝四舍五入后不为正的值
        BigDecimal rounded = hours.setScale(2, RoundingMode.HALF_UP);
        if (rounded.signum() <= 0) {
            throw new IllegalArgumentException("allocated_hours must be positive: " + hours.toPlainString());
        }
        return rounded;
    }

    private LocalTime toTime(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(field + " is not a string");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (END_OF_DAY.equals(trimmed)) {
            return LocalTime.MIDNIGHT;
        }
        return LocalTime.parse(trimmed, TIME_FORMAT);
    }

    /**
     * 解析结果：合法条目与被丢弃条目的原因。
     */
    public record ProposalParseResult(List<ProposedScheduleEntry> entries, List<String> droppedReasons) {
    }
}
