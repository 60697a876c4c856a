package com.timebox.domain.task.service;

import com.timebox.types.enums.AllocationRemainderPolicyEnum;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 任务拆分时的按比例分配领域服务。
 * <p>
 * 比例以整数权重 / 总权重的有理数形式保存，分配时先乘后除再截断，
 * 避免 1/3 之类的比例先被舍入导致 90 分钟的 1/3 截成 29 分钟。
 * </p>
 */
@Service
public class TaskAllocationDomainService {

    private static final int RATIO_SCALE = 10;
    private static final int HOURS_SCALE = 2;
    private static final BigDecimal MIN_SCHEDULE_HOURS = new BigDecimal("0.01");

    /**
     * 计算每个子任务的分配比例。
     * <p>
     * 显式指定 allocatedHours 的子任务为手动组，直接以该值参与归一化；
     * 其余为自动组：组内任一子任务有预估工时则按预估工时计权，否则组内均分一份单位权重。
     * 所有权重为 0 时退化为全体均分。
     * </p>
     */
    public List<AllocationShare> calculateShares(List<ShareInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return Collections.emptyList();
        }
        for (int i = 0; i < inputs.size(); i++) {
            ShareInput input = inputs.get(i);
            if (isNegative(input.allocatedHours())) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "子任务[" + i + "] 的 allocatedHours 不能为负数");
            }
            if (isNegative(input.estimatedHours())) {
                throw new AppException(ResponseCode.VALIDATION_FAILED, "子任务[" + i + "] 的 estimatedHours 不能为负数");
            }
        }

        List<Integer> autoIndices = new ArrayList<>();
        BigDecimal autoEstimateTotal = BigDecimal.ZERO;
        for (int i = 0; i < inputs.size(); i++) {
            ShareInput input = inputs.get(i);
            if (input.allocatedHours() == null) {
                autoIndices.add(i);
                autoEstimateTotal = autoEstimateTotal.add(zeroIfNull(input.estimatedHours()));
            }
        }
        boolean autoByEstimate = autoEstimateTotal.signum() > 0;
        // 自动组均分时每份权重为 1/n，整体乘以 n 保持整数权重。
        BigDecimal scale = !autoByEstimate && !autoIndices.isEmpty()
                ? BigDecimal.valueOf(autoIndices.size())
                : BigDecimal.ONE;

        List<BigDecimal> weights = new ArrayList<>(inputs.size());
        BigDecimal total = BigDecimal.ZERO;
        for (ShareInput input : inputs) {
            BigDecimal weight;
            if (input.allocatedHours() != null) {
                weight = input.allocatedHours().multiply(scale);
            } else if (autoByEstimate) {
                weight = zeroIfNull(input.estimatedHours());
            } else {
                weight = BigDecimal.ONE;
            }
            weights.add(weight);
            total = total.add(weight);
        }

        List<AllocationShare> shares = new ArrayList<>(inputs.size());
        if (total.signum() == 0) {
            BigDecimal count = BigDecimal.valueOf(inputs.size());
            for (int i = 0; i < inputs.size(); i++) {
                shares.add(new AllocationShare(BigDecimal.ONE, count));
            }
            return shares;
        }
        for (BigDecimal weight : weights) {
            shares.add(new AllocationShare(weight, total));
        }
        return shares;
    }

    /**
     * 按比例分配分钟数，每份向下取整。
     */
    public MinuteAllocation allocateMinutes(long totalMinutes,
                                            List<AllocationShare> shares,
                                            AllocationRemainderPolicyEnum remainderPolicy) {
        if (totalMinutes <= 0 || shares == null || shares.isEmpty()) {
            List<Long> zeros = new ArrayList<>();
            int size = shares == null ? 0 : shares.size();
            for (int i = 0; i < size; i++) {
                zeros.add(0L);
            }
            return new MinuteAllocation(zeros, 0L, Math.max(totalMinutes, 0L));
        }
        List<Long> minutes = new ArrayList<>(shares.size());
        long allocated = 0L;
        for (AllocationShare share : shares) {
            long value = share.applyTo(BigDecimal.valueOf(totalMinutes), 0).longValue();
            minutes.add(value);
            allocated += value;
        }
        long remainder = totalMinutes - allocated;
        if (remainder > 0 && remainderPolicy == AllocationRemainderPolicyEnum.ASSIGN_TO_LAST) {
            int target = lastPositiveIndex(minutes);
            minutes.set(target, minutes.get(target) + remainder);
            allocated += remainder;
            remainder = 0L;
        }
        return new MinuteAllocation(minutes, allocated, remainder);
    }

    /**
     * 按比例分配单个排程块的小时数，保留两位小数向下截断；低于 0.01 小时的份额记为 0。
     */
    public List<BigDecimal> allocateHours(BigDecimal hours,
                                          List<AllocationShare> shares,
                                          AllocationRemainderPolicyEnum remainderPolicy) {
        List<BigDecimal> result = new ArrayList<>();
        if (shares == null || shares.isEmpty()) {
            return result;
        }
        BigDecimal source = zeroIfNull(hours);
        BigDecimal allocated = BigDecimal.ZERO;
        for (AllocationShare share : shares) {
            BigDecimal value = share.applyTo(source, HOURS_SCALE);
            if (value.compareTo(MIN_SCHEDULE_HOURS) < 0) {
                value = BigDecimal.ZERO.setScale(HOURS_SCALE);
            }
            result.add(value);
            allocated = allocated.add(value);
        }
        BigDecimal remainder = source.setScale(HOURS_SCALE, RoundingMode.DOWN).subtract(allocated);
        if (remainder.signum() > 0 && remainderPolicy == AllocationRemainderPolicyEnum.ASSIGN_TO_LAST) {
            int target = lastPositiveHoursIndex(result);
            result.set(target, result.get(target).add(remainder));
        }
        return result;
    }

    private int lastPositiveIndex(List<Long> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            if (values.get(i) > 0) {
                return i;
            }
        }
        return values.size() - 1;
    }

    private int lastPositiveHoursIndex(List<BigDecimal> values) {
        for (int i = values.size() - 1; i >= 0; i--) {
            if (values.get(i).signum() > 0) {
                return i;
            }
        }
        return values.size() - 1;
    }

    private boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    private BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    /**
     * 子任务的分配输入：allocatedHours 为手动覆盖值，estimatedHours 为预估工时，均可为空。
     */
    public record ShareInput(BigDecimal allocatedHours, BigDecimal estimatedHours) {
    }

    /**
     * 分配比例 weight / totalWeight。
     */
    public record AllocationShare(BigDecimal weight, BigDecimal totalWeight) {

        public BigDecimal ratio() {
            return weight.divide(totalWeight, RATIO_SCALE, RoundingMode.HALF_EVEN);
        }

        /**
         * amount × weight / totalWeight，按给定小数位向下截断。
         */
        public BigDecimal applyTo(BigDecimal amount, int scale) {
            return amount.multiply(weight).divide(totalWeight, scale, RoundingMode.DOWN);
        }

        public String percentLabel() {
            return ratio().multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
        }
    }

    /**
     * 分钟分配结果：每个子任务的分钟数、已分配总数与未分配余数。
     */
    public record MinuteAllocation(List<Long> minutes, long allocatedMinutes, long unallocatedMinutes) {
    }
}
