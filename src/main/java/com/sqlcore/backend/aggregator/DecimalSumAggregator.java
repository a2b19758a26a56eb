package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.backend.value.DecimalVal;
import com.sqlcore.common.Error;

/**
 * DECIMAL 的 SUM：在 {@link FixedDecimal128} 上原地累加，并记录 scale。
 * <p>
 * 调用方保证同一个聚合器只见到同一 scale 的值；strictScale 打开时，
 * 已有累加值后再遇到不同 scale 会抛出 {@link Error#ScaleMismatchException}，
 * 关闭时沿用最后一个非 NULL 操作数的 scale，不做换算。
 * </p>
 */
public class DecimalSumAggregator implements Aggregator<DecimalVal, DecimalVal, DecimalSumAggregator> {
    private final boolean strictScale;
    private final FixedDecimal128 sum = new FixedDecimal128(0);
    private int precision = 0;
    private boolean isNull = true;

    public DecimalSumAggregator() {
        this(true);
    }

    public DecimalSumAggregator(boolean strictScale) {
        this.strictScale = strictScale;
    }

    @Override
    public void advance(DecimalVal value) {
        if(value.isNull()) {
            return;
        }
        accumulate(value.payload(), value.precision());
    }

    @Override
    public void merge(DecimalSumAggregator partial) {
        if(partial.isNull) {
            return;
        }
        accumulate(partial.sum, partial.precision);
    }

    private void accumulate(FixedDecimal128 v, int scale) {
        DecimalScales.check(strictScale, isNull, precision, scale);
        // 溢出时 sum 保持不变
        sum.addAndSet(v);
        precision = scale;
        isNull = false;
    }

    @Override
    public void reset() {
        sum.setValue(0L, 0L);
        precision = 0;
        isNull = true;
    }

    @Override
    public DecimalVal result() {
        return isNull ? DecimalVal.ofNull(precision) : DecimalVal.of(sum, precision);
    }
}
