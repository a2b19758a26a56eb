package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.backend.value.DecimalVal;

/**
 * DECIMAL 的 MAX：初始值为 DECIMAL128_MIN_RAW 哨兵，按 raw 比较。
 */
public class DecimalMaxAggregator implements Aggregator<DecimalVal, DecimalVal, DecimalMaxAggregator> {
    private final boolean strictScale;
    private final FixedDecimal128 max = new FixedDecimal128();
    private int precision = 0;
    private boolean isNull = true;

    public DecimalMaxAggregator() {
        this(true);
    }

    public DecimalMaxAggregator(boolean strictScale) {
        this.strictScale = strictScale;
        max.setValue(FixedDecimal128.DECIMAL128_MIN_RAW);
    }

    @Override
    public void advance(DecimalVal value) {
        if(value.isNull()) {
            return;
        }
        accumulate(value.payload(), value.precision());
    }

    @Override
    public void merge(DecimalMaxAggregator partial) {
        if(partial.isNull) {
            return;
        }
        accumulate(partial.max, partial.precision);
    }

    private void accumulate(FixedDecimal128 v, int scale) {
        DecimalScales.check(strictScale, isNull, precision, scale);
        if(v.greaterThan(max)) {
            max.setValue(v);
        }
        precision = scale;
        isNull = false;
    }

    @Override
    public void reset() {
        max.setValue(FixedDecimal128.DECIMAL128_MIN_RAW);
        precision = 0;
        isNull = true;
    }

    @Override
    public DecimalVal result() {
        return isNull ? DecimalVal.ofNull(precision) : DecimalVal.of(max, precision);
    }
}
