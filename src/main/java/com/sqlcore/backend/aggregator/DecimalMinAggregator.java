package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.backend.value.DecimalVal;

/**
 * DECIMAL 的 MIN：初始值为 DECIMAL128_MAX_RAW 哨兵，按 raw 比较。
 */
public class DecimalMinAggregator implements Aggregator<DecimalVal, DecimalVal, DecimalMinAggregator> {
    private final boolean strictScale;
    private final FixedDecimal128 min = new FixedDecimal128();
    private int precision = 0;
    private boolean isNull = true;

    public DecimalMinAggregator() {
        this(true);
    }

    public DecimalMinAggregator(boolean strictScale) {
        this.strictScale = strictScale;
        min.setValue(FixedDecimal128.DECIMAL128_MAX_RAW);
    }

    @Override
    public void advance(DecimalVal value) {
        if(value.isNull()) {
            return;
        }
        accumulate(value.payload(), value.precision());
    }

    @Override
    public void merge(DecimalMinAggregator partial) {
        if(partial.isNull) {
            return;
        }
        accumulate(partial.min, partial.precision);
    }

    private void accumulate(FixedDecimal128 v, int scale) {
        DecimalScales.check(strictScale, isNull, precision, scale);
        if(v.lessThan(min)) {
            min.setValue(v);
        }
        precision = scale;
        isNull = false;
    }

    @Override
    public void reset() {
        min.setValue(FixedDecimal128.DECIMAL128_MAX_RAW);
        precision = 0;
        isNull = true;
    }

    @Override
    public DecimalVal result() {
        return isNull ? DecimalVal.ofNull(precision) : DecimalVal.of(min, precision);
    }
}
