package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;
import com.sqlcore.backend.value.ValueKind;

/**
 * AVG(column)。
 * 无论输入是 INTEGER、REAL 还是 DECIMAL，都以 double 累加，结果为 REAL；
 * DECIMAL 先按自身 scale 换算成 double，精度有损。
 */
public class AvgAggregator implements Aggregator<NullableValue<?>, NullableValue<Double>, AvgAggregator> {
    private double sum = 0.0;
    private long count = 0;

    @Override
    public void advance(NullableValue<?> value) {
        if(value.isNull()) {
            return;
        }
        sum += value.asDouble();
        count++;
    }

    @Override
    public void merge(AvgAggregator partial) {
        sum += partial.sum;
        count += partial.count;
    }

    @Override
    public void reset() {
        sum = 0.0;
        count = 0;
    }

    @Override
    public NullableValue<Double> result() {
        if(count == 0) {
            return NullableValue.nullOf(ValueKind.REAL);
        }
        return NullableValue.ofReal(sum / count);
    }
}
