package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;

/**
 * COUNT(column)：只统计非 NULL 的值。
 */
public class CountAggregator implements Aggregator<NullableValue<?>, NullableValue<Long>, CountAggregator> {
    private long count = 0;

    @Override
    public void advance(NullableValue<?> value) {
        if(!value.isNull()) {
            count++;
        }
    }

    @Override
    public void merge(CountAggregator partial) {
        count += partial.count;
    }

    @Override
    public void reset() {
        count = 0;
    }

    /** 空分组返回 0 而不是 NULL */
    @Override
    public NullableValue<Long> result() {
        return NullableValue.ofInteger(count);
    }
}
