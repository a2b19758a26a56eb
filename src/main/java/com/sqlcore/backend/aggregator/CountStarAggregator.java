package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;

/**
 * COUNT(*)：统计行数，不关心值是否为 NULL。
 */
public class CountStarAggregator implements Aggregator<NullableValue<?>, NullableValue<Long>, CountStarAggregator> {
    private long count = 0;

    @Override
    public void advance(NullableValue<?> value) {
        count++;
    }

    @Override
    public void merge(CountStarAggregator partial) {
        count += partial.count;
    }

    @Override
    public void reset() {
        count = 0;
    }

    @Override
    public NullableValue<Long> result() {
        return NullableValue.ofInteger(count);
    }
}
