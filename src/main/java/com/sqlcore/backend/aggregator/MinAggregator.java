package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;
import com.sqlcore.backend.value.ValueKind;

/**
 * MIN(column)，按 {@link ValueKind} 的自然序比较。
 * 初始值为类型上界哨兵，首个非 NULL 值总会替换哨兵。
 */
public class MinAggregator<T> implements Aggregator<NullableValue<T>, NullableValue<T>, MinAggregator<T>> {
    private final ValueKind<T> kind;
    private T min;
    private boolean isNull = true;

    public MinAggregator(ValueKind<T> kind) {
        this.kind = kind;
        this.min = kind.maxValue();
    }

    @Override
    public void advance(NullableValue<T> value) {
        if(value.isNull()) {
            return;
        }
        accumulate(value.payload());
    }

    @Override
    public void merge(MinAggregator<T> partial) {
        if(partial.isNull) {
            return;
        }
        accumulate(partial.min);
    }

    private void accumulate(T v) {
        if(isNull || kind.compare(v, min) < 0) {
            min = v;
        }
        isNull = false;
    }

    @Override
    public void reset() {
        min = kind.maxValue();
        isNull = true;
    }

    @Override
    public NullableValue<T> result() {
        return isNull ? NullableValue.nullOf(kind) : NullableValue.of(kind, min);
    }
}
