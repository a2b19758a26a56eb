package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;
import com.sqlcore.backend.value.ValueKind;

public class MaxAggregator<T> implements Aggregator<NullableValue<T>, NullableValue<T>, MaxAggregator<T>> {
    private final ValueKind<T> kind;
    private T max;
    private boolean isNull = true;

    public MaxAggregator(ValueKind<T> kind) {
        this.kind = kind;
        this.max = kind.minValue();
    }

    @Override
    public void advance(NullableValue<T> value) {
        if(value.isNull()) {
            return;
        }
        accumulate(value.payload());
    }

    @Override
    public void merge(MaxAggregator<T> partial) {
        if(partial.isNull) {
            return;
        }
        accumulate(partial.max);
    }

    private void accumulate(T v) {
        if(isNull || kind.compare(v, max) > 0) {
            max = v;
        }
        isNull = false;
    }

    @Override
    public void reset() {
        max = kind.minValue();
        isNull = true;
    }

    @Override
    public NullableValue<T> result() {
        return isNull ? NullableValue.nullOf(kind) : NullableValue.of(kind, max);
    }
}
