package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;
import com.sqlcore.backend.value.ValueKind;
import com.sqlcore.common.Error;

/**
 * SUM(column)，对任意数值类型通用。
 * NULL 输入被跳过（不当作 0）；没有见过非 NULL 输入时结果为 NULL。
 * INTEGER 溢出抛出 {@link Error#ArithmeticOverflowException}，REAL 遵循 IEEE-754。
 */
public class SumAggregator<T> implements Aggregator<NullableValue<T>, NullableValue<T>, SumAggregator<T>> {
    private final ValueKind<T> kind;
    private T sum;
    private boolean isNull = true;

    public SumAggregator(ValueKind<T> kind) {
        if(!kind.isNumeric()) {
            throw Error.InvalidAggregateTypeException;
        }
        this.kind = kind;
        this.sum = kind.zero();
    }

    @Override
    public void advance(NullableValue<T> value) {
        if(value.isNull()) {
            return;
        }
        sum = kind.add(sum, value.payload());
        isNull = false;
    }

    @Override
    public void merge(SumAggregator<T> partial) {
        if(partial.isNull) {
            return;
        }
        sum = kind.add(sum, partial.sum);
        isNull = false;
    }

    @Override
    public void reset() {
        sum = kind.zero();
        isNull = true;
    }

    @Override
    public NullableValue<T> result() {
        return isNull ? NullableValue.nullOf(kind) : NullableValue.of(kind, sum);
    }
}
