package com.sqlcore.backend.value;

import com.google.common.base.Preconditions;

import com.sqlcore.backend.decimal.FixedDecimal128;

/**
 * 带 scale 的 DECIMAL 值。
 * payload 在构造时复制，对外也只返回副本（见 {@link ValueKind#copy}），保证聚合器持有的累加值不会被外部修改。
 */
public class DecimalVal extends NullableValue<FixedDecimal128> {
    private final int precision;

    private DecimalVal(FixedDecimal128 payload, int precision, boolean isNull) {
        super(ValueKind.DECIMAL, payload, isNull);
        this.precision = precision;
    }

    public static DecimalVal of(FixedDecimal128 raw, int precision) {
        Preconditions.checkNotNull(raw, "payload of a non-null DECIMAL value");
        checkPrecision(precision);
        return new DecimalVal(new FixedDecimal128(raw), precision, false);
    }

    /** 由放大后的 long 构造，例如 of(150, 2) 表示 1.50 */
    public static DecimalVal of(long raw, int precision) {
        return of(new FixedDecimal128(raw), precision);
    }

    public static DecimalVal ofNull() {
        return new DecimalVal(null, 0, true);
    }

    public static DecimalVal ofNull(int precision) {
        checkPrecision(precision);
        return new DecimalVal(null, precision, true);
    }

    private static void checkPrecision(int precision) {
        Preconditions.checkArgument(precision >= 0 && precision <= FixedDecimal128.MAX_PRECISION,
                "decimal precision out of range: %s", precision);
    }

    /** 小数位数 */
    public int precision() {
        return precision;
    }

    @Override
    public double asDouble() {
        return payload().toDouble(precision);
    }

    @Override
    public String stringValue(String nullLabel) {
        return isNull() ? nullLabel : payload().toBigDecimal(precision).toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && precision == ((DecimalVal) o).precision;
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + precision;
    }
}
