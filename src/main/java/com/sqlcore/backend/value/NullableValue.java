package com.sqlcore.backend.value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

import com.google.common.base.Preconditions;

import com.sqlcore.common.Error;

/**
 * 可为 NULL 的 SQL 值：payload + NULL 标记。
 * <p>
 * isNull 为 true 时 payload 无意义，读取它会抛出 {@link Error#NullValueAccessException}；
 * 所有消费方都必须先判断 {@link #isNull()}。实例不可变。
 * </p>
 *
 * @param <T> payload 类型
 */
public class NullableValue<T> {
    private final ValueKind<T> kind;
    private final T payload;
    private final boolean isNull;

    protected NullableValue(ValueKind<T> kind, T payload, boolean isNull) {
        this.kind = kind;
        this.payload = payload;
        this.isNull = isNull;
    }

    public static <T> NullableValue<T> of(ValueKind<T> kind, T payload) {
        Preconditions.checkNotNull(payload, "payload of a non-null %s value", kind);
        return new NullableValue<>(kind, kind.copy(payload), false);
    }

    public static <T> NullableValue<T> nullOf(ValueKind<T> kind) {
        return new NullableValue<>(kind, null, true);
    }

    public static NullableValue<Long> ofInteger(long v) {
        return of(ValueKind.INTEGER, v);
    }

    public static NullableValue<Double> ofReal(double v) {
        return of(ValueKind.REAL, v);
    }

    public static NullableValue<String> ofString(String v) {
        return of(ValueKind.STRING, v);
    }

    public static NullableValue<LocalDate> ofDate(LocalDate v) {
        return of(ValueKind.DATE, v);
    }

    public static NullableValue<LocalDateTime> ofTimestamp(LocalDateTime v) {
        return of(ValueKind.TIMESTAMP, v);
    }

    public ValueKind<T> kind() {
        return kind;
    }

    public boolean isNull() {
        return isNull;
    }

    public T payload() {
        if(isNull) {
            throw Error.NullValueAccessException;
        }
        return kind.copy(payload);
    }

    /** 数值类型转 double，供 AVG 使用 */
    public double asDouble() {
        return kind.toDouble(payload());
    }

    public String stringValue(String nullLabel) {
        return isNull ? nullLabel : kind.format(payload);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        NullableValue<?> that = (NullableValue<?>) o;
        return isNull == that.isNull && kind == that.kind && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind.name(), payload, isNull);
    }

    @Override
    public String toString() {
        return kind + "(" + stringValue("NULL") + ")";
    }
}
