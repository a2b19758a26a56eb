package com.sqlcore.backend.value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

import com.google.common.math.LongMath;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.common.Error;

/**
 * 值类型特征：聚合器通过它完成清零、哨兵取值、加法与比较，
 * 从而一个泛型聚合器即可覆盖所有 payload 类型。
 *
 * @param <T> payload 的 Java 类型
 */
public abstract class ValueKind<T> implements Comparator<T> {

    /** STRING 没有真正的上界，MIN 的初始哨兵只是一个占位值，首个非 NULL 值总会替换它 */
    static final String STRING_MAX_SENTINEL = String.valueOf(Character.MAX_VALUE);

    public static final ValueKind<Long> INTEGER = new ValueKind<Long>("INTEGER", true) {
        @Override
        public Long zero() {
            return 0L;
        }

        @Override
        public Long minValue() {
            return Long.MIN_VALUE;
        }

        @Override
        public Long maxValue() {
            return Long.MAX_VALUE;
        }

        @Override
        public Long add(Long a, Long b) {
            try {
                return LongMath.checkedAdd(a, b);
            } catch (ArithmeticException e) {
                throw Error.ArithmeticOverflowException;
            }
        }

        @Override
        public int compare(Long a, Long b) {
            return Long.compare(a, b);
        }

        @Override
        public double toDouble(Long v) {
            return v.doubleValue();
        }
    };

    public static final ValueKind<Double> REAL = new ValueKind<Double>("REAL", true) {
        @Override
        public Double zero() {
            return 0.0;
        }

        @Override
        public Double minValue() {
            return Double.NEGATIVE_INFINITY;
        }

        @Override
        public Double maxValue() {
            return Double.POSITIVE_INFINITY;
        }

        @Override
        public Double add(Double a, Double b) {
            return a + b;
        }

        @Override
        public int compare(Double a, Double b) {
            return Double.compare(a, b);
        }

        @Override
        public double toDouble(Double v) {
            return v;
        }
    };

    /**
     * 只比较 raw；scale 由 {@link DecimalVal} 携带，转 double 也由它完成。
     */
    public static final ValueKind<FixedDecimal128> DECIMAL = new ValueKind<FixedDecimal128>("DECIMAL", true) {
        @Override
        public FixedDecimal128 zero() {
            return new FixedDecimal128(0);
        }

        @Override
        public FixedDecimal128 minValue() {
            return FixedDecimal128.valueOf(FixedDecimal128.DECIMAL128_MIN_RAW);
        }

        @Override
        public FixedDecimal128 maxValue() {
            return FixedDecimal128.valueOf(FixedDecimal128.DECIMAL128_MAX_RAW);
        }

        @Override
        public FixedDecimal128 add(FixedDecimal128 a, FixedDecimal128 b) {
            return a.add(b);
        }

        @Override
        public int compare(FixedDecimal128 a, FixedDecimal128 b) {
            return a.compareTo(b);
        }

        @Override
        public double toDouble(FixedDecimal128 v) {
            return v.toDouble(0);
        }

        @Override
        public FixedDecimal128 copy(FixedDecimal128 v) {
            return new FixedDecimal128(v);
        }
    };

    public static final ValueKind<String> STRING = new ValueKind<String>("STRING", false) {
        @Override
        public String minValue() {
            return "";
        }

        @Override
        public String maxValue() {
            return STRING_MAX_SENTINEL;
        }

        @Override
        public int compare(String a, String b) {
            return a.compareTo(b);
        }
    };

    public static final ValueKind<LocalDate> DATE = new ValueKind<LocalDate>("DATE", false) {
        @Override
        public LocalDate minValue() {
            return LocalDate.MIN;
        }

        @Override
        public LocalDate maxValue() {
            return LocalDate.MAX;
        }

        @Override
        public int compare(LocalDate a, LocalDate b) {
            return a.compareTo(b);
        }
    };

    public static final ValueKind<LocalDateTime> TIMESTAMP = new ValueKind<LocalDateTime>("TIMESTAMP", false) {
        @Override
        public LocalDateTime minValue() {
            return LocalDateTime.MIN;
        }

        @Override
        public LocalDateTime maxValue() {
            return LocalDateTime.MAX;
        }

        @Override
        public int compare(LocalDateTime a, LocalDateTime b) {
            return a.compareTo(b);
        }
    };

    private final String name;
    private final boolean numeric;

    private ValueKind(String name, boolean numeric) {
        this.name = name;
        this.numeric = numeric;
    }

    public String name() {
        return name;
    }

    /** 是否支持 SUM / AVG */
    public boolean isNumeric() {
        return numeric;
    }

    public T zero() {
        throw Error.InvalidAggregateTypeException;
    }

    /** MAX 的初始哨兵 */
    public abstract T minValue();

    /** MIN 的初始哨兵 */
    public abstract T maxValue();

    public T add(T a, T b) {
        throw Error.InvalidAggregateTypeException;
    }

    public double toDouble(T v) {
        throw Error.InvalidAggregateTypeException;
    }

    /** 可变 payload 需要覆写此方法返回副本，其余类型都是不可变对象 */
    public T copy(T v) {
        return v;
    }

    public String format(T v) {
        return String.valueOf(v);
    }

    @Override
    public String toString() {
        return name;
    }
}
