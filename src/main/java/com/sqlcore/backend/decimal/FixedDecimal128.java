package com.sqlcore.backend.decimal;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLong;

import com.sqlcore.common.Error;

/**
 * 128 位有符号定点十进制数。
 * <p>
 * 内部只保存补码整数 raw（high 为高 64 位，low 为低 64 位），
 * 实际数值为 raw / 10^scale，scale 由调用方（{@link com.sqlcore.backend.value.DecimalVal}）维护。
 * 比较与相等只比较 raw，调用方需保证两个操作数 scale 相同。
 * </p>
 * 所有运算都在溢出时抛出 {@link Error#ArithmeticOverflowException}，
 * 原地运算失败时接收者保持不变。
 */
public final class FixedDecimal128 implements Comparable<FixedDecimal128> {

    /** 128 位最多容纳 38 位十进制有效数字 */
    public static final int MAX_PRECISION = 38;

    /** 2^127 - 1 */
    public static final BigInteger DECIMAL128_MAX_RAW = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    /** -2^127 */
    public static final BigInteger DECIMAL128_MIN_RAW = BigInteger.ONE.shiftLeft(127).negate();

    private static final double[] DOUBLE_POW10 = {
            1e0, 1e1, 1e2, 1e3, 1e4, 1e5, 1e6, 1e7, 1e8, 1e9, 1e10,
            1e11, 1e12, 1e13, 1e14, 1e15, 1e16, 1e17, 1e18, 1e19, 1e20, 1e21, 1e22
    };
    private static final long DOUBLE_EXACT_LIMIT = 1L << 53;

    private long high;
    private long low;

    public FixedDecimal128() {
    }

    public FixedDecimal128(long value) {
        this.high = value < 0 ? -1L : 0L;
        this.low = value;
    }

    public FixedDecimal128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public FixedDecimal128(FixedDecimal128 other) {
        this.high = other.high;
        this.low = other.low;
    }

    /**
     * 由已经按 scale 放大的整数构造，例如 1.50 (scale=2) 传入 150。
     */
    public static FixedDecimal128 valueOf(BigInteger raw) {
        FixedDecimal128 d = new FixedDecimal128();
        d.setValue(raw);
        return d;
    }

    // ----------------- add / subtract -----------------
    public FixedDecimal128 add(FixedDecimal128 other) {
        FixedDecimal128 result = new FixedDecimal128(this);
        result.addAndSet(other);
        return result;
    }

    public void addAndSet(FixedDecimal128 other) {
        long lo = low + other.low;
        long carry = Long.compareUnsigned(lo, low) < 0 ? 1L : 0L;
        long hi = high + other.high + carry;
        // 两个同号数相加，结果符号改变即为溢出
        if(((high ^ hi) & (other.high ^ hi)) < 0) {
            throw Error.ArithmeticOverflowException;
        }
        high = hi;
        low = lo;
    }

    public FixedDecimal128 subtract(FixedDecimal128 other) {
        FixedDecimal128 result = new FixedDecimal128(this);
        result.subtractAndSet(other);
        return result;
    }

    public void subtractAndSet(FixedDecimal128 other) {
        long lo = low - other.low;
        long borrow = Long.compareUnsigned(low, other.low) < 0 ? 1L : 0L;
        long hi = high - other.high - borrow;
        if(((high ^ other.high) & (high ^ hi)) < 0) {
            throw Error.ArithmeticOverflowException;
        }
        high = hi;
        low = lo;
    }

    public FixedDecimal128 negate() {
        FixedDecimal128 result = new FixedDecimal128(this);
        result.negateAndSet();
        return result;
    }

    public void negateAndSet() {
        if(high == Long.MIN_VALUE && low == 0) {
            throw Error.ArithmeticOverflowException;
        }
        long lo = ~low + 1;
        high = ~high + (lo == 0 ? 1L : 0L);
        low = lo;
    }

    // ----------------- multiply -----------------
    public FixedDecimal128 multiply(FixedDecimal128 other, int resultPrecision) {
        FixedDecimal128 result = new FixedDecimal128(this);
        result.multiplyAndSet(other, resultPrecision);
        return result;
    }

    /**
     * 乘法：先求完整的 256 位乘积，再除以 10^resultPrecision（向零截断）。
     *
     * @param resultPrecision 需要从乘积中去掉的小数位数，
     *                        即两个操作数 scale 之和减去目标 scale
     */
    public void multiplyAndSet(FixedDecimal128 other, int resultPrecision) {
        Preconditions.checkArgument(resultPrecision >= 0 && resultPrecision <= 2 * MAX_PRECISION,
                "result precision out of range: %s", resultPrecision);
        boolean negative = (high < 0) != (other.high < 0);
        int[] product = WideIntUtil.multiply(WideIntUtil.magnitude(high, low),
                WideIntUtil.magnitude(other.high, other.low));
        WideIntUtil.divideByPowerOfTen(product, resultPrecision);
        if(!WideIntUtil.fitsIn128(product)) {
            throw Error.ArithmeticOverflowException;
        }
        long hi = WideIntUtil.high(product);
        long lo = WideIntUtil.low(product);
        if(hi < 0) {
            // 绝对值 >= 2^127，只有 -2^127 可以表示
            if(!negative || hi != Long.MIN_VALUE || lo != 0) {
                throw Error.ArithmeticOverflowException;
            }
            high = Long.MIN_VALUE;
            low = 0;
            return;
        }
        if(negative) {
            lo = ~lo + 1;
            hi = ~hi + (lo == 0 ? 1L : 0L);
        }
        high = hi;
        low = lo;
    }

    // ----------------- set -----------------
    public void setValue(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public void setValue(FixedDecimal128 other) {
        this.high = other.high;
        this.low = other.low;
    }

    public void setValue(BigInteger raw) {
        Preconditions.checkArgument(raw.bitLength() <= 127, "raw value exceeds 128 bits: %s", raw);
        this.low = raw.longValue();
        this.high = raw.shiftRight(64).longValue();
    }

    // ----------------- compare -----------------
    @Override
    public int compareTo(FixedDecimal128 other) {
        if(high != other.high) {
            return Long.compare(high, other.high);
        }
        return Long.compareUnsigned(low, other.low);
    }

    public boolean lessThan(FixedDecimal128 other) {
        return compareTo(other) < 0;
    }

    public boolean lessThanOrEqual(FixedDecimal128 other) {
        return compareTo(other) <= 0;
    }

    public boolean greaterThan(FixedDecimal128 other) {
        return compareTo(other) > 0;
    }

    public boolean greaterThanOrEqual(FixedDecimal128 other) {
        return compareTo(other) >= 0;
    }

    public int signum() {
        if(high < 0) {
            return -1;
        }
        return (high == 0 && low == 0) ? 0 : 1;
    }

    // ----------------- convert -----------------
    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    /** raw 是否落在 long 范围内 */
    public boolean fitsInLong() {
        return high == (low >> 63);
    }

    public BigInteger toBigInteger() {
        return BigInteger.valueOf(high).shiftLeft(64).add(UnsignedLong.fromLongBits(low).bigIntegerValue());
    }

    public BigDecimal toBigDecimal(int scale) {
        return new BigDecimal(toBigInteger(), scale);
    }

    /**
     * 按给定 scale 转成 double。
     * raw 与 10^scale 都能被 double 精确表示时直接相除，结果为正确舍入。
     */
    public double toDouble(int scale) {
        if(fitsInLong() && Math.abs(low) < DOUBLE_EXACT_LIMIT && scale < DOUBLE_POW10.length) {
            return low / DOUBLE_POW10[scale];
        }
        return toBigDecimal(scale).doubleValue();
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof FixedDecimal128)) {
            return false;
        }
        FixedDecimal128 other = (FixedDecimal128) obj;
        return high == other.high && low == other.low;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(high) * 31 + Long.hashCode(low);
    }

    /** raw 的十进制表示，不含小数点 */
    @Override
    public String toString() {
        return toBigInteger().toString();
    }
}
