package com.sqlcore.backend.decimal;

import java.math.BigInteger;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 与 BigInteger 的精确结果对拍：乘积除以 10^p 后向零截断。
 */
public class FixedDecimal128RandomTest {

    private static final int PAIRS = 10_000;

    private final Random random = new Random(20240601L);

    /** 34 位十进制数：前 33 位取 1~9，末位取 0~9，符号随机 */
    private BigInteger randomDigits34() {
        StringBuilder sb = new StringBuilder(35);
        if(random.nextBoolean()) {
            sb.append('-');
        }
        for (int i = 0; i < 33; i++) {
            sb.append((char) ('1' + random.nextInt(9)));
        }
        sb.append((char) ('0' + random.nextInt(10)));
        return new BigInteger(sb.toString());
    }

    private BigInteger randomRaw(int maxBits) {
        BigInteger v = new BigInteger(1 + random.nextInt(maxBits), random);
        return random.nextBoolean() ? v.negate() : v;
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    public void testMultiply34DigitPairs() {
        BigInteger divisor = BigInteger.TEN.pow(33);
        for (int i = 0; i < PAIRS; i++) {
            BigInteger a = randomDigits34();
            BigInteger b = randomDigits34();
            FixedDecimal128 d = FixedDecimal128.valueOf(a);
            d.multiplyAndSet(FixedDecimal128.valueOf(b), 33);
            // BigInteger.divide 同样向零截断
            assertEquals(a.multiply(b).divide(divisor), d.toBigInteger(), "pair " + a + " * " + b);
        }
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    public void testMultiplyRandomPrecisionAndWidth() {
        for (int i = 0; i < PAIRS; i++) {
            BigInteger a = randomRaw(127);
            BigInteger b = randomRaw(127);
            int p = random.nextInt(2 * FixedDecimal128.MAX_PRECISION + 1);
            BigInteger expected = a.multiply(b).divide(BigInteger.TEN.pow(p));
            FixedDecimal128 d = FixedDecimal128.valueOf(a);
            if(expected.bitLength() > 127) {
                assertThrows(ArithmeticException.class, () -> d.multiplyAndSet(FixedDecimal128.valueOf(b), p));
                assertEquals(a, d.toBigInteger());
            } else {
                d.multiplyAndSet(FixedDecimal128.valueOf(b), p);
                assertEquals(expected, d.toBigInteger());
            }
        }
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    public void testAddRandom() {
        for (int i = 0; i < PAIRS; i++) {
            BigInteger a = randomRaw(127);
            BigInteger b = randomRaw(127);
            BigInteger expected = a.add(b);
            FixedDecimal128 d = FixedDecimal128.valueOf(a);
            if(expected.bitLength() > 127) {
                assertThrows(ArithmeticException.class, () -> d.addAndSet(FixedDecimal128.valueOf(b)));
            } else {
                d.addAndSet(FixedDecimal128.valueOf(b));
                assertEquals(expected, d.toBigInteger());
                assertEquals(Integer.signum(expected.signum()), d.signum());
            }
        }
    }
}
