package com.sqlcore.backend.decimal;

/**
 * 128/256 位无符号整数的分段运算工具。
 * 数值按 32 位分段、小端序存放在 int[] 中，每段按无符号解释。
 */
public class WideIntUtil {
    static final long MASK = 0xffffffffL;

    /** 10^0 ~ 10^9，单次短除法的最大除数为 10^9 */
    private static final int[] POW10 = {
            1, 10, 100, 1_000, 10_000, 100_000,
            1_000_000, 10_000_000, 100_000_000, 1_000_000_000
    };
    private static final int MAX_POW10_STEP = POW10.length - 1;

    private WideIntUtil() {
    }

    // ----------------- 128 bit <-> limbs -----------------
    public static int[] toLimbs(long high, long low) {
        return new int[] {(int) low, (int) (low >>> 32), (int) high, (int) (high >>> 32)};
    }

    public static long low(int[] limbs) {
        return (limbs[0] & MASK) | ((limbs[1] & MASK) << 32);
    }

    public static long high(int[] limbs) {
        return (limbs[2] & MASK) | ((limbs[3] & MASK) << 32);
    }

    /**
     * 取 128 位补码数的绝对值（按无符号 128 位解释）。
     * -2^127 的绝对值为 2^127，无符号下可以表示。
     */
    public static int[] magnitude(long high, long low) {
        if(high >= 0) {
            return toLimbs(high, low);
        }
        long nLow = ~low + 1;
        long nHigh = ~high + (nLow == 0 ? 1L : 0L);
        return toLimbs(nHigh, nLow);
    }

    // ----------------- multiply -----------------
    /**
     * 完整乘法，不截断：4 段 x 4 段 -> 8 段 (256 位)。
     */
    public static int[] multiply(int[] a, int[] b) {
        int[] r = new int[a.length + b.length];
        for (int i = 0; i < a.length; i++) {
            long ai = a[i] & MASK;
            if(ai == 0) {
                continue;
            }
            long carry = 0;
            for (int j = 0; j < b.length; j++) {
                // ai * bj + r + carry 最大为 2^64 - 1，不会溢出无符号 64 位
                long t = ai * (b[j] & MASK) + (r[i + j] & MASK) + carry;
                r[i + j] = (int) t;
                carry = t >>> 32;
            }
            r[i + b.length] = (int) carry;
        }
        return r;
    }

    // ----------------- divide -----------------
    /**
     * 原地短除法，商向零截断。
     *
     * @return 余数
     */
    public static long divideInPlace(int[] limbs, int divisor) {
        long rem = 0;
        for (int i = limbs.length - 1; i >= 0; i--) {
            long cur = (rem << 32) | (limbs[i] & MASK);
            limbs[i] = (int) (cur / divisor);
            rem = cur % divisor;
        }
        return rem;
    }

    /**
     * 原地除以 10^power，商向零截断。
     * 对正整数，逐次截断除法与一次性截断除法结果相同，所以按 10^9 分步。
     */
    public static void divideByPowerOfTen(int[] limbs, int power) {
        while (power > 0) {
            int step = Math.min(power, MAX_POW10_STEP);
            divideInPlace(limbs, POW10[step]);
            power -= step;
        }
    }

    /** 高于 128 位的部分是否全为 0 */
    public static boolean fitsIn128(int[] limbs) {
        for (int i = 4; i < limbs.length; i++) {
            if(limbs[i] != 0) {
                return false;
            }
        }
        return true;
    }
}
