package com.sqlcore.backend.aggregator;

import java.math.BigInteger;

import org.junit.Test;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.backend.value.DecimalVal;
import com.sqlcore.common.Error;

import static org.junit.Assert.*;

public class DecimalAggregatorTest {

    private static DecimalVal d(long raw) {
        return DecimalVal.of(raw, 2);
    }

    private static DecimalVal raw(BigInteger raw) {
        return DecimalVal.of(FixedDecimal128.valueOf(raw), 2);
    }

    @Test
    public void testSumCarriesScale() {
        DecimalSumAggregator sum = new DecimalSumAggregator();
        assertTrue(sum.result().isNull());
        sum.advance(d(150));
        sum.advance(DecimalVal.ofNull(2));
        sum.advance(d(-25));
        DecimalVal r = sum.result();
        assertEquals(d(125), r);
        assertEquals(2, r.precision());
        assertEquals("1.25", r.stringValue("NULL"));
    }

    @Test
    public void testSumOverflowIsEager() {
        DecimalSumAggregator sum = new DecimalSumAggregator();
        sum.advance(raw(FixedDecimal128.DECIMAL128_MAX_RAW));
        RuntimeException e = assertThrows(RuntimeException.class, () -> sum.advance(d(1)));
        assertSame(Error.ArithmeticOverflowException, e);
        // 失败的 advance 不修改累加值
        assertEquals(raw(FixedDecimal128.DECIMAL128_MAX_RAW), sum.result());

        DecimalSumAggregator other = new DecimalSumAggregator();
        other.advance(d(1));
        assertThrows(ArithmeticException.class, () -> sum.merge(other));
    }

    @Test
    public void testSumMerge() {
        DecimalSumAggregator a = new DecimalSumAggregator();
        DecimalSumAggregator b = new DecimalSumAggregator();
        b.advance(d(199));
        a.merge(b);
        assertEquals(d(199), a.result());
        a.merge(b);
        assertEquals(d(398), a.result());
        a.merge(new DecimalSumAggregator());
        assertEquals(d(398), a.result());
    }

    @Test
    public void testMinMaxAtSentinels() {
        DecimalMaxAggregator max = new DecimalMaxAggregator();
        assertTrue(max.result().isNull());
        max.advance(raw(FixedDecimal128.DECIMAL128_MIN_RAW));
        assertEquals(raw(FixedDecimal128.DECIMAL128_MIN_RAW), max.result());

        DecimalMinAggregator min = new DecimalMinAggregator();
        min.advance(raw(FixedDecimal128.DECIMAL128_MAX_RAW));
        assertEquals(raw(FixedDecimal128.DECIMAL128_MAX_RAW), min.result());
    }

    @Test
    public void testMinMax() {
        DecimalMinAggregator min = new DecimalMinAggregator();
        DecimalMaxAggregator max = new DecimalMaxAggregator();
        for (long v : new long[] {300, -150, 0, 275}) {
            min.advance(d(v));
            max.advance(d(v));
            min.advance(DecimalVal.ofNull(2));
            max.advance(DecimalVal.ofNull(2));
        }
        assertEquals(d(-150), min.result());
        assertEquals(d(300), max.result());

        DecimalMinAggregator otherMin = new DecimalMinAggregator();
        otherMin.advance(d(-151));
        min.merge(otherMin);
        assertEquals(d(-151), min.result());

        DecimalMaxAggregator otherMax = new DecimalMaxAggregator();
        max.merge(otherMax);
        assertEquals(d(300), max.result());
    }

    @Test
    public void testScaleMismatch() {
        DecimalSumAggregator strict = new DecimalSumAggregator(true);
        strict.advance(d(100));
        assertSame(Error.ScaleMismatchException,
                assertThrows(RuntimeException.class, () -> strict.advance(DecimalVal.of(100, 3))));

        DecimalMaxAggregator strictMax = new DecimalMaxAggregator(true);
        DecimalMaxAggregator partial = new DecimalMaxAggregator(true);
        strictMax.advance(d(1));
        partial.advance(DecimalVal.of(1, 4));
        assertSame(Error.ScaleMismatchException,
                assertThrows(RuntimeException.class, () -> strictMax.merge(partial)));

        // 非严格模式下沿用最后一个非 NULL 操作数的 scale
        DecimalSumAggregator lenient = new DecimalSumAggregator(false);
        lenient.advance(d(100));
        lenient.advance(DecimalVal.of(5, 3));
        assertEquals(DecimalVal.of(105, 3), lenient.result());
    }

    @Test
    public void testFirstValueDonatesScale() {
        DecimalMinAggregator min = new DecimalMinAggregator();
        min.advance(DecimalVal.ofNull(2));
        min.advance(DecimalVal.of(42, 5));
        assertEquals(5, min.result().precision());
    }

    @Test
    public void testReset() {
        DecimalSumAggregator sum = new DecimalSumAggregator();
        DecimalMinAggregator min = new DecimalMinAggregator();
        DecimalMaxAggregator max = new DecimalMaxAggregator();
        sum.advance(d(5));
        min.advance(d(5));
        max.advance(d(5));
        sum.reset();
        min.reset();
        max.reset();
        assertEquals(new DecimalSumAggregator().result(), sum.result());
        assertEquals(new DecimalMinAggregator().result(), min.result());
        assertEquals(new DecimalMaxAggregator().result(), max.result());

        min.advance(d(900));
        max.advance(d(-900));
        assertEquals(d(900), min.result());
        assertEquals(d(-900), max.result());
    }
}
