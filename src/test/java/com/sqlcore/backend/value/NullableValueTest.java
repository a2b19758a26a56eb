package com.sqlcore.backend.value;

import java.time.LocalDate;

import org.junit.Test;

import com.sqlcore.backend.decimal.FixedDecimal128;
import com.sqlcore.common.Error;

import static org.junit.Assert.*;

public class NullableValueTest {

    @Test
    public void testNullPayloadAccess() {
        NullableValue<Long> v = NullableValue.nullOf(ValueKind.INTEGER);
        assertTrue(v.isNull());
        assertSame(Error.NullValueAccessException, assertThrows(RuntimeException.class, v::payload));
        assertSame(Error.NullValueAccessException, assertThrows(RuntimeException.class, v::asDouble));
        assertSame(Error.NullValueAccessException, assertThrows(RuntimeException.class, () -> DecimalVal.ofNull(2).payload()));
        assertEquals("NULL", v.stringValue("NULL"));
    }

    @Test
    public void testNonNullRequiresPayload() {
        assertThrows(NullPointerException.class, () -> NullableValue.of(ValueKind.STRING, null));
    }

    @Test
    public void testDecimalValCopiesPayload() {
        FixedDecimal128 raw = new FixedDecimal128(150);
        DecimalVal v = DecimalVal.of(raw, 2);
        raw.addAndSet(new FixedDecimal128(1));
        v.payload().addAndSet(new FixedDecimal128(1));
        assertEquals(new FixedDecimal128(150), v.payload());
        assertEquals(2, v.precision());
        assertEquals("1.50", v.stringValue("NULL"));
        assertEquals(1.5, v.asDouble(), 0.0);
    }

    @Test
    public void testGenericDecimalValueIsNotAliased() {
        FixedDecimal128 raw = new FixedDecimal128(150);
        NullableValue<FixedDecimal128> v = NullableValue.of(ValueKind.DECIMAL, raw);
        raw.addAndSet(new FixedDecimal128(1));
        assertEquals(new FixedDecimal128(150), v.payload());

        v.payload().addAndSet(new FixedDecimal128(1));
        assertEquals(new FixedDecimal128(150), v.payload());
        assertNotSame(v.payload(), v.payload());
    }

    @Test
    public void testDecimalEqualityIncludesPrecision() {
        assertEquals(DecimalVal.of(150, 2), DecimalVal.of(150, 2));
        assertNotEquals(DecimalVal.of(150, 2), DecimalVal.of(150, 3));
        assertNotEquals(DecimalVal.of(150, 2), NullableValue.of(ValueKind.DECIMAL, new FixedDecimal128(150)));
        assertThrows(IllegalArgumentException.class, () -> DecimalVal.of(1, FixedDecimal128.MAX_PRECISION + 1));
    }

    @Test
    public void testKinds() {
        assertTrue(ValueKind.INTEGER.compare(-1L, 2L) < 0);
        assertTrue(ValueKind.STRING.compare("abc", "abd") < 0);
        assertTrue(ValueKind.DATE.compare(LocalDate.of(2020, 1, 1), LocalDate.of(2019, 12, 31)) > 0);
        assertEquals(Double.valueOf(3.5), ValueKind.REAL.add(1.25, 2.25));
        assertEquals(new FixedDecimal128(7), ValueKind.DECIMAL.add(new FixedDecimal128(3), new FixedDecimal128(4)));

        assertSame(Error.ArithmeticOverflowException,
                assertThrows(RuntimeException.class, () -> ValueKind.INTEGER.add(Long.MAX_VALUE, 1L)));
        assertSame(Error.InvalidAggregateTypeException,
                assertThrows(RuntimeException.class, () -> ValueKind.STRING.add("a", "b")));
        assertSame(Error.InvalidAggregateTypeException,
                assertThrows(RuntimeException.class, ValueKind.DATE::zero));
        assertFalse(ValueKind.TIMESTAMP.isNumeric());
    }

    @Test
    public void testSqlTypeFrom() {
        assertEquals(SqlType.DECIMAL, SqlType.from("decimal"));
        assertEquals(SqlType.TIMESTAMP, SqlType.from(" Timestamp "));
        assertSame(Error.InvalidTypeException, assertThrows(RuntimeException.class, () -> SqlType.from("int128")));
        assertSame(Error.InvalidTypeException, assertThrows(RuntimeException.class, () -> SqlType.from(null)));
        assertTrue(SqlType.REAL.isNumeric());
        assertFalse(SqlType.STRING.isNumeric());
    }

    @Test
    public void testColumn() {
        Column price = Column.decimal("price", 2);
        assertEquals(DecimalVal.ofNull(2), price.nullValue());
        assertEquals(NullableValue.nullOf(ValueKind.STRING), new Column("name", SqlType.STRING).nullValue());
        assertEquals(Column.decimal("price", 2), price);
        assertThrows(IllegalArgumentException.class, () -> new Column("id", SqlType.INTEGER, 2));
    }
}
