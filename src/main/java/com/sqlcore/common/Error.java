package com.sqlcore.common;

/**
 * 全局错误常量，调用方通过 {@code e == Error.Xxx} 判断错误类型。
 */
public class Error {
    // decimal
    public static final RuntimeException ArithmeticOverflowException = new ArithmeticException("Numeric value out of range!");
    public static final RuntimeException ScaleMismatchException = new IllegalStateException("Decimal scale mismatch!");

    // value
    public static final RuntimeException NullValueAccessException = new IllegalStateException("Read payload of a NULL value!");
    public static final RuntimeException InvalidTypeException = new IllegalArgumentException("Invalid sql type!");
    public static final RuntimeException TypeMismatchException = new IllegalArgumentException("Value type does not match column type!");

    // aggregator
    public static final RuntimeException InvalidAggregateTypeException = new IllegalArgumentException("Aggregate function does not support this type!");
    public static final RuntimeException FieldNotFoundException = new IllegalArgumentException("Field not found!");
    public static final RuntimeException IncompatiblePartialException = new IllegalArgumentException("Partial aggregate layout mismatch!");
    public static final RuntimeException ContextAlreadyReleasedException = new IllegalStateException("Aggregate context is already released!");
    public static final RuntimeException InvalidCommandException = new IllegalArgumentException("Invalid aggregate function!");

    private Error() {
    }
}
