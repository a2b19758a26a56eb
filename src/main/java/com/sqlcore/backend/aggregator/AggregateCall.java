package com.sqlcore.backend.aggregator;

import java.util.Objects;

/**
 * 一次聚合函数调用，如 SUM(price) AS total。
 * field 为 null 表示 "*"。
 */
public class AggregateCall {
    public final AggregateFunc func;
    public final String field;
    public final String alias;

    public AggregateCall(AggregateFunc func, String field, String alias) {
        this.func = func;
        this.field = field;
        this.alias = alias;
    }

    public static AggregateCall of(AggregateFunc func, String field) {
        return new AggregateCall(func, field, null);
    }

    public static AggregateCall countStar() {
        return new AggregateCall(AggregateFunc.COUNT, null, null);
    }

    public AggregateCall as(String alias) {
        return new AggregateCall(func, field, alias);
    }

    /** 默认列名：COUNT(*)、SUM(age) */
    public String label() {
        return func.name() + "(" + (field == null ? "*" : field) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof AggregateCall)) {
            return false;
        }
        AggregateCall that = (AggregateCall) o;
        return func == that.func && Objects.equals(field, that.field) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, field, alias);
    }

    @Override
    public String toString() {
        return alias == null ? label() : label() + " AS " + alias;
    }
}
