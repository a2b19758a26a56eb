package com.sqlcore.backend.value;

import java.util.Objects;

import com.google.common.base.Preconditions;

import com.sqlcore.backend.decimal.FixedDecimal128;

/**
 * 输入行中的一列：列名、类型，DECIMAL 列另带 scale。
 */
public class Column {
    private final String name;
    private final SqlType type;
    private final int scale;

    public Column(String name, SqlType type) {
        this(name, type, 0);
    }

    public Column(String name, SqlType type, int scale) {
        Preconditions.checkNotNull(name, "column name");
        Preconditions.checkNotNull(type, "column type");
        Preconditions.checkArgument(scale >= 0 && scale <= FixedDecimal128.MAX_PRECISION,
                "decimal scale out of range: %s", scale);
        Preconditions.checkArgument(type == SqlType.DECIMAL || scale == 0,
                "only DECIMAL columns carry a scale");
        this.name = name;
        this.type = type;
        this.scale = scale;
    }

    public static Column decimal(String name, int scale) {
        return new Column(name, SqlType.DECIMAL, scale);
    }

    public String getName() {
        return name;
    }

    public SqlType getType() {
        return type;
    }

    public int getScale() {
        return scale;
    }

    /** 该列上的 NULL 值 */
    public NullableValue<?> nullValue() {
        if(type == SqlType.DECIMAL) {
            return DecimalVal.ofNull(scale);
        }
        return NullableValue.nullOf(type.kind());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Column)) {
            return false;
        }
        Column that = (Column) o;
        return scale == that.scale && type == that.type && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, scale);
    }

    @Override
    public String toString() {
        return type == SqlType.DECIMAL ? name + " DECIMAL(" + scale + ")" : name + " " + type;
    }
}
