package com.sqlcore.backend.value;

import java.util.Locale;

import com.sqlcore.common.Error;

public enum SqlType {
    INTEGER(ValueKind.INTEGER),
    REAL(ValueKind.REAL),
    DECIMAL(ValueKind.DECIMAL),
    STRING(ValueKind.STRING),
    DATE(ValueKind.DATE),
    TIMESTAMP(ValueKind.TIMESTAMP);

    private final ValueKind<?> kind;

    SqlType(ValueKind<?> kind) {
        this.kind = kind;
    }

    public ValueKind<?> kind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind.isNumeric();
    }

    /**
     * 从类型名解析 SqlType，大小写不敏感
     */
    public static SqlType from(String s) {
        if(s == null) {
            throw Error.InvalidTypeException;
        }
        try {
            // "decimal" -> "DECIMAL" -> SqlType.DECIMAL
            return SqlType.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw Error.InvalidTypeException;
        }
    }
}
