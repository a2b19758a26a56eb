package com.sqlcore.backend.aggregator;

import java.util.Locale;

import com.sqlcore.backend.value.Column;
import com.sqlcore.backend.value.SqlType;
import com.sqlcore.backend.value.ValueKind;
import com.sqlcore.common.Error;
import com.sqlcore.config.AggregationConfig;

public enum AggregateFunc {
    COUNT(true) {
        @Override
        protected Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config) {
            return new CountAggregator();
        }
    },
    SUM(false) {
        @Override
        protected Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config) {
            ensureNumeric(column);
            if(column.getType() == SqlType.DECIMAL) {
                return new DecimalSumAggregator(config.isStrictScale());
            }
            return sum(column.getType().kind());
        }
    },
    AVG(false) {
        @Override
        protected Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config) {
            ensureNumeric(column);
            return new AvgAggregator();
        }
    },
    MIN(false) {
        @Override
        protected Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config) {
            if(column.getType() == SqlType.DECIMAL) {
                return new DecimalMinAggregator(config.isStrictScale());
            }
            return min(column.getType().kind());
        }
    },
    MAX(false) {
        @Override
        protected Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config) {
            if(column.getType() == SqlType.DECIMAL) {
                return new DecimalMaxAggregator(config.isStrictScale());
            }
            return max(column.getType().kind());
        }
    };

    private final boolean allowStar;

    AggregateFunc(boolean allowStar) {
        this.allowStar = allowStar;
    }

    public boolean allowStar() {
        return allowStar;
    }

    /**
     * 为给定列创建对应类型的聚合器；column 为 null 表示 "*"，只有 COUNT 允许。
     */
    public Aggregator<?, ?, ?> create(Column column, AggregationConfig config) {
        if(column == null) {
            if(!allowStar) {
                throw Error.InvalidCommandException;
            }
            return new CountStarAggregator();
        }
        return createFor(column, config);
    }

    protected abstract Aggregator<?, ?, ?> createFor(Column column, AggregationConfig config);

    public static AggregateFunc from(String s) {
        if(s == null) {
            throw Error.InvalidCommandException;
        }
        try {
            return AggregateFunc.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw Error.InvalidCommandException;
        }
    }

    private static void ensureNumeric(Column column) {
        if(!column.getType().isNumeric()) {
            throw Error.InvalidAggregateTypeException;
        }
    }

    private static <T> SumAggregator<T> sum(ValueKind<T> kind) {
        return new SumAggregator<>(kind);
    }

    private static <T> MinAggregator<T> min(ValueKind<T> kind) {
        return new MinAggregator<>(kind);
    }

    private static <T> MaxAggregator<T> max(ValueKind<T> kind) {
        return new MaxAggregator<>(kind);
    }
}
