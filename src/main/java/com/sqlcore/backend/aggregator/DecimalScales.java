package com.sqlcore.backend.aggregator;

import com.sqlcore.common.Error;

/**
 * 十进制聚合器共用的 scale 前置检查。
 */
final class DecimalScales {
    private DecimalScales() {
    }

    /**
     * 已有累加值（accumulatorNull 为 false）时，新操作数必须与累加值同 scale。
     */
    static void check(boolean strictScale, boolean accumulatorNull, int current, int incoming) {
        if(strictScale && !accumulatorNull && current != incoming) {
            throw Error.ScaleMismatchException;
        }
    }
}
