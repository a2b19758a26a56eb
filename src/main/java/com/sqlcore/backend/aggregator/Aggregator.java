package com.sqlcore.backend.aggregator;

import com.sqlcore.backend.value.NullableValue;

/**
 * 聚合器接口，封装单个聚合函数在一个分组上的状态与运算。
 * <p>
 * 状态只有两种：Empty（新建或 reset 之后）与 Accumulating（见过至少一个非 NULL 输入）。
 * 同一个实例只允许单线程访问；并行执行时每个 worker 持有自己的部分聚合，
 * 最后通过 {@link #merge} 合并。merge 满足交换律与结合律，分区方式不影响最终结果。
 * 状态不可复制，只能通过下面四个方法修改或读取。
 * </p>
 *
 * @param <V> 输入值类型
 * @param <R> 结果值类型
 * @param <S> 可合并的部分聚合类型（即实现类自身）
 */
public interface Aggregator<V extends NullableValue<?>, R extends NullableValue<?>, S extends Aggregator<V, R, S>> {

    /** 每行数据调用一次 */
    void advance(V value);

    /** 合并另一个部分聚合，partial 本身不被修改 */
    void merge(S partial);

    /** 回到 Empty 状态，用于复用状态对象 */
    void reset();

    /** 聚合结果，纯读取；每次返回新的值对象 */
    R result();
}
