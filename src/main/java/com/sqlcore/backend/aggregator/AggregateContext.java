package com.sqlcore.backend.aggregator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sqlcore.backend.value.Column;
import com.sqlcore.backend.value.DecimalVal;
import com.sqlcore.backend.value.NullableValue;
import com.sqlcore.backend.value.SqlType;
import com.sqlcore.backend.value.ValueKind;
import com.sqlcore.common.Error;
import com.sqlcore.common.ResultSet;
import com.sqlcore.config.AggregationConfig;

/**
 * 聚合器列表容器，对应一个分组的一份部分聚合。
 * <p>
 * 分组算子为每个分组持有一个上下文，逐行调用 {@link #accept}；
 * 并行执行时每个 worker 用 {@link #newPartial()} 得到同布局的空上下文，
 * 最后在屏障处通过 {@link #merge} 合并。
 * </p>
 */
public class AggregateContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateContext.class);

    /** COUNT(*) 不读取值，统一传入这个占位值 */
    private static final NullableValue<Long> ROW_MARKER = NullableValue.nullOf(ValueKind.INTEGER);

    private final List<AggregateCall> calls;
    /** 与 calls 一一对应，"*" 对应 null */
    private final List<Column> columns;
    private final List<Aggregator<?, ?, ?>> aggregators;
    private final AggregationConfig config;

    private AggregateContext(List<AggregateCall> calls, List<Column> columns, AggregationConfig config) {
        this.calls = calls;
        this.columns = columns;
        this.config = config;
        this.aggregators = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            aggregators.add(calls.get(i).func.create(columns.get(i), config));
        }
    }

    public static AggregateContext of(List<Column> fields, List<AggregateCall> calls, AggregationConfig config) {
        Map<String, Column> fieldMap = new HashMap<>();
        for (Column f : fields) {
            fieldMap.put(f.getName(), f);
        }
        List<Column> resolved = new ArrayList<>(calls.size());
        // 遍历聚合调用，依次解析所引用的列
        for (AggregateCall call : calls) {
            Column column = null;
            if(call.field != null) {
                column = fieldMap.get(call.field);
                if(column == null) {
                    throw Error.FieldNotFoundException;
                }
            }
            resolved.add(column);
        }
        AggregateContext context = new AggregateContext(new ArrayList<>(calls), resolved, config);
        LOGGER.debug("Created aggregate context {}", context.labels());
        return context;
    }

    public static AggregateContext of(List<Column> fields, AggregateCall... calls) {
        return of(fields, Arrays.asList(calls), AggregationConfig.getDefault());
    }

    public AggregationConfig getConfig() {
        return config;
    }

    /** 同布局的空上下文，用于另一个分区或 worker */
    public AggregateContext newPartial() {
        return new AggregateContext(calls, columns, config);
    }

    public boolean isCompatible(AggregateContext other) {
        return calls.equals(other.calls) && columns.equals(other.columns);
    }

    /**
     * 每行数据调用一次。行中缺失的列按 NULL 处理。
     * 先校验整行再推进聚合器，被拒绝的行不会改变任何聚合状态。
     */
    public void accept(Map<String, NullableValue<?>> row) {
        NullableValue<?>[] values = new NullableValue<?>[aggregators.size()];
        for (int i = 0; i < values.length; i++) {
            Column column = columns.get(i);
            NullableValue<?> value;
            if(column == null) {
                value = ROW_MARKER;
            } else {
                value = row.get(column.getName());
                if(value == null) {
                    value = column.nullValue();
                } else {
                    checkValue(column, value);
                }
            }
            values[i] = value;
        }
        for (int i = 0; i < values.length; i++) {
            advance(aggregators.get(i), values[i]);
        }
    }

    private void checkValue(Column column, NullableValue<?> value) {
        if(value.kind() != column.getType().kind()) {
            throw Error.TypeMismatchException;
        }
        if(column.getType() != SqlType.DECIMAL) {
            return;
        }
        if(!(value instanceof DecimalVal)) {
            throw Error.TypeMismatchException;
        }
        if(config.isStrictScale() && !value.isNull() && ((DecimalVal) value).precision() != column.getScale()) {
            throw Error.ScaleMismatchException;
        }
    }

    /**
     * 合并另一个分区的部分聚合，partial 本身不变。
     */
    public void merge(AggregateContext partial) {
        if(!isCompatible(partial)) {
            throw Error.IncompatiblePartialException;
        }
        for (int i = 0; i < aggregators.size(); i++) {
            merge(aggregators.get(i), partial.aggregators.get(i));
        }
    }

    public void reset() {
        for (Aggregator<?, ?, ?> agg : aggregators) {
            agg.reset();
        }
    }

    // 输入类型已在 accept 中按列校验，聚合器由同一个 AggregateFunc 按列类型创建
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void advance(Aggregator agg, NullableValue<?> value) {
        agg.advance(value);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void merge(Aggregator agg, Aggregator partial) {
        if(agg.getClass() != partial.getClass()) {
            throw Error.IncompatiblePartialException;
        }
        agg.merge(partial);
    }

    public int size() {
        return aggregators.size();
    }

    public List<String> labels() {
        List<String> headers = new ArrayList<>();
        for (AggregateCall call : calls) {
            headers.add(call.alias != null ? call.alias : call.label());
        }
        return headers;
    }

    public List<NullableValue<?>> values() {
        List<NullableValue<?>> values = new ArrayList<>();
        for (Aggregator<?, ?, ?> agg : aggregators) {
            values.add(agg.result());
        }
        return values;
    }

    public List<String> stringValues() {
        List<String> values = new ArrayList<>();
        for (NullableValue<?> v : values()) {
            values.add(v.stringValue(config.getNullLabel()));
        }
        return values;
    }

    /**
     * 将当前聚合结果转为列名 -> 值的映射。
     * @param aliases 可选的列名列表；为空或某项为 null 时使用默认 label。
     */
    public Map<String, NullableValue<?>> toValueMap(List<String> aliases) {
        List<String> labels = labels();
        List<NullableValue<?>> vals = values();
        Map<String, NullableValue<?>> map = new LinkedHashMap<>();
        for (int i = 0; i < aggregators.size(); i++) {
            String alias = (aliases != null && i < aliases.size()) ? aliases.get(i) : null;
            map.put(alias != null ? alias : labels.get(i), vals.get(i));
        }
        return map;
    }

    public ResultSet toResultSet() {
        ResultSet rs = new ResultSet(labels());
        appendTo(rs);
        return rs;
    }

    /** 追加为结果集中的一行，列头须由 {@link #labels()} 生成 */
    public void appendTo(ResultSet rs) {
        rs.addRow(stringValues());
    }
}
