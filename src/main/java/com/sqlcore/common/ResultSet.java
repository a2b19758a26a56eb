package com.sqlcore.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * 结构化的聚合结果，包含列头和行值。
 * 值使用字符串表示，每个分组一行。
 */
public class ResultSet {
    private final List<String> headers;
    private final List<List<String>> rows;

    public ResultSet(List<String> headers) {
        this(headers, null);
    }

    public ResultSet(List<String> headers, List<List<String>> rows) {
        this.headers = headers == null ? Collections.emptyList() : new ArrayList<>(headers);
        this.rows = new ArrayList<>();
        if(rows != null) {
            for (List<String> row : rows) {
                addRow(row);
            }
        }
    }

    public void addRow(List<String> row) {
        Preconditions.checkArgument(row.size() == headers.size(),
                "row has %s values but there are %s headers", row.size(), headers.size());
        rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    public List<List<String>> getRows() {
        return Collections.unmodifiableList(rows);
    }
}
