package com.qiu.codecache.codegen;

import com.qiu.codecache.core.Slice;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 行投影的编译产物：把基础 schema 的行投影为目标 schema 的行
 *
 * <p>键格式（大端）：
 * <pre>
 * int32 类型tag | int32 基础列数 | 基础列名... | int32 投影列数 | 投影列名...
 * 列名 = int32 字节长度 + UTF-8 字节
 * </pre>
 * 投影中不存在于基础 schema 的列投影为 null。
 */
public class RowProjectorArtifact extends JitArtifact {
    private final List<String> baseColumns;
    private final List<String> projectionColumns;
    private final int[] mapping;

    public RowProjectorArtifact(List<String> baseColumns, List<String> projectionColumns, CodeOwner owner) {
        super(ArtifactType.ROW_PROJECTOR, owner);
        Objects.requireNonNull(baseColumns, "Base columns cannot be null");
        Objects.requireNonNull(projectionColumns, "Projection columns cannot be null");
        this.baseColumns = Collections.unmodifiableList(new ArrayList<>(baseColumns));
        this.projectionColumns = Collections.unmodifiableList(new ArrayList<>(projectionColumns));
        this.mapping = new int[this.projectionColumns.size()];
        for (int i = 0; i < mapping.length; i++) {
            mapping[i] = this.baseColumns.indexOf(this.projectionColumns.get(i));
        }
    }

    public List<String> getBaseColumns() {
        return baseColumns;
    }

    public List<String> getProjectionColumns() {
        return projectionColumns;
    }

    /**
     * 投影一行数据
     */
    public Object[] projectRow(Object[] baseRow) {
        if (baseRow.length != baseColumns.size()) {
            throw new IllegalArgumentException("Row has " + baseRow.length
                    + " columns, expected " + baseColumns.size());
        }
        Object[] projected = new Object[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            projected[i] = mapping[i] >= 0 ? baseRow[mapping[i]] : null;
        }
        return projected;
    }

    @Override
    public void encodeOwnKey(ByteArrayOutputStream out) throws KeyEncodingException {
        writeKey(baseColumns, projectionColumns, out);
    }

    /**
     * 不构造产物，直接生成查找用的键
     */
    public static Slice encodeKey(List<String> baseColumns, List<String> projectionColumns)
            throws KeyEncodingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeKey(baseColumns, projectionColumns, out);
        return Slice.wrap(out.toByteArray());
    }

    private static void writeKey(List<String> baseColumns, List<String> projectionColumns,
                                 ByteArrayOutputStream out) throws KeyEncodingException {
        try {
            DataOutputStream data = new DataOutputStream(out);
            data.writeInt(ArtifactType.ROW_PROJECTOR.getTag());
            writeColumns("base", baseColumns, data);
            writeColumns("projection", projectionColumns, data);
            data.flush();
        } catch (IOException e) {
            throw new KeyEncodingException("Failed to write row projector key", e);
        }
    }

    private static void writeColumns(String schema, List<String> columns, DataOutputStream data)
            throws IOException, KeyEncodingException {
        if (columns == null) {
            throw new KeyEncodingException("Missing " + schema + " schema");
        }
        Set<String> seen = new HashSet<>();
        data.writeInt(columns.size());
        for (String column : columns) {
            if (column == null || column.isEmpty()) {
                throw new KeyEncodingException("Empty column name in " + schema + " schema");
            }
            if (!seen.add(column)) {
                throw new KeyEncodingException("Duplicate column '" + column + "' in " + schema + " schema");
            }
            byte[] bytes = column.getBytes(StandardCharsets.UTF_8);
            data.writeInt(bytes.length);
            data.write(bytes);
        }
    }

    @Override
    public String toString() {
        return String.format("RowProjectorArtifact{base=%s, projection=%s, refs=%d}",
                baseColumns, projectionColumns, getRefCount());
    }
}
