/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.larch.types;

import org.apache.larch.annotation.Public;
import org.apache.larch.utils.Preconditions;
import org.apache.larch.utils.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 行类型,由有序的 {@link DataField} 序列组成。
 *
 * <p>在记录物化流水线中,行类型承担三种角色:
 * <ul>
 *   <li>源类型: 输入行实际的布局
 *   <li>写入类型: 可能包含系统保留字段的目标布局
 *   <li>数据文件类型: 最终落盘的布局,可能去掉了分区列
 * </ul>
 *
 * <p>字段名必须唯一且非空白。按名查找的索引延迟构建并缓存。
 */
@Public
public final class RowType extends DataType {

    private static final long serialVersionUID = 1L;

    public static final String FORMAT = "ROW<%s>";

    private final List<DataField> fields;

    // 延迟初始化的索引,用于高效的字段查询
    private transient volatile Map<String, Integer> laziedNameToIndex;

    public RowType(boolean isNullable, List<DataField> fields) {
        super(isNullable, DataTypeRoot.ROW);
        this.fields =
                Collections.unmodifiableList(
                        new ArrayList<>(
                                Preconditions.checkNotNull(fields, "Fields must not be null.")));

        validateFields(fields);
    }

    public RowType(List<DataField> fields) {
        this(true, fields);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.stream().map(DataField::name).collect(Collectors.toList());
    }

    public DataType getTypeAt(int i) {
        return fields.get(i).type();
    }

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * 按名称查找字段位置。
     *
     * @param fieldName 字段名
     * @return 字段位置,不存在时返回 -1
     */
    public int getFieldIndex(String fieldName) {
        return nameToIndex().getOrDefault(fieldName, -1);
    }

    public boolean containsField(String fieldName) {
        return nameToIndex().containsKey(fieldName);
    }

    public DataField getField(String fieldName) {
        int index = getFieldIndex(fieldName);
        if (index < 0) {
            throw new RuntimeException("Cannot find field: " + fieldName);
        }
        return fields.get(index);
    }

    /**
     * 返回去掉满足条件的字段后的新行类型,字段顺序保持不变。
     *
     * @param excluded 需要排除的字段
     * @return 新的行类型
     */
    public RowType withoutFields(Predicate<DataField> excluded) {
        return new RowType(
                isNullable(),
                fields.stream().filter(excluded.negate()).collect(Collectors.toList()));
    }

    @Override
    public RowType copy(boolean isNullable) {
        return new RowType(
                isNullable, fields.stream().map(DataField::copy).collect(Collectors.toList()));
    }

    @Override
    public String asSQLString() {
        return withNullability(
                FORMAT,
                fields.stream().map(DataField::asSQLString).collect(Collectors.joining(", ")));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        RowType rowType = (RowType) o;
        return fields.equals(rowType.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), fields);
    }

    private static void validateFields(List<DataField> fields) {
        final List<String> fieldNames =
                fields.stream().map(DataField::name).collect(Collectors.toList());
        if (fieldNames.stream().anyMatch(StringUtils::isNullOrWhitespaceOnly)) {
            throw new IllegalArgumentException(
                    "Field names must contain at least one non-whitespace character.");
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates =
                fieldNames.stream().filter(n -> !seen.add(n)).collect(Collectors.toSet());
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException(
                    String.format("Field names must be unique. Found duplicates: %s", duplicates));
        }
    }

    private Map<String, Integer> nameToIndex() {
        Map<String, Integer> nameToIndex = this.laziedNameToIndex;
        if (nameToIndex == null) {
            nameToIndex = new HashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                nameToIndex.put(fields.get(i).name(), i);
            }
            this.laziedNameToIndex = nameToIndex;
        }
        return nameToIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** {@link RowType} 的构建器,字段 ID 按添加顺序自增。 */
    public static class Builder {

        private final List<DataField> fields = new ArrayList<>();

        private int nextId = 0;

        public Builder field(String name, DataType type) {
            fields.add(new DataField(nextId++, name, type));
            return this;
        }

        public Builder field(String name, DataType type, String description) {
            fields.add(new DataField(nextId++, name, type, description));
            return this;
        }

        public RowType build() {
            return new RowType(fields);
        }
    }
}
