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

package org.apache.larch.utils;

import org.apache.larch.data.GenericRow;
import org.apache.larch.data.InternalRow;
import org.apache.larch.types.DataField;
import org.apache.larch.types.DataType;
import org.apache.larch.types.DataTypeRoot;
import org.apache.larch.types.RowType;
import org.apache.larch.types.SchemaProjectionException;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * 按字段名把 {@link InternalRow} 从源 {@link RowType} 投影到目标 {@link RowType}。
 *
 * <p>投影规则:
 * <ul>
 *   <li>源和目标都有的字段: 复制字段值,嵌套行递归投影
 *   <li>只在源中出现的字段: 丢弃
 *   <li>只在目标中出现的字段: 可空时填充 null,否则抛出 {@link SchemaProjectionException}
 * </ul>
 *
 * <p>投影结果总是新的 {@link GenericRow},不会与输入行共享可变结构。
 * byte[] 字段会被复制。
 *
 * <p>投影计划只依赖两个行类型,通过 {@link #of(RowType, RowType)} 获取的实例会被缓存,
 * 同一对类型在多个分区间复用同一个计划。
 */
public class InternalRowProjection implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Cache<CacheKey, InternalRowProjection> PROJECTIONS =
            Caffeine.newBuilder().maximumSize(256).executor(Runnable::run).build();

    private final RowType targetType;

    /** 目标字段在源中的位置,-1 表示源中不存在 */
    private final int[] sourceIndexes;

    private final InternalRow.FieldGetter[] getters;

    /** 嵌套行字段的子投影,非嵌套字段为 null */
    private final InternalRowProjection[] nested;

    private InternalRowProjection(RowType sourceType, RowType targetType) {
        this.targetType = targetType;
        int arity = targetType.getFieldCount();
        this.sourceIndexes = new int[arity];
        this.getters = new InternalRow.FieldGetter[arity];
        this.nested = new InternalRowProjection[arity];

        for (int i = 0; i < arity; i++) {
            DataField targetField = targetType.getFields().get(i);
            int sourceIndex = sourceType.getFieldIndex(targetField.name());
            sourceIndexes[i] = sourceIndex;
            if (sourceIndex < 0) {
                if (!targetField.type().isNullable()) {
                    throw new SchemaProjectionException(
                            String.format(
                                    "Field '%s' is required by the target type %s but missing in the source type %s.",
                                    targetField.name(), targetType, sourceType));
                }
                continue;
            }

            DataType sourceFieldType = sourceType.getTypeAt(sourceIndex);
            DataType targetFieldType = targetField.type();
            if (sourceFieldType.getTypeRoot() != targetFieldType.getTypeRoot()) {
                throw new SchemaProjectionException(
                        String.format(
                                "Field '%s' has type %s in the source but %s in the target.",
                                targetField.name(), sourceFieldType, targetFieldType));
            }
            getters[i] = InternalRow.createFieldGetter(sourceFieldType, sourceIndex);
            if (targetFieldType.is(DataTypeRoot.ROW)) {
                nested[i] =
                        new InternalRowProjection(
                                (RowType) sourceFieldType, (RowType) targetFieldType);
            }
        }
    }

    /**
     * 获取(可能是缓存的)投影。
     *
     * @param sourceType 输入行的类型
     * @param targetType 投影后的类型
     * @return 投影
     * @throws SchemaProjectionException 如果目标类型无法由源类型填充
     */
    public static InternalRowProjection of(RowType sourceType, RowType targetType) {
        return PROJECTIONS.get(
                new CacheKey(sourceType, targetType),
                k -> new InternalRowProjection(sourceType, targetType));
    }

    public RowType targetType() {
        return targetType;
    }

    public GenericRow apply(InternalRow row) {
        GenericRow result = new GenericRow(sourceIndexes.length);
        for (int i = 0; i < sourceIndexes.length; i++) {
            if (sourceIndexes[i] < 0) {
                continue;
            }
            Object value = getters[i].getFieldOrNull(row);
            if (value == null) {
                if (!targetType.getTypeAt(i).isNullable()) {
                    throw new SchemaProjectionException(
                            String.format(
                                    "Field '%s' is not nullable in the target type but is null in the row.",
                                    targetType.getFields().get(i).name()));
                }
                continue;
            }
            if (nested[i] != null) {
                value = nested[i].apply((InternalRow) value);
            } else if (value instanceof byte[]) {
                byte[] bytes = (byte[]) value;
                value = Arrays.copyOf(bytes, bytes.length);
            }
            result.setField(i, value);
        }
        return result;
    }

    private static final class CacheKey {

        private final RowType sourceType;
        private final RowType targetType;

        private CacheKey(RowType sourceType, RowType targetType) {
            this.sourceType = sourceType;
            this.targetType = targetType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            CacheKey that = (CacheKey) o;
            return sourceType.equals(that.sourceType) && targetType.equals(that.targetType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sourceType, targetType);
        }
    }
}
