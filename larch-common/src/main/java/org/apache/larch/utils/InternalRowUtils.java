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

import org.apache.larch.data.InternalRow;
import org.apache.larch.types.DataField;
import org.apache.larch.types.DataTypeRoot;
import org.apache.larch.types.RowType;

import javax.annotation.Nullable;

/** {@link InternalRow} 工具类。 */
public class InternalRowUtils {

    /**
     * 为 '.' 分隔的嵌套字段路径创建字段读取器。
     *
     * <p>路径在创建时解析,读取时中间层的行为 null 则返回 null。
     *
     * @param rowType 行类型
     * @param fieldPath 字段路径,例如 {@code "meta.ts"}
     * @throws IllegalArgumentException 如果路径中的字段不存在,或中间字段不是 ROW 类型
     */
    public static InternalRow.FieldGetter createNestedFieldGetter(
            RowType rowType, String fieldPath) {
        String[] parts = fieldPath.split("\\.");
        InternalRow.FieldGetter[] getters = new InternalRow.FieldGetter[parts.length];
        RowType current = rowType;
        for (int i = 0; i < parts.length; i++) {
            int index = current.getFieldIndex(parts[i]);
            if (index < 0) {
                throw new IllegalArgumentException(
                        String.format(
                                "Field '%s' of path '%s' does not exist in %s.",
                                parts[i], fieldPath, current));
            }
            DataField field = current.getFields().get(index);
            getters[i] = InternalRow.createFieldGetter(field.type(), index);
            if (i < parts.length - 1) {
                if (!field.type().is(DataTypeRoot.ROW)) {
                    throw new IllegalArgumentException(
                            String.format(
                                    "Field '%s' of path '%s' is not a row.", parts[i], fieldPath));
                }
                current = (RowType) field.type();
            }
        }
        return row -> getNestedField(row, getters);
    }

    @Nullable
    private static Object getNestedField(InternalRow row, InternalRow.FieldGetter[] getters) {
        Object value = row;
        for (InternalRow.FieldGetter getter : getters) {
            value = getter.getFieldOrNull((InternalRow) value);
            if (value == null) {
                return null;
            }
        }
        return value;
    }

    private InternalRowUtils() {}
}
