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

package org.apache.larch.data;

import org.apache.larch.annotation.Public;
import org.apache.larch.types.DataType;
import org.apache.larch.types.RowType;

import javax.annotation.Nullable;

import java.io.Serializable;

/* This file is based on source code of Apache Flink Project (https://flink.apache.org/), licensed by the Apache
 * Software Foundation (ASF) under the Apache License, Version 2.0. See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership. */

/**
 * 列式(定长布局)行的基础接口,用于表示 {@link RowType} 的数据。
 *
 * <p>与自描述的 Avro 记录不同,{@link InternalRow} 不携带字段名,字段只能按位置访问,
 * 字段名和类型由批次共享的 {@link RowType} 给出。
 *
 * <p>逻辑类型到内部数据结构的映射表如下:
 *
 * <pre>
 * +--------------------------------+-----------------------------------------+
 * | 逻辑类型                        | 内部数据结构                              |
 * +--------------------------------+-----------------------------------------+
 * | STRING                         | {@link String}                          |
 * +--------------------------------+-----------------------------------------+
 * | BOOLEAN                        | boolean                                 |
 * +--------------------------------+-----------------------------------------+
 * | BYTES                          | byte[]                                  |
 * +--------------------------------+-----------------------------------------+
 * | INT                            | int                                     |
 * +--------------------------------+-----------------------------------------+
 * | BIGINT                         | long                                    |
 * +--------------------------------+-----------------------------------------+
 * | DOUBLE                         | double                                  |
 * +--------------------------------+-----------------------------------------+
 * | ROW                            | {@link InternalRow}                     |
 * +--------------------------------+-----------------------------------------+
 * </pre>
 *
 * <p>空值处理: 所有的空值(NULL)都由容器数据结构统一处理,读取前应先调用 {@link #isNullAt}。
 *
 * @see GenericRow
 */
@Public
public interface InternalRow {

    /** 返回此行中的字段数量。 */
    int getFieldCount();

    boolean isNullAt(int pos);

    boolean getBoolean(int pos);

    int getInt(int pos);

    long getLong(int pos);

    double getDouble(int pos);

    String getString(int pos);

    byte[] getBinary(int pos);

    /**
     * 返回指定位置的嵌套行。
     *
     * @param pos 字段位置索引
     * @param numFields 嵌套行的字段数量
     * @return 嵌套行
     */
    InternalRow getRow(int pos, int numFields);

    // ------------------------------------------------------------------------------------------
    // 访问工具方法
    // ------------------------------------------------------------------------------------------

    /**
     * 创建一个字段访问器,用于在内部行数据结构中获取指定位置的元素。
     *
     * <p>对于可空字段,访问器会先做空值检查。
     *
     * <pre>{@code
     * FieldGetter getter = InternalRow.createFieldGetter(DataTypes.BIGINT(), 1);
     * Long ts = (Long) getter.getFieldOrNull(row);
     * }</pre>
     *
     * @param fieldType 行元素的类型
     * @param fieldPos 行元素的位置(从0开始)
     * @return 字段访问器
     */
    static FieldGetter createFieldGetter(DataType fieldType, int fieldPos) {
        final FieldGetter fieldGetter;
        // ordered by type root definition
        switch (fieldType.getTypeRoot()) {
            case VARCHAR:
                fieldGetter = row -> row.getString(fieldPos);
                break;
            case BOOLEAN:
                fieldGetter = row -> row.getBoolean(fieldPos);
                break;
            case VARBINARY:
                fieldGetter = row -> row.getBinary(fieldPos);
                break;
            case INTEGER:
                fieldGetter = row -> row.getInt(fieldPos);
                break;
            case BIGINT:
                fieldGetter = row -> row.getLong(fieldPos);
                break;
            case DOUBLE:
                fieldGetter = row -> row.getDouble(fieldPos);
                break;
            case ROW:
                final int rowFieldCount = ((RowType) fieldType).getFieldCount();
                fieldGetter = row -> row.getRow(fieldPos, rowFieldCount);
                break;
            default:
                String msg =
                        String.format(
                                "type %s not support in %s",
                                fieldType.getTypeRoot().toString(), InternalRow.class.getName());
                throw new IllegalArgumentException(msg);
        }
        if (!fieldType.isNullable()) {
            return fieldGetter;
        }
        return row -> {
            if (row.isNullAt(fieldPos)) {
                return null;
            }
            return fieldGetter.getFieldOrNull(row);
        };
    }

    /** 字段访问器接口,用于在运行时获取行的字段值。 */
    interface FieldGetter extends Serializable {
        @Nullable
        Object getFieldOrNull(InternalRow row);
    }
}
