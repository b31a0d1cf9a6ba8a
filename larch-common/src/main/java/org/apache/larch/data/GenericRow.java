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

import java.io.Serializable;
import java.util.Arrays;

/**
 * {@link InternalRow} 的通用实现,底层由 Java {@link Object} 数组支持。
 *
 * <p>字段可以为 null 以表示空值。字段值必须是 {@link InternalRow} 中列出的内部数据结构,
 * 否则类型化的 getter 会抛出 {@link ClassCastException}。
 *
 * <p>投影产生的载荷行总是新的 {@link GenericRow},与输入行不共享字段数组。
 */
@Public
public final class GenericRow implements InternalRow, Serializable {

    private static final long serialVersionUID = 1L;

    /** 存储实际内部格式值的数组 */
    private final Object[] fields;

    /**
     * 创建具有给定字段数量的 {@link GenericRow} 实例,初始时所有字段都为 null。
     *
     * @param arity 字段数量
     */
    public GenericRow(int arity) {
        this.fields = new Object[arity];
    }

    public void setField(int pos, Object value) {
        this.fields[pos] = value;
    }

    public Object getField(int pos) {
        return this.fields[pos];
    }

    @Override
    public int getFieldCount() {
        return fields.length;
    }

    @Override
    public boolean isNullAt(int pos) {
        return this.fields[pos] == null;
    }

    @Override
    public boolean getBoolean(int pos) {
        return (boolean) this.fields[pos];
    }

    @Override
    public int getInt(int pos) {
        return (int) this.fields[pos];
    }

    @Override
    public long getLong(int pos) {
        return (long) this.fields[pos];
    }

    @Override
    public double getDouble(int pos) {
        return (double) this.fields[pos];
    }

    @Override
    public String getString(int pos) {
        return (String) this.fields[pos];
    }

    @Override
    public byte[] getBinary(int pos) {
        return (byte[]) this.fields[pos];
    }

    @Override
    public InternalRow getRow(int pos, int numFields) {
        return (InternalRow) this.fields[pos];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenericRow)) {
            return false;
        }
        GenericRow that = (GenericRow) o;
        return Arrays.deepEquals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("+I(");
        for (int i = 0; i < fields.length; i++) {
            if (i != 0) {
                sb.append(",");
            }
            sb.append(arrayAwareToString(fields[i]));
        }
        sb.append(")");
        return sb.toString();
    }

    private static String arrayAwareToString(Object o) {
        final String arrayString = Arrays.deepToString(new Object[] {o});
        return arrayString.substring(1, arrayString.length() - 1);
    }

    /**
     * 使用给定的字段值创建 {@link GenericRow} 实例。
     *
     * <pre>{@code
     * GenericRow row = GenericRow.of("id-1", 5L, "emea", 1.5d);
     * }</pre>
     *
     * @param values 字段值数组(每个值必须是内部数据结构)
     * @return 新创建的 GenericRow 实例
     */
    public static GenericRow of(Object... values) {
        GenericRow row = new GenericRow(values.length);

        for (int i = 0; i < values.length; ++i) {
            row.setField(i, values[i]);
        }

        return row;
    }
}
