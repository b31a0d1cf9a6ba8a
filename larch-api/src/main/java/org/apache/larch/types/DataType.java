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

import java.io.Serializable;
import java.util.Objects;

/**
 * 描述逻辑数据类型的抽象基类。
 *
 * <p>数据类型由类型根 {@link DataTypeRoot} 和可空性组成。可空性决定字段读取时是否需要
 * 先检查 null,也决定投影时目标字段缺少来源值能否填充 null。
 *
 * <p>子类:
 * <ul>
 *   <li>{@link AtomicDataType}: 原子类型,如 INT、STRING
 *   <li>{@link RowType}: 由有序字段组成的行类型
 * </ul>
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean isNullable;

    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    public boolean isNullable() {
        return isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    /**
     * 返回具有指定可空性的深拷贝。
     *
     * @param isNullable 新类型是否可空
     * @return 数据类型的拷贝
     */
    public abstract DataType copy(boolean isNullable);

    public final DataType copy() {
        return copy(isNullable);
    }

    public DataType notNull() {
        return copy(false);
    }

    public DataType nullable() {
        return copy(true);
    }

    public abstract String asSQLString();

    protected String withNullability(String format, Object... params) {
        if (!isNullable) {
            return String.format(format + " NOT NULL", params);
        }
        return String.format(format, params);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
