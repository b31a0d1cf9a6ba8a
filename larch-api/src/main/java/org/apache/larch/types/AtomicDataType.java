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

import static org.apache.larch.utils.Preconditions.checkArgument;

/**
 * 原子数据类型,即除 {@link RowType} 之外不含子结构的类型。
 *
 * <p>类型根到 SQL 名称的映射:
 * <pre>
 * VARCHAR   -> STRING
 * BOOLEAN   -> BOOLEAN
 * VARBINARY -> BYTES
 * INTEGER   -> INT
 * BIGINT    -> BIGINT
 * DOUBLE    -> DOUBLE
 * </pre>
 */
@Public
public final class AtomicDataType extends DataType {

    private static final long serialVersionUID = 1L;

    public AtomicDataType(boolean isNullable, DataTypeRoot typeRoot) {
        super(isNullable, typeRoot);
        checkArgument(typeRoot != DataTypeRoot.ROW, "Use RowType for ROW type root.");
    }

    @Override
    public AtomicDataType copy(boolean isNullable) {
        return new AtomicDataType(isNullable, getTypeRoot());
    }

    @Override
    public String asSQLString() {
        return withNullability(sqlName());
    }

    private String sqlName() {
        switch (getTypeRoot()) {
            case VARCHAR:
                return "STRING";
            case BOOLEAN:
                return "BOOLEAN";
            case VARBINARY:
                return "BYTES";
            case INTEGER:
                return "INT";
            case BIGINT:
                return "BIGINT";
            case DOUBLE:
                return "DOUBLE";
            default:
                throw new IllegalStateException("Unexpected type root: " + getTypeRoot());
        }
    }
}
