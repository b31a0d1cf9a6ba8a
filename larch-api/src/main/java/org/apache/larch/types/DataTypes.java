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

import java.util.Arrays;

/**
 * 用于创建 {@link DataType} 的工具类。
 *
 * <pre>{@code
 * RowType rowType =
 *         DataTypes.ROW(
 *                 DataTypes.FIELD(0, "id", DataTypes.STRING().notNull()),
 *                 DataTypes.FIELD(1, "ts", DataTypes.BIGINT()));
 * }</pre>
 */
@Public
public class DataTypes {

    public static AtomicDataType STRING() {
        return new AtomicDataType(true, DataTypeRoot.VARCHAR);
    }

    public static AtomicDataType BOOLEAN() {
        return new AtomicDataType(true, DataTypeRoot.BOOLEAN);
    }

    public static AtomicDataType BYTES() {
        return new AtomicDataType(true, DataTypeRoot.VARBINARY);
    }

    public static AtomicDataType INT() {
        return new AtomicDataType(true, DataTypeRoot.INTEGER);
    }

    public static AtomicDataType BIGINT() {
        return new AtomicDataType(true, DataTypeRoot.BIGINT);
    }

    public static AtomicDataType DOUBLE() {
        return new AtomicDataType(true, DataTypeRoot.DOUBLE);
    }

    public static DataField FIELD(int id, String name, DataType type) {
        return new DataField(id, name, type);
    }

    public static RowType ROW(DataField... fields) {
        return new RowType(Arrays.asList(fields));
    }

    private DataTypes() {}
}
