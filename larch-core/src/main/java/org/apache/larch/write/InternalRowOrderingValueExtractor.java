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

package org.apache.larch.write;

import org.apache.larch.data.InternalRow;
import org.apache.larch.types.RowType;
import org.apache.larch.utils.InternalRowUtils;

import javax.annotation.Nullable;

/** 从列式行读取排序值,字段路径在构造时按行类型解析。 */
public class InternalRowOrderingValueExtractor implements OrderingValueExtractor<InternalRow> {

    private final String field;

    private final InternalRow.FieldGetter getter;

    public InternalRowOrderingValueExtractor(RowType rowType, String field) {
        this.field = field;
        this.getter = InternalRowUtils.createNestedFieldGetter(rowType, field);
    }

    @Nullable
    @Override
    public Comparable<?> extract(InternalRow row) {
        Object value = getter.getFieldOrNull(row);
        return value == null ? null : OrderingValueExtractor.checkComparable(value, field);
    }
}
