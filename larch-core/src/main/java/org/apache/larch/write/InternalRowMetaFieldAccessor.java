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
import org.apache.larch.record.MetadataField;
import org.apache.larch.record.RecordType;
import org.apache.larch.types.DataTypeRoot;
import org.apache.larch.types.RowType;

import javax.annotation.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按固定位置读取列式行的元数据列。
 *
 * <p>列式行的元数据列位于行首,位置由 {@link MetadataField#position()} 给出。
 * 某个位置上的字段名不匹配或不是字符串类型时视为该列缺失。
 */
public class InternalRowMetaFieldAccessor implements MetaFieldAccessor<InternalRow> {

    private final RowType rowType;

    public InternalRowMetaFieldAccessor(RowType rowType) {
        this.rowType = rowType;
    }

    @Override
    public RecordType recordType() {
        return RecordType.INTERNAL_ROW;
    }

    @Override
    public List<MetadataField> missingFields(InternalRow row) {
        return MetadataField.REQUIRED.stream()
                .filter(f -> !isPresent(f))
                .collect(Collectors.toList());
    }

    @Nullable
    @Override
    public String get(InternalRow row, MetadataField field) {
        int pos = field.position();
        if (!isPresent(field) || row.isNullAt(pos)) {
            return null;
        }
        return row.getString(pos);
    }

    private boolean isPresent(MetadataField field) {
        int pos = field.position();
        return pos < rowType.getFieldCount()
                && rowType.getFields().get(pos).name().equals(field.fieldName())
                && rowType.getTypeAt(pos).is(DataTypeRoot.VARCHAR);
    }
}
