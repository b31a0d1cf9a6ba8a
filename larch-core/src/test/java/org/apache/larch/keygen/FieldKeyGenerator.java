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

package org.apache.larch.keygen;

import org.apache.larch.data.InternalRow;
import org.apache.larch.options.Options;
import org.apache.larch.types.RowType;

import org.apache.avro.generic.GenericRecord;

import javax.annotation.Nullable;

/**
 * 测试用键生成器,直接使用单个字段的值作为记录键和分区路径。
 *
 * <p>没有配置记录键字段时生成 {@code instantTime_partitionId_sequence} 形式的键。
 * 记录每个方法的调用次数。
 */
public class FieldKeyGenerator implements InternalRowKeyGenerator {

    private final Options options;

    @Nullable private final String recordKeyField;

    @Nullable private final String partitionPathField;

    private long autoKeySequence;

    private int recordKeyCalls;

    private int partitionPathCalls;

    public FieldKeyGenerator(Options options) {
        this.options = options;
        this.recordKeyField = options.get(KeyGenOptions.RECORD_KEY_FIELD);
        this.partitionPathField = options.get(KeyGenOptions.PARTITION_PATH_FIELD);
    }

    @Override
    public String getRecordKey(GenericRecord record) {
        recordKeyCalls++;
        if (recordKeyField == null) {
            return nextAutoKey();
        }
        return toStringOrNull(record.get(recordKeyField));
    }

    @Override
    public String getPartitionPath(GenericRecord record) {
        partitionPathCalls++;
        return partitionPathField == null ? "" : toStringOrNull(record.get(partitionPathField));
    }

    @Override
    public String getRecordKey(InternalRow row, RowType rowType) {
        recordKeyCalls++;
        if (recordKeyField == null) {
            return nextAutoKey();
        }
        return toStringOrNull(read(row, rowType, recordKeyField));
    }

    @Override
    public String getPartitionPath(InternalRow row, RowType rowType) {
        partitionPathCalls++;
        return partitionPathField == null
                ? ""
                : toStringOrNull(read(row, rowType, partitionPathField));
    }

    public Options options() {
        return options;
    }

    public int recordKeyCalls() {
        return recordKeyCalls;
    }

    public int partitionPathCalls() {
        return partitionPathCalls;
    }

    private String nextAutoKey() {
        return options.get(KeyGenOptions.AUTO_KEY_INSTANT_TIME)
                + "_"
                + options.get(KeyGenOptions.AUTO_KEY_PARTITION_ID)
                + "_"
                + autoKeySequence++;
    }

    private static Object read(InternalRow row, RowType rowType, String field) {
        int index = rowType.getFieldIndex(field);
        return InternalRow.createFieldGetter(rowType.getTypeAt(index), index).getFieldOrNull(row);
    }

    @Nullable
    private static String toStringOrNull(@Nullable Object value) {
        return value == null ? null : value.toString();
    }
}
