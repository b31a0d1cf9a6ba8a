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

import org.apache.larch.avro.AvroRecordUtils;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

/** 通过 {@link AvroRecordUtils#rewriteRecord} 把 Avro 行改写为目标 schema。 */
public class AvroRowProjector implements RowProjector<GenericRecord> {

    private final Schema targetSchema;

    public AvroRowProjector(Schema targetSchema) {
        this.targetSchema = targetSchema;
    }

    /**
     * 计算载荷的目标 schema。
     *
     * <p>去掉分区列时使用数据文件 schema,否则使用写入 schema。行会读取元数据列时,
     * 元数据列从目标 schema 中去掉。
     */
    public static Schema targetSchema(
            RecordCreationContext context, Schema writerSchema, Schema dataFileSchema) {
        Schema target = context.dropPartitionColumns() ? dataFileSchema : writerSchema;
        return context.readsLocation() ? AvroRecordUtils.removeMetadataFields(target) : target;
    }

    @Override
    public GenericRecord project(GenericRecord row) {
        return AvroRecordUtils.rewriteRecord(row, targetSchema);
    }
}
