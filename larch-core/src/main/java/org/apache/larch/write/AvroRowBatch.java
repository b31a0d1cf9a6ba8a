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

import org.apache.larch.keygen.KeyGenerator;
import org.apache.larch.keygen.KeyGenerators;
import org.apache.larch.record.RecordType;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import java.util.List;

/**
 * Avro 行组成的批次。
 *
 * <p>每行携带自己的 schema,元数据列和预合并字段都按名称读取。
 */
public class AvroRowBatch extends RowBatch<GenericRecord> {

    private final Schema writerSchema;

    private final Schema dataFileSchema;

    /**
     * @param partitions 按分区组织的行
     * @param writerSchema 写入 schema
     * @param dataFileSchema 数据文件 schema,去掉分区列时使用
     */
    public AvroRowBatch(
            List<List<GenericRecord>> partitions, Schema writerSchema, Schema dataFileSchema) {
        super(partitions);
        this.writerSchema = writerSchema;
        this.dataFileSchema = dataFileSchema;
    }

    @Override
    public RecordType recordType() {
        return RecordType.AVRO;
    }

    @Override
    public PartitionRecordCreator<GenericRecord> createPartitionRecordCreator(
            RecordCreationContext context, int partitionId) {
        AvroMetaFieldAccessor accessor = new AvroMetaFieldAccessor();

        RecordKeyResolver<GenericRecord> keyResolver;
        if (context.prepped()) {
            keyResolver = RecordKeyResolver.prepped(accessor);
        } else {
            KeyGenerator keyGenerator =
                    KeyGenerators.create(context.keyGeneratorOptions(partitionId));
            keyResolver =
                    RecordKeyResolver.generated(
                            keyGenerator::getRecordKey, keyGenerator::getPartitionPath);
        }

        AvroRowProjector projector =
                new AvroRowProjector(
                        AvroRowProjector.targetSchema(context, writerSchema, dataFileSchema));

        AvroOrderingValueExtractor orderingExtractor =
                context.shouldCombine()
                        ? new AvroOrderingValueExtractor(
                                context.precombineField(), context.consistentLogicalTimestamp())
                        : null;

        return new PartitionRecordCreator<>(
                context, partitionId, accessor, keyResolver, projector, orderingExtractor);
    }
}
