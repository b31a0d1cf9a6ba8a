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
import org.apache.larch.keygen.InternalRowKeyGenerator;
import org.apache.larch.keygen.KeyGenerators;
import org.apache.larch.record.RecordType;
import org.apache.larch.types.RowType;

import java.util.List;

/**
 * 列式行组成的批次。
 *
 * <p>所有行按同一个源行类型读取,元数据列按固定位置读取。配置的键生成器必须实现
 * {@link InternalRowKeyGenerator}。
 */
public class InternalRowBatch extends RowBatch<InternalRow> {

    private final RowType sourceType;

    private final RowType writerType;

    private final RowType dataFileType;

    public InternalRowBatch(
            List<List<InternalRow>> partitions,
            RowType sourceType,
            RowType writerType,
            RowType dataFileType) {
        super(partitions);
        this.sourceType = sourceType;
        this.writerType = writerType;
        this.dataFileType = dataFileType;
    }

    @Override
    public RecordType recordType() {
        return RecordType.INTERNAL_ROW;
    }

    @Override
    public PartitionRecordCreator<InternalRow> createPartitionRecordCreator(
            RecordCreationContext context, int partitionId) {
        InternalRowMetaFieldAccessor accessor = new InternalRowMetaFieldAccessor(sourceType);

        RecordKeyResolver<InternalRow> keyResolver;
        if (context.prepped()) {
            keyResolver = RecordKeyResolver.prepped(accessor);
        } else {
            InternalRowKeyGenerator keyGenerator =
                    KeyGenerators.createForInternalRow(context.keyGeneratorOptions(partitionId));
            keyResolver =
                    RecordKeyResolver.generated(
                            row -> keyGenerator.getRecordKey(row, sourceType),
                            row -> keyGenerator.getPartitionPath(row, sourceType));
        }

        InternalRowProjector projector =
                new InternalRowProjector(
                        sourceType,
                        InternalRowProjector.targetType(context, writerType, dataFileType));

        InternalRowOrderingValueExtractor orderingExtractor =
                context.shouldCombine()
                        ? new InternalRowOrderingValueExtractor(
                                sourceType, context.precombineField())
                        : null;

        return new PartitionRecordCreator<>(
                context, partitionId, accessor, keyResolver, projector, orderingExtractor);
    }
}
