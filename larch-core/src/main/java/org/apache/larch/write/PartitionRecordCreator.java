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

import org.apache.larch.annotation.VisibleForTesting;
import org.apache.larch.record.LarchRecord;
import org.apache.larch.record.RecordKey;
import org.apache.larch.record.RecordLocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * 把一个分区的行逐条物化为 {@link LarchRecord}。
 *
 * <p>每行的处理顺序:
 * <ol>
 *   <li>prepped 行: 分区的第一行检查元数据列
 *   <li>确定记录键和分区路径
 *   <li>读取位置(仅 prepped 或 MERGE INTO 预处理的行)
 *   <li>需要合并时从输入行读取排序值
 *   <li>投影载荷并组装记录
 * </ol>
 *
 * <p>实例由 {@link RowBatch} 为每个分区单独创建,持有该分区的校验状态,不是线程安全的。
 *
 * @param <R> 行类型
 */
public class PartitionRecordCreator<R> {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionRecordCreator.class);

    private final int partitionId;

    @Nullable private final PreppedRecordValidator<R> validator;

    private final RecordKeyResolver<R> keyResolver;

    private final RecordLocationResolver<R> locationResolver;

    private final RowProjector<R> projector;

    @Nullable private final OrderingValueExtractor<R> orderingExtractor;

    private final LarchRecordBuilder recordBuilder;

    private long rowIndex;

    public PartitionRecordCreator(
            RecordCreationContext context,
            int partitionId,
            MetaFieldAccessor<R> accessor,
            RecordKeyResolver<R> keyResolver,
            RowProjector<R> projector,
            @Nullable OrderingValueExtractor<R> orderingExtractor) {
        this.partitionId = partitionId;
        this.validator = context.prepped() ? new PreppedRecordValidator<>(accessor) : null;
        this.keyResolver = keyResolver;
        this.locationResolver = new RecordLocationResolver<>(accessor, context.readsLocation());
        this.projector = projector;
        this.orderingExtractor = orderingExtractor;
        this.recordBuilder = new LarchRecordBuilder(context.payloadName());
        LOG.debug(
                "Created record creator for {} partition {}, prepped: {}, reads location: {}, combine: {}.",
                accessor.recordType(),
                partitionId,
                context.prepped(),
                context.readsLocation(),
                orderingExtractor != null);
    }

    public LarchRecord<R> create(R row) {
        if (validator != null) {
            validator.validate(row);
        }
        RecordKey key = keyResolver.resolve(row, partitionId, rowIndex++);
        RecordLocation location = locationResolver.resolve(row);
        if (orderingExtractor == null) {
            return recordBuilder.build(key, projector.project(row), location);
        }
        Comparable<?> orderingValue = orderingExtractor.extract(row);
        return recordBuilder.build(key, projector.project(row), orderingValue, location);
    }

    @VisibleForTesting
    @Nullable
    PreppedRecordValidator<R> validator() {
        return validator;
    }
}
