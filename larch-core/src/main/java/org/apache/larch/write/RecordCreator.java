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

import org.apache.larch.options.Options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把输入行批次物化为带键记录的入口。
 *
 * <pre>{@code
 * RecordCreationContext context = RecordCreationContext.create(options);
 * PartitionedRecords<GenericRecord> records =
 *         RecordCreator.createRecords(context, new AvroRowBatch(rows, writerSchema, fileSchema));
 * for (int i = 0; i < records.numPartitions(); i++) {
 *     Iterator<LarchRecord<GenericRecord>> iterator = records.partition(i);
 *     ...
 * }
 * }</pre>
 *
 * <p>行格式由批次类型决定,每个批次只判断一次。
 */
public class RecordCreator {

    private static final Logger LOG = LoggerFactory.getLogger(RecordCreator.class);

    public static <R> PartitionedRecords<R> createRecords(
            RecordCreationContext context, RowBatch<R> batch) {
        LOG.debug(
                "Creating {} records for {} partitions with {}.",
                batch.recordType(),
                batch.numPartitions(),
                context);
        return new PartitionedRecords<>(context, batch);
    }

    public static <R> PartitionedRecords<R> createRecords(Options options, RowBatch<R> batch) {
        return createRecords(RecordCreationContext.create(options), batch);
    }

    private RecordCreator() {}
}
