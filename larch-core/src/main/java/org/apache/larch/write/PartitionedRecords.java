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

import org.apache.larch.record.LarchRecord;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 按分区组织的物化结果,与输入批次的分区一一对应。
 *
 * <p>记录在迭代时才被创建。{@link #partition} 每次调用都返回独立的迭代器,
 * 第一次访问时才为该分区构造键生成器、目标 schema 和校验状态,空分区不做任何准备工作。
 * 分区内记录的顺序与输入行相同。
 *
 * @param <R> 行类型
 */
public class PartitionedRecords<R> {

    private final RecordCreationContext context;

    private final RowBatch<R> batch;

    PartitionedRecords(RecordCreationContext context, RowBatch<R> batch) {
        this.context = context;
        this.batch = batch;
    }

    public int numPartitions() {
        return batch.numPartitions();
    }

    /** 返回第 {@code partitionId} 个分区记录的惰性迭代器。 */
    public Iterator<LarchRecord<R>> partition(int partitionId) {
        Supplier<PartitionRecordCreator<R>> creator =
                Suppliers.memoize(
                        () -> batch.createPartitionRecordCreator(context, partitionId));
        return Iterators.transform(
                batch.rows(partitionId).iterator(), row -> creator.get().create(row));
    }

    /** 物化一个分区的全部记录。 */
    public List<LarchRecord<R>> collect(int partitionId) {
        return ImmutableList.copyOf(partition(partitionId));
    }

    /**
     * 在给定线程池上并发物化所有分区。
     *
     * <p>每个分区对应一个 future,某个分区失败只会让它自己的 future 异常完成。
     */
    public List<CompletableFuture<List<LarchRecord<R>>>> collectAsync(Executor executor) {
        List<CompletableFuture<List<LarchRecord<R>>>> futures = new ArrayList<>();
        for (int i = 0; i < numPartitions(); i++) {
            final int partitionId = i;
            futures.add(CompletableFuture.supplyAsync(() -> collect(partitionId), executor));
        }
        return futures;
    }
}
