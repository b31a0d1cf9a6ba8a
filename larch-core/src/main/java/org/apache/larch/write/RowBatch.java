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

import org.apache.larch.record.RecordType;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * 一批待物化的输入行,按分区组织。
 *
 * <p>行格式由子类决定,同一批次只使用一种格式。子类还负责为每个分区构造
 * {@link PartitionRecordCreator},构造时才创建键生成器、推导目标 schema。
 *
 * @param <R> 行类型
 */
public abstract class RowBatch<R> {

    private final List<List<R>> partitions;

    protected RowBatch(List<List<R>> partitions) {
        ImmutableList.Builder<List<R>> builder = ImmutableList.builder();
        for (List<R> partition : partitions) {
            builder.add(ImmutableList.copyOf(partition));
        }
        this.partitions = builder.build();
    }

    public int numPartitions() {
        return partitions.size();
    }

    public List<R> rows(int partitionId) {
        return partitions.get(partitionId);
    }

    public abstract RecordType recordType();

    /** 为第 {@code partitionId} 个分区创建新的物化器,不同分区之间不共享可变状态。 */
    public abstract PartitionRecordCreator<R> createPartitionRecordCreator(
            RecordCreationContext context, int partitionId);
}
