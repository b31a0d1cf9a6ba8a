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

import org.apache.larch.WriteOperationType;
import org.apache.larch.WriteOptions;
import org.apache.larch.keygen.KeyGenerators;
import org.apache.larch.options.Options;

import static org.apache.larch.utils.Preconditions.checkArgument;

/**
 * 一个批次物化记录时使用的不可变设置。
 *
 * <p>所有分区共享同一个实例。是否合并由 {@link CombinePolicy} 在创建时计算一次,
 * 不会在每行上重新判断。配置在创建时复制,之后对原 {@link Options} 的修改不会生效。
 */
public final class RecordCreationContext {

    private final Options options;
    private final WriteOperationType operation;
    private final String instantTime;
    private final boolean prepped;
    private final boolean mergeIntoPrepped;
    private final boolean dropPartitionColumns;
    private final boolean shouldCombine;
    private final String precombineField;
    private final String payloadName;
    private final boolean consistentLogicalTimestamp;

    private RecordCreationContext(Options options) {
        this.options = options;
        WriteOptions writeOptions = new WriteOptions(options);
        this.operation = writeOptions.operation();
        this.instantTime = writeOptions.instantTime();
        checkArgument(
                instantTime != null, "Option '%s' must be set.", WriteOptions.INSTANT_TIME.key());
        this.prepped = writeOptions.prepped();
        this.mergeIntoPrepped = writeOptions.mergeIntoPrepped();
        this.dropPartitionColumns = writeOptions.dropPartitionColumns();
        this.shouldCombine = CombinePolicy.shouldCombine(prepped, operation, writeOptions);
        this.precombineField = writeOptions.precombineField();
        this.payloadName = writeOptions.payload();
        this.consistentLogicalTimestamp = writeOptions.consistentLogicalTimestampEnabled();
        checkArgument(
                !shouldCombine || precombineField != null,
                "Option '%s' must be set when records are combined.",
                WriteOptions.PRECOMBINE_FIELD.key());
    }

    public static RecordCreationContext create(Options options) {
        return new RecordCreationContext(options.copy());
    }

    public WriteOperationType operation() {
        return operation;
    }

    public String instantTime() {
        return instantTime;
    }

    public boolean prepped() {
        return prepped;
    }

    public boolean mergeIntoPrepped() {
        return mergeIntoPrepped;
    }

    /** 是否需要读取系统元数据列中的文件位置。 */
    public boolean readsLocation() {
        return prepped || mergeIntoPrepped;
    }

    public boolean dropPartitionColumns() {
        return dropPartitionColumns;
    }

    public boolean shouldCombine() {
        return shouldCombine;
    }

    public String precombineField() {
        return precombineField;
    }

    public String payloadName() {
        return payloadName;
    }

    public boolean consistentLogicalTimestamp() {
        return consistentLogicalTimestamp;
    }

    /** 返回第 {@code partitionId} 个分区构造键生成器使用的配置副本。 */
    public Options keyGeneratorOptions(int partitionId) {
        return KeyGenerators.partitionOptions(options, partitionId, instantTime);
    }

    @Override
    public String toString() {
        return "RecordCreationContext{"
                + "operation="
                + operation
                + ", instantTime="
                + instantTime
                + ", prepped="
                + prepped
                + ", mergeIntoPrepped="
                + mergeIntoPrepped
                + ", dropPartitionColumns="
                + dropPartitionColumns
                + ", shouldCombine="
                + shouldCombine
                + '}';
    }
}
