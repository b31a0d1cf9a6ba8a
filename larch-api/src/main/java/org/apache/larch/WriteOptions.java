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

package org.apache.larch;

import org.apache.larch.options.ConfigOption;
import org.apache.larch.options.Options;

import static org.apache.larch.options.ConfigOptions.key;

/**
 * Larch 写入配置选项类。
 *
 * <p>该类定义了把输入行物化为带键记录时使用的全部配置选项。
 *
 * <h2>操作与记录来源</h2>
 * <ul>
 *   <li>write.operation: 写入操作类型
 *   <li>write.prepped: 输入行是否已经携带系统元数据列
 *   <li>write.merge-into.prepped: 输入行是否来自 MERGE INTO 的预处理
 *   <li>write.instant-time: 本批次的提交时间标识
 * </ul>
 *
 * <h2>去重与排序</h2>
 * <ul>
 *   <li>write.combine-before-insert / write.combine-before-upsert: 写入前是否按键合并
 *   <li>write.insert.drop-duplicates: 插入时是否丢弃重复记录
 *   <li>write.precombine.field: 合并时用于比较新旧的字段
 * </ul>
 *
 * <h2>schema</h2>
 * <ul>
 *   <li>write.drop-partition-columns: 数据文件中是否去掉分区列
 * </ul>
 */
public class WriteOptions {

    public static final ConfigOption<WriteOperationType> OPERATION =
            key("write.operation")
                    .enumType(WriteOperationType.class)
                    .defaultValue(WriteOperationType.UPSERT)
                    .withDescription("The write operation of this batch.");

    public static final ConfigOption<Boolean> PREPPED =
            key("write.prepped")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether the input rows are prepped, i.e. already carry the record key, "
                                    + "partition path, commit time and file name meta fields.");

    public static final ConfigOption<Boolean> MERGE_INTO_PREPPED =
            key("write.merge-into.prepped")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether the input rows were prepared by a MERGE INTO statement. "
                                    + "Such rows keep their meta fields for location lookup, "
                                    + "but their keys are still produced by the key generator.");

    public static final ConfigOption<Boolean> DROP_PARTITION_COLUMNS =
            key("write.drop-partition-columns")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to drop the partition columns from the data files.");

    public static final ConfigOption<Boolean> COMBINE_BEFORE_INSERT =
            key("write.combine-before-insert")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to combine records with the same key before an insert.");

    public static final ConfigOption<Boolean> COMBINE_BEFORE_UPSERT =
            key("write.combine-before-upsert")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether to combine records with the same key before an upsert.");

    public static final ConfigOption<Boolean> INSERT_DROP_DUPLICATES =
            key("write.insert.drop-duplicates")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to drop incoming records that already exist during an insert.");

    public static final ConfigOption<String> PRECOMBINE_FIELD =
            key("write.precombine.field")
                    .stringType()
                    .defaultValue("ts")
                    .withDescription(
                            "Field used to order records with the same key when combining, "
                                    + "nested fields are separated by '.'.");

    public static final ConfigOption<String> PAYLOAD =
            key("write.payload")
                    .stringType()
                    .defaultValue("overwrite-with-latest")
                    .withDescription(
                            "Identifier of the payload that downstream merging applies to the records.");

    public static final ConfigOption<String> INSTANT_TIME =
            key("write.instant-time")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Instant time of the commit this batch is written to.");

    public static final ConfigOption<Boolean> CONSISTENT_LOGICAL_TIMESTAMP_ENABLED =
            key("keygen.consistent-logical-timestamp.enabled")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether to convert logical timestamp values to timestamps when reading "
                                    + "fields for keys and ordering, so that both row formats "
                                    + "produce the same values.");

    private final Options options;

    public WriteOptions(Options options) {
        this.options = options;
    }

    public WriteOperationType operation() {
        return options.get(OPERATION);
    }

    public boolean prepped() {
        return options.get(PREPPED);
    }

    public boolean mergeIntoPrepped() {
        return options.get(MERGE_INTO_PREPPED);
    }

    public boolean dropPartitionColumns() {
        return options.get(DROP_PARTITION_COLUMNS);
    }

    public boolean combineBeforeInsert() {
        return options.get(COMBINE_BEFORE_INSERT);
    }

    public boolean combineBeforeUpsert() {
        return options.get(COMBINE_BEFORE_UPSERT);
    }

    public boolean insertDropDuplicates() {
        return options.get(INSERT_DROP_DUPLICATES);
    }

    public String precombineField() {
        return options.get(PRECOMBINE_FIELD);
    }

    public String payload() {
        return options.get(PAYLOAD);
    }

    public String instantTime() {
        return options.get(INSTANT_TIME);
    }

    public boolean consistentLogicalTimestampEnabled() {
        return options.get(CONSISTENT_LOGICAL_TIMESTAMP_ENABLED);
    }
}
