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

import org.apache.larch.record.MetadataField;
import org.apache.larch.record.RecordKey;

import java.util.function.Function;

import static org.apache.larch.utils.StringUtils.isEmpty;

/**
 * 为一行确定 {@link RecordKey}。
 *
 * <ul>
 *   <li>{@link #prepped}: 读取 {@code _larch_record_key} 和 {@code _larch_partition_path} 列
 *   <li>{@link #generated}: 分别调用一次键生成器的记录键和分区路径方法
 * </ul>
 *
 * <p>任一部分为 null 或空串时抛出 {@link KeyResolutionException},不会使用默认键。只含空白字符的值是合法的。
 * 异常信息只给出行在分区中的位置,不包含行内容。
 *
 * @param <R> 行类型
 */
public class RecordKeyResolver<R> {

    private final Function<R, String> recordKeyFunction;

    private final Function<R, String> partitionPathFunction;

    private final String source;

    private RecordKeyResolver(
            Function<R, String> recordKeyFunction,
            Function<R, String> partitionPathFunction,
            String source) {
        this.recordKeyFunction = recordKeyFunction;
        this.partitionPathFunction = partitionPathFunction;
        this.source = source;
    }

    public static <R> RecordKeyResolver<R> prepped(MetaFieldAccessor<R> accessor) {
        return new RecordKeyResolver<>(
                row -> accessor.get(row, MetadataField.RECORD_KEY),
                row -> accessor.get(row, MetadataField.PARTITION_PATH),
                "meta fields");
    }

    public static <R> RecordKeyResolver<R> generated(
            Function<R, String> recordKeyFunction, Function<R, String> partitionPathFunction) {
        return new RecordKeyResolver<>(
                recordKeyFunction, partitionPathFunction, "key generator");
    }

    /**
     * 确定行的键。
     *
     * @param row 输入行
     * @param partitionId 行所在的分区
     * @param rowIndex 行在分区中的位置,从 0 开始
     * @throws KeyResolutionException 如果记录键或分区路径为 null 或空
     */
    public RecordKey resolve(R row, int partitionId, long rowIndex) {
        String recordKey = recordKeyFunction.apply(row);
        if (isEmpty(recordKey)) {
            throw new KeyResolutionException(
                    String.format(
                            "Record key from %s is null or empty for row %s of partition %s.",
                            source, rowIndex, partitionId));
        }
        String partitionPath = partitionPathFunction.apply(row);
        if (isEmpty(partitionPath)) {
            throw new KeyResolutionException(
                    String.format(
                            "Partition path from %s is null or empty for record key '%s'.",
                            source, recordKey));
        }
        return new RecordKey(recordKey, partitionPath);
    }
}
