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

package org.apache.larch.record;

import org.apache.larch.annotation.Public;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * 系统保留的元数据字段。
 *
 * <p>已写入表的记录在数据文件中携带这些字段。上游规划阶段读回的行(prepped 行)仍然带着它们,
 * 物化时可以直接读取记录键、分区路径和记录位置,而不必再调用键生成器。
 *
 * <p>每个字段都有固定的名称和在列式行中的固定位置:
 *
 * <pre>
 * 0  _larch_commit_time      提交时间
 * 1  _larch_commit_seqno     提交序列号
 * 2  _larch_record_key       记录键
 * 3  _larch_partition_path   分区路径
 * 4  _larch_file_name        文件名
 * 5  _larch_operation        变更操作(可选)
 * </pre>
 *
 * <p>前五个字段是 prepped 行必须具备的;{@link #OPERATION} 只在剥离载荷时被视为保留字段。
 */
@Public
public enum MetadataField {
    COMMIT_TIME("_larch_commit_time", 0, true),
    COMMIT_SEQNO("_larch_commit_seqno", 1, true),
    RECORD_KEY("_larch_record_key", 2, true),
    PARTITION_PATH("_larch_partition_path", 3, true),
    FILE_NAME("_larch_file_name", 4, true),
    OPERATION("_larch_operation", 5, false);

    /** prepped 行必须具备的字段,按位置排序。 */
    public static final List<MetadataField> REQUIRED =
            Arrays.stream(values())
                    .filter(MetadataField::isRequired)
                    .collect(ImmutableList.toImmutableList());

    private static final ImmutableMap<String, MetadataField> BY_NAME =
            Arrays.stream(values())
                    .collect(
                            ImmutableMap.toImmutableMap(
                                    MetadataField::fieldName, Function.identity()));

    private final String fieldName;

    private final int position;

    private final boolean required;

    MetadataField(String fieldName, int position, boolean required) {
        this.fieldName = fieldName;
        this.position = position;
        this.required = required;
    }

    public String fieldName() {
        return fieldName;
    }

    /** 该字段在列式行中的固定位置。 */
    public int position() {
        return position;
    }

    public boolean isRequired() {
        return required;
    }

    public static boolean isMetadataField(String fieldName) {
        return BY_NAME.containsKey(fieldName);
    }

    @Nullable
    public static MetadataField fromFieldName(String fieldName) {
        return BY_NAME.get(fieldName);
    }
}
