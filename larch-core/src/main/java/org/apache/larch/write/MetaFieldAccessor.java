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
import org.apache.larch.record.RecordType;

import javax.annotation.Nullable;

import java.util.List;

/**
 * 读取行中的系统元数据列。
 *
 * @param <R> 行类型
 */
public interface MetaFieldAccessor<R> {

    RecordType recordType();

    /** 返回行的 schema 中缺失的必需元数据列,按列位置排序。 */
    List<MetadataField> missingFields(R row);

    /** 返回元数据列的字符串值,列不存在或值为 null 时返回 null。 */
    @Nullable
    String get(R row, MetadataField field);
}
