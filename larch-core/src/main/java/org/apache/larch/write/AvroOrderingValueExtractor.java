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

import org.apache.larch.avro.AvroRecordUtils;

import org.apache.avro.generic.GenericRecord;

import javax.annotation.Nullable;

/** 从 Avro 行读取排序值,逻辑类型按 {@link AvroRecordUtils#getNestedFieldValue} 规范化。 */
public class AvroOrderingValueExtractor implements OrderingValueExtractor<GenericRecord> {

    private final String field;

    private final boolean consistentLogicalTimestamp;

    public AvroOrderingValueExtractor(String field, boolean consistentLogicalTimestamp) {
        this.field = field;
        this.consistentLogicalTimestamp = consistentLogicalTimestamp;
    }

    @Nullable
    @Override
    public Comparable<?> extract(GenericRecord row) {
        Object value = AvroRecordUtils.getNestedFieldValue(row, field, consistentLogicalTimestamp);
        return value == null ? null : OrderingValueExtractor.checkComparable(value, field);
    }
}
