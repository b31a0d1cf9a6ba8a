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

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import javax.annotation.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/** 按字段名读取 Avro 行的元数据列。 */
public class AvroMetaFieldAccessor implements MetaFieldAccessor<GenericRecord> {

    @Override
    public RecordType recordType() {
        return RecordType.AVRO;
    }

    @Override
    public List<MetadataField> missingFields(GenericRecord row) {
        Schema schema = row.getSchema();
        return MetadataField.REQUIRED.stream()
                .filter(f -> schema.getField(f.fieldName()) == null)
                .collect(Collectors.toList());
    }

    @Nullable
    @Override
    public String get(GenericRecord row, MetadataField field) {
        Schema.Field schemaField = row.getSchema().getField(field.fieldName());
        if (schemaField == null) {
            return null;
        }
        Object value = row.get(schemaField.pos());
        return value == null ? null : value.toString();
    }
}
