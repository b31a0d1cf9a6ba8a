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

import java.util.List;
import java.util.stream.Collectors;

/** prepped 行的 schema 缺少必需的系统元数据列。 */
public class MissingMetadataFieldException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<MetadataField> missingFields;

    private final RecordType recordType;

    public MissingMetadataFieldException(List<MetadataField> missingFields, RecordType recordType) {
        super(
                String.format(
                        "Prepped rows must contain the meta fields %s, missing %s when reading %s rows.",
                        names(MetadataField.REQUIRED),
                        names(missingFields),
                        recordType == RecordType.AVRO ? "avro" : "internal-row"));
        this.missingFields = missingFields;
        this.recordType = recordType;
    }

    public List<MetadataField> missingFields() {
        return missingFields;
    }

    public RecordType recordType() {
        return recordType;
    }

    private static String names(List<MetadataField> fields) {
        return fields.stream()
                .map(MetadataField::fieldName)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
