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

package org.apache.larch.avro;

import org.apache.larch.record.MetadataField;
import org.apache.larch.types.SchemaProjectionException;

import org.apache.avro.Conversions;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;

import javax.annotation.Nullable;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Avro 记录工具类。
 *
 * <ul>
 *   <li>{@link #removeMetadataFields}: 从 schema 中去掉系统元数据列
 *   <li>{@link #rewriteRecord}: 按字段名把记录改写为目标 schema
 *   <li>{@link #getNestedFieldValue}: 按 '.' 分隔的路径读取嵌套字段并规范化逻辑类型
 * </ul>
 */
public class AvroRecordUtils {

    private static final Conversions.DecimalConversion DECIMAL_CONVERSION =
            new Conversions.DecimalConversion();

    /** 返回去掉全部系统元数据列的记录 schema,没有元数据列时返回原 schema。 */
    public static Schema removeMetadataFields(Schema schema) {
        List<Schema.Field> fields = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            if (!MetadataField.isMetadataField(field.name())) {
                fields.add(copyField(field));
            }
        }
        if (fields.size() == schema.getFields().size()) {
            return schema;
        }
        Schema result =
                Schema.createRecord(
                        schema.getName(), schema.getDoc(), schema.getNamespace(), false, fields);
        schema.getObjectProps().forEach(result::addProp);
        return result;
    }

    /**
     * 把记录改写为目标 schema。
     *
     * <p>两边都有的字段复制值(深拷贝,嵌套记录递归改写),只在目标中出现的字段
     * 使用默认值或 null。结果不会与输入记录共享可变结构。
     *
     * @throws SchemaProjectionException 如果不可空且没有默认值的目标字段无法填充
     */
    public static GenericRecord rewriteRecord(GenericRecord record, Schema targetSchema) {
        Schema sourceSchema = record.getSchema();
        GenericData.Record result = new GenericData.Record(targetSchema);
        for (Schema.Field targetField : targetSchema.getFields()) {
            Schema.Field sourceField = sourceSchema.getField(targetField.name());
            Object value = sourceField == null ? null : record.get(sourceField.pos());
            if (value == null) {
                result.put(targetField.pos(), defaultValue(targetField, sourceField == null));
                continue;
            }
            result.put(
                    targetField.pos(),
                    rewriteValue(value, sourceField.schema(), targetField.schema()));
        }
        return result;
    }

    private static Object rewriteValue(Object value, Schema sourceSchema, Schema targetSchema) {
        Schema target = resolveNullable(targetSchema);
        if (value instanceof GenericRecord && target.getType() == Schema.Type.RECORD) {
            return rewriteRecord((GenericRecord) value, target);
        }
        return GenericData.get().deepCopy(sourceSchema, value);
    }

    @Nullable
    private static Object defaultValue(Schema.Field targetField, boolean missingInSource) {
        if (targetField.hasDefaultValue()) {
            Object defaultValue = GenericData.get().getDefaultValue(targetField);
            if (defaultValue != null || isNullable(targetField.schema())) {
                return GenericData.get().deepCopy(targetField.schema(), defaultValue);
            }
        }
        if (isNullable(targetField.schema())) {
            return null;
        }
        throw new SchemaProjectionException(
                String.format(
                        missingInSource
                                ? "Field '%s' is required by the target schema but missing in the record."
                                : "Field '%s' is not nullable in the target schema but is null in the record.",
                        targetField.name()));
    }

    /**
     * 按路径读取嵌套字段的值。
     *
     * <p>中间层的值为 null 时返回 null。返回值做以下规范化:
     * <ul>
     *   <li>{@link Utf8} 和枚举: {@link String}
     *   <li>date: {@link LocalDate}
     *   <li>decimal: {@link java.math.BigDecimal}
     *   <li>timestamp-millis / timestamp-micros: 开启 consistentLogicalTimestamp 时转为
     *       {@link Instant},否则保留 long
     * </ul>
     *
     * @param record 记录
     * @param fieldPath 字段路径,例如 {@code "meta.ts"}
     * @param consistentLogicalTimestamp 是否把时间戳逻辑类型转为 {@link Instant}
     * @throws IllegalArgumentException 如果路径中的字段在 schema 中不存在
     */
    @Nullable
    public static Object getNestedFieldValue(
            GenericRecord record, String fieldPath, boolean consistentLogicalTimestamp) {
        String[] parts = fieldPath.split("\\.");
        GenericRecord current = record;
        for (int i = 0; i < parts.length; i++) {
            Schema.Field field = current.getSchema().getField(parts[i]);
            if (field == null) {
                throw new IllegalArgumentException(
                        String.format(
                                "Field '%s' of path '%s' does not exist in schema %s.",
                                parts[i], fieldPath, current.getSchema().getFullName()));
            }
            Object value = current.get(field.pos());
            if (value == null) {
                return null;
            }
            if (i == parts.length - 1) {
                return convertValue(value, field.schema(), consistentLogicalTimestamp);
            }
            if (!(value instanceof GenericRecord)) {
                throw new IllegalArgumentException(
                        String.format(
                                "Field '%s' of path '%s' is not a record.", parts[i], fieldPath));
            }
            current = (GenericRecord) value;
        }
        throw new IllegalArgumentException("Empty field path.");
    }

    private static Object convertValue(
            Object value, Schema fieldSchema, boolean consistentLogicalTimestamp) {
        if (value instanceof Utf8 || value instanceof GenericEnumSymbol) {
            return value.toString();
        }
        Schema schema = resolveNullable(fieldSchema);
        LogicalType logicalType = schema.getLogicalType();
        if (logicalType == null) {
            return value;
        }
        if (logicalType instanceof LogicalTypes.Date && value instanceof Integer) {
            return LocalDate.ofEpochDay((Integer) value);
        }
        if (logicalType instanceof LogicalTypes.Decimal) {
            if (value instanceof ByteBuffer) {
                return DECIMAL_CONVERSION.fromBytes(
                        ((ByteBuffer) value).duplicate(), schema, logicalType);
            }
            if (value instanceof GenericFixed) {
                return DECIMAL_CONVERSION.fromFixed((GenericFixed) value, schema, logicalType);
            }
        }
        if (consistentLogicalTimestamp && value instanceof Long) {
            long time = (Long) value;
            if (logicalType instanceof LogicalTypes.TimestampMillis) {
                return Instant.ofEpochMilli(time);
            }
            if (logicalType instanceof LogicalTypes.TimestampMicros) {
                return Instant.ofEpochSecond(
                        Math.floorDiv(time, 1_000_000L), Math.floorMod(time, 1_000_000L) * 1_000L);
            }
        }
        return value;
    }

    /** 对 [null, T] 形式的联合类型返回 T,其余 schema 原样返回。 */
    public static Schema resolveNullable(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) {
            return schema;
        }
        List<Schema> types = schema.getTypes();
        if (types.size() == 2) {
            if (types.get(0).getType() == Schema.Type.NULL) {
                return types.get(1);
            }
            if (types.get(1).getType() == Schema.Type.NULL) {
                return types.get(0);
            }
        }
        return schema;
    }

    public static boolean isNullable(Schema schema) {
        if (schema.getType() == Schema.Type.NULL) {
            return true;
        }
        if (schema.getType() == Schema.Type.UNION) {
            for (Schema type : schema.getTypes()) {
                if (type.getType() == Schema.Type.NULL) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Schema.Field copyField(Schema.Field field) {
        Schema.Field copy =
                new Schema.Field(
                        field.name(), field.schema(), field.doc(), field.defaultVal(), field.order());
        field.getObjectProps().forEach(copy::addProp);
        field.aliases().forEach(copy::addAlias);
        return copy;
    }

    private AvroRecordUtils() {}
}
