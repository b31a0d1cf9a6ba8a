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

import org.apache.larch.types.SchemaProjectionException;

import org.apache.avro.Conversions;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link AvroRecordUtils}. */
class AvroRecordUtilsTest {

    private static final Schema META_SCHEMA =
            SchemaBuilder.record("Meta")
                    .fields()
                    .requiredLong("version")
                    .requiredString("source")
                    .endRecord();

    private static final Schema SCHEMA =
            SchemaBuilder.record("Order")
                    .namespace("org.apache.larch.test")
                    .fields()
                    .optionalString("_larch_commit_time")
                    .optionalString("_larch_commit_seqno")
                    .optionalString("_larch_record_key")
                    .optionalString("_larch_partition_path")
                    .optionalString("_larch_file_name")
                    .optionalString("_larch_operation")
                    .requiredLong("id")
                    .requiredString("region")
                    .name("meta")
                    .type(Schema.createUnion(Schema.create(Schema.Type.NULL), META_SCHEMA))
                    .noDefault()
                    .optionalBytes("blob")
                    .endRecord();

    @Test
    void testRemoveMetadataFields() {
        Schema stripped = AvroRecordUtils.removeMetadataFields(SCHEMA);

        assertThat(stripped.getFields().stream().map(Schema.Field::name))
                .containsExactly("id", "region", "meta", "blob");
        assertThat(stripped.getFullName()).isEqualTo("org.apache.larch.test.Order");
        assertThat(AvroRecordUtils.removeMetadataFields(stripped)).isSameAs(stripped);
    }

    @Test
    void testRewriteDropsAndFillsFields() {
        Schema target =
                SchemaBuilder.record("Order")
                        .fields()
                        .requiredLong("id")
                        .name("comment")
                        .type()
                        .stringType()
                        .stringDefault("n/a")
                        .optionalString("note")
                        .endRecord();

        GenericRecord rewritten = AvroRecordUtils.rewriteRecord(order(), target);

        assertThat(rewritten.getSchema()).isEqualTo(target);
        assertThat(rewritten.get("id")).isEqualTo(7L);
        assertThat(rewritten.get("comment").toString()).isEqualTo("n/a");
        assertThat(rewritten.get("note")).isNull();
    }

    @Test
    void testRewriteDeepCopiesValues() {
        Schema target = AvroRecordUtils.removeMetadataFields(SCHEMA);
        GenericRecord source = order();

        GenericRecord rewritten = AvroRecordUtils.rewriteRecord(source, target);
        ((GenericRecord) source.get("meta")).put("source", "changed");
        ((ByteBuffer) source.get("blob")).put(0, (byte) 9);

        GenericRecord meta = (GenericRecord) rewritten.get("meta");
        assertThat(meta.get("source").toString()).isEqualTo("app");
        assertThat(((ByteBuffer) rewritten.get("blob")).get(0)).isEqualTo((byte) 1);
        assertThat(rewritten.get("region").toString()).isEqualTo("eu");
    }

    @Test
    void testRewriteMissingRequiredField() {
        Schema target =
                SchemaBuilder.record("Order").fields().requiredDouble("amount").endRecord();

        assertThatThrownBy(() -> AvroRecordUtils.rewriteRecord(order(), target))
                .isInstanceOf(SchemaProjectionException.class)
                .hasMessageContaining("amount");
    }

    @Test
    void testNestedFieldValue() {
        GenericRecord order = order();

        assertThat(AvroRecordUtils.getNestedFieldValue(order, "region", false)).isEqualTo("eu");
        assertThat(AvroRecordUtils.getNestedFieldValue(order, "meta.version", false))
                .isEqualTo(3L);
        assertThat(AvroRecordUtils.getNestedFieldValue(order, "_larch_file_name", false))
                .isNull();

        order.put("meta", null);
        assertThat(AvroRecordUtils.getNestedFieldValue(order, "meta.version", false)).isNull();
    }

    @Test
    void testUnknownNestedField() {
        assertThatThrownBy(() -> AvroRecordUtils.getNestedFieldValue(order(), "meta.ts", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("meta.ts");
        assertThatThrownBy(() -> AvroRecordUtils.getNestedFieldValue(order(), "id.ts", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a record");
    }

    @Test
    void testLogicalTypes() {
        Schema dateSchema = LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
        LogicalTypes.Decimal decimalType = LogicalTypes.decimal(10, 2);
        Schema decimalSchema = decimalType.addToSchema(Schema.create(Schema.Type.BYTES));
        Schema millisSchema =
                LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
        Schema microsSchema =
                LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
        Schema schema =
                SchemaBuilder.record("Event")
                        .fields()
                        .name("day")
                        .type(dateSchema)
                        .noDefault()
                        .name("amount")
                        .type(decimalSchema)
                        .noDefault()
                        .name("millis")
                        .type(millisSchema)
                        .noDefault()
                        .name("micros")
                        .type(microsSchema)
                        .noDefault()
                        .endRecord();

        GenericRecord event = new GenericData.Record(schema);
        event.put("day", 19723);
        event.put(
                "amount",
                new Conversions.DecimalConversion()
                        .toBytes(new BigDecimal("12.34"), decimalSchema, decimalType));
        event.put("millis", 1704067200123L);
        event.put("micros", 1704067200123456L);

        assertThat(AvroRecordUtils.getNestedFieldValue(event, "day", false))
                .isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(AvroRecordUtils.getNestedFieldValue(event, "amount", false))
                .isEqualTo(new BigDecimal("12.34"));
        assertThat(AvroRecordUtils.getNestedFieldValue(event, "millis", false))
                .isEqualTo(1704067200123L);
        assertThat(AvroRecordUtils.getNestedFieldValue(event, "millis", true))
                .isEqualTo(Instant.ofEpochMilli(1704067200123L));
        assertThat(AvroRecordUtils.getNestedFieldValue(event, "micros", true))
                .isEqualTo(Instant.ofEpochSecond(1704067200L, 123456000L));
    }

    private static GenericRecord order() {
        GenericRecord meta = new GenericData.Record(META_SCHEMA);
        meta.put("version", 3L);
        meta.put("source", new Utf8("app"));

        GenericRecord order = new GenericData.Record(SCHEMA);
        order.put("id", 7L);
        order.put("region", new Utf8("eu"));
        order.put("meta", meta);
        order.put("blob", ByteBuffer.wrap(new byte[] {1, 2, 3}));
        return order;
    }
}
