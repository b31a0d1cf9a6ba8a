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

import org.apache.larch.keygen.FieldKeyGenerator;
import org.apache.larch.record.RecordKey;

import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;

import static org.apache.larch.write.AvroTestRows.order;
import static org.apache.larch.write.AvroTestRows.preppedOrder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RecordKeyResolver}. */
class RecordKeyResolverTest {

    @Test
    void testGeneratedKeysCallKeyGeneratorOncePerPart() {
        FieldKeyGenerator keyGenerator = new FieldKeyGenerator(AvroTestRows.options());
        RecordKeyResolver<GenericRecord> resolver =
                RecordKeyResolver.generated(
                        keyGenerator::getRecordKey, keyGenerator::getPartitionPath);

        assertThat(resolver.resolve(order(1, "eu", 5L, "a"), 0, 0))
                .isEqualTo(new RecordKey("1", "eu"));
        assertThat(resolver.resolve(order(2, "us", 3L, "b"), 0, 1))
                .isEqualTo(new RecordKey("2", "us"));
        assertThat(resolver.resolve(order(3, "eu", 8L, "c"), 0, 2))
                .isEqualTo(new RecordKey("3", "eu"));

        assertThat(keyGenerator.recordKeyCalls()).isEqualTo(3);
        assertThat(keyGenerator.partitionPathCalls()).isEqualTo(3);
    }

    @Test
    void testPreppedKeysReadMetaFields() {
        RecordKeyResolver<GenericRecord> resolver =
                RecordKeyResolver.prepped(new AvroMetaFieldAccessor());

        GenericRecord row = preppedOrder(null, "key-1", "region=eu", null, 1, "us", 5L);

        assertThat(resolver.resolve(row, 0, 0)).isEqualTo(new RecordKey("key-1", "region=eu"));
    }

    @Test
    void testNullPartitionPath() {
        FieldKeyGenerator keyGenerator = new FieldKeyGenerator(AvroTestRows.options());
        RecordKeyResolver<GenericRecord> resolver =
                RecordKeyResolver.generated(
                        keyGenerator::getRecordKey, keyGenerator::getPartitionPath);

        assertThatThrownBy(() -> resolver.resolve(order(1, null, 5L, "a"), 0, 0))
                .isInstanceOf(KeyResolutionException.class)
                .hasMessageContaining("Partition path")
                .hasMessageContaining("'1'");
    }

    @Test
    void testEmptyRecordKey() {
        RecordKeyResolver<GenericRecord> resolver =
                RecordKeyResolver.prepped(new AvroMetaFieldAccessor());

        GenericRecord row = preppedOrder(null, "", "region=eu", null, 1, "eu", 5L);

        assertThatThrownBy(() -> resolver.resolve(row, 2, 7))
                .isInstanceOf(KeyResolutionException.class)
                .hasMessageContaining("Record key from meta fields")
                .hasMessageContaining("row 7 of partition 2")
                .hasMessageNotContaining("region=eu");
    }

    @Test
    void testWhitespaceKeysAreValid() {
        RecordKeyResolver<String> resolver = RecordKeyResolver.generated(row -> " ", row -> "p");

        assertThat(resolver.resolve("row", 0, 0)).isEqualTo(new RecordKey(" ", "p"));

        RecordKeyResolver<String> blankPartition =
                RecordKeyResolver.generated(row -> "k", row -> "  ");
        assertThat(blankPartition.resolve("row", 0, 0).partitionPath()).isEqualTo("  ");
    }

    @Test
    void testNullRecordKeyFromKeyGenerator() {
        RecordKeyResolver<String> resolver = RecordKeyResolver.generated(row -> null, row -> "p");

        assertThatThrownBy(() -> resolver.resolve("secret-payload", 1, 3))
                .isInstanceOf(KeyResolutionException.class)
                .hasMessage(
                        "Record key from key generator is null or empty for row 3 of partition 1.");
    }
}
