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

import org.apache.larch.WriteOptions;
import org.apache.larch.data.GenericRow;
import org.apache.larch.data.InternalRow;
import org.apache.larch.keygen.AvroOnlyKeyGenerator;
import org.apache.larch.keygen.FieldKeyGeneratorFactory;
import org.apache.larch.keygen.KeyGenOptions;
import org.apache.larch.keygen.KeyGeneratorException;
import org.apache.larch.options.Options;
import org.apache.larch.record.LarchRecord;
import org.apache.larch.record.RecordKey;
import org.apache.larch.record.RecordLocation;
import org.apache.larch.record.RecordType;
import org.apache.larch.types.DataTypes;
import org.apache.larch.types.RowType;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RecordCreator} with {@link InternalRow}s. */
class InternalRowRecordCreatorTest {

    private static final RowType META = RowType.builder().field("version", DataTypes.INT()).build();

    private static final RowType SOURCE =
            RowType.builder()
                    .field("_larch_commit_time", DataTypes.STRING())
                    .field("_larch_commit_seqno", DataTypes.STRING())
                    .field("_larch_record_key", DataTypes.STRING())
                    .field("_larch_partition_path", DataTypes.STRING())
                    .field("_larch_file_name", DataTypes.STRING())
                    .field("id", DataTypes.BIGINT().notNull())
                    .field("region", DataTypes.STRING())
                    .field("meta", META)
                    .field("value", DataTypes.STRING())
                    .build();

    private static final String LOG_FILE = ".f3a1c2d4-0_20231231000000000.log.1_1-22-33";

    @Test
    void testPreppedRows() {
        Options options = options();
        options.set(WriteOptions.PREPPED, true);
        List<InternalRow> rows =
                Arrays.asList(
                        row("20231231000000000", "k1", "eu", LOG_FILE, 1L, "eu", 2, "a"),
                        row(null, "k2", "us", null, 2L, "us", 1, "b"));

        InternalRowBatch batch = batch(rows, SOURCE);
        PartitionedRecords<InternalRow> records = RecordCreator.createRecords(options, batch);
        List<LarchRecord<InternalRow>> partition = records.collect(0);

        assertThat(batch.recordType()).isEqualTo(RecordType.INTERNAL_ROW);
        assertThat(partition.stream().map(LarchRecord::key).collect(Collectors.toList()))
                .containsExactly(new RecordKey("k1", "eu"), new RecordKey("k2", "us"));
        assertThat(partition.get(0).currentLocation())
                .contains(new RecordLocation("20231231000000000", "f3a1c2d4-0"));
        assertThat(partition.get(1).currentLocation()).isEmpty();
        assertThat(partition.get(0).payload())
                .isEqualTo(GenericRow.of(1L, "eu", GenericRow.of(2), "a"));
        assertThat(partition).noneMatch(LarchRecord::isOrderingValueSupplied);
    }

    @Test
    void testMergeIntoPreppedRows() {
        Options options = options();
        options.set(WriteOptions.MERGE_INTO_PREPPED, true);
        options.set(WriteOptions.PRECOMBINE_FIELD, "meta.version");
        List<InternalRow> rows =
                Arrays.asList(
                        row("20231231000000000", "stale", "stale", LOG_FILE, 1L, "eu", 7, "a"),
                        row(null, null, null, null, 2L, "us", null, "b"));

        List<LarchRecord<InternalRow>> partition =
                RecordCreator.createRecords(options, batch(rows, SOURCE)).collect(0);

        assertThat(partition.stream().map(LarchRecord::key).collect(Collectors.toList()))
                .containsExactly(new RecordKey("1", "eu"), new RecordKey("2", "us"));
        assertThat(partition.get(0).currentLocation())
                .contains(new RecordLocation("20231231000000000", "f3a1c2d4-0"));
        assertThat(partition.get(1).currentLocation()).isEmpty();
        assertThat(partition.get(0).orderingValue()).contains(7);
        assertThat(partition.get(1).isOrderingValueSupplied()).isTrue();
        assertThat(partition.get(1).orderingValue()).isEmpty();
        assertThat(partition.get(1).payload()).isEqualTo(GenericRow.of(2L, "us", null, "b"));
    }

    @Test
    void testDropPartitionColumns() {
        RowType source = SOURCE.withoutFields(f -> f.name().startsWith("_larch_"));
        RowType dataFile = source.withoutFields(f -> f.name().equals("region"));
        Options options = options();
        options.set(WriteOptions.DROP_PARTITION_COLUMNS, true);
        options.set(WriteOptions.PRECOMBINE_FIELD, "id");
        List<InternalRow> rows =
                Collections.singletonList(GenericRow.of(1L, "eu", GenericRow.of(3), "a"));

        LarchRecord<InternalRow> record =
                RecordCreator.createRecords(
                                options,
                                new InternalRowBatch(
                                        Collections.singletonList(rows), source, source, dataFile))
                        .collect(0)
                        .get(0);

        assertThat(record.payload()).isEqualTo(GenericRow.of(1L, GenericRow.of(3), "a"));
        assertThat(record.partitionPath()).isEqualTo("eu");
        assertThat(record.orderingValue()).contains(1L);
    }

    @Test
    void testMissingMetaFields() {
        RowType source = SOURCE.withoutFields(f -> f.name().equals("_larch_commit_seqno"));
        Options options = options();
        options.set(WriteOptions.PREPPED, true);
        List<InternalRow> rows =
                Collections.singletonList(
                        GenericRow.of("t", "k1", "eu", null, 1L, "eu", null, "a"));

        assertThatThrownBy(
                        () -> RecordCreator.createRecords(options, batch(rows, source)).collect(0))
                .isInstanceOf(MissingMetadataFieldException.class)
                .hasMessageContaining("internal-row")
                .hasMessageContaining("_larch_commit_seqno");
    }

    @Test
    void testKeyGeneratorWithoutInternalRowSupport() {
        Options options = options();
        options.set(KeyGenOptions.KEYGEN_CLASS, AvroOnlyKeyGenerator.class.getName());
        List<InternalRow> rows =
                Collections.singletonList(row(null, null, null, null, 1L, "eu", 1, "a"));

        assertThatThrownBy(
                        () -> RecordCreator.createRecords(options, batch(rows, SOURCE)).collect(0))
                .isInstanceOf(KeyGeneratorException.class);
    }

    @Test
    void testUnknownPrecombineField() {
        Options options = options();
        options.set(WriteOptions.PRECOMBINE_FIELD, "meta.ts");
        List<InternalRow> rows =
                Collections.singletonList(row(null, null, null, null, 1L, "eu", 1, "a"));

        assertThatThrownBy(
                        () -> RecordCreator.createRecords(options, batch(rows, SOURCE)).collect(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("meta.ts");
    }

    private static Options options() {
        Options options = new Options();
        options.set(WriteOptions.INSTANT_TIME, AvroTestRows.INSTANT_TIME);
        options.set(WriteOptions.PRECOMBINE_FIELD, "meta.version");
        options.set(KeyGenOptions.KEYGEN_TYPE, FieldKeyGeneratorFactory.IDENTIFIER);
        options.set(KeyGenOptions.RECORD_KEY_FIELD, "id");
        options.set(KeyGenOptions.PARTITION_PATH_FIELD, "region");
        return options;
    }

    private static InternalRowBatch batch(List<InternalRow> rows, RowType source) {
        return new InternalRowBatch(
                Collections.singletonList(rows),
                source,
                source,
                source.withoutFields(f -> f.name().equals("region")));
    }

    private static GenericRow row(
            String commitTime,
            String recordKey,
            String partitionPath,
            String fileName,
            long id,
            String region,
            Integer version,
            String value) {
        return GenericRow.of(
                commitTime,
                commitTime == null ? null : commitTime + "_0_" + id,
                recordKey,
                partitionPath,
                fileName,
                id,
                region,
                version == null ? null : GenericRow.of(version),
                value);
    }
}
