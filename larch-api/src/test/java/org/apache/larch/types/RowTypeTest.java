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

package org.apache.larch.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RowType}. */
class RowTypeTest {

    private final RowType rowType =
            RowType.builder()
                    .field("_larch_commit_time", DataTypes.STRING())
                    .field("id", DataTypes.BIGINT().notNull())
                    .field("region", DataTypes.STRING())
                    .field("ts", DataTypes.BIGINT())
                    .build();

    @Test
    void testFieldLookup() {
        assertThat(rowType.getFieldCount()).isEqualTo(4);
        assertThat(rowType.getFieldNames())
                .containsExactly("_larch_commit_time", "id", "region", "ts");
        assertThat(rowType.getFieldIndex("region")).isEqualTo(2);
        assertThat(rowType.getFieldIndex("missing")).isEqualTo(-1);
        assertThat(rowType.containsField("ts")).isTrue();
        assertThat(rowType.getTypeAt(1).isNullable()).isFalse();
        assertThat(rowType.getField("id").id()).isEqualTo(1);
    }

    @Test
    void testWithoutFields() {
        RowType stripped = rowType.withoutFields(f -> f.name().startsWith("_larch_"));
        assertThat(stripped.getFieldNames()).containsExactly("id", "region", "ts");
        assertThat(stripped.getFieldIndex("ts")).isEqualTo(2);
        assertThat(rowType.getFieldCount()).isEqualTo(4);
    }

    @Test
    void testEquality() {
        RowType same =
                RowType.builder()
                        .field("_larch_commit_time", DataTypes.STRING())
                        .field("id", DataTypes.BIGINT().notNull())
                        .field("region", DataTypes.STRING())
                        .field("ts", DataTypes.BIGINT())
                        .build();
        assertThat(same).isEqualTo(rowType).hasSameHashCodeAs(rowType);
        assertThat(rowType.copy(false)).isNotEqualTo(rowType);
    }

    @Test
    void testDataTypesFactory() {
        RowType built =
                DataTypes.ROW(
                        DataTypes.FIELD(0, "id", DataTypes.BIGINT().notNull()),
                        DataTypes.FIELD(1, "deleted", DataTypes.BOOLEAN()));

        assertThat(built)
                .isEqualTo(
                        RowType.builder()
                                .field("id", DataTypes.BIGINT().notNull())
                                .field("deleted", DataTypes.BOOLEAN())
                                .build());
        assertThat(built.getTypeAt(1).is(DataTypeRoot.BOOLEAN)).isTrue();
        assertThat(built.asSQLString()).isEqualTo("ROW<`id` BIGINT NOT NULL, `deleted` BOOLEAN>");
    }

    @Test
    void testDuplicateFieldNames() {
        assertThatThrownBy(
                        () ->
                                RowType.builder()
                                        .field("id", DataTypes.INT())
                                        .field("id", DataTypes.STRING())
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id");
    }
}
