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

package org.apache.larch.utils;

import org.apache.larch.data.GenericRow;
import org.apache.larch.data.InternalRow;
import org.apache.larch.types.DataTypes;
import org.apache.larch.types.RowType;
import org.apache.larch.types.SchemaProjectionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link InternalRowProjection}. */
class InternalRowProjectionTest {

    private static final RowType LOCATION =
            RowType.builder()
                    .field("city", DataTypes.STRING())
                    .field("zip", DataTypes.INT())
                    .build();

    private static final RowType SOURCE =
            RowType.builder()
                    .field("id", DataTypes.BIGINT().notNull())
                    .field("region", DataTypes.STRING())
                    .field("ts", DataTypes.BIGINT())
                    .field("blob", DataTypes.BYTES())
                    .field("location", LOCATION)
                    .build();

    @Test
    void testProjectByName() {
        RowType target =
                RowType.builder()
                        .field("ts", DataTypes.BIGINT())
                        .field("id", DataTypes.BIGINT().notNull())
                        .field("comment", DataTypes.STRING())
                        .build();
        InternalRowProjection projection = InternalRowProjection.of(SOURCE, target);

        GenericRow row = GenericRow.of(1L, "eu", 5L, null, null);
        InternalRow projected = projection.apply(row);

        assertThat(projected).isEqualTo(GenericRow.of(5L, 1L, null));
        assertThat(projection.targetType()).isEqualTo(target);
    }

    @Test
    void testCopiesMutableValues() {
        RowType target =
                RowType.builder()
                        .field("blob", DataTypes.BYTES())
                        .field(
                                "location",
                                RowType.builder().field("city", DataTypes.STRING()).build())
                        .build();
        byte[] blob = new byte[] {1, 2, 3};
        GenericRow location = GenericRow.of("Oslo", 150);
        GenericRow row = GenericRow.of(1L, "eu", 5L, blob, location);

        GenericRow projected = (GenericRow) InternalRowProjection.of(SOURCE, target).apply(row);
        blob[0] = 9;
        location.setField(0, "Bergen");

        assertThat((byte[]) projected.getField(0)).containsExactly(1, 2, 3);
        assertThat(projected.getField(1)).isEqualTo(GenericRow.of("Oslo"));
    }

    @Test
    void testProjectionIsCached() {
        RowType target = RowType.builder().field("id", DataTypes.BIGINT().notNull()).build();
        assertThat(InternalRowProjection.of(SOURCE, target))
                .isSameAs(InternalRowProjection.of(SOURCE, target));
    }

    @Test
    void testMissingRequiredField() {
        RowType target = RowType.builder().field("amount", DataTypes.DOUBLE().notNull()).build();
        assertThatThrownBy(() -> InternalRowProjection.of(SOURCE, target))
                .isInstanceOf(SchemaProjectionException.class)
                .hasMessageContaining("amount");
    }

    @Test
    void testTypeMismatch() {
        RowType target = RowType.builder().field("ts", DataTypes.STRING()).build();
        assertThatThrownBy(() -> InternalRowProjection.of(SOURCE, target))
                .isInstanceOf(SchemaProjectionException.class)
                .hasMessageContaining("ts");
    }

    @Test
    void testNullInNonNullableTarget() {
        RowType target = RowType.builder().field("region", DataTypes.STRING().notNull()).build();
        InternalRowProjection projection = InternalRowProjection.of(SOURCE, target);
        assertThat(projection.apply(GenericRow.of(1L, "eu", 5L, null, null)))
                .isEqualTo(GenericRow.of("eu"));
        assertThatThrownBy(() -> projection.apply(GenericRow.of(1L, null, 5L, null, null)))
                .isInstanceOf(SchemaProjectionException.class)
                .hasMessageContaining("region");
    }
}
