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

package org.apache.larch.record;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RecordKey} and {@link MetadataField}. */
class RecordKeyTest {

    @Test
    void testRecordKey() {
        RecordKey key = new RecordKey("id-1", "region=eu");
        assertThat(key.recordKey()).isEqualTo("id-1");
        assertThat(key.partitionPath()).isEqualTo("region=eu");
        assertThat(key).isEqualTo(new RecordKey("id-1", "region=eu"));
        assertThat(key).isNotEqualTo(new RecordKey("id-1", "region=us"));
    }

    @Test
    void testEmptyParts() {
        assertThatThrownBy(() -> new RecordKey("", "region=eu"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecordKey("id-1", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id-1");
    }

    @Test
    void testWhitespaceParts() {
        RecordKey key = new RecordKey(" ", " ");
        assertThat(key.recordKey()).isEqualTo(" ");
        assertThat(key.partitionPath()).isEqualTo(" ");
    }

    @Test
    void testMetadataFields() {
        assertThat(MetadataField.REQUIRED)
                .containsExactly(
                        MetadataField.COMMIT_TIME,
                        MetadataField.COMMIT_SEQNO,
                        MetadataField.RECORD_KEY,
                        MetadataField.PARTITION_PATH,
                        MetadataField.FILE_NAME);
        assertThat(MetadataField.FILE_NAME.position()).isEqualTo(4);
        assertThat(MetadataField.isMetadataField("_larch_operation")).isTrue();
        assertThat(MetadataField.isMetadataField("id")).isFalse();
        assertThat(MetadataField.fromFieldName("_larch_record_key"))
                .isEqualTo(MetadataField.RECORD_KEY);
    }
}
