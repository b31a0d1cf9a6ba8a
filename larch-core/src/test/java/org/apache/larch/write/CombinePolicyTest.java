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

import org.apache.larch.WriteOperationType;
import org.apache.larch.WriteOptions;
import org.apache.larch.options.Options;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link CombinePolicy}. */
class CombinePolicyTest {

    @ParameterizedTest(name = "prepped={0}, operation={1}, expected={5}")
    @CsvSource({
        // insert class
        "false, INSERT, false, false, true, false",
        "false, INSERT, true, false, false, true",
        "false, INSERT, false, true, false, true",
        "false, BULK_INSERT, true, true, false, true",
        "false, INSERT_OVERWRITE, false, false, true, false",
        "true, INSERT_PREPPED, true, true, true, false",
        // upsert class
        "false, UPSERT, false, false, true, true",
        "false, UPSERT, true, true, false, false",
        "true, UPSERT_PREPPED, false, false, true, false",
        // others
        "false, DELETE, false, false, false, true",
        "true, DELETE_PREPPED, false, false, false, false",
        "false, UNKNOWN, false, false, false, true",
        "true, DELETE_PARTITION, true, true, true, false"
    })
    void testShouldCombine(
            boolean prepped,
            WriteOperationType operation,
            boolean dropDuplicates,
            boolean combineBeforeInsert,
            boolean combineBeforeUpsert,
            boolean expected) {
        Options options = new Options();
        options.set(WriteOptions.INSERT_DROP_DUPLICATES, dropDuplicates);
        options.set(WriteOptions.COMBINE_BEFORE_INSERT, combineBeforeInsert);
        options.set(WriteOptions.COMBINE_BEFORE_UPSERT, combineBeforeUpsert);

        assertThat(CombinePolicy.shouldCombine(prepped, operation, new WriteOptions(options)))
                .isEqualTo(expected);
    }
}
