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

package org.apache.larch.keygen;

import org.apache.larch.options.ConfigOption;

import static org.apache.larch.options.ConfigOptions.key;

/** 键生成器相关的配置选项。 */
public class KeyGenOptions {

    public static final ConfigOption<String> RECORD_KEY_FIELD =
            key("record-key.field")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Record key fields, separated by ','. "
                                    + "If not set, record keys are generated automatically.");

    public static final ConfigOption<String> PARTITION_PATH_FIELD =
            key("partition-path.field")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Partition path fields, separated by ','.");

    public static final ConfigOption<String> KEYGEN_CLASS =
            key("keygen.class")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Key generator class with a public constructor taking Options. "
                                    + "Takes precedence over 'keygen.type'.");

    public static final ConfigOption<String> KEYGEN_TYPE =
            key("keygen.type")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Identifier of the key generator factory to use.");

    public static final ConfigOption<Integer> AUTO_KEY_PARTITION_ID =
            key("keygen.auto.partition-id")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "Index of the input partition, set by the writer when record keys "
                                    + "are generated automatically.");

    public static final ConfigOption<String> AUTO_KEY_INSTANT_TIME =
            key("keygen.auto.instant-time")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Instant time of the batch, set by the writer when record keys "
                                    + "are generated automatically.");

    private KeyGenOptions() {}
}
