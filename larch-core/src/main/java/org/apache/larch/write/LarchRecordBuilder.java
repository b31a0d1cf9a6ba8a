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

import org.apache.larch.record.LarchRecord;
import org.apache.larch.record.RecordKey;
import org.apache.larch.record.RecordLocation;

import javax.annotation.Nullable;

/**
 * 组装 {@link LarchRecord}。
 *
 * <p>不合并的批次使用不带排序值的形式,记录的排序值状态为"未提供"。
 * 位置存在时作为记录的当前位置。载荷标识原样透传。
 */
public class LarchRecordBuilder {

    private final String payloadName;

    public LarchRecordBuilder(String payloadName) {
        this.payloadName = payloadName;
    }

    public <T> LarchRecord<T> build(RecordKey key, T payload, @Nullable RecordLocation location) {
        return new LarchRecord<>(key, payload, payloadName, false, null, location);
    }

    public <T> LarchRecord<T> build(
            RecordKey key,
            T payload,
            @Nullable Comparable<?> orderingValue,
            @Nullable RecordLocation location) {
        return new LarchRecord<>(key, payload, payloadName, true, orderingValue, location);
    }
}
