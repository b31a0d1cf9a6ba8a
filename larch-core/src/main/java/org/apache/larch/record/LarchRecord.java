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

import org.apache.larch.annotation.Public;

import javax.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

import static org.apache.larch.utils.Preconditions.checkNotNull;

/**
 * 物化后的记录,写入路径的最小处理单元。
 *
 * <p>记录包含:
 * <ul>
 *   <li><b>键</b>: {@link RecordKey},记录键加分区路径
 *   <li><b>载荷</b>: 投影后的行,与输入行不共享可变结构
 *   <li><b>载荷标识</b>: 下游合并使用的载荷实现,原样透传
 *   <li><b>排序值</b>: 下游合并重复记录时比较新旧用的值
 *   <li><b>当前位置</b>: 可选的 {@link RecordLocation}
 * </ul>
 *
 * <p>排序值有三种状态,下游对它们的处理不同:
 * <ul>
 *   <li>未提供: 本批次不做合并,{@link #isOrderingValueSupplied()} 为 false
 *   <li>已提供且非空: {@link #orderingValue()} 返回该值
 *   <li>已提供但为空: 查找到的字段值为 null
 * </ul>
 *
 * <p>实例不可变,通过 {@code LarchRecordBuilder} 创建。
 *
 * @param <T> 载荷类型
 */
@Public
public final class LarchRecord<T> {

    private final RecordKey key;

    private final T payload;

    private final String payloadName;

    private final boolean orderingValueSupplied;

    @Nullable private final Comparable<?> orderingValue;

    @Nullable private final RecordLocation currentLocation;

    public LarchRecord(
            RecordKey key,
            T payload,
            String payloadName,
            boolean orderingValueSupplied,
            @Nullable Comparable<?> orderingValue,
            @Nullable RecordLocation currentLocation) {
        this.key = checkNotNull(key, "Record key must not be null.");
        this.payload = checkNotNull(payload, "Payload must not be null.");
        this.payloadName = checkNotNull(payloadName, "Payload name must not be null.");
        this.orderingValueSupplied = orderingValueSupplied;
        this.orderingValue = orderingValue;
        this.currentLocation = currentLocation;
    }

    public RecordKey key() {
        return key;
    }

    public String recordKey() {
        return key.recordKey();
    }

    public String partitionPath() {
        return key.partitionPath();
    }

    public T payload() {
        return payload;
    }

    public String payloadName() {
        return payloadName;
    }

    public boolean isOrderingValueSupplied() {
        return orderingValueSupplied;
    }

    public Optional<Comparable<?>> orderingValue() {
        return Optional.ofNullable(orderingValue);
    }

    public Optional<RecordLocation> currentLocation() {
        return Optional.ofNullable(currentLocation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LarchRecord<?> that = (LarchRecord<?>) o;
        return orderingValueSupplied == that.orderingValueSupplied
                && key.equals(that.key)
                && payload.equals(that.payload)
                && payloadName.equals(that.payloadName)
                && Objects.equals(orderingValue, that.orderingValue)
                && Objects.equals(currentLocation, that.currentLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                key, payload, payloadName, orderingValueSupplied, orderingValue, currentLocation);
    }

    @Override
    public String toString() {
        return "LarchRecord{"
                + "key="
                + key
                + ", payload="
                + payload
                + ", orderingValue="
                + (orderingValueSupplied ? orderingValue : "<not supplied>")
                + ", currentLocation="
                + currentLocation
                + '}';
    }
}
