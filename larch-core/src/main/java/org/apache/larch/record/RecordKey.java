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

import java.io.Serializable;
import java.util.Objects;

import static org.apache.larch.utils.Preconditions.checkArgument;
import static org.apache.larch.utils.StringUtils.isEmpty;

/**
 * 记录的唯一键,由记录键和分区路径组成。
 *
 * <p>两者都不能为空: 解析阶段拿不到有效值时应直接失败,而不是构造一个残缺的键。
 */
@Public
public final class RecordKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String recordKey;

    private final String partitionPath;

    public RecordKey(String recordKey, String partitionPath) {
        checkArgument(!isEmpty(recordKey), "Record key must not be empty.");
        checkArgument(
                !isEmpty(partitionPath),
                "Partition path must not be empty for record key '%s'.",
                recordKey);
        this.recordKey = recordKey;
        this.partitionPath = partitionPath;
    }

    public String recordKey() {
        return recordKey;
    }

    public String partitionPath() {
        return partitionPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RecordKey that = (RecordKey) o;
        return recordKey.equals(that.recordKey) && partitionPath.equals(that.partitionPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordKey, partitionPath);
    }

    @Override
    public String toString() {
        return "RecordKey{recordKey=" + recordKey + ", partitionPath=" + partitionPath + "}";
    }
}
