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

import org.apache.larch.annotation.VisibleForTesting;
import org.apache.larch.record.MetadataField;

import java.util.List;

/**
 * 检查 prepped 行是否带有全部必需的元数据列。
 *
 * <p>同一分区的行共享 schema,只检查分区的第一行。每个分区使用新的实例。
 * 不是线程安全的。
 */
public class PreppedRecordValidator<R> {

    private final MetaFieldAccessor<R> accessor;

    private boolean validated;

    private int checkCount;

    public PreppedRecordValidator(MetaFieldAccessor<R> accessor) {
        this.accessor = accessor;
    }

    /**
     * 检查行的 schema,通过一次之后的调用直接返回。
     *
     * @throws MissingMetadataFieldException 如果缺少必需的元数据列
     */
    public void validate(R row) {
        if (validated) {
            return;
        }
        checkCount++;
        List<MetadataField> missing = accessor.missingFields(row);
        if (!missing.isEmpty()) {
            throw new MissingMetadataFieldException(missing, accessor.recordType());
        }
        validated = true;
    }

    @VisibleForTesting
    int checkCount() {
        return checkCount;
    }
}
