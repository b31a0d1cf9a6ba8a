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

import org.apache.larch.record.FileNames;
import org.apache.larch.record.MetadataField;
import org.apache.larch.record.RecordLocation;

import javax.annotation.Nullable;

/**
 * 从元数据列恢复行之前写入的位置。
 *
 * <p>只有 prepped 或 MERGE INTO 预处理的行会被读取。提交时间和文件名都不为 null
 * 时返回位置,文件 ID 由 {@link FileNames#fileId} 从文件名中提取。
 *
 * @param <R> 行类型
 */
public class RecordLocationResolver<R> {

    private final MetaFieldAccessor<R> accessor;

    private final boolean enabled;

    public RecordLocationResolver(MetaFieldAccessor<R> accessor, boolean enabled) {
        this.accessor = accessor;
        this.enabled = enabled;
    }

    @Nullable
    public RecordLocation resolve(R row) {
        if (!enabled) {
            return null;
        }
        String commitTime = accessor.get(row, MetadataField.COMMIT_TIME);
        String fileName = accessor.get(row, MetadataField.FILE_NAME);
        if (commitTime == null || fileName == null) {
            return null;
        }
        return new RecordLocation(commitTime, FileNames.fileId(fileName));
    }
}
