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

import static org.apache.larch.utils.Preconditions.checkNotNull;

/**
 * 记录在存储上已知的位置: 写入它的提交时间和所在文件组的文件 ID。
 *
 * <p>附加在记录上时表示"该记录可能已经存在于此位置",写入路径据此走更新而不是插入。
 */
@Public
public final class RecordLocation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String instantTime;

    private final String fileId;

    public RecordLocation(String instantTime, String fileId) {
        this.instantTime = checkNotNull(instantTime, "Instant time must not be null.");
        this.fileId = checkNotNull(fileId, "File id must not be null.");
    }

    public String instantTime() {
        return instantTime;
    }

    public String fileId() {
        return fileId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RecordLocation that = (RecordLocation) o;
        return instantTime.equals(that.instantTime) && fileId.equals(that.fileId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instantTime, fileId);
    }

    @Override
    public String toString() {
        return "RecordLocation{instantTime=" + instantTime + ", fileId=" + fileId + "}";
    }
}
