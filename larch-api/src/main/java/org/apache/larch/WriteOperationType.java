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

package org.apache.larch;

import org.apache.larch.annotation.Public;

/**
 * 写入操作类型。
 *
 * <p>记录物化只关心操作属于哪一类:
 * <ul>
 *   <li>插入类({@link #isInsert}): INSERT、BULK_INSERT、INSERT_OVERWRITE 及其 prepped 变体
 *   <li>更新插入类({@link #isUpsert}): UPSERT 及其 prepped 变体
 *   <li>其他: 删除、删除分区等
 * </ul>
 *
 * <p>类别决定是否需要在写入前按键合并重复记录,见 {@code CombinePolicy}。
 */
@Public
public enum WriteOperationType {
    INSERT,
    INSERT_PREPPED,
    UPSERT,
    UPSERT_PREPPED,
    BULK_INSERT,
    BULK_INSERT_PREPPED,
    DELETE,
    DELETE_PREPPED,
    DELETE_PARTITION,
    INSERT_OVERWRITE,
    INSERT_OVERWRITE_TABLE,
    UNKNOWN;

    public static boolean isInsert(WriteOperationType operation) {
        switch (operation) {
            case INSERT:
            case INSERT_PREPPED:
            case BULK_INSERT:
            case BULK_INSERT_PREPPED:
            case INSERT_OVERWRITE:
            case INSERT_OVERWRITE_TABLE:
                return true;
            default:
                return false;
        }
    }

    public static boolean isUpsert(WriteOperationType operation) {
        return operation == UPSERT || operation == UPSERT_PREPPED;
    }
}
