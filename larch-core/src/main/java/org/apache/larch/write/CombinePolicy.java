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

/**
 * 决定一个批次的记录是否需要携带排序值。
 *
 * <p>需要在写入前按键合并重复记录时,每条记录都要带上预合并字段的值:
 * <ul>
 *   <li>非 prepped 的插入类操作: {@code write.insert.drop-duplicates} 或
 *       {@code write.combine-before-insert}
 *   <li>非 prepped 的更新插入类操作: {@code write.combine-before-upsert}
 *   <li>其他情况: 非 prepped 时合并
 * </ul>
 *
 * <p>prepped 的行已经由上游完成去重,永远不合并。
 */
public class CombinePolicy {

    public static boolean shouldCombine(
            boolean prepped, WriteOperationType operation, WriteOptions options) {
        if (!prepped && WriteOperationType.isInsert(operation)) {
            return options.insertDropDuplicates() || options.combineBeforeInsert();
        }
        if (!prepped && WriteOperationType.isUpsert(operation)) {
            return options.combineBeforeUpsert();
        }
        return !prepped;
    }

    private CombinePolicy() {}
}
