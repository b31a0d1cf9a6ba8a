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

import javax.annotation.Nullable;

/**
 * 从输入行(投影前)读取预合并字段的值。
 *
 * @param <R> 行类型
 */
public interface OrderingValueExtractor<R> {

    /**
     * 返回行的排序值,字段值为 null 时返回 null。
     *
     * @throws IllegalArgumentException 如果字段不存在或值不可比较
     */
    @Nullable
    Comparable<?> extract(R row);

    static Comparable<?> checkComparable(Object value, String field) {
        if (!(value instanceof Comparable)) {
            throw new IllegalArgumentException(
                    String.format(
                            "Ordering field '%s' has a non-comparable value of %s.",
                            field, value.getClass().getName()));
        }
        return (Comparable<?>) value;
    }
}
