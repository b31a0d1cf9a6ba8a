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

package org.apache.larch.types;

import org.apache.larch.annotation.Public;

/**
 * 数据类型根枚举。
 *
 * <p>每个 {@link DataType} 都有唯一的类型根,用于在不做 instanceof 判断的情况下
 * 区分类型。枚举顺序即类型根定义的顺序,按类型根分派的 switch 语句保持同样的顺序。
 */
@Public
public enum DataTypeRoot {
    VARCHAR,

    BOOLEAN,

    VARBINARY,

    INTEGER,

    BIGINT,

    DOUBLE,

    ROW
}
