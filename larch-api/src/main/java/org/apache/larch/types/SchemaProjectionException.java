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

/**
 * 行无法投影到目标 schema 时抛出的异常。
 *
 * <p>投影是尽力而为的结构映射: 源和目标共有的字段保留原值,目标独有的字段填充默认值或 null。
 * 只有目标中不可空、没有默认值的字段找不到来源值,或者同名字段类型无法对应时,才会失败。
 */
public class SchemaProjectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaProjectionException(String message) {
        super(message);
    }

    public SchemaProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
