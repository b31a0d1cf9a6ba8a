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

package org.apache.larch.keygen;

import org.apache.larch.annotation.Public;
import org.apache.larch.options.Options;

/**
 * 键生成器工厂,通过 {@link java.util.ServiceLoader} 发现。
 *
 * <p>实现需要在 {@code META-INF/services/org.apache.larch.keygen.KeyGeneratorFactory}
 * 中注册,并通过 {@link KeyGenOptions#KEYGEN_TYPE} 按标识符选择。
 */
@Public
public interface KeyGeneratorFactory {

    /** 工厂的唯一标识符,与 {@code keygen.type} 的取值比较。 */
    String identifier();

    /**
     * 创建键生成器。
     *
     * @param options 当前分区的配置,自动生成键时已包含分区 ID 和提交时间
     */
    KeyGenerator create(Options options);
}
