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

/**
 * 键生成器异常,表示无法构造键生成器。
 *
 * <p>以下情况会抛出该异常:
 * <ul>
 *   <li>既没有配置 {@code keygen.class} 也没有配置 {@code keygen.type}
 *   <li>配置的类无法加载或实例化
 *   <li>没有找到标识符匹配的工厂,或找到多个
 *   <li>键生成器不支持当前的行格式
 * </ul>
 */
public class KeyGeneratorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public KeyGeneratorException(String message) {
        super(message);
    }

    public KeyGeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
