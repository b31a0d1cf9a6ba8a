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

package org.apache.larch.options;

import org.apache.larch.annotation.Public;

import static org.apache.larch.utils.Preconditions.checkNotNull;

/**
 * 配置选项构建器类,用于构建 {@link ConfigOption} 实例。
 *
 * <p>该类提供了流式 API 来创建类型安全的配置选项:
 *
 * <pre>{@code
 * // 带有默认值的布尔选项
 * ConfigOption<Boolean> prepped = ConfigOptions
 *     .key("write.prepped")
 *     .booleanType()
 *     .defaultValue(false);
 *
 * // 没有默认值的选项
 * ConfigOption<String> recordKeyField = ConfigOptions
 *     .key("record-key.field")
 *     .stringType()
 *     .noDefaultValue();
 * }</pre>
 */
@Public
public class ConfigOptions {

    /**
     * 开始构建一个新的 {@link ConfigOption}。
     *
     * @param key 配置选项的键
     * @return 配置选项的构建器
     */
    public static OptionBuilder key(String key) {
        checkNotNull(key);
        return new OptionBuilder(key);
    }

    // ------------------------------------------------------------------------

    /**
     * 选项构建器,用于确定 {@link ConfigOption} 的值类型。
     *
     * <p>通过 {@link ConfigOptions#key(String)} 实例化。
     */
    public static final class OptionBuilder {

        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        /** 定义选项值应为 {@link Boolean} 类型。 */
        public TypedConfigOptionBuilder<Boolean> booleanType() {
            return new TypedConfigOptionBuilder<>(key, Boolean.class);
        }

        /** 定义选项值应为 {@link Integer} 类型。 */
        public TypedConfigOptionBuilder<Integer> intType() {
            return new TypedConfigOptionBuilder<>(key, Integer.class);
        }

        /** 定义选项值应为 {@link String} 类型。 */
        public TypedConfigOptionBuilder<String> stringType() {
            return new TypedConfigOptionBuilder<>(key, String.class);
        }

        /**
         * 定义选项值应为 {@link Enum} 类型。
         *
         * @param enumClass 期望的枚举的具体类型
         */
        public <T extends Enum<T>> TypedConfigOptionBuilder<T> enumType(Class<T> enumClass) {
            return new TypedConfigOptionBuilder<>(key, enumClass);
        }
    }

    /**
     * 带有已定义原子类型的 {@link ConfigOption} 构建器。
     *
     * @param <T> 选项的原子类型
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, "", value);
        }

        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, clazz, "", null);
        }
    }

    /** 不打算实例化的私有构造函数。 */
    private ConfigOptions() {}
}
