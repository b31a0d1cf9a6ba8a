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

import java.util.Objects;

import static org.apache.larch.utils.Preconditions.checkNotNull;

/* This file is based on source code of Apache Flink Project (https://flink.apache.org/), licensed by the Apache
 * Software Foundation (ASF) under the Apache License, Version 2.0. See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership. */

/**
 * 配置选项类,描述一个配置参数。
 *
 * <p>该类封装了配置项的以下信息:
 * <ul>
 *   <li>配置键(key)
 *   <li>可选的默认值(default value)
 *   <li>配置项的描述信息(description)
 *   <li>配置值的类型(clazz)
 * </ul>
 *
 * <h2>创建方式</h2>
 * {@code ConfigOption} 通过 {@link ConfigOptions} 类构建。一旦创建完成,配置选项就是不可变的。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * ConfigOption<Boolean> combineBeforeUpsert = ConfigOptions
 *     .key("write.combine-before-upsert")
 *     .booleanType()
 *     .defaultValue(true)
 *     .withDescription("写入前是否按键合并重复记录");
 * }</pre>
 *
 * @param <T> 配置选项关联的值的类型
 */
@Public
public class ConfigOption<T> {

    /** 该配置选项的键 */
    private final String key;

    /** 该配置选项的默认值,可能为 null */
    private final T defaultValue;

    /** 该配置选项的描述信息 */
    private final String description;

    /** 该 ConfigOption 描述的值的类型 */
    private final Class<?> clazz;

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    /**
     * 创建一个新的配置选项,使用当前选项的键和默认值,并添加给定的描述。
     *
     * @param description 该选项的描述
     * @return 一个新的配置选项,包含给定的描述
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /**
     * 返回默认值,如果没有默认值则返回 null。
     *
     * @return 默认值或 null
     */
    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && this.clazz.equals(that.clazz)
                    && Objects.equals(this.defaultValue, that.defaultValue);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
