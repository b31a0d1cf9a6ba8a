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

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 配置选项类,用于存储键值对。
 *
 * <p>该类是线程安全的,提供了类型安全的配置访问方法。所有值都以字符串形式保存,
 * 读取时按 {@link ConfigOption} 声明的类型转换,无法解析时抛出
 * {@link IllegalArgumentException} 并指明出错的键。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * Options options = new Options();
 * options.setString("write.combine-before-upsert", "false");
 *
 * boolean combine = options.get(WriteOptions.COMBINE_BEFORE_UPSERT); // false
 * boolean prepped = options.get(WriteOptions.PREPPED); // 默认值 false
 * }</pre>
 *
 * <p>在写入流水线中,同一个 {@link Options} 会被多个分区并发读取;需要针对单个分区补充配置时,
 * 应先通过 {@link #copy()} 复制,再修改副本。
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 存储具体键值对的映射 */
    private final HashMap<String, String> data;

    /** 创建一个新的空配置对象。 */
    public Options() {
        this.data = new HashMap<>();
    }

    /**
     * 创建一个新的配置对象,使用给定 Map 的选项进行初始化。
     *
     * @param map 初始配置键值对
     */
    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    /**
     * 使用 ConfigOption 设置配置值。
     *
     * @param option 配置选项
     * @param value 配置值
     * @param <T> 值的类型
     * @return 当前 Options 对象,用于链式调用
     */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /**
     * 获取配置选项的值,如果未设置则返回默认值。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return 配置值或默认值
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    /**
     * 获取配置选项的 Optional 值,不考虑默认值。
     *
     * @param option 配置选项
     * @param <T> 值的类型
     * @return Optional 包装的配置值
     * @throws IllegalArgumentException 如果无法解析值
     */
    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<String> rawValue = Optional.ofNullable(data.get(option.key()));
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> configOption) {
        return data.containsKey(configOption.key());
    }

    public synchronized boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public synchronized void remove(ConfigOption<?> option) {
        data.remove(option.key());
    }

    /**
     * 复制当前配置。
     *
     * @return 包含相同键值对的新 Options,对其修改不会影响当前对象
     */
    public synchronized Options copy() {
        return new Options(data);
    }

    /**
     * 将配置转换为 Map。
     *
     * @return 键值对的不可变快照
     */
    public synchronized Map<String, String> toMap() {
        return Collections.unmodifiableMap(new HashMap<>(data));
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }
}
