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

import org.apache.larch.annotation.VisibleForTesting;
import org.apache.larch.options.Options;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * 键生成器的构造入口。
 *
 * <h2>构造方式</h2>
 * <ol>
 *   <li>{@code keygen.class}: 反射调用该类的 {@code (Options)} 构造函数
 *   <li>{@code keygen.type}: 通过 {@link ServiceLoader} 发现标识符匹配的 {@link KeyGeneratorFactory}
 * </ol>
 *
 * <p>工厂列表按类加载器缓存,值为软引用。
 *
 * <h2>自动生成键</h2>
 * <p>没有配置 {@code record-key.field} 时,键生成器需要为每行生成唯一键。
 * {@link #partitionOptions} 会复制配置并写入分区 ID 和提交时间,生成器据此保证跨分区唯一。
 */
public class KeyGenerators {

    private static final Logger LOG = LoggerFactory.getLogger(KeyGenerators.class);

    private static final Cache<ClassLoader, List<KeyGeneratorFactory>> FACTORIES =
            Caffeine.newBuilder().softValues().maximumSize(100).executor(Runnable::run).build();

    /**
     * 返回某个分区构造键生成器使用的配置。
     *
     * <p>总是返回副本,自动生成键时副本中额外包含分区 ID 和提交时间。
     */
    public static Options partitionOptions(Options options, int partitionId, String instantTime) {
        Options copy = options.copy();
        if (isAutoKeyEnabled(options)) {
            copy.set(KeyGenOptions.AUTO_KEY_PARTITION_ID, partitionId);
            copy.set(KeyGenOptions.AUTO_KEY_INSTANT_TIME, instantTime);
        }
        return copy;
    }

    public static boolean isAutoKeyEnabled(Options options) {
        return !options.getOptional(KeyGenOptions.RECORD_KEY_FIELD).isPresent();
    }

    /**
     * 构造键生成器。
     *
     * @throws KeyGeneratorException 如果配置不完整或构造失败
     */
    public static KeyGenerator create(Options options) {
        Optional<String> className = options.getOptional(KeyGenOptions.KEYGEN_CLASS);
        if (className.isPresent()) {
            return instantiate(className.get(), options);
        }

        Optional<String> type = options.getOptional(KeyGenOptions.KEYGEN_TYPE);
        if (type.isPresent()) {
            return discoverFactory(classLoader(), type.get()).create(options);
        }

        throw new KeyGeneratorException(
                String.format(
                        "No key generator configured, set either '%s' or '%s'.",
                        KeyGenOptions.KEYGEN_CLASS.key(), KeyGenOptions.KEYGEN_TYPE.key()));
    }

    /**
     * 构造支持列式行的键生成器。
     *
     * @throws KeyGeneratorException 如果构造失败或生成器没有实现 {@link InternalRowKeyGenerator}
     */
    public static InternalRowKeyGenerator createForInternalRow(Options options) {
        KeyGenerator keyGenerator = create(options);
        if (!(keyGenerator instanceof InternalRowKeyGenerator)) {
            throw new KeyGeneratorException(
                    String.format(
                            "Key generator %s does not implement %s and cannot be used for internal rows.",
                            keyGenerator.getClass().getName(),
                            InternalRowKeyGenerator.class.getName()));
        }
        return (InternalRowKeyGenerator) keyGenerator;
    }

    private static KeyGenerator instantiate(String className, Options options) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className, true, classLoader());
        } catch (ClassNotFoundException e) {
            throw new KeyGeneratorException(
                    String.format("Could not load key generator class '%s'.", className), e);
        }
        if (!KeyGenerator.class.isAssignableFrom(clazz)) {
            throw new KeyGeneratorException(
                    String.format(
                            "Class '%s' does not implement %s.",
                            className, KeyGenerator.class.getName()));
        }

        try {
            return (KeyGenerator) clazz.getConstructor(Options.class).newInstance(options);
        } catch (InvocationTargetException e) {
            throw new KeyGeneratorException(
                    String.format("Failed to create key generator '%s'.", className),
                    e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new KeyGeneratorException(
                    String.format(
                            "Key generator '%s' must have a public constructor taking %s.",
                            className, Options.class.getName()),
                    e);
        }
    }

    @VisibleForTesting
    static KeyGeneratorFactory discoverFactory(ClassLoader classLoader, String identifier) {
        List<KeyGeneratorFactory> factories =
                FACTORIES.get(classLoader, KeyGenerators::loadFactories);

        List<KeyGeneratorFactory> matching =
                factories.stream()
                        .filter(f -> f.identifier().equals(identifier))
                        .collect(Collectors.toList());

        if (matching.isEmpty()) {
            throw new KeyGeneratorException(
                    String.format(
                            "Could not find any key generator factory for identifier '%s' in the classpath.\n\n"
                                    + "Available factory identifiers are:\n\n"
                                    + "%s",
                            identifier,
                            factories.stream()
                                    .map(KeyGeneratorFactory::identifier)
                                    .sorted()
                                    .collect(Collectors.joining("\n"))));
        }
        if (matching.size() > 1) {
            throw new KeyGeneratorException(
                    String.format(
                            "Multiple key generator factories for identifier '%s' found in the classpath.\n\n"
                                    + "Ambiguous factory classes are:\n\n"
                                    + "%s",
                            identifier,
                            matching.stream()
                                    .map(f -> f.getClass().getName())
                                    .sorted()
                                    .collect(Collectors.joining("\n"))));
        }
        return matching.get(0);
    }

    private static List<KeyGeneratorFactory> loadFactories(ClassLoader classLoader) {
        Iterator<KeyGeneratorFactory> iterator =
                ServiceLoader.load(KeyGeneratorFactory.class, classLoader).iterator();

        List<KeyGeneratorFactory> result = new ArrayList<>();
        while (true) {
            try {
                // hasNext() may fail as well when a provider cannot be loaded
                if (!iterator.hasNext()) {
                    break;
                }
                result.add(iterator.next());
            } catch (Throwable t) {
                if (t instanceof NoClassDefFoundError) {
                    LOG.debug(
                            "NoClassDefFoundError when loading a {}, skipping the provider.",
                            KeyGeneratorFactory.class.getCanonicalName(),
                            t);
                } else {
                    throw new KeyGeneratorException(
                            "Unexpected error when trying to load key generator factories.", t);
                }
            }
        }
        LOG.debug("Discovered {} key generator factories.", result.size());
        return result;
    }

    private static ClassLoader classLoader() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        return classLoader != null ? classLoader : KeyGenerators.class.getClassLoader();
    }

    private KeyGenerators() {}
}
