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

import org.apache.avro.generic.GenericRecord;

/**
 * 键生成器,从 Avro 行中提取记录键和分区路径。
 *
 * <p>键生成算法由外部实现提供,写入路径只负责构造并调用它们。实现通过
 * {@link KeyGenerators#create} 构造,可以是带 {@code (Options)} 构造函数的类,
 * 也可以由 {@link KeyGeneratorFactory} 创建。
 *
 * <p>每个分区构造一个独立的实例,实现不需要线程安全。
 *
 * @see InternalRowKeyGenerator
 */
@Public
public interface KeyGenerator {

    /** 返回行的记录键。 */
    String getRecordKey(GenericRecord record);

    /** 返回行的分区路径,非分区表返回空字符串。 */
    String getPartitionPath(GenericRecord record);
}
