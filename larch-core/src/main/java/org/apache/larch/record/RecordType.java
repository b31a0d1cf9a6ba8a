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

package org.apache.larch.record;

/** 输入行的表示方式,决定物化流水线使用哪一种行格式适配。 */
public enum RecordType {

    /** 自描述的 Avro {@code GenericRecord},字段按名称访问。 */
    AVRO,

    /** 列式 {@code InternalRow},字段按位置访问,字段名由共享的行类型给出。 */
    INTERNAL_ROW
}
