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
import org.apache.larch.data.InternalRow;
import org.apache.larch.types.RowType;

/**
 * 同时支持列式 {@link InternalRow} 的键生成器。
 *
 * <p>列式行不携带字段名,调用方会传入读取该行使用的 {@link RowType}。物化列式批次时,
 * 配置的键生成器必须实现该接口。
 */
@Public
public interface InternalRowKeyGenerator extends KeyGenerator {

    String getRecordKey(InternalRow row, RowType rowType);

    String getPartitionPath(InternalRow row, RowType rowType);
}
