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

package org.apache.larch.write;

import org.apache.larch.data.InternalRow;
import org.apache.larch.record.MetadataField;
import org.apache.larch.types.RowType;
import org.apache.larch.utils.InternalRowProjection;

/** 通过缓存的 {@link InternalRowProjection} 投影列式行。 */
public class InternalRowProjector implements RowProjector<InternalRow> {

    private final InternalRowProjection projection;

    public InternalRowProjector(RowType sourceType, RowType targetType) {
        this.projection = InternalRowProjection.of(sourceType, targetType);
    }

    /** 规则与 {@link AvroRowProjector#targetSchema} 相同。 */
    public static RowType targetType(
            RecordCreationContext context, RowType writerType, RowType dataFileType) {
        RowType target = context.dropPartitionColumns() ? dataFileType : writerType;
        return context.readsLocation()
                ? target.withoutFields(f -> MetadataField.isMetadataField(f.name()))
                : target;
    }

    @Override
    public InternalRow project(InternalRow row) {
        return projection.apply(row);
    }
}
