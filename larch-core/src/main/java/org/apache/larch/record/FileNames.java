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

import static org.apache.larch.utils.Preconditions.checkArgument;
import static org.apache.larch.utils.StringUtils.isNullOrWhitespaceOnly;

/**
 * 数据文件命名规则。
 *
 * <p>文件组内的文件按以下规则命名:
 * <pre>
 * 基础文件: {fileId}_{writeToken}_{instantTime}.{extension}
 * 日志文件: .{fileId}_{baseInstantTime}.log.{version}_{writeToken}
 * </pre>
 *
 * <p>文件名可以带目录前缀,解析前会先去掉。
 */
public final class FileNames {

    public static final String LOG_FILE_PREFIX = ".";

    public static final String LOG_FILE_MARKER = ".log.";

    private static final char TOKEN_SEPARATOR = '_';

    /**
     * 从文件名中提取文件 ID。
     *
     * @param fileName 文件名,可以包含目录
     * @return 文件 ID
     * @throws IllegalArgumentException 如果文件名为空或不含文件 ID
     */
    public static String fileId(String fileName) {
        checkArgument(!isNullOrWhitespaceOnly(fileName), "File name must not be empty.");
        String name = fileName.substring(fileName.lastIndexOf('/') + 1);
        if (isLogFile(name)) {
            name = name.substring(LOG_FILE_PREFIX.length());
        }
        int separator = name.indexOf(TOKEN_SEPARATOR);
        String fileId = separator < 0 ? stripExtension(name) : name.substring(0, separator);
        checkArgument(!fileId.isEmpty(), "Cannot extract file id from file name '%s'.", fileName);
        return fileId;
    }

    public static boolean isLogFile(String fileName) {
        return fileName.startsWith(LOG_FILE_PREFIX) && fileName.contains(LOG_FILE_MARKER);
    }

    private static String stripExtension(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    private FileNames() {}
}
