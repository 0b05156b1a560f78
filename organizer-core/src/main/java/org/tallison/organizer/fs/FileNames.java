/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tallison.organizer.fs;

import java.util.Locale;

import org.apache.commons.io.FilenameUtils;

/**
 * Splits file names into stem and suffix.
 * <p>
 * Only the last dot counts (<code>archive.tar.gz</code> has the suffix <code>.gz</code>).
 * A dot in the first position does not start a suffix, so <code>.bashrc</code>
 * has no extension at all.
 */
public final class FileNames {

    private FileNames() {
    }

    /**
     * @param fileName the final path component only
     * @return the suffix including its dot, or "" if there is none
     */
    public static String getSuffix(String fileName) {
        int i = suffixIndex(fileName);
        return i < 0 ? "" : fileName.substring(i);
    }

    /**
     * @return the name without its suffix
     */
    public static String getStem(String fileName) {
        int i = suffixIndex(fileName);
        return i < 0 ? fileName : fileName.substring(0, i);
    }

    /**
     * @return lowercased extension without the dot, or "" if there is none
     */
    public static String getExtension(String fileName) {
        String suffix = getSuffix(fileName);
        if (suffix.length() < 2) {
            return "";
        }
        return suffix.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * @return <code>stem(counter)suffix</code>, e.g. <code>photo(2).jpg</code>
     */
    public static String withCounter(String fileName, long counter) {
        return getStem(fileName) + "(" + counter + ")" + getSuffix(fileName);
    }

    private static int suffixIndex(String name) {
        int i = FilenameUtils.indexOfExtension(name);
        //leading dot marks a hidden file, not an extension
        return i > 0 ? i : -1;
    }
}
