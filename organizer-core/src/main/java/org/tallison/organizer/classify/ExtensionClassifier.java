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
package org.tallison.organizer.classify;

import java.nio.file.Path;
import java.util.Map;

import org.tallison.organizer.config.CategoryConfig;
import org.tallison.organizer.fs.FileNames;

/**
 * Answers "which category does this file belong to?" from the extension alone.
 * <p>
 * Matching is case-insensitive and only the final extension counts, so
 * <code>archive.tar.gz</code> is classified by <code>gz</code>.
 * Files with no extension, or one that isn't mapped, go to {@link CategoryConfig#OTHERS}.
 */
public class ExtensionClassifier {

    private final Map<String, String> extensionLookup;

    public ExtensionClassifier() {
        this(CategoryConfig.getDefault());
    }

    public ExtensionClassifier(CategoryConfig config) {
        this.extensionLookup = config.getExtensionLookup();
    }

    public String classify(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return CategoryConfig.OTHERS;
        }
        return classify(fileName.toString());
    }

    public String classify(String fileName) {
        String ext = getExtension(fileName);
        if (ext.isEmpty()) {
            return CategoryConfig.OTHERS;
        }
        return extensionLookup.getOrDefault(ext, CategoryConfig.OTHERS);
    }

    /**
     * @return lowercased extension without its dot, "" if there is none
     */
    public static String getExtension(String fileName) {
        return FileNames.getExtension(fileName);
    }
}
