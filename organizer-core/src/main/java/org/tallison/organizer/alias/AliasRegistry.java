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
package org.tallison.organizer.alias;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.tallison.organizer.config.CategoryConfig;

/**
 * Knows which folder names stand for which category: canonical names
 * (exact match), user aliases (case-insensitive) and {@link CategoryConfig#OTHERS}.
 */
public class AliasRegistry {

    private final Map<String, Set<String>> categoryAliases;
    private final Map<String, String> aliasLookup;
    private final Set<String> canonicalNames;

    public AliasRegistry() {
        this(CategoryConfig.getDefault());
    }

    public AliasRegistry(CategoryConfig config) {
        this.categoryAliases = config.getCategoryAliases();
        this.aliasLookup = config.getAliasLookup();
        this.canonicalNames = config.getCanonicalNames();
    }

    /**
     * @return the aliases of <code>category</code>, empty if it has none
     */
    public Set<String> getAliases(String category) {
        return categoryAliases.getOrDefault(category, Collections.emptySet());
    }

    /**
     * @return the category <code>folderName</code> is an alias of, or <code>null</code>
     */
    public String lookupAlias(String folderName) {
        if (folderName == null) {
            return null;
        }
        return aliasLookup.get(folderName.toLowerCase(Locale.ROOT));
    }

    public boolean isCanonical(String folderName) {
        return canonicalNames.contains(folderName);
    }

    public Set<String> getCanonicalNames() {
        return canonicalNames;
    }

    /**
     * <code>Others</code> is not a category folder: it is a destination only,
     * so files of other categories found inside it are sorted into subfolders.
     *
     * @return the category a canonical or alias folder with this name holds, or
     * <code>null</code> if it's an ordinary user folder
     */
    public String categoryOfFolder(String folderName) {
        if (folderName == null) {
            return null;
        }
        if (isCanonical(folderName)) {
            return folderName;
        }
        return lookupAlias(folderName);
    }

    public boolean isCategoryFolder(String folderName) {
        return categoryOfFolder(folderName) != null;
    }
}
