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
package org.tallison.organizer.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * Read-only classification tables plus the reverse indices derived from them.
 * <p>
 * An instance is immutable once constructed, so a single instance can be shared
 * by any number of organizers. Use {@link #getDefault()} for the compiled-in tables
 * or construct one directly to substitute other tables (e.g. in tests).
 * <p>
 * The canonical category names are the key set of the extension table; they are
 * never listed separately.
 */
public class CategoryConfig {

    /**
     * Destination for files whose extension is missing or unmapped.
     * Not a canonical category and never the target of an alias.
     */
    public static final String OTHERS = "Others";

    private final Map<String, Set<String>> categoryExtensions;
    private final Map<String, Set<String>> categoryAliases;
    private final Map<String, String> extensionLookup;
    private final Map<String, String> aliasLookup;
    private final Set<String> canonicalNames;

    /**
     * @param categoryExtensions category name -&gt; extensions (no leading dot)
     * @param categoryAliases    category name -&gt; folder aliases
     * @throws IllegalArgumentException if the tables are inconsistent: an extension or alias
     *                                  claimed by two categories, an alias that is another
     *                                  category's canonical name, an alias for an unknown category,
     *                                  or a category named {@link #OTHERS}
     */
    public CategoryConfig(Map<String, Set<String>> categoryExtensions,
                          Map<String, Set<String>> categoryAliases) {
        Objects.requireNonNull(categoryExtensions, "categoryExtensions");
        Objects.requireNonNull(categoryAliases, "categoryAliases");

        Map<String, Set<String>> exts = new LinkedHashMap<>();
        Map<String, String> extLookup = new HashMap<>();
        for (Map.Entry<String, Set<String>> e : categoryExtensions.entrySet()) {
            String category = e.getKey();
            if (StringUtils.isBlank(category)) {
                throw new IllegalArgumentException("category name must not be blank");
            }
            if (OTHERS.equalsIgnoreCase(category)) {
                throw new IllegalArgumentException("'" + OTHERS + "' is reserved for unmapped extensions");
            }
            Set<String> normed = new LinkedHashSet<>();
            for (String ext : e.getValue()) {
                String normedExt = normalizeExtension(ext);
                if (normedExt.isEmpty()) {
                    throw new IllegalArgumentException("empty extension for category: " + category);
                }
                String prev = extLookup.put(normedExt, category);
                if (prev != null && !prev.equals(category)) {
                    throw new IllegalArgumentException("extension '" + normedExt +
                            "' is mapped to both '" + prev + "' and '" + category + "'");
                }
                normed.add(normedExt);
            }
            exts.put(category, Collections.unmodifiableSet(normed));
        }

        Map<String, String> lowerCanonical = new HashMap<>();
        for (String category : exts.keySet()) {
            lowerCanonical.put(category.toLowerCase(Locale.ROOT), category);
        }

        Map<String, Set<String>> aliases = new LinkedHashMap<>();
        Map<String, String> lookup = new HashMap<>();
        for (Map.Entry<String, Set<String>> e : categoryAliases.entrySet()) {
            String category = e.getKey();
            if (!exts.containsKey(category)) {
                throw new IllegalArgumentException("aliases given for unknown category: " + category);
            }
            Set<String> normed = new LinkedHashSet<>();
            for (String alias : e.getValue()) {
                String normedAlias = StringUtils.trimToEmpty(alias).toLowerCase(Locale.ROOT);
                if (normedAlias.isEmpty()) {
                    throw new IllegalArgumentException("empty alias for category: " + category);
                }
                String canonical = lowerCanonical.get(normedAlias);
                if (canonical != null && !canonical.equals(category)) {
                    throw new IllegalArgumentException("alias '" + normedAlias +
                            "' of '" + category + "' is the canonical name of '" + canonical + "'");
                }
                String prev = lookup.put(normedAlias, category);
                if (prev != null && !prev.equals(category)) {
                    throw new IllegalArgumentException("alias '" + normedAlias +
                            "' is mapped to both '" + prev + "' and '" + category + "'");
                }
                normed.add(normedAlias);
            }
            aliases.put(category, Collections.unmodifiableSet(normed));
        }

        this.categoryExtensions = Collections.unmodifiableMap(exts);
        this.categoryAliases = Collections.unmodifiableMap(aliases);
        this.extensionLookup = Collections.unmodifiableMap(extLookup);
        this.aliasLookup = Collections.unmodifiableMap(lookup);
        this.canonicalNames = Collections.unmodifiableSet(new LinkedHashSet<>(exts.keySet()));
    }

    /**
     * @return the shared configuration built from {@link DefaultCategories}
     */
    public static CategoryConfig getDefault() {
        return DefaultHolder.INSTANCE;
    }

    public Map<String, Set<String>> getCategoryExtensions() {
        return categoryExtensions;
    }

    public Map<String, Set<String>> getCategoryAliases() {
        return categoryAliases;
    }

    /**
     * @return extension -&gt; category
     */
    public Map<String, String> getExtensionLookup() {
        return extensionLookup;
    }

    /**
     * @return lowercase alias -&gt; category
     */
    public Map<String, String> getAliasLookup() {
        return aliasLookup;
    }

    public Set<String> getCanonicalNames() {
        return canonicalNames;
    }

    private static String normalizeExtension(String ext) {
        String normed = StringUtils.trimToEmpty(ext).toLowerCase(Locale.ROOT);
        return StringUtils.removeStart(normed, ".");
    }

    private static class DefaultHolder {
        private static final CategoryConfig INSTANCE = new CategoryConfig(
                DefaultCategories.getCategoryExtensions(),
                DefaultCategories.getCategoryAliases());
    }
}
