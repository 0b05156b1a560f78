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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class TestCategoryConfig {

    @Test
    public void testDefaultTables() {
        CategoryConfig config = CategoryConfig.getDefault();
        assertEquals(26, config.getCanonicalNames().size());
        assertEquals(config.getCategoryExtensions().keySet(), config.getCanonicalNames());
        assertFalse(config.getCanonicalNames().contains(CategoryConfig.OTHERS));
        assertEquals("Image Files", config.getExtensionLookup().get("jpg"));
        assertEquals("Image Files", config.getAliasLookup().get("camera roll"));
        assertEquals("Video Files", config.getAliasLookup().get("recordings"));
    }

    @Test
    public void testDefaultIsShared() {
        assertTrue(CategoryConfig.getDefault() == CategoryConfig.getDefault());
    }

    @Test
    public void testDefaultAliasesAreAFunction() {
        CategoryConfig config = CategoryConfig.getDefault();
        int total = 0;
        for (Map.Entry<String, Set<String>> e : config.getCategoryAliases().entrySet()) {
            for (String alias : e.getValue()) {
                assertEquals(alias, alias.toLowerCase(Locale.ROOT));
                assertEquals(e.getKey(), config.getAliasLookup().get(alias));
                total++;
            }
        }
        assertEquals(total, config.getAliasLookup().size());
        for (String alias : config.getAliasLookup().keySet()) {
            for (String canonical : config.getCanonicalNames()) {
                if (canonical.equalsIgnoreCase(alias)) {
                    assertEquals(canonical, config.getAliasLookup().get(alias));
                }
            }
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testImmutable() {
        CategoryConfig.getDefault().getExtensionLookup().put("foo", "Image Files");
    }

    @Test
    public void testRejectsInconsistentTables() {
        Map<String, Set<String>> exts = new LinkedHashMap<>();
        exts.put("Image Files", set("jpg"));
        exts.put("Video Files", set("mp4"));

        assertRejected(exts, aliases("Image Files", "clips", "Video Files", "clips"));
        assertRejected(exts, aliases("Image Files", "video files"));
        assertRejected(exts, aliases("Audio Files", "music"));

        Map<String, Set<String>> dupExt = new LinkedHashMap<>(exts);
        dupExt.put("Movies", set("MP4"));
        assertRejected(dupExt, aliases());

        Map<String, Set<String>> others = new LinkedHashMap<>(exts);
        others.put(CategoryConfig.OTHERS, set("xyz"));
        assertRejected(others, aliases());
    }

    @Test
    public void testOwnCanonicalNameAsAlias() {
        Map<String, Set<String>> exts = new LinkedHashMap<>();
        exts.put("PDF Files", set("pdf"));
        CategoryConfig config = new CategoryConfig(exts, aliases("PDF Files", "PDF files", " pdfs "));
        assertEquals("PDF Files", config.getAliasLookup().get("pdf files"));
        assertEquals("PDF Files", config.getAliasLookup().get("pdfs"));
    }

    private static void assertRejected(Map<String, Set<String>> exts, Map<String, Set<String>> aliases) {
        try {
            new CategoryConfig(exts, aliases);
            fail("should have rejected " + exts + " / " + aliases);
        } catch (IllegalArgumentException e) {
            //expected
        }
    }

    private static Set<String> set(String... vals) {
        return new HashSet<>(Arrays.asList(vals));
    }

    private static Map<String, Set<String>> aliases(String... categoryAliasPairs) {
        Map<String, Set<String>> m = new LinkedHashMap<>();
        for (int i = 0; i < categoryAliasPairs.length; i += 2) {
            m.computeIfAbsent(categoryAliasPairs[i], k -> new HashSet<>())
                    .add(categoryAliasPairs[i + 1]);
        }
        return m;
    }
}
