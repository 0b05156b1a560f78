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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.tallison.organizer.config.CategoryConfig;

public class TestAliasRegistry {

    private final AliasRegistry registry = new AliasRegistry();

    @Test
    public void testLookup() {
        assertEquals("Image Files", registry.lookupAlias("pics"));
        assertEquals("Image Files", registry.lookupAlias("Camera Roll"));
        assertEquals("Audio Files", registry.lookupAlias("MUSIC"));
        assertNull(registry.lookupAlias("taxes 2023"));
        assertNull(registry.lookupAlias(null));
    }

    @Test
    public void testCanonicalIsExact() {
        assertTrue(registry.isCanonical("Image Files"));
        assertFalse(registry.isCanonical("image files"));
        assertFalse(registry.isCanonical(CategoryConfig.OTHERS));
    }

    @Test
    public void testCategoryOfFolder() {
        assertEquals("Image Files", registry.categoryOfFolder("Image Files"));
        assertEquals("Image Files", registry.categoryOfFolder("Photos"));
        //Others is a destination, not a folder files get moved out of
        assertNull(registry.categoryOfFolder(CategoryConfig.OTHERS));
        assertFalse(registry.isCategoryFolder(CategoryConfig.OTHERS));
        assertNull(registry.categoryOfFolder("work"));
        assertTrue(registry.isCategoryFolder("pdfs"));
        assertFalse(registry.isCategoryFolder("projects"));
    }

    @Test
    public void testAliases() {
        assertTrue(registry.getAliases("Image Files").contains("camera roll"));
        assertTrue(registry.getAliases("Header Files").isEmpty());
        assertTrue(registry.getAliases("No Such Category").isEmpty());
    }
}
