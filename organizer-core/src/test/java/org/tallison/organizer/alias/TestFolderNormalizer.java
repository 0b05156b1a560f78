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
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.Test;
import org.tallison.organizer.OrganizerTestBase;
import org.tallison.organizer.fs.PathSafety;

public class TestFolderNormalizer extends OrganizerTestBase {

    private final FolderNormalizer normalizer = new FolderNormalizer(new AliasRegistry(), new PathSafety());

    @Test
    public void testRenamesAlias() throws Exception {
        touch("pics/a.jpg");
        assertEquals(1, normalizer.normalize(tmpDir));
        assertTrue(isDirectory("Image Files"));
        assertFalse(exists("pics"));
        assertEquals("pics/a.jpg", read("Image Files/a.jpg"));
    }

    @Test
    public void testOnlyOneAliasPerCategory() throws Exception {
        touch("pics/a.jpg");
        touch("photos/b.jpg");
        assertEquals(1, normalizer.normalize(tmpDir));
        assertTrue(isDirectory("Image Files"));
        //exactly one of the two survives under its own name
        assertTrue(exists("pics") ^ exists("photos"));
    }

    @Test
    public void testExistingCanonicalFolderBlocksRename() throws Exception {
        touch("Image Files/a.jpg");
        touch("pics/b.jpg");
        assertEquals(0, normalizer.normalize(tmpDir));
        assertEquals(Arrays.asList("Image Files", "Image Files/a.jpg", "pics", "pics/b.jpg"), listTree());
    }

    @Test
    public void testCaseInsensitiveAlias() throws Exception {
        mkdirs("Camera Roll");
        mkdirs("MUSIC");
        assertEquals(2, normalizer.normalize(tmpDir));
        assertEquals(Arrays.asList("Audio Files", "Image Files"), listTree());
    }

    @Test
    public void testOneRenamePerCategory() throws Exception {
        mkdirs("docs-2021");
        mkdirs("pdfs");
        mkdirs("videos");
        mkdirs("songs");
        assertEquals(3, normalizer.normalize(tmpDir));
        assertEquals(Arrays.asList("Audio Files", "PDF Files", "Video Files", "docs-2021"), listTree());
    }

    @Test
    public void testDoesNotRecurseOrCreate() throws Exception {
        mkdirs("work/pics");
        touch("music.txt");
        assertEquals(0, normalizer.normalize(tmpDir));
        assertEquals(Arrays.asList("music.txt", "work", "work/pics"), listTree());

        Path work = tmpDir.resolve("work");
        assertEquals(1, normalizer.normalize(work));
        assertTrue(isDirectory("work/Image Files"));
    }

    @Test
    public void testIdempotent() throws Exception {
        mkdirs("pics");
        assertEquals(1, normalizer.normalize(tmpDir));
        assertEquals(0, normalizer.normalize(tmpDir));
    }

    @Test
    public void testUnreadableDirectoryIsNotAnError() throws IOException {
        Path locked = mkdirs("locked");
        mkdirs("locked/pics");
        revokePermissions(locked);
        try {
            assertEquals(0, normalizer.normalize(locked));
        } finally {
            restorePermissions(locked);
        }
    }
}
