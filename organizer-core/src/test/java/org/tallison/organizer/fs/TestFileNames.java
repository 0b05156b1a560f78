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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestFileNames {

    @Test
    public void testSimple() {
        assertEquals(".jpg", FileNames.getSuffix("photo.jpg"));
        assertEquals("photo", FileNames.getStem("photo.jpg"));
        assertEquals("jpg", FileNames.getExtension("photo.JPG"));
    }

    @Test
    public void testOnlyLastDotCounts() {
        assertEquals(".gz", FileNames.getSuffix("archive.tar.gz"));
        assertEquals("archive.tar", FileNames.getStem("archive.tar.gz"));
        assertEquals("gz", FileNames.getExtension("archive.tar.gz"));
    }

    @Test
    public void testNoExtension() {
        assertEquals("", FileNames.getSuffix("Makefile"));
        assertEquals("Makefile", FileNames.getStem("Makefile"));
        assertEquals("", FileNames.getExtension("Makefile"));
    }

    @Test
    public void testHiddenFile() {
        assertEquals("", FileNames.getExtension(".bashrc"));
        assertEquals(".bashrc", FileNames.getStem(".bashrc"));
        assertEquals("txt", FileNames.getExtension(".notes.txt"));
    }

    @Test
    public void testTrailingDot() {
        assertEquals(".", FileNames.getSuffix("file."));
        assertEquals("", FileNames.getExtension("file."));
        assertEquals("file(1).", FileNames.withCounter("file.", 1));
    }

    @Test
    public void testWithCounter() {
        assertEquals("photo(1).jpg", FileNames.withCounter("photo.jpg", 1));
        assertEquals("archive.tar(12).gz", FileNames.withCounter("archive.tar.gz", 12));
        assertEquals(".bashrc(2)", FileNames.withCounter(".bashrc", 2));
        assertEquals("README(3)", FileNames.withCounter("README", 3));
    }
}
