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

import static org.junit.Assert.assertEquals;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.Test;
import org.tallison.organizer.config.CategoryConfig;

public class TestExtensionClassifier {

    private final ExtensionClassifier classifier = new ExtensionClassifier();

    @Test
    public void testBasic() {
        assertEquals("Image Files", classifier.classify("img.jpg"));
        assertEquals("PDF Files", classifier.classify("report.pdf"));
        assertEquals("C++ Files", classifier.classify("main.cpp"));
        assertEquals("Header Files", classifier.classify("main.hpp"));
        assertEquals("Config Files", classifier.classify("settings.ini"));
    }

    @Test
    public void testCaseInsensitive() {
        assertEquals(classifier.classify("img.jpg"), classifier.classify("IMG.JPG"));
        assertEquals("Image Files", classifier.classify("Holiday.JpEg"));
        assertEquals("Word Files", classifier.classify("CV.DOCX"));
    }

    @Test
    public void testUnmappedAndMissing() {
        assertEquals(CategoryConfig.OTHERS, classifier.classify("blob.xyz123"));
        assertEquals(CategoryConfig.OTHERS, classifier.classify("Makefile"));
        assertEquals(CategoryConfig.OTHERS, classifier.classify("file."));
        assertEquals(CategoryConfig.OTHERS, classifier.classify(".bashrc"));
    }

    @Test
    public void testOnlyFinalExtensionCounts() {
        //tar.gz is classified by gz, not by a compound extension
        assertEquals("Archive Files", classifier.classify("archive.tar.gz"));
        assertEquals("Text Files", classifier.classify("report.pdf.txt"));
        assertEquals("PDF Files", classifier.classify("notes.txt.pdf"));
    }

    @Test
    public void testPath() {
        assertEquals("Python Files", classifier.classify(Paths.get("some", "dir.jpg", "script.py")));
        assertEquals("Java Files", classifier.classify(Paths.get("Foo.java")));
    }

    @Test
    public void testExtension() {
        assertEquals("gz", ExtensionClassifier.getExtension("a.tar.GZ"));
        assertEquals("", ExtensionClassifier.getExtension("noext"));
    }

    @Test
    public void testSubstitutedTables() {
        Map<String, Set<String>> exts = new HashMap<>();
        exts.put("Pictures", new HashSet<>(Arrays.asList("JPG", ".png")));
        CategoryConfig config = new CategoryConfig(exts, Collections.emptyMap());
        ExtensionClassifier custom = new ExtensionClassifier(config);
        assertEquals("Pictures", custom.classify("a.jpg"));
        assertEquals("Pictures", custom.classify("a.PNG"));
        assertEquals(CategoryConfig.OTHERS, custom.classify("a.pdf"));
    }
}
