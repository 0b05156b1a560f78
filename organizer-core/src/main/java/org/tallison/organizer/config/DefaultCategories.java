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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The compiled-in category tables: which extensions belong to which category,
 * and which user folder names are shorthand for a category.
 * <p>
 * To support a new file type, add its extension here. Nothing else needs to change.
 * Extensions are lowercase and carry no leading dot; aliases are lowercase.
 */
public final class DefaultCategories {

    static final Map<String, Set<String>> CATEGORY_EXTENSIONS = new LinkedHashMap<>();
    static final Map<String, Set<String>> CATEGORY_ALIASES = new LinkedHashMap<>();

    static {
        //media
        extensions("Image Files", "jpg", "jpeg", "png", "gif", "bmp", "webp",
                "tiff", "svg", "ico", "heic");
        extensions("Video Files", "mp4", "mkv", "avi", "mov", "wmv", "flv",
                "webm", "mpeg", "mpg", "3gp", "m4v");
        extensions("Audio Files", "mp3", "wav", "aac", "flac", "ogg",
                "m4a", "wma", "opus", "aiff");

        //documents
        extensions("Text Files", "txt", "md", "log", "rtf", "nfo");
        extensions("PDF Files", "pdf");
        extensions("Word Files", "doc", "docx");
        extensions("Excel Files", "xls", "xlsx");
        extensions("PowerPoint Files", "ppt", "pptx");

        //source code
        extensions("C Files", "c");
        extensions("C++ Files", "cpp", "cc", "cxx");
        extensions("Header Files", "h", "hpp", "hh", "hxx");
        extensions("Java Files", "java");
        extensions("Python Files", "py");
        extensions("JavaScript Files", "js");
        extensions("TypeScript Files", "ts");
        extensions("Web Files", "html", "css", "scss");
        extensions("Shell Scripts", "sh");
        extensions("Go Files", "go");
        extensions("Rust Files", "rs");
        extensions("PHP Files", "php");

        extensions("Data Files", "csv", "json", "xml", "yaml", "yml");
        extensions("Database Files", "sql", "db", "sqlite", "sqlite3", "mdb");
        extensions("Archive Files", "zip", "rar", "7z", "tar", "gz",
                "bz2", "xz", "tgz");
        extensions("Executable Files", "exe", "msi", "bin", "app", "apk");
        extensions("Library Files", "dll", "so", "dylib", "a", "lib");
        extensions("Config Files", "ini", "conf", "cfg", "env");
    }

    static {
        aliases("Image Files",
                "img", "imgs", "image", "images", "pic", "pics", "picture", "pictures",
                "photo", "photos", "photography", "camera", "camera roll", "gallery",
                "photo gallery", "screenshots", "wallpapers", "backgrounds", "portraits",
                "landscapes", "selfies", "family photos", "vacation photos", "travel photos",
                "event photos", "wedding photos", "birthday photos", "nature photos",
                "street photos", "raw images", "edited photos", "final images", "scans",
                "prints", "artwork", "illustrations", "graphics", "icons", "logos",
                "thumbnails", "references", "inspiration", "concept art");
        aliases("Video Files",
                "video", "videos", "vid", "vids", "movie", "movies", "films", "clips",
                "recordings", "lectures", "screen captures", "tutorial videos", "courses",
                "vlogs", "reels", "shorts", "vacation videos", "travel videos",
                "family videos", "event videos", "wedding videos", "gameplay",
                "walkthroughs", "streams", "webinars", "meetings recordings", "interviews",
                "trailers", "screen recordings", "edits", "final cuts", "raw footage",
                "b roll", "montage", "highlights", "dashcam", "timelapse", "slow motion",
                "drone footage");
        //"recordings" is taken by Video Files
        aliases("Audio Files",
                "audio", "audios", "music", "songs", "tracks", "albums", "playlist",
                "playlists", "podcast", "podcasts", "audiobooks", "voice notes",
                "voice recordings", "lectures audio", "interviews audio", "sfx",
                "meetings audio", "sound effects", "background music", "instrumentals",
                "beats", "loops", "samples", "live recordings", "concerts", "practice",
                "rehearsals", "demos", "draft mixes", "final mixes", "masters", "exports",
                "ringtones", "notifications", "alarms", "ambient sounds", "nature sounds");

        aliases("Text Files",
                "text", "texts", "text files", "txt files", "notes", "plain text", "logs",
                "markdown", "readme", "documentation", "draft notes");
        aliases("PDF Files",
                "pdf", "pdfs", "pdf files", "documents pdf", "manuals pdf", "ebooks",
                "reports pdf", "invoices pdf", "statements pdf", "scanned pdfs");
        aliases("Word Files",
                "word", "word files", "documents word", "doc files", "docx files", "letters",
                "reports word", "essays", "assignments", "resumes", "cover letters");
        aliases("Excel Files",
                "excel", "excel files", "spreadsheets", "sheets", "financial sheets",
                "budgets", "expenses", "accounts", "tracking sheets", "reports excel",
                "tables");
        aliases("PowerPoint Files",
                "powerpoint", "powerpoint files", "presentations", "slides", "ppt files",
                "pptx files", "pitch decks", "lecture slides", "meeting slides");

        aliases("C Files", "c", "c files", "c source", "c language", "c programs");
        aliases("C++ Files", "cpp", "c++", "cplusplus", "cpp files", "c++ source",
                "c++ programs");
        aliases("Java Files", "java", "java files", "java source", "java programs");
        aliases("Python Files", "python", "python files", "python source", "py scripts",
                "python programs", "python scripts");
        aliases("JavaScript Files", "javascript", "javascript files", "js files",
                "js source");
        aliases("TypeScript Files", "typescript", "typescript files", "ts files",
                "ts source");
        aliases("Web Files", "web", "web files", "html files", "css files", "frontend",
                "frontend files");
        aliases("Shell Scripts", "shell", "shell scripts", "bash scripts",
                "terminal scripts");
        aliases("Go Files", "go", "golang", "go files", "go source", "go programs");
        aliases("Rust Files", "rust", "rust files", "rust source", "rs files",
                "rust programs");
        aliases("PHP Files", "php", "php files", "php source", "php scripts");

        aliases("Database Files", "database", "databases", "db", "db files", "sqlite",
                "sql files");
        aliases("Archive Files", "archive", "archives", "compressed", "compressed files",
                "zip files", "rar files", "backups", "backup archives");
        aliases("Executable Files", "executables", "binaries", "apps", "applications",
                "programs", "installers");
        aliases("Library Files", "libraries", "libs", "shared libraries",
                "static libraries");
        aliases("Config Files", "config", "configs", "configuration", "settings",
                "env files", "environment config");
    }

    private DefaultCategories() {
    }

    /**
     * @return unmodifiable view of category name -&gt; extensions, in declaration order
     */
    public static Map<String, Set<String>> getCategoryExtensions() {
        return Collections.unmodifiableMap(CATEGORY_EXTENSIONS);
    }

    /**
     * @return unmodifiable view of category name -&gt; folder aliases, in declaration order
     */
    public static Map<String, Set<String>> getCategoryAliases() {
        return Collections.unmodifiableMap(CATEGORY_ALIASES);
    }

    private static void extensions(String category, String... exts) {
        CATEGORY_EXTENSIONS.put(category, new LinkedHashSet<>(Arrays.asList(exts)));
    }

    private static void aliases(String category, String... aliases) {
        CATEGORY_ALIASES.put(category, new LinkedHashSet<>(Arrays.asList(aliases)));
    }
}
