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

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tallison.organizer.OrganizerException;
import org.tallison.organizer.fs.PathSafety;
import org.tallison.organizer.fs.TransferStatus;

/**
 * Renames user alias folders (<code>pics</code>, <code>camera roll</code>...) to their
 * canonical category name, one directory level at a time.
 * <p>
 * Only the first alias folder per category is renamed; the others keep their names.
 * Nothing is created or merged, and a failed rename is not an error: normalizing is
 * best effort and the walk continues either way.
 */
public class FolderNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(FolderNormalizer.class);

    private final AliasRegistry aliasRegistry;
    private final PathSafety pathSafety;

    public FolderNormalizer(AliasRegistry aliasRegistry, PathSafety pathSafety) {
        this.aliasRegistry = aliasRegistry;
        this.pathSafety = pathSafety;
    }

    /**
     * @param dir directory whose immediate subdirectories are normalized; never recurses
     * @return number of folders renamed
     */
    public int normalize(Path dir) {
        List<Path> entries;
        try {
            entries = pathSafety.listDirectory(dir);
        } catch (OrganizerException e) {
            //the walk will report this when it lists the same directory
            LOG.debug("skipping normalization of " + dir, e);
            return 0;
        }

        Map<String, Path> toPromote = new LinkedHashMap<>();
        for (Path entry : entries) {
            if (!Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            String name = entry.getFileName().toString();
            if (aliasRegistry.isCanonical(name)) {
                continue;
            }
            String category = aliasRegistry.lookupAlias(name);
            if (category != null && !toPromote.containsKey(category)) {
                toPromote.put(category, entry);
            }
        }

        int renamed = 0;
        for (Map.Entry<String, Path> e : toPromote.entrySet()) {
            String canonical = e.getKey();
            Path aliasDir = e.getValue();
            if (aliasDir.getFileName().toString().equals(canonical)) {
                continue;
            }
            TransferStatus status = pathSafety.renameInPlace(aliasDir, canonical);
            if (status == TransferStatus.SUCCESS) {
                LOG.info("renamed folder " + aliasDir + " -> " + canonical);
                renamed++;
            } else {
                LOG.debug("left {} as is ({})", aliasDir, status);
            }
        }
        return renamed;
    }
}
