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
package org.tallison.organizer;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tallison.organizer.alias.AliasRegistry;
import org.tallison.organizer.alias.FolderNormalizer;
import org.tallison.organizer.classify.ExtensionClassifier;
import org.tallison.organizer.config.CategoryConfig;
import org.tallison.organizer.fs.DirectoryStatus;
import org.tallison.organizer.fs.PathSafety;
import org.tallison.organizer.fs.PathStatus;
import org.tallison.organizer.fs.TransferStatus;

/**
 * Walks a directory tree and moves every file into the category folder its
 * extension calls for, keeping the user's own folder structure.
 * <p>
 * The walk is iterative (an explicit stack, most recently pushed directory first),
 * so tree depth is not limited by the call stack. At each level, alias folders are
 * normalized first, then each file is either left alone (already in a folder of its
 * category) or moved. A file sitting in a category folder of the wrong kind is moved
 * out to a sibling category folder, never into a folder nested inside. The one
 * exception is the root itself: nothing is ever written above it, so when the
 * root's own name is a category, other categories get folders inside the root.
 * <code>Others</code> is a destination, not a category folder: misplaced files
 * in it are sorted into category folders under it.
 * <p>
 * The first file that can't be moved stops the run; everything not yet visited is
 * left untouched. Running twice over an unchanged tree is a no-op the second time.
 * <p>
 * Single-threaded and blocking. Don't run two organizers over overlapping trees
 * at the same time.
 */
public class DirectoryOrganizer {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryOrganizer.class);

    /**
     * Directories whose names start with this are not descended into.
     */
    public static final String HIDDEN_PREFIX = ".";

    private final ExtensionClassifier classifier;
    private final AliasRegistry aliasRegistry;
    private final FolderNormalizer folderNormalizer;
    private final PathSafety pathSafety;

    public DirectoryOrganizer() {
        this(CategoryConfig.getDefault(), new PathSafety());
    }

    public DirectoryOrganizer(CategoryConfig config, PathSafety pathSafety) {
        Objects.requireNonNull(config, "config");
        this.pathSafety = Objects.requireNonNull(pathSafety, "pathSafety");
        this.classifier = new ExtensionClassifier(config);
        this.aliasRegistry = new AliasRegistry(config);
        this.folderNormalizer = new FolderNormalizer(aliasRegistry, pathSafety);
    }

    public OrganizeStatus organize(String rootPath, TransferMode mode) {
        Path root;
        try {
            root = Paths.get(rootPath);
        } catch (InvalidPathException e) {
            LOG.warn("not a valid path: " + rootPath);
            return OrganizeStatus.PATH_NOT_FOUND;
        }
        return organize(root, mode);
    }

    /**
     * @return the single terminal status of the run
     */
    public OrganizeStatus organize(Path root, TransferMode mode) {
        return run(root, mode).getStatus();
    }

    /**
     * Same as {@link #organize(Path, TransferMode)}, but also reports what was done.
     */
    public OrganizeResult run(Path root, TransferMode mode) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(mode, "mode");
        root = root.toAbsolutePath().normalize();

        PathStatus pathStatus = pathSafety.validate(root);
        if (pathStatus != PathStatus.OK) {
            LOG.warn("can't organize " + root + ": " + pathStatus);
            return new OrganizeResult(toOrganizeStatus(pathStatus), root, 0, 0, 0, 0);
        }

        long start = System.currentTimeMillis();
        Walk walk = new Walk(root, mode);
        try {
            walk.run();
        } catch (OrganizerException e) {
            LOG.warn("stopped organizing " + root + " at " + e.getPath() + ": " + e.getMessage());
            return walk.result(e.getStatus(), e.getPath());
        }
        OrganizeResult result = walk.result(OrganizeStatus.SUCCESS, null);
        LOG.info("organized " + root + " in " + (System.currentTimeMillis() - start) +
                " ms: moved " + result.getFilesMoved() + " files, renamed " +
                result.getFoldersRenamed() + " folders, visited " +
                result.getDirectoriesVisited() + " directories");
        return result;
    }

    private static OrganizeStatus toOrganizeStatus(PathStatus pathStatus) {
        switch (pathStatus) {
            case OK:
                return OrganizeStatus.SUCCESS;
            case NOT_FOUND:
                return OrganizeStatus.PATH_NOT_FOUND;
            case NOT_A_DIRECTORY:
                return OrganizeStatus.NOT_A_DIRECTORY;
            case PERMISSION_DENIED:
                return OrganizeStatus.PERMISSION_DENIED;
            default:
                return OrganizeStatus.UNKNOWN_ERROR;
        }
    }

    private static OrganizeStatus toOrganizeStatus(TransferStatus transferStatus, TransferMode mode) {
        switch (transferStatus) {
            case SUCCESS:
                return OrganizeStatus.SUCCESS;
            case PERMISSION_DENIED:
                return OrganizeStatus.PERMISSION_DENIED;
            case CROSS_DEVICE:
                return mode == TransferMode.ATOMIC ?
                        OrganizeStatus.ATOMIC_TRANSFER_FAILED : OrganizeStatus.FALLBACK_TRANSFER_FAILED;
            default:
                return mode == TransferMode.ATOMIC ?
                        OrganizeStatus.UNKNOWN_ERROR : OrganizeStatus.FALLBACK_TRANSFER_FAILED;
        }
    }

    private static String nameOf(Path dir) {
        Path name = dir.getFileName();
        return name == null ? "" : name.toString();
    }

    /**
     * State of a single run. Lives only as long as one call to {@link #run(Path, TransferMode)}.
     */
    private class Walk {
        private final Path root;
        private final TransferMode mode;
        private final Deque<Path> pending = new ArrayDeque<>();
        private int filesMoved = 0;
        private int filesInPlace = 0;
        private int foldersRenamed = 0;
        private int directoriesVisited = 0;

        Walk(Path root, TransferMode mode) {
            this.root = root;
            this.mode = mode;
        }

        void run() throws OrganizerException {
            pending.push(root);
            while (!pending.isEmpty()) {
                Path dir = pending.pop();
                directoriesVisited++;
                foldersRenamed += folderNormalizer.normalize(dir);

                for (Path entry : pathSafety.listDirectory(dir)) {
                    if (Files.isSymbolicLink(entry)) {
                        LOG.debug("skipping symbolic link {}", entry);
                    } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                        if (placeFile(dir, entry)) {
                            filesMoved++;
                        } else {
                            filesInPlace++;
                        }
                    } else if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                        if (!nameOf(entry).startsWith(HIDDEN_PREFIX)) {
                            pending.push(entry);
                        }
                    }
                }
            }
        }

        /**
         * @return true if the file was moved, false if it was already in place
         */
        private boolean placeFile(Path dir, Path file) throws OrganizerException {
            String category = classifier.classify(file);
            String dirName = nameOf(dir);
            String dirCategory = aliasRegistry.categoryOfFolder(dirName);
            if (category.equals(dirCategory)) {
                return false;
            }
            if (CategoryConfig.OTHERS.equals(category) && CategoryConfig.OTHERS.equals(dirName)) {
                return false;
            }

            //in a category folder of another kind: move out, not deeper.
            //never above the root though, so a root named like a category
            //gets its category folders nested inside it.
            Path base = dir;
            if (dirCategory != null && !dir.equals(root)) {
                base = dir.getParent();
            }
            Path destDir = base.resolve(category);

            DirectoryStatus dirStatus = pathSafety.ensureDirectory(destDir);
            if (!dirStatus.isUsable()) {
                OrganizeStatus status = dirStatus == DirectoryStatus.PERMISSION_DENIED ?
                        OrganizeStatus.PERMISSION_DENIED : OrganizeStatus.DIRECTORY_CREATION_FAILED;
                throw new OrganizerException(status, destDir, "couldn't create " + destDir);
            }

            TransferStatus transferStatus = (mode == TransferMode.ATOMIC) ?
                    pathSafety.atomicTransfer(file, destDir) :
                    pathSafety.fallbackTransfer(file, destDir);
            if (transferStatus != TransferStatus.SUCCESS) {
                throw new OrganizerException(toOrganizeStatus(transferStatus, mode), file,
                        "couldn't move " + file + " to " + destDir + " (" + transferStatus + ")");
            }
            return true;
        }

        OrganizeResult result(OrganizeStatus status, Path failedPath) {
            return new OrganizeResult(status, failedPath, filesMoved, filesInPlace,
                    foldersRenamed, directoriesVisited);
        }
    }
}
