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

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tallison.organizer.OrganizeStatus;
import org.tallison.organizer.OrganizerException;

/**
 * All filesystem mutation goes through here. Every {@link IOException} is caught
 * in this class and turned into a status; nothing raw escapes to the caller.
 * <p>
 * The low-level primitives ({@link #rename(Path, Path)}, {@link #copy(Path, Path)},
 * {@link #delete(Path)}, {@link #createDirectory(Path)}) are protected so that
 * a subclass can stand in for a file system that behaves differently,
 * e.g. one that refuses same-device renames.
 */
public class PathSafety {

    private static final Logger LOG = LoggerFactory.getLogger(PathSafety.class);

    private static final Comparator<Path> BY_FILE_NAME =
            Comparator.comparing(p -> p.getFileName().toString());

    /**
     * Checks that <code>root</code> exists, is a directory and can actually be
     * listed and traversed. Existence and accessibility are reported separately.
     */
    public PathStatus validate(Path root) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return PathStatus.NOT_FOUND;
        } catch (AccessDeniedException e) {
            return PathStatus.PERMISSION_DENIED;
        } catch (IOException e) {
            if (isNotADirectory(e)) {
                //a path component is a regular file
                return PathStatus.NOT_FOUND;
            }
            LOG.warn("couldn't read attributes of " + root, e);
            return PathStatus.UNKNOWN;
        }
        if (!attrs.isDirectory()) {
            return PathStatus.NOT_A_DIRECTORY;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(root)) {
            ds.iterator().hasNext();
        } catch (AccessDeniedException e) {
            return PathStatus.PERMISSION_DENIED;
        } catch (IOException | DirectoryIteratorException e) {
            if (isPermissionDenied(unwrap(e))) {
                return PathStatus.PERMISSION_DENIED;
            }
            LOG.warn("couldn't list " + root, e);
            return PathStatus.UNKNOWN;
        }
        if (!Files.isExecutable(root)) {
            return PathStatus.PERMISSION_DENIED;
        }
        return PathStatus.OK;
    }

    /**
     * Creates <code>dir</code> if it isn't there. An existing directory is
     * success, not an error.
     */
    public DirectoryStatus ensureDirectory(Path dir) {
        if (Files.isDirectory(dir)) {
            return DirectoryStatus.ALREADY_EXISTS;
        }
        if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            LOG.warn("can't create directory; something that isn't a directory is in the way: " + dir);
            return DirectoryStatus.UNKNOWN;
        }
        try {
            createDirectory(dir);
            LOG.debug("created {}", dir);
            return DirectoryStatus.CREATED;
        } catch (FileAlreadyExistsException e) {
            //lost a race with someone else creating it
            return Files.isDirectory(dir) ? DirectoryStatus.ALREADY_EXISTS : DirectoryStatus.UNKNOWN;
        } catch (IOException e) {
            if (isPermissionDenied(e)) {
                LOG.warn("permission denied creating " + dir);
                return DirectoryStatus.PERMISSION_DENIED;
            }
            LOG.warn("couldn't create " + dir + ": " + reason(e), e);
            return DirectoryStatus.UNKNOWN;
        }
    }

    /**
     * @return <code>dir/fileName</code> if nothing is there, otherwise the first free
     * <code>stem(n)suffix</code> for n = 1, 2, ...
     */
    public Path uniqueDestination(Path dir, String fileName) {
        Path target = dir.resolve(fileName);
        if (!isOccupied(target)) {
            return target;
        }
        long counter = 1;
        do {
            target = dir.resolve(FileNames.withCounter(fileName, counter));
            counter++;
        } while (isOccupied(target));
        return target;
    }

    /**
     * Renames <code>source</code> into <code>destDir</code> under a collision-free name.
     * The rename is all-or-nothing.
     */
    public TransferStatus atomicTransfer(Path source, Path destDir) {
        Path target = uniqueDestination(destDir, source.getFileName().toString());
        try {
            rename(source, target);
        } catch (IOException e) {
            if (isCrossDevice(e)) {
                LOG.warn("can't rename across devices: " + source + " -> " + target);
                return TransferStatus.CROSS_DEVICE;
            }
            if (isPermissionDenied(e)) {
                LOG.warn("permission denied moving " + source + " -> " + target);
                return TransferStatus.PERMISSION_DENIED;
            }
            LOG.warn("couldn't move " + source + " -> " + target + ": " + reason(e), e);
            return TransferStatus.UNKNOWN;
        }
        LOG.debug("moved {} -> {}", source, target);
        return TransferStatus.SUCCESS;
    }

    /**
     * Copies <code>source</code> into <code>destDir</code> under a collision-free name,
     * checks the copy is complete and only then deletes the source.
     * <p>
     * On any failure the source is left in place and no copy is left behind.
     */
    public TransferStatus fallbackTransfer(Path source, Path destDir) {
        Path target = uniqueDestination(destDir, source.getFileName().toString());
        try {
            copy(source, target);
        } catch (FileAlreadyExistsException e) {
            //nothing was written; whatever is at target isn't ours
            LOG.warn("target appeared during copy: " + target);
            return TransferStatus.UNKNOWN;
        } catch (IOException e) {
            removeCopy(target);
            return copyFailure(source, target, e);
        }

        try {
            long expected = Files.size(source);
            long actual = Files.size(target);
            if (expected != actual) {
                LOG.warn("incomplete copy of " + source + ": expected " + expected +
                        " bytes but found " + actual);
                removeCopy(target);
                return TransferStatus.UNKNOWN;
            }
        } catch (IOException e) {
            removeCopy(target);
            return copyFailure(source, target, e);
        }

        try {
            delete(source);
        } catch (IOException e) {
            //don't leave two copies around
            removeCopy(target);
            return copyFailure(source, target, e);
        }
        LOG.debug("copied and deleted {} -> {}", source, target);
        return TransferStatus.SUCCESS;
    }

    /**
     * Renames a directory within its parent. Never replaces an existing entry;
     * a case-only rename of the same directory is allowed.
     */
    public TransferStatus renameInPlace(Path dir, String newName) {
        Path target = dir.resolveSibling(newName);
        try {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) && !Files.isSameFile(dir, target)) {
                LOG.debug("not renaming {}; {} already exists", dir, target);
                return TransferStatus.UNKNOWN;
            }
            rename(dir, target);
        } catch (IOException e) {
            LOG.debug("couldn't rename " + dir + " -> " + newName, e);
            return isPermissionDenied(e) ? TransferStatus.PERMISSION_DENIED : TransferStatus.UNKNOWN;
        }
        LOG.debug("renamed {} -> {}", dir, newName);
        return TransferStatus.SUCCESS;
    }

    /**
     * Lists the immediate entries of <code>dir</code>, sorted by name.
     * The directory stream is closed before this returns.
     *
     * @throws OrganizerException if the directory can't be read
     */
    public List<Path> listDirectory(Path dir) throws OrganizerException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                entries.add(p);
            }
        } catch (IOException | DirectoryIteratorException e) {
            IOException cause = unwrap(e);
            OrganizeStatus status = isPermissionDenied(cause) ?
                    OrganizeStatus.PERMISSION_DENIED : OrganizeStatus.UNKNOWN_ERROR;
            throw new OrganizerException(status, dir, "couldn't list " + dir + ": " + reason(cause), cause);
        }
        entries.sort(BY_FILE_NAME);
        return entries;
    }

    protected void rename(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    protected void copy(Path source, Path target) throws IOException {
        Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    }

    protected void delete(Path path) throws IOException {
        Files.delete(path);
    }

    protected void createDirectory(Path dir) throws IOException {
        Files.createDirectory(dir);
    }

    private boolean isOccupied(Path p) {
        //NOFOLLOW so that a dangling link still counts
        return Files.exists(p, LinkOption.NOFOLLOW_LINKS);
    }

    private void removeCopy(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.warn("couldn't remove partial copy " + target, e);
        }
    }

    private TransferStatus copyFailure(Path source, Path target, IOException e) {
        if (isPermissionDenied(e)) {
            LOG.warn("permission denied copying " + source + " -> " + target);
            return TransferStatus.PERMISSION_DENIED;
        }
        LOG.warn("couldn't copy " + source + " -> " + target + ": " + reason(e), e);
        return TransferStatus.UNKNOWN;
    }

    static boolean isPermissionDenied(IOException e) {
        if (e instanceof AccessDeniedException) {
            return true;
        }
        String reason = lowerReason(e);
        return reason.contains("permission denied") || reason.contains("operation not permitted");
    }

    static boolean isCrossDevice(IOException e) {
        if (e instanceof AtomicMoveNotSupportedException) {
            return true;
        }
        return lowerReason(e).contains("cross-device");
    }

    private static boolean isNotADirectory(IOException e) {
        return e instanceof NotDirectoryException || lowerReason(e).contains("not a directory");
    }

    private static IOException unwrap(Exception e) {
        if (e instanceof DirectoryIteratorException) {
            return ((DirectoryIteratorException) e).getCause();
        }
        return (IOException) e;
    }

    private static String reason(IOException e) {
        if (e instanceof FileSystemException && ((FileSystemException) e).getReason() != null) {
            return ((FileSystemException) e).getReason();
        }
        return Objects.toString(e.getMessage(), e.getClass().getSimpleName());
    }

    private static String lowerReason(IOException e) {
        String reason = (e instanceof FileSystemException) ?
                ((FileSystemException) e).getReason() : e.getMessage();
        return Objects.toString(reason, "").toLowerCase(Locale.ROOT);
    }
}
