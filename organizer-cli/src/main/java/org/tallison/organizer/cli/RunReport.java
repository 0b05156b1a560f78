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
package org.tallison.organizer.cli;

import java.util.Locale;

import org.tallison.organizer.OrganizeResult;
import org.tallison.organizer.TransferMode;

/**
 * Summary of one command line run, written out as JSON with -j.
 * <p>
 * When the run was retried in fallback mode, <code>filesMoved</code> and
 * <code>foldersRenamed</code> add up both passes, <code>filesInPlace</code> and
 * <code>directoriesVisited</code> come from the last pass, and the atomic pass's
 * own counters are kept under <code>atomicPass</code>.
 */
public class RunReport {

    private final String root;
    private final String mode;
    private final String status;
    private final boolean retriedInFallback;
    private final int filesMoved;
    private final int filesInPlace;
    private final int foldersRenamed;
    private final int directoriesVisited;
    private final String failedPath;
    private final long elapsedMillis;
    private final PassCounts atomicPass;

    /**
     * @param firstPass the failed atomic pass if the run was retried, otherwise <code>null</code>
     * @param result    the last pass
     */
    public RunReport(String root, TransferMode mode, OrganizeResult firstPass,
                     OrganizeResult result, long elapsedMillis) {
        this.root = root;
        this.mode = mode.name().toLowerCase(Locale.ROOT);
        this.status = result.getStatus().getName();
        this.retriedInFallback = firstPass != null;
        this.filesInPlace = result.getFilesInPlace();
        this.directoriesVisited = result.getDirectoriesVisited();
        this.failedPath = result.getFailedPath() == null ? null : result.getFailedPath().toString();
        this.elapsedMillis = elapsedMillis;
        if (firstPass == null) {
            this.filesMoved = result.getFilesMoved();
            this.foldersRenamed = result.getFoldersRenamed();
            this.atomicPass = null;
        } else {
            this.filesMoved = firstPass.getFilesMoved() + result.getFilesMoved();
            this.foldersRenamed = firstPass.getFoldersRenamed() + result.getFoldersRenamed();
            this.atomicPass = new PassCounts(firstPass);
        }
    }

    public String getRoot() {
        return root;
    }

    /**
     * @return mode of the last pass
     */
    public String getMode() {
        return mode;
    }

    public String getStatus() {
        return status;
    }

    public boolean isRetriedInFallback() {
        return retriedInFallback;
    }

    public int getFilesMoved() {
        return filesMoved;
    }

    public int getFilesInPlace() {
        return filesInPlace;
    }

    public int getFoldersRenamed() {
        return foldersRenamed;
    }

    public int getDirectoriesVisited() {
        return directoriesVisited;
    }

    public String getFailedPath() {
        return failedPath;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * @return counters of the atomic pass that was retried, or <code>null</code>
     */
    public PassCounts getAtomicPass() {
        return atomicPass;
    }

    public static class PassCounts {
        private final String status;
        private final String failedPath;
        private final int filesMoved;
        private final int filesInPlace;
        private final int foldersRenamed;
        private final int directoriesVisited;

        PassCounts(OrganizeResult result) {
            this.status = result.getStatus().getName();
            this.failedPath = result.getFailedPath() == null ? null : result.getFailedPath().toString();
            this.filesMoved = result.getFilesMoved();
            this.filesInPlace = result.getFilesInPlace();
            this.foldersRenamed = result.getFoldersRenamed();
            this.directoriesVisited = result.getDirectoriesVisited();
        }

        public String getStatus() {
            return status;
        }

        public String getFailedPath() {
            return failedPath;
        }

        public int getFilesMoved() {
            return filesMoved;
        }

        public int getFilesInPlace() {
            return filesInPlace;
        }

        public int getFoldersRenamed() {
            return foldersRenamed;
        }

        public int getDirectoriesVisited() {
            return directoriesVisited;
        }
    }
}
