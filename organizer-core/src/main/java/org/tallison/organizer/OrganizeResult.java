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

import java.nio.file.Path;

/**
 * What one run did. {@link #getFailedPath()} is set only when the run failed.
 */
public class OrganizeResult {

    private final OrganizeStatus status;
    private final Path failedPath;
    private final int filesMoved;
    private final int filesInPlace;
    private final int foldersRenamed;
    private final int directoriesVisited;

    OrganizeResult(OrganizeStatus status, Path failedPath, int filesMoved,
                   int filesInPlace, int foldersRenamed, int directoriesVisited) {
        this.status = status;
        this.failedPath = failedPath;
        this.filesMoved = filesMoved;
        this.filesInPlace = filesInPlace;
        this.foldersRenamed = foldersRenamed;
        this.directoriesVisited = directoriesVisited;
    }

    public OrganizeStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == OrganizeStatus.SUCCESS;
    }

    public Path getFailedPath() {
        return failedPath;
    }

    public int getFilesMoved() {
        return filesMoved;
    }

    /**
     * @return files that were already where they belong
     */
    public int getFilesInPlace() {
        return filesInPlace;
    }

    public int getFoldersRenamed() {
        return foldersRenamed;
    }

    public int getDirectoriesVisited() {
        return directoriesVisited;
    }

    @Override
    public String toString() {
        return "OrganizeResult{" +
                "status=" + status +
                ", failedPath=" + failedPath +
                ", filesMoved=" + filesMoved +
                ", filesInPlace=" + filesInPlace +
                ", foldersRenamed=" + foldersRenamed +
                ", directoriesVisited=" + directoriesVisited +
                '}';
    }
}
