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

/**
 * Terminal outcome of one organize run. There is no partial-success value:
 * the first hard failure stops the run.
 */
public enum OrganizeStatus {
    SUCCESS("success"),
    PATH_NOT_FOUND("path_not_found"),
    NOT_A_DIRECTORY("not_a_directory"),
    PERMISSION_DENIED("permission_denied"),
    DIRECTORY_CREATION_FAILED("directory_creation_failed"),
    //a cross-device move was needed; rerunning in FALLBACK mode can recover
    ATOMIC_TRANSFER_FAILED("atomic_transfer_failed"),
    FALLBACK_TRANSFER_FAILED("fallback_transfer_failed"),
    UNKNOWN_ERROR("unknown_error");

    private final String name;

    OrganizeStatus(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return whether a rerun in {@link TransferMode#FALLBACK} may succeed
     */
    public boolean isRecoverableWithFallback() {
        return this == ATOMIC_TRANSFER_FAILED;
    }
}
