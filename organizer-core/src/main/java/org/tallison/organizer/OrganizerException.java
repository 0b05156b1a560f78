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
 * Thrown inside a run when the walk cannot continue. Carries the status
 * the run should terminate with.
 */
public class OrganizerException extends Exception {

    private final OrganizeStatus status;
    private final Path path;

    public OrganizerException(OrganizeStatus status, Path path, String msg) {
        super(msg);
        this.status = status;
        this.path = path;
    }

    public OrganizerException(OrganizeStatus status, Path path, String msg, Throwable cause) {
        super(msg, cause);
        this.status = status;
        this.path = path;
    }

    public OrganizeStatus getStatus() {
        return status;
    }

    public Path getPath() {
        return path;
    }
}
