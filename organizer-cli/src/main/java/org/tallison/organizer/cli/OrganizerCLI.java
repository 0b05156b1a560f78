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

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tallison.organizer.DirectoryOrganizer;
import org.tallison.organizer.OrganizeResult;
import org.tallison.organizer.OrganizeStatus;
import org.tallison.organizer.TransferMode;

/**
 * Command line front end: organizes one directory and reports the outcome.
 */
public class OrganizerCLI {

    private static final Logger LOG = LoggerFactory.getLogger(OrganizerCLI.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private static Options OPTIONS;

    static {
        OPTIONS = new Options();
        OPTIONS.addOption("i", "input", true, "directory to organize")
                .addOption("m", "mode", true, "transfer mode: 'atomic' (default) or 'fallback'")
                .addOption("r", "retryFallback", false,
                        "if an atomic move fails across devices, rerun in fallback (copy+delete) mode")
                .addOption("j", "json", true, "write a json report of the run to this file")
                .addOption("h", "help", false, "this message");
    }

    private final DirectoryOrganizer organizer;

    public OrganizerCLI() {
        this(new DirectoryOrganizer());
    }

    OrganizerCLI(DirectoryOrganizer organizer) {
        this.organizer = organizer;
    }

    public static void main(String[] args) throws Exception {
        int exitCode = new OrganizerCLI().execute(args);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    int execute(String[] args) {
        DefaultParser defaultCLIParser = new DefaultParser();
        CommandLine commandLine = null;
        try {
            commandLine = defaultCLIParser.parse(OPTIONS, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            USAGE();
            return EXIT_USAGE;
        }
        if (commandLine.hasOption("h")) {
            USAGE();
            return EXIT_SUCCESS;
        }

        String input = commandLine.getOptionValue("i");
        if (StringUtils.isBlank(input)) {
            System.err.println("must specify a directory to organize with -i");
            USAGE();
            return EXIT_USAGE;
        }
        TransferMode mode = TransferMode.ATOMIC;
        if (commandLine.hasOption("m")) {
            mode = parseMode(commandLine.getOptionValue("m"));
            if (mode == null) {
                System.err.println("-m must be 'atomic' or 'fallback', not: " + commandLine.getOptionValue("m"));
                USAGE();
                return EXIT_USAGE;
            }
        }
        Path root;
        Path reportPath = null;
        try {
            root = Paths.get(input);
            if (commandLine.hasOption("j")) {
                reportPath = Paths.get(commandLine.getOptionValue("j"));
            }
        } catch (InvalidPathException e) {
            System.err.println("not a valid path: " + e.getMessage());
            USAGE();
            return EXIT_USAGE;
        }

        long start = System.currentTimeMillis();
        OrganizeResult result = organizer.run(root, mode);
        OrganizeResult firstPass = null;
        if (result.getStatus().isRecoverableWithFallback()) {
            if (commandLine.hasOption("r")) {
                LOG.info("atomic move failed across devices; rerunning in fallback mode");
                firstPass = result;
                mode = TransferMode.FALLBACK;
                result = organizer.run(root, mode);
            } else {
                System.err.println("Some files are on a different device and can't be moved atomically.");
                System.err.println("Rerun with '-m fallback' (or add -r) to copy and then delete them instead.");
            }
        }
        long elapsed = System.currentTimeMillis() - start;

        RunReport report = new RunReport(root.toString(), mode, firstPass, result, elapsed);
        printSummary(report);
        if (reportPath != null) {
            try {
                writeReport(report, reportPath);
            } catch (IOException e) {
                LOG.error("couldn't write report to " + reportPath, e);
                return EXIT_FAILED;
            }
        }
        return result.isSuccess() ? EXIT_SUCCESS : EXIT_FAILED;
    }

    static TransferMode parseMode(String s) {
        String normed = StringUtils.trimToEmpty(s).toUpperCase(Locale.ROOT);
        for (TransferMode mode : TransferMode.values()) {
            if (mode.name().equals(normed)) {
                return mode;
            }
        }
        return null;
    }

    private static void printSummary(RunReport report) {
        if (report.getStatus().equals(OrganizeStatus.SUCCESS.getName())) {
            System.out.println("Files are organized successfully: " + report.getRoot());
            System.out.println("moved " + report.getFilesMoved() + " files, left " +
                    report.getFilesInPlace() + " in place, renamed " +
                    report.getFoldersRenamed() + " folders");
            if (report.isRetriedInFallback()) {
                System.out.println("(" + report.getAtomicPass().getFilesMoved() +
                        " of the moves were atomic, the rest copied in fallback mode)");
            }
            return;
        }
        System.err.println(describe(report.getStatus()) + " (" + report.getStatus() + ")");
        if (report.getFailedPath() != null) {
            System.err.println("at: " + report.getFailedPath());
        }
    }

    static String describe(String statusName) {
        for (OrganizeStatus status : OrganizeStatus.values()) {
            if (status.getName().equals(statusName)) {
                return describe(status);
            }
        }
        return "Unknown error";
    }

    static String describe(OrganizeStatus status) {
        switch (status) {
            case SUCCESS:
                return "Files are organized successfully";
            case PATH_NOT_FOUND:
                return "The directory does not exist";
            case NOT_A_DIRECTORY:
                return "The path is not a directory";
            case PERMISSION_DENIED:
                return "Permission denied";
            case DIRECTORY_CREATION_FAILED:
                return "Couldn't create a category folder";
            case ATOMIC_TRANSFER_FAILED:
                return "Couldn't move a file atomically (different device)";
            case FALLBACK_TRANSFER_FAILED:
                return "Couldn't copy a file";
            default:
                return "Unknown error";
        }
    }

    private static void writeReport(RunReport report, Path reportPath) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            GSON.toJson(report, writer);
        }
    }

    private static void USAGE() {
        HelpFormatter helpFormatter = new HelpFormatter();
        helpFormatter.printHelp(
                80,
                "java -jar organizer-cli.jar -i <directory> [-m atomic|fallback] [-r] [-j report.json]",
                "Sort files into category folders by extension",
                OPTIONS,
                "");
    }
}
