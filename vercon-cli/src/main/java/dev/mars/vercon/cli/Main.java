/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.vercon.cli;

import dev.mars.vercon.VerConException;
import dev.mars.vercon.repository.CommitResult;
import dev.mars.vercon.repository.FileRepository;
import dev.mars.vercon.repository.Repository;
import dev.mars.vercon.repository.RepositoryConfig;
import dev.mars.vercon.repository.RestoreResult;
import dev.mars.vercon.tree.PathChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Command line entry point.
 * <p>
 * The repository is looked up from the current working directory upwards and
 * created there if none is found.
 *
 * <h2>Usage</h2>
 * <pre>
 * vercon commit &lt;comment...&gt;        record the working tree as a new revision
 * vercon list [verbose]              show the commit log
 * vercon revert [&lt;n&gt;|cur] [&lt;regex&gt;]  restore revision n (default: the one before
 *                                    the last), cur for the last revision,
 *                                    only files whose path starts with regex
 * </pre>
 *
 * <h2>Exit status</h2>
 * 0 on success, 1 when the operation fails, 2 on bad usage.
 *
 * @see RepositoryConfig
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String CURRENT = "cur";

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, Path.of(""), RepositoryConfig.load(), System.out, System.err));
    }

    /**
     * Runs one command against the repository governing {@code workingDir}.
     *
     * @return the process exit status
     */
    static int run(String[] args, Path workingDir, RepositoryConfig config, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(err);
            return EXIT_USAGE;
        }
        String command = args[0];
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "commit" -> {
                    if (rest.length == 0) {
                        err.println("commit needs a comment");
                        return EXIT_USAGE;
                    }
                    return commit(FileRepository.open(workingDir, config), String.join(" ", rest), out);
                }
                case "list" -> {
                    if (rest.length > 1 || (rest.length == 1 && !rest[0].equals("verbose"))) {
                        usage(err);
                        return EXIT_USAGE;
                    }
                    out.print(FileRepository.open(workingDir, config).list(rest.length == 1));
                    return EXIT_OK;
                }
                case "revert" -> {
                    if (rest.length > 2) {
                        usage(err);
                        return EXIT_USAGE;
                    }
                    return revert(workingDir, config, rest, out, err);
                }
                default -> {
                    err.println("unknown command: " + command);
                    usage(err);
                    return EXIT_USAGE;
                }
            }
        } catch (VerConException e) {
            LOG.debug("Command {} failed", command, e);
            err.println("error: " + e.kind() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int commit(Repository repository, String comment, PrintStream out) {
        CommitResult result = repository.commit(comment);
        if (result.isNoChange()) {
            out.println("Nothing to commit");
            return EXIT_OK;
        }
        out.println("Committed revision " + result.revision());
        for (PathChange change : result.changes()) {
            out.println("  " + change.toLogLine());
        }
        return EXIT_OK;
    }

    private static int revert(Path workingDir, RepositoryConfig config, String[] rest,
                              PrintStream out, PrintStream err) {
        // Optional leading revision; anything else is the filter
        Optional<Integer> revision = Optional.empty();
        boolean previous = true;
        int filterAt = 0;
        if (rest.length > 0) {
            if (rest[0].equals(CURRENT)) {
                previous = false;
                filterAt = 1;
            } else if (rest[0].matches("-?\\d+")) {
                try {
                    revision = Optional.of(Integer.parseInt(rest[0]));
                } catch (NumberFormatException e) {
                    err.println("revision number out of range: " + rest[0]);
                    return EXIT_USAGE;
                }
                previous = false;
                filterAt = 1;
            }
        }
        if (rest.length - filterAt > 1) {
            usage(err);
            return EXIT_USAGE;
        }
        String filter = filterAt < rest.length ? rest[filterAt] : Repository.ALL_PATHS;

        Repository repository = FileRepository.open(workingDir, config);
        if (previous) {
            revision = Optional.of(repository.lastRevision() - 1);
        }

        RestoreResult result = repository.restoreTo(revision, filter);
        out.println("Restored revision " + result.revision());
        result.createdDirectories().forEach(p -> out.println("  +d " + p));
        result.restoredFiles().forEach(p -> out.println("  *f " + p));
        result.deletedFiles().forEach(p -> out.println("  -f " + p));
        result.deletedDirectories().forEach(p -> out.println("  -d " + p));
        return EXIT_OK;
    }

    private static void usage(PrintStream err) {
        err.println("usage: vercon commit <comment...>");
        err.println("       vercon list [verbose]");
        err.println("       vercon revert [<n>|cur] [<regex>]");
    }
}
