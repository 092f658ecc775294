package com.libragraph.squash.codecs.registry;

import org.jboss.logging.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds executables on a list of directories, the way a shell walks {@code PATH}.
 */
public class ToolLocator {

    private static final Logger log = Logger.getLogger(ToolLocator.class);

    private final List<Path> searchPath;

    public ToolLocator(List<Path> searchPath) {
        this.searchPath = List.copyOf(searchPath);
    }

    /**
     * Locator over the process's {@code PATH} environment variable.
     */
    public static ToolLocator fromEnvironment() {
        return fromPathString(System.getenv("PATH"));
    }

    /**
     * Locator over a {@link File#pathSeparator}-separated directory list.
     * Blank and malformed entries are skipped.
     */
    public static ToolLocator fromPathString(String pathString) {
        List<Path> dirs = new ArrayList<>();
        if (pathString != null) {
            for (String entry : pathString.split(File.pathSeparator)) {
                if (entry.isBlank()) continue;
                try {
                    dirs.add(Path.of(entry));
                } catch (InvalidPathException e) {
                    log.debugf("Ignoring malformed search path entry '%s': %s", entry, e.getMessage());
                }
            }
        }
        return new ToolLocator(dirs);
    }

    public List<Path> searchPath() {
        return searchPath;
    }

    /**
     * First executable regular file named {@code name} on the search path.
     */
    public Optional<Path> find(String name) {
        for (Path dir : searchPath) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate.toAbsolutePath());
            }
        }
        return Optional.empty();
    }
}
