package com.squadron.agent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts OS processes with all three standard streams piped.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException;

    /** Default launcher backed by {@link ProcessBuilder}. */
    static ProcessLauncher system() {
        return (command, workingDirectory, environment) -> {
            var builder = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(false);
            builder.environment().putAll(environment);
            return builder.start();
        };
    }
}
