package com.devicesim.io;

import java.nio.file.Path;

/**
 * Thrown when a definition file is missing, unreadable or describes an inconsistent model.
 */
public class DefinitionLoadException extends RuntimeException {

    private final Path source;

    public DefinitionLoadException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public DefinitionLoadException(Path source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
