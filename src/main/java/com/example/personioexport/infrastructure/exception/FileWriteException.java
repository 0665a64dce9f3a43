package com.example.personioexport.infrastructure.exception;

import java.nio.file.Path;

/**
 * Infrastructure-layer exception raised when an output artifact cannot be written.
 */
public class FileWriteException extends InfrastructureException {

	/**
	 * Creates the exception for an unusable output location.
	 *
	 * @param path    file or directory that could not be written
	 * @param message description of the problem
	 */
    public FileWriteException(Path path, String message) {
        super("Failed to write " + path + ": " + message);
    }

	/**
	 * Creates the exception wrapping the underlying IO failure.
	 *
	 * @param path  file or directory that could not be written
	 * @param cause low-level IO exception
	 */
    public FileWriteException(Path path, Throwable cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
    }
}
