package io.taulite.client;

/**
 * Raised for bad command lines and for non-2xx responses from the server.
 * {@link Cli#main} turns it into exit code 1.
 */
public class CliException extends RuntimeException {
    public CliException(String msg) {
        super(msg);
    }
}
