package io.merklite.client;

/** Usage error: bad flags, missing arguments or unknown command. */
final class CliException extends RuntimeException {
    CliException(String message) {
        super(message);
    }
}
