package org.chatrelay.server;

/**
 * The listener could not be bound. Fatal: the server never starts accepting.
 */
public class ServerStartupException extends RuntimeException {

    public ServerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
