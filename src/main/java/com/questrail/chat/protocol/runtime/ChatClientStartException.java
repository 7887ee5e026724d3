package com.questrail.chat.protocol.runtime;

/**
 * The transport could not be brought up.
 */
public final class ChatClientStartException extends RuntimeException
{
    public ChatClientStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
