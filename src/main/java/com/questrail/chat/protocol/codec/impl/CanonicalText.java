package com.questrail.chat.protocol.codec.impl;

/**
 * CanonicalText
 * -----------------------------------------------------------------------------
 * Renders logical frames into the exact text shape of the stream wire format.
 *
 * <p>Used in two directions:</p>
 * <ul>
 *   <li>the stream encoder, for client-to-server frames</li>
 *   <li>the datagram codec, which re-renders inbound binary frames into text
 *       and decodes that text with the stream decoder</li>
 * </ul>
 *
 * <p>No terminator is appended here.</p>
 */
public final class CanonicalText
{
    private CanonicalText() {
    }

    public static String authenticate(String username, String displayName, String secret) {
        return "AUTH " + username + " AS " + displayName + " USING " + secret;
    }

    public static String join(String channel, String displayName) {
        return "JOIN " + channel + " AS " + displayName;
    }

    public static String chat(String displayName, String content) {
        return "MSG FROM " + displayName + " IS " + content;
    }

    public static String farewell(String displayName) {
        return "BYE FROM " + displayName;
    }

    public static String error(String displayName, String content) {
        return "ERROR FROM " + displayName + " IS " + content;
    }

    public static String reply(boolean success, String content) {
        return "REPLY " + (success ? "OK" : "NOK") + " IS " + content;
    }
}
