package com.questrail.chat.protocol.validation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * FieldRules
 * -----------------------------------------------------------------------------
 * Character-class and length rules for every text field the protocol carries.
 *
 * <p>The same rules apply in three places:</p>
 * <ul>
 *   <li>user commands, which are rejected locally on violation</li>
 *   <li>outbound frames, which the codecs refuse to encode</li>
 *   <li>inbound frames, which are classified as malformed</li>
 * </ul>
 *
 * <p>Each check returns the violation text, or empty when the value is valid.</p>
 */
public final class FieldRules
{
    public static final int MAX_USERNAME = 20;
    public static final int MAX_CHANNEL = 20;
    public static final int MAX_SECRET = 128;
    public static final int MAX_DISPLAY_NAME = 20;
    public static final int MAX_CONTENT = 60_000;

    private static final Pattern USERNAME = Pattern.compile("[A-Za-z0-9_-]{1," + MAX_USERNAME + "}");
    private static final Pattern CHANNEL = Pattern.compile("[A-Za-z0-9_.-]{1," + MAX_CHANNEL + "}");
    private static final Pattern SECRET = Pattern.compile("[A-Za-z0-9_-]{1," + MAX_SECRET + "}");
    private static final Pattern DISPLAY_NAME = Pattern.compile("[\\x21-\\x7E]{1," + MAX_DISPLAY_NAME + "}");
    private static final Pattern CONTENT = Pattern.compile("[\\x20-\\x7E\\n]{1," + MAX_CONTENT + "}");

    private FieldRules() {
    }

    public static Optional<String> checkUsername(String value) {
        return check("username", value, USERNAME, "1-" + MAX_USERNAME + " characters of [A-Za-z0-9_-]");
    }

    public static Optional<String> checkChannel(String value) {
        return check("channel", value, CHANNEL, "1-" + MAX_CHANNEL + " characters of [A-Za-z0-9_.-]");
    }

    public static Optional<String> checkSecret(String value) {
        return check("secret", value, SECRET, "1-" + MAX_SECRET + " characters of [A-Za-z0-9_-]");
    }

    public static Optional<String> checkDisplayName(String value) {
        return check("display name", value, DISPLAY_NAME, "1-" + MAX_DISPLAY_NAME + " printable characters without spaces");
    }

    public static Optional<String> checkContent(String value) {
        return check("message content", value, CONTENT, "1-" + MAX_CONTENT + " printable ASCII characters");
    }

    /**
     * Coerces diagnostic text into the content rule: disallowed characters
     * become {@code '?'}, overlong text is cut, empty text becomes {@code "?"}.
     */
    public static String sanitizeContent(String text) {
        if (text == null || text.isEmpty()) {
            return "?";
        }
        int limit = Math.min(text.length(), MAX_CONTENT);
        StringBuilder sb = new StringBuilder(limit);
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            sb.append((c >= 0x20 && c <= 0x7E) || c == '\n' ? c : '?');
        }
        return sb.toString();
    }

    private static Optional<String> check(String field, String value, Pattern pattern, String expectation) {
        if (value == null) {
            return Optional.of(field + " is missing");
        }
        if (!pattern.matcher(value).matches()) {
            return Optional.of("invalid " + field + " '" + abbreviate(value) + "': expected " + expectation);
        }
        return Optional.empty();
    }

    // Keeps violation text inside the content rule so it can travel in an Error frame.
    private static String abbreviate(String value) {
        StringBuilder sb = new StringBuilder();
        int limit = Math.min(value.length(), 32);
        for (int i = 0; i < limit; i++) {
            char c = value.charAt(i);
            sb.append(c >= 0x20 && c <= 0x7E ? c : '?');
        }
        if (value.length() > limit) {
            sb.append("...");
        }
        return sb.toString();
    }
}
