package org.navtools.cal.dsl;

import java.util.regex.Pattern;

/**
 * Removes absolute file-system paths from diagnostic text before it leaves the front end.
 */
public final class MessageSanitizer {

    public static final String PLACEHOLDER = "<path>";

    private static final Pattern FILE_URI = Pattern.compile("file:/{0,3}[^\\s'\"()]+");
    private static final Pattern WINDOWS_PATH = Pattern.compile("\\b[A-Za-z]:[\\\\/][^\\s'\"()]*");
    // Two segments at least, so "a/b" fractions and lone "/" stay intact
    private static final Pattern POSIX_PATH = Pattern.compile("(?<![\\w.:/])/[^\\s/'\"()]+(?:/[^\\s/'\"()]+)+/?");

    private MessageSanitizer() {
    }

    public static String stripPaths(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String result = FILE_URI.matcher(message).replaceAll(PLACEHOLDER);
        result = WINDOWS_PATH.matcher(result).replaceAll(PLACEHOLDER);
        return POSIX_PATH.matcher(result).replaceAll(PLACEHOLDER);
    }
}
