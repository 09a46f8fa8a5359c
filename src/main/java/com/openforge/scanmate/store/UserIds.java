package com.openforge.scanmate.store;

import com.openforge.scanmate.task.ValidationException;

import java.util.regex.Pattern;

/**
 * User identities double as storage file names, so only a conservative
 * character set is accepted.
 */
public final class UserIds {

    public static final int MAX_LENGTH = 64;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._@-]+");

    private UserIds() {
    }

    /** @return the trimmed identity */
    public static String validate(String user) {
        if (user == null || user.isBlank()) {
            throw new ValidationException("Missing 'user'");
        }
        String trimmed = user.trim();
        if (trimmed.length() > MAX_LENGTH
                || !ALLOWED.matcher(trimmed).matches()
                || trimmed.startsWith(".")) {
            throw new ValidationException("Invalid user identifier");
        }
        return trimmed;
    }
}
