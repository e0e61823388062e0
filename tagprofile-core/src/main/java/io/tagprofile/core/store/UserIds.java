package io.tagprofile.core.store;

import java.util.regex.Pattern;

public final class UserIds {
    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]+");

    private UserIds() {
    }

    public static String requireValid(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        String trimmed = userId.trim();
        if (!VALID.matcher(trimmed).matches() || ".".equals(trimmed) || "..".equals(trimmed)) {
            throw new IllegalArgumentException("Invalid userId: " + userId);
        }
        return trimmed;
    }
}
