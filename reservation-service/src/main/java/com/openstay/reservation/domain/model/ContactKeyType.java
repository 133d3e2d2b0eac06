package com.openstay.reservation.domain.model;

import java.util.Locale;

/**
 * The guest attribute used as the globally unique contact key.
 * Deployments pick one; the engine only relies on {@link #normalize(String)} producing a stable key.
 */
public enum ContactKeyType {

    EMAIL {
        @Override
        public String normalize(String raw) {
            return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
        }

        @Override
        public boolean isValid(String normalized) {
            if (normalized == null) return false;
            int at = normalized.indexOf('@');
            return at > 0 && at == normalized.lastIndexOf('@') && at < normalized.length() - 1
                    && normalized.chars().noneMatch(Character::isWhitespace);
        }
    },

    PHONE {
        @Override
        public String normalize(String raw) {
            if (raw == null) return null;
            String trimmed = raw.trim();
            StringBuilder sb = new StringBuilder(trimmed.length());
            for (int i = 0; i < trimmed.length(); i++) {
                char c = trimmed.charAt(i);
                if (Character.isDigit(c) || (c == '+' && sb.length() == 0)) {
                    sb.append(c);
                }
            }
            return sb.toString();
        }

        @Override
        public boolean isValid(String normalized) {
            if (normalized == null) return false;
            long digits = normalized.chars().filter(Character::isDigit).count();
            return digits >= MIN_PHONE_DIGITS;
        }
    };

    private static final int MIN_PHONE_DIGITS = 7;

    public abstract String normalize(String raw);

    public abstract boolean isValid(String normalized);
}
