package com.aviax.common.infra;

/**
 * Track duration parsing and formatting.
 * Display form is {@code M:SS}; minutes are not folded into hours.
 */
public final class DurationFormat {

    private DurationFormat() {
    }

    /**
     * Format whole seconds as {@code M:SS}, e.g. 212 -> "3:32", 3725 -> "62:05".
     * Negative input is treated as zero.
     */
    public static String formatSeconds(long seconds) {
        if (seconds < 0)
            seconds = 0;
        return (seconds / 60) + ":" + String.format("%02d", seconds % 60);
    }

    /**
     * Parse {@code SS}, {@code M:SS} or {@code H:MM:SS} into total seconds.
     * A string without a colon is whole seconds.
     *
     * @return total seconds, or 0 if the input is blank or malformed
     */
    public static long parseSeconds(String text) {
        if (text == null)
            return 0;
        String trimmed = text.trim();
        if (trimmed.isEmpty())
            return 0;

        long total = 0;
        for (String part : trimmed.split(":")) {
            String digits = part.trim();
            if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                return 0;
            }
            try {
                total = Math.addExact(Math.multiplyExact(total, 60), Long.parseLong(digits));
            } catch (ArithmeticException | NumberFormatException e) {
                return 0;
            }
        }
        return total;
    }
}
