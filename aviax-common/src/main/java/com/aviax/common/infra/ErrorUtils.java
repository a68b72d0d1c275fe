package com.aviax.common.infra;

/**
 * Error formatting helpers for single-line log messages.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Format the whole cause chain on one line, outermost first.
     */
    public static String formatCauseChain(Throwable err) {
        if (err == null) {
            return "unknown error";
        }
        StringBuilder sb = new StringBuilder();
        Throwable current = err;
        int depth = 0;
        while (current != null && depth++ < 8) {
            if (sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(formatErrorMessage(current));
            current = current.getCause();
        }
        return sb.toString();
    }
}
