package com.vidnyan.dokita.adapter.in.cli;

import java.util.Locale;

/**
 * Report rendering selected with {@code --format}.
 */
public enum OutputFormat {
    HUMAN,
    JSON;

    /**
     * Case-insensitive; anything but "json" renders for humans.
     */
    public static OutputFormat fromOption(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).equals("json") ? JSON : HUMAN;
    }
}
