package io.scrapejobs.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

public final class OutputPaths {
    public static final String DATE_PLACEHOLDER = "{date}";

    private OutputPaths() {
    }

    /**
     * Replaces every {@code {date}} in {@code template} with {@code date} as {@code YYYY-MM-DD}.
     *
     * @return null when {@code template} is null
     */
    public static String resolve(String template, LocalDate date) {
        if (template == null) {
            return null;
        }
        Objects.requireNonNull(date, "date must not be null");
        return template.replace(DATE_PLACEHOLDER, date.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }
}
