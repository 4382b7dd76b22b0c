package org.faultscan.util;

import java.util.ArrayList;
import java.util.List;

/**
 * CSV field helpers shared by the loader and the report writer.
 */
public final class Utils {

    private Utils() {
    }

    public static String escapeCsvField(String field) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }

    /**
     * Splits one CSV line on commas. Double-quoted fields may contain commas, and a doubled quote
     * inside them stands for one literal quote.
     */
    public static List<String> splitCsvLine(String line) {
        final List<String> fields = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
