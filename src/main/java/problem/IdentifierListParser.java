/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import dashboard.DiagnosticKind;
import dashboard.Diagnostics;

/**
 * Turns comma-separated text into an ordered list of canonical identifiers: each segment is trimmed, every interior
 * whitespace character becomes an underscore, and empty segments are dropped. No duplicate detection is done here.
 */
public final class IdentifierListParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\p{javaWhitespace}");

    private IdentifierListParser() {
    }

    /**
     * Parses the given text; a null text gives an empty list.
     *
     * @param text comma-separated names
     * @return the identifiers, in order of appearance
     */
    public static List<String> parse(String text) {
        return parse(text, null, null);
    }

    /**
     * Parses the given text and, when segments had to be dropped, records a warning naming the field.
     *
     * @param text comma-separated names
     * @param diagnostics where to record the warning, or null
     * @param field the name of the input field, used in the warning
     * @return the identifiers, in order of appearance
     */
    public static List<String> parse(String text, Diagnostics diagnostics, String field) {
        if (text == null)
            return Collections.emptyList();
        List<String> identifiers = new ArrayList<>();
        String[] segments = text.split(",", -1);
        int dropped = 0;
        for (String segment : segments) {
            String trimmed = segment.strip();
            if (trimmed.isEmpty()) {
                dropped++;
                continue;
            }
            identifiers.add(WHITESPACE.matcher(trimmed).replaceAll("_"));
        }
        if (dropped > 0 && diagnostics != null && !text.isBlank())
            diagnostics.report(DiagnosticKind.IDENTIFIER_PARSE_WARNING, 0, text,
                    dropped + " empty name(s) ignored in " + (field == null ? "identifier list" : field));
        return identifiers;
    }
}
