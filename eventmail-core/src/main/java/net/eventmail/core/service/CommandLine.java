package net.eventmail.core.service;

import java.util.ArrayList;
import java.util.List;

/** Splits an argument string on whitespace; double quotes group, {@code \"} is a literal quote. */
final class CommandLine {
    private CommandLine() {}

    static List<String> build(String filePath, String arguments) {
        var out = new ArrayList<String>();
        out.add(filePath);
        out.addAll(split(arguments));
        return out;
    }

    static List<String> split(String arguments) {
        var out = new ArrayList<String>();
        if (arguments == null || arguments.isBlank()) return out;

        var cur = new StringBuilder();
        boolean inQuotes = false;
        boolean hasToken = false;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '\\' && i + 1 < arguments.length() && arguments.charAt(i + 1) == '"') {
                cur.append('"');
                hasToken = true;
                i++;
            } else if (c == '"') {
                inQuotes = !inQuotes;
                hasToken = true; // "" 는 빈 인자
            } else if (Character.isWhitespace(c) && !inQuotes) {
                if (hasToken) {
                    out.add(cur.toString());
                    cur.setLength(0);
                    hasToken = false;
                }
            } else {
                cur.append(c);
                hasToken = true;
            }
        }
        if (hasToken) out.add(cur.toString());
        return out;
    }
}
