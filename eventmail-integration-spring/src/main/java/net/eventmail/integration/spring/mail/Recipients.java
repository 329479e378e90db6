package net.eventmail.integration.spring.mail;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recipient expression shared by the mail transports. The expression is split on {@code ,} and
 * {@code ;}; a token matching a configured alias (case-insensitive) expands to that alias'
 * addresses, anything else is used as an address. Duplicates are dropped, first position kept.
 */
final class Recipients {
    private final Map<String, String> aliases;

    Recipients(Map<String, String> aliases) {
        var m = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (aliases != null) m.putAll(aliases);
        this.aliases = m;
    }

    /** 별칭은 한 단계만 펼친다 (별칭 안의 별칭은 주소로 취급) */
    List<String> expand(String expression) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : split(expression)) {
            String expanded = aliases.get(token);
            if (expanded != null) out.addAll(split(expanded));
            else out.add(token);
        }
        return new ArrayList<>(out);
    }

    static List<String> split(String expression) {
        var out = new ArrayList<String>();
        if (expression == null) return out;
        for (String s : expression.split("[,;]")) {
            String t = s.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
