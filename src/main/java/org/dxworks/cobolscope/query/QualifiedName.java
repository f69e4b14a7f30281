package org.dxworks.cobolscope.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A user-supplied name such as {@code BALANCE OF CUSTOMER-REC IN MASTER-FILE}, split into the
 * base name and its qualifiers, innermost first. Subscripts are dropped.
 */
public final class QualifiedName {

    private final String name;
    private final List<String> qualifiers;

    private QualifiedName(String name, List<String> qualifiers) {
        this.name = name;
        this.qualifiers = Collections.unmodifiableList(qualifiers);
    }

    public static QualifiedName parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        String cleaned = text.trim();
        int paren = cleaned.indexOf('(');
        if (paren >= 0) {
            cleaned = cleaned.substring(0, paren).trim();
        }
        String[] words = cleaned.toUpperCase(Locale.ROOT).split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        List<String> qualifiers = new ArrayList<>();
        for (int i = 1; i < words.length; i++) {
            if (("OF".equals(words[i]) || "IN".equals(words[i])) && i + 1 < words.length) {
                qualifiers.add(words[++i]);
            }
        }
        return new QualifiedName(words[0], qualifiers);
    }

    public String getName() {
        return name;
    }

    public List<String> getQualifiers() {
        return qualifiers;
    }

    public boolean isQualified() {
        return !qualifiers.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        qualifiers.forEach(q -> sb.append(" OF ").append(q));
        return sb.toString();
    }
}
