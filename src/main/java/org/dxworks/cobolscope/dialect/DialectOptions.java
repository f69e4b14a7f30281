package org.dxworks.cobolscope.dialect;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of recognized dialect extensions plus vendor verbs that start statements.
 */
public final class DialectOptions {

    private static final Set<DialectExtension> DEFAULT_EXTENSIONS =
            EnumSet.of(DialectExtension.FLOATING_COMMENTS, DialectExtension.UNDERSCORE_IN_WORDS);

    private final Set<DialectExtension> extensions;
    private final Set<String> extraVerbs;

    private DialectOptions(Set<DialectExtension> extensions, Set<String> extraVerbs) {
        this.extensions = Collections.unmodifiableSet(extensions);
        this.extraVerbs = Collections.unmodifiableSet(extraVerbs);
    }

    public static DialectOptions defaults() {
        return new DialectOptions(EnumSet.copyOf(DEFAULT_EXTENSIONS), new TreeSet<>());
    }

    public static DialectOptions of(Collection<DialectExtension> extensions, Collection<String> extraVerbs) {
        Set<DialectExtension> ext = extensions == null || extensions.isEmpty()
                ? EnumSet.noneOf(DialectExtension.class)
                : EnumSet.copyOf(extensions);
        Set<String> verbs = new TreeSet<>();
        if (extraVerbs != null) {
            for (String verb : extraVerbs) {
                if (verb != null && !verb.isBlank()) {
                    verbs.add(verb.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return new DialectOptions(ext, verbs);
    }

    public DialectOptions with(DialectExtension extension) {
        Set<DialectExtension> ext = extensions.isEmpty() ? EnumSet.noneOf(DialectExtension.class) : EnumSet.copyOf(extensions);
        ext.add(extension);
        return new DialectOptions(ext, new TreeSet<>(extraVerbs));
    }

    public boolean has(DialectExtension extension) {
        return extensions.contains(extension);
    }

    public Set<DialectExtension> getExtensions() {
        return extensions;
    }

    public Set<String> getExtraVerbs() {
        return extraVerbs;
    }

    @Override
    public String toString() {
        return "DialectOptions" + extensions + (extraVerbs.isEmpty() ? "" : " verbs=" + extraVerbs);
    }
}
