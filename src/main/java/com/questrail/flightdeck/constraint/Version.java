package com.questrail.flightdeck.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Version
 * -----------------------------------------------------------------------------
 * Dotted numeric product version such as {@code 2.3} or {@code 10.0.4}.
 *
 * <p>Comparison is component-wise; missing trailing components count as zero,
 * so {@code 2.3}, {@code 2.3.0} and {@code 2.3.0.0} are equal. The canonical
 * form drops trailing zero components (but keeps at least one).</p>
 */
public final class Version implements Comparable<Version>
{
    private final List<Integer> components;

    private Version(List<Integer> components) {
        int end = components.size();
        while (end > 1 && components.get(end - 1) == 0) {
            end--;
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components.subList(0, end)));
    }

    /**
     * Parses a version, throwing on malformed input.
     */
    public static Version parse(String text) {
        return tryParse(text).orElseThrow(
                () -> new IllegalArgumentException("Not a version: '" + text + "'"));
    }

    /**
     * Parses a version, returning empty on malformed input.
     */
    public static Optional<Version> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String s = text.trim();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        List<Integer> parts = new ArrayList<>();
        for (String part : s.split("\\.", -1)) {
            if (part.isEmpty() || part.length() > 9) {
                return Optional.empty();
            }
            for (int i = 0; i < part.length(); i++) {
                if (!Character.isDigit(part.charAt(i))) {
                    return Optional.empty();
                }
            }
            parts.add(Integer.parseInt(part));
        }
        return Optional.of(new Version(parts));
    }

    public List<Integer> components() {
        return components;
    }

    @Override
    public int compareTo(Version other) {
        int n = Math.max(components.size(), other.components.size());
        for (int i = 0; i < n; i++) {
            int a = i < components.size() ? components.get(i) : 0;
            int b = i < other.components.size() ? other.components.get(i) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Version v && components.equals(v.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(components);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(components.get(i));
        }
        return sb.toString();
    }
}
