package com.restaurant.simulator.engine.random;

import java.util.List;
import java.util.Objects;

/**
 * What gets hashed into a seed: an ordered list of string components.
 *
 * The canonical form joins components with {@code |}. Separator and escape
 * characters inside a component are backslash-escaped, so {@code of("a|b")}
 * and {@code of("a", "b")} never share a canonical form.
 */
public final class SeedIdentity {

    private static final char SEPARATOR = '|';
    private static final char ESCAPE = '\\';

    private final List<String> components;
    private final String canonical;

    private SeedIdentity(List<String> components) {
        this.components = List.copyOf(components);
        this.canonical = encode(this.components);
    }

    public static SeedIdentity of(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("Seed identity needs at least one component");
        }
        for (String component : components) {
            Objects.requireNonNull(component, "Seed identity components must not be null");
        }
        return new SeedIdentity(List.of(components));
    }

    /**
     * Derives a narrower identity, e.g. a day-scoped one from a run identity.
     */
    public SeedIdentity scoped(String... prefix) {
        String[] all = new String[prefix.length + components.size()];
        System.arraycopy(prefix, 0, all, 0, prefix.length);
        for (int i = 0; i < components.size(); i++) {
            all[prefix.length + i] = components.get(i);
        }
        return of(all);
    }

    public List<String> components() {
        return components;
    }

    public String canonical() {
        return canonical;
    }

    private static String encode(List<String> components) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) sb.append(SEPARATOR);
            String component = components.get(i);
            for (int j = 0; j < component.length(); j++) {
                char c = component.charAt(j);
                if (c == SEPARATOR || c == ESCAPE) sb.append(ESCAPE);
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeedIdentity other)) return false;
        return canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
