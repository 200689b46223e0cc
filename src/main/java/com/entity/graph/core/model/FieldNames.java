package com.entity.graph.core.model;

import java.util.Locale;

/**
 * Naming conventions that connect collection keys, type names and reference fields.
 * <ul>
 *   <li>{@code units} → type {@code Unit}, list reference {@code unitIds}</li>
 *   <li>{@code owner} → type {@code Owner}, scalar reference {@code ownerId}</li>
 *   <li>{@code properties} → {@code property}, {@code addresses} → {@code address}</li>
 *   <li>{@code statuses} → {@code status}, {@code status} is already singular</li>
 * </ul>
 */
public final class FieldNames {

    public static final String SCALAR_REFERENCE_SUFFIX = "Id";
    public static final String LIST_REFERENCE_SUFFIX = "Ids";

    // status, campus, bonus and the like are singular despite the trailing s
    private static final String[] LATIN_US_STEMS = {"at", "it", "amp", "on", "ir", "ens", "oc", "orp"};

    private FieldNames() {
        // utility class
    }

    public static String singularize(String name) {
        if (name == null || name.length() < 2) {
            return name;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ies") && name.length() > 3) {
            return name.substring(0, name.length() - 3) + "y";
        }
        if (lower.endsWith("sses") || lower.endsWith("xes") || lower.endsWith("ches")
                || lower.endsWith("shes") || lower.endsWith("zes")) {
            return name.substring(0, name.length() - 2);
        }
        for (String stem : LATIN_US_STEMS) {
            if (lower.endsWith(stem + "us")) {
                return name;
            }
            if (lower.endsWith(stem + "uses")) {
                return name.substring(0, name.length() - 2);
            }
        }
        if (lower.endsWith("ss")) {
            return name;
        }
        if (lower.endsWith("s")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }

    public static String pluralize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("y") && name.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
            return name.substring(0, name.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
                || lower.endsWith("ch") || lower.endsWith("sh")) {
            return name + "es";
        }
        return name + "s";
    }

    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Type name materialized for a nested object stored under {@code field}.
     */
    public static String typeNameOf(String field) {
        return capitalize(singularize(field));
    }

    /**
     * Sibling field holding the id of the object stored under {@code field}.
     */
    public static String scalarReference(String field) {
        return field + SCALAR_REFERENCE_SUFFIX;
    }

    /**
     * Sibling field holding the ordered ids of the objects listed under {@code field}.
     */
    public static String listReference(String field) {
        return singularize(field) + LIST_REFERENCE_SUFFIX;
    }

    private static boolean isVowel(char c) {
        return c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u';
    }
}
