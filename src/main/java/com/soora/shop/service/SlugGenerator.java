package com.soora.shop.service;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Derives URL slugs from product names.
 *
 * @author Soora Platform Team
 */
public final class SlugGenerator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SlugGenerator() {
    }

    /**
     * Trim, lowercase and collapse each whitespace run into one hyphen.
     * {@code "Red Silk Scarf "} becomes {@code "red-silk-scarf"}.
     *
     * @param name Product name
     * @return Base slug
     */
    public static String slugify(String name) {
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }

    /**
     * Slugify a name and append {@code -2}, {@code -3}, ... until the slug is free.
     *
     * @param name Product name
     * @param taken Tells whether a slug is already in use
     * @return Unused slug
     */
    public static String uniqueSlug(String name, Predicate<String> taken) {
        String base = slugify(name);
        String candidate = base;
        int suffix = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
