package com.largomodo.dotshop.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Symbol name checks and sanitization for emitted source code.
 * <p>
 * The accepted form {@code [A-Za-z_][A-Za-z0-9_]*} is a valid identifier in C, Python and
 * JavaScript alike, so one symbol works for every target. Names reserved in any of those
 * languages are rejected for the same reason.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class IdentifierUtil {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String RESERVED_SUFFIX = "_img";

    // Keywords and reserved words of C (C11 plus stdbool/stdint names), Python 3 and JavaScript (strict mode)
    private static final Set<String> RESERVED = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
            "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
            "union", "unsigned", "void", "volatile", "while", "_Bool", "_Complex", "_Imaginary",
            "_Alignas", "_Alignof", "_Atomic", "_Generic", "_Noreturn", "_Static_assert", "_Thread_local",
            "bool", "true", "false", "NULL", "uint8_t", "uint16_t", "uint32_t", "size_t", "PROGMEM",
            "False", "None", "True", "and", "as", "assert", "async", "await", "class", "def", "del",
            "elif", "except", "finally", "from", "global", "import", "in", "is", "lambda", "nonlocal",
            "not", "or", "pass", "raise", "try", "with", "yield",
            "catch", "debugger", "delete", "export", "extends", "function", "implements", "instanceof",
            "interface", "let", "new", "null", "package", "private", "protected", "public", "super",
            "this", "throw", "typeof", "var", "arguments", "eval", "undefined", "NaN", "Infinity");

    private IdentifierUtil() {
        // Static utility class - prevent instantiation
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !isReserved(name);
    }

    /**
     * @return true if the name is a keyword or reserved word in C, Python or JavaScript
     */
    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /**
     * @return the name unchanged
     * @throws IllegalArgumentException if the name is not a valid identifier
     */
    public static String requireValid(String name) {
        if (name != null && isReserved(name)) {
            throw new IllegalArgumentException(
                    "Symbol name is a reserved word in C, Python or JavaScript: " + name);
        }
        if (!isValid(name)) {
            throw new IllegalArgumentException(
                    "Symbol name must match [A-Za-z_][A-Za-z0-9_]*, got: " + name);
        }
        return name;
    }

    /**
     * Derives an identifier from a file name.
     * <p>
     * Strategy: drop the extension after the last dot ("logo.v2.png" → "logo.v2"), replace every
     * run of other characters with one underscore, lowercase, and prefix an underscore when the
     * result starts with a digit. A result that is a reserved word gets an "_img" suffix
     * ("int.png" → "int_img").
     *
     * @param filename Source file name, may contain spaces and punctuation
     * @return valid identifier
     * @throws IllegalArgumentException if filename is null or blank, or nothing usable remains
     */
    public static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }

        int lastDot = filename.lastIndexOf('.');
        String name = lastDot > 0 ? filename.substring(0, lastDot) : filename;

        // "my logo (1)" → "my_logo_1"
        String clean = name.replaceAll("[^A-Za-z0-9]+", "_")
                .replaceAll("^_+|_+$", "")
                .toLowerCase(Locale.ROOT);

        if (clean.isEmpty()) {
            throw new IllegalArgumentException(
                    "Filename cannot be sanitized to a valid identifier (nothing would remain): " + filename);
        }
        if (Character.isDigit(clean.charAt(0))) {
            clean = "_" + clean;
        }
        if (isReserved(clean)) {
            clean = clean + RESERVED_SUFFIX;
        }
        return clean;
    }
}
