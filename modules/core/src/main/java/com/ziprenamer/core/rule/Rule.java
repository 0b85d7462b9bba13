package com.ziprenamer.core.rule;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One step of a rule group. Each variant validates its own fields; input that
 * cannot form a valid variant is carried as {@link Unsupported}, which evaluates
 * as a no-op.
 */
public sealed interface Rule {

    /** Literal, case-sensitive, all-occurrences substitution. Empty {@code find} is a no-op. */
    record Replace(String find, String replacement) implements Rule {
        public Replace {
            Objects.requireNonNull(find, "find cannot be null");
            replacement = replacement == null ? "" : replacement;
        }
    }

    record Prefix(String text) implements Rule {
        public Prefix {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    record Suffix(String text) implements Rule {
        public Suffix {
            Objects.requireNonNull(text, "text cannot be null");
        }
    }

    /** Folds the whole base name, extension included. */
    record Lowercase() implements Rule {}

    /** Folds the whole base name, extension included. */
    record Uppercase() implements Rule {}

    /** Deletes everything outside {@code [A-Za-z0-9 _-]}. */
    record RemoveSpecial() implements Rule {}

    record Trim() implements Rule {}

    /** Collapses whitespace runs to a single space. */
    record NormalizeSpace() implements Rule {}

    record KebabCase() implements Rule {}

    /**
     * Appends or prepends {@code scopedIndex + start}, zero-padded to {@code padding} digits.
     */
    record Numbering(int start, int padding, String separator, Position position) implements Rule {

        public enum Position { START, END }

        public Numbering {
            if (padding < 1) {
                throw new IllegalArgumentException("padding must be >= 1, got: " + padding);
            }
            Objects.requireNonNull(separator, "separator cannot be null");
            Objects.requireNonNull(position, "position cannot be null");
        }

        public static Numbering defaults() {
            return new Numbering(1, 1, "-", Position.END);
        }
    }

    /**
     * Template over {@code {name} {index} {ext} {parent} {date} {depth}} that replaces
     * the whole stem. A template using {@code {ext}} owns the extension too.
     */
    record Template(String template) implements Rule {
        public Template {
            Objects.requireNonNull(template, "template cannot be null");
            if (template.isEmpty()) {
                throw new IllegalArgumentException("template cannot be empty");
            }
        }

        public boolean ownsExtension() {
            return template.contains("{ext}");
        }
    }

    /**
     * User-supplied regular expression. {@code global=false} replaces the first match only.
     */
    record Regex(Pattern pattern, boolean global, String replacement) implements Rule {
        public Regex {
            Objects.requireNonNull(pattern, "pattern cannot be null");
            replacement = replacement == null ? "" : replacement;
        }

        /**
         * Compiles a pattern with JavaScript-style flags ({@code g i m s u}).
         *
         * @throws PatternSyntaxException   if the expression is invalid
         * @throws IllegalArgumentException if a flag is unknown
         */
        public static Regex compile(String expression, String flags, String replacement) {
            Objects.requireNonNull(expression, "pattern cannot be null");
            if (expression.isEmpty()) {
                throw new IllegalArgumentException("pattern cannot be empty");
            }
            String f = flags == null || flags.isEmpty() ? "g" : flags;
            int javaFlags = 0;
            boolean global = false;
            for (char c : f.toCharArray()) {
                switch (c) {
                    case 'g' -> global = true;
                    case 'i' -> javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    case 'm' -> javaFlags |= Pattern.MULTILINE;
                    case 's' -> javaFlags |= Pattern.DOTALL;
                    case 'u' -> { }
                    default -> throw new IllegalArgumentException(
                            "Unknown regex flag '" + c + "' in: " + f.toLowerCase(Locale.ROOT));
                }
            }
            return new Regex(Pattern.compile(expression, javaFlags), global, replacement);
        }
    }

    /** Unknown type or malformed fields; never changes the name. */
    record Unsupported(String type, String reason) implements Rule {}
}
