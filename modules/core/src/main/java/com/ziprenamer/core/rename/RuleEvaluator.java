package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.Rule;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies rules to a stem. Every rule is total: whatever the input, a rule yields
 * a name and never throws.
 */
public class RuleEvaluator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(name|index|ext|parent|date|depth)}");
    private static final Pattern NOT_SPECIAL = Pattern.compile("[^A-Za-z0-9 \\-_]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("(?U)\\s+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern KEBAB_SEPARATORS = Pattern.compile("(?U)[\\s_]+");

    /**
     * A base name under evaluation. Directories carry an empty extension.
     */
    public record Name(String stem, String extension) {
        public Name {
            Objects.requireNonNull(stem, "stem cannot be null");
            Objects.requireNonNull(extension, "extension cannot be null");
        }

        public String baseName() {
            return stem + extension;
        }

        Name withStem(String newStem) {
            return new Name(newStem, extension);
        }
    }

    /**
     * Per-entry values visible to numbering and templates.
     *
     * @param scopedIndex zero-based position among the entries the group matched
     * @param parentName  immediate parent directory name, empty at top level
     * @param depth       number of parent segments
     * @param date        the run's date
     */
    public record Context(int scopedIndex, String parentName, int depth, LocalDate date) {
        public Context {
            Objects.requireNonNull(parentName, "parentName cannot be null");
            Objects.requireNonNull(date, "date cannot be null");
        }
    }

    public Name applyAll(List<Rule> rules, Name name, Context context) {
        Name current = name;
        for (Rule rule : rules) {
            current = apply(rule, current, context);
        }
        return current;
    }

    public Name apply(Rule rule, Name name, Context context) {
        String stem = name.stem();
        if (rule instanceof Rule.Replace r) {
            if (r.find().isEmpty()) return name;
            return name.withStem(Pattern.compile(Pattern.quote(r.find()))
                    .matcher(stem)
                    .replaceAll(Matcher.quoteReplacement(r.replacement())));
        } else if (rule instanceof Rule.Prefix p) {
            return name.withStem(p.text() + stem);
        } else if (rule instanceof Rule.Suffix s) {
            return name.withStem(stem + s.text());
        } else if (rule instanceof Rule.Lowercase) {
            return new Name(stem.toLowerCase(Locale.ROOT), name.extension().toLowerCase(Locale.ROOT));
        } else if (rule instanceof Rule.Uppercase) {
            return new Name(stem.toUpperCase(Locale.ROOT), name.extension().toUpperCase(Locale.ROOT));
        } else if (rule instanceof Rule.RemoveSpecial) {
            return name.withStem(NOT_SPECIAL.matcher(stem).replaceAll(""));
        } else if (rule instanceof Rule.Trim) {
            return name.withStem(stem.strip());
        } else if (rule instanceof Rule.NormalizeSpace) {
            return name.withStem(WHITESPACE_RUN.matcher(stem).replaceAll(" "));
        } else if (rule instanceof Rule.KebabCase) {
            String spaced = CAMEL_BOUNDARY.matcher(stem).replaceAll("$1-$2");
            return name.withStem(KEBAB_SEPARATORS.matcher(spaced).replaceAll("-").toLowerCase(Locale.ROOT));
        } else if (rule instanceof Rule.Numbering n) {
            return name.withStem(number(n, stem, context.scopedIndex()));
        } else if (rule instanceof Rule.Template t) {
            String rendered = render(t.template(), name, context);
            return t.ownsExtension() ? new Name(rendered, "") : name.withStem(rendered);
        } else if (rule instanceof Rule.Regex rx) {
            return name.withStem(replaceRegex(rx, stem));
        }
        return name;
    }

    static String number(Rule.Numbering rule, String stem, int scopedIndex) {
        String number = pad(Long.toString((long) scopedIndex + rule.start()), rule.padding());
        return rule.position() == Rule.Numbering.Position.START
                ? number + rule.separator() + stem
                : stem + rule.separator() + number;
    }

    static String pad(String digits, int width) {
        if (digits.length() >= width) return digits;
        return "0".repeat(width - digits.length()) + digits;
    }

    static String render(String template, Name name, Context context) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = switch (m.group(1)) {
                case "name" -> name.stem();
                case "index" -> pad(Integer.toString(context.scopedIndex() + 1), 3);
                case "ext" -> name.extension().isEmpty() ? "" : name.extension().substring(1);
                case "parent" -> context.parentName();
                case "date" -> context.date().format(DateTimeFormatter.ISO_LOCAL_DATE);
                case "depth" -> Integer.toString(context.depth());
                default -> m.group();
            };
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    static String replaceRegex(Rule.Regex rule, String input) {
        Matcher m = rule.pattern().matcher(input);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (m.find()) {
            out.append(input, last, m.start());
            out.append(expand(m, input, rule.replacement()));
            last = m.end();
            if (!rule.global()) break;
        }
        out.append(input, last, input.length());
        return out.toString();
    }

    /**
     * Expands {@code $$ $& $` $' $n $nn} in a replacement string. Unknown
     * references stay literal.
     */
    private static String expand(Matcher m, String input, String replacement) {
        if (replacement.indexOf('$') < 0) return replacement;
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < replacement.length()) {
            char c = replacement.charAt(i);
            if (c != '$' || i + 1 >= replacement.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = replacement.charAt(i + 1);
            if (next == '$') {
                out.append('$');
                i += 2;
            } else if (next == '&') {
                out.append(m.group());
                i += 2;
            } else if (next == '`') {
                out.append(input, 0, m.start());
                i += 2;
            } else if (next == '\'') {
                out.append(input, m.end(), input.length());
                i += 2;
            } else if (Character.isDigit(next)) {
                int consumed = groupReference(m, replacement, i + 1);
                if (consumed == 0) {
                    out.append(c);
                    i++;
                } else {
                    int group = Integer.parseInt(replacement.substring(i + 1, i + 1 + consumed));
                    String value = m.group(group);
                    out.append(value == null ? "" : value);
                    i += 1 + consumed;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Number of digits forming a valid group reference at {@code from}, or 0. */
    private static int groupReference(Matcher m, String replacement, int from) {
        if (from + 1 < replacement.length() && Character.isDigit(replacement.charAt(from + 1))) {
            int two = Integer.parseInt(replacement.substring(from, from + 2));
            if (two >= 1 && two <= m.groupCount()) return 2;
        }
        int one = replacement.charAt(from) - '0';
        return one >= 1 && one <= m.groupCount() ? 1 : 0;
    }
}
