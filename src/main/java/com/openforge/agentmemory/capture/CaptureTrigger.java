package com.openforge.agentmemory.capture;

import com.openforge.agentmemory.memory.MemoryCategory;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One row of the capture trigger table: a pattern that makes text memory-worthy,
 * and the category it implies, if any.
 *
 * {@link #TABLE} is evaluated top to bottom. Any matching row makes the text
 * capturable; the first matching row that carries a category decides the
 * category. The categorizing rows therefore come first, in precedence order
 * correction → preference → decision → learning.
 */
public record CaptureTrigger(
        String                   name,
        Pattern                  pattern,
        @Nullable MemoryCategory category
) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public static final List<CaptureTrigger> TABLE = List.of(
            categorizing("correction", "\\bactually|\\bno,|\\bthat's wrong|\\bcorrection", MemoryCategory.CORRECTION),
            categorizing("preference", "\\bprefer|\\blike|\\blove|\\bhate|\\bwant",       MemoryCategory.PREFERENCE),
            categorizing("decision",   "\\bdecided|\\bdecision|\\bwill use",                 MemoryCategory.DECISION),
            categorizing("learning",   "\\blearned|\\brealized|\\bdiscovered",               MemoryCategory.LEARNING),
            plain("remember-request", "\\bremember|\\bzapamatuj"),
            plain("need",             "\\bneed|\\bradši"),
            plain("commitment",       "\\bbudeme"),
            plain("emphasis",         "\\bimportant|\\balways|\\bnever"),
            plain("phone-number",     "\\+\\d{10,}"),
            plain("email",            "[\\w.-]+@[\\w.-]+\\.\\w+"),
            plain("possessive-fact",  "\\bmy\\s+\\w+\\s+is\\b|\\bis\\s+my\\b")
    );

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    /** First categorizing row matching {@code text}, in table order. */
    public static Optional<MemoryCategory> categoryOf(String text) {
        return TABLE.stream()
                .filter(t -> t.category() != null && t.matches(text))
                .map(CaptureTrigger::category)
                .findFirst();
    }

    public static boolean anyMatches(String text) {
        return TABLE.stream().anyMatch(t -> t.matches(text));
    }

    private static CaptureTrigger categorizing(String name, String regex, MemoryCategory category) {
        return new CaptureTrigger(name, Pattern.compile(regex, FLAGS), category);
    }

    private static CaptureTrigger plain(String name, String regex) {
        return new CaptureTrigger(name, Pattern.compile(regex, FLAGS), null);
    }
}
