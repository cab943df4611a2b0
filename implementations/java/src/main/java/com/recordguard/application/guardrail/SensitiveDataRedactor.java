package com.recordguard.application.guardrail;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based redaction applied to every text before release.
 *
 * <p>Rules: identity numbers become {@value #REDACTED}, e-mail addresses keep
 * their local part, dates keep their year, contact numbers keep their last
 * four digits. Dates are recognised in ISO form, as {@code 05/14/1990} or
 * {@code 14.05.1990}, and with an English month name ({@code May 14, 1990},
 * {@code 14 May 1990}). Contact numbers are recognised in North American form
 * and in international form with a leading {@code +}. Postal addresses have no
 * reliable pattern and are left to the sanitization oracle.
 */
@Component
public class SensitiveDataRedactor {

    public static final String REDACTED = "REDACTED";

    /**
     * Redacted text plus the categories that were touched.
     */
    public record Redaction(String text, Set<String> categories) {

        public boolean changed() {
            return !categories.isEmpty();
        }
    }

    private static final Pattern SSN = Pattern.compile("(?<![\\w-])\\d{3}-\\d{2}-\\d{4}(?![\\w-])");
    private static final Pattern EMAIL = Pattern.compile(
        "([A-Za-z0-9._%+-]+)@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}");
    private static final Pattern ISO_DATE = Pattern.compile(
        "(?<![\\w-])(\\d{4})-(?:0[1-9]|1[0-2])-(?:0[1-9]|[12]\\d|3[01])(?:[T ][0-9:.]+Z?)?(?![\\w-])");
    private static final Pattern NUMERIC_DATE = Pattern.compile(
        "(?<![\\w/.-])\\d{1,2}[/.]\\d{1,2}[/.](\\d{4})(?![\\w/.-])");
    private static final String MONTH =
        "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
            + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";
    private static final Pattern NAMED_DATE = Pattern.compile(
        "\\b(?:" + MONTH + "\\s+\\d{1,2}(?:st|nd|rd|th)?,?|\\d{1,2}(?:st|nd|rd|th)?\\s+" + MONTH + ",?)"
            + "\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern INTERNATIONAL_PHONE = Pattern.compile(
        "(?<![\\w+])(?<number>\\+(?=(?:[\\s().-]*\\d){8})\\d{1,3}(?:[\\s.-]?\\(?\\d{1,5}\\)?){2,5})"
            + "(?:\\s?(?:x|ext\\.?)\\s?\\d{1,6})?(?![\\w-])");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern PHONE = Pattern.compile(
        "(?<![\\w*])(?:\\+?\\d{1,3}[\\s.-]?)?(?:\\(\\d{3}\\)\\s?|\\d{3}[\\s.-]?)\\d{3}[\\s.-]?(\\d{4})"
            + "(?:\\s?(?:x|ext\\.?)\\s?\\d{1,6})?(?!\\w)");

    public Redaction redact(String text) {
        if (text == null || text.isEmpty()) {
            return new Redaction(text, Set.of());
        }
        Set<String> categories = new LinkedHashSet<>();
        String result = replace(SSN, text, m -> REDACTED, "ssn", categories);
        result = replace(EMAIL, result, m -> m.group(1), "email", categories);
        result = replace(ISO_DATE, result, m -> m.group(1), "date_of_birth", categories);
        result = replace(NUMERIC_DATE, result, m -> m.group(1), "date_of_birth", categories);
        result = replace(NAMED_DATE, result, m -> m.group(1), "date_of_birth", categories);
        result = replace(INTERNATIONAL_PHONE, result, SensitiveDataRedactor::lastFourDigits, "phone_number", categories);
        result = replace(PHONE, result, m -> "***-***-" + m.group(1), "phone_number", categories);
        return new Redaction(result, Set.copyOf(categories));
    }

    private static String lastFourDigits(Matcher matcher) {
        String digits = NON_DIGITS.matcher(matcher.group("number")).replaceAll("");
        return digits.length() < 4 ? REDACTED : "***-***-" + digits.substring(digits.length() - 4);
    }

    private interface Replacement {
        String apply(Matcher matcher);
    }

    private static String replace(
            Pattern pattern, String text, Replacement replacement, String category, Set<String> categories) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        boolean found = false;
        while (matcher.find()) {
            found = true;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        if (!found) {
            return text;
        }
        matcher.appendTail(out);
        categories.add(category);
        return out.toString();
    }
}
