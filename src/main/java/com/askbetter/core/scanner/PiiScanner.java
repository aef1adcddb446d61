package com.askbetter.core.scanner;

import com.askbetter.core.model.Flag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic detector for sensitive substrings in free text.
 * <p>
 * Detection is pattern based: email-like tokens, phone-like digit runs and
 * card-like digit runs. Card candidates must pass the mod-10 (Luhn) checksum, and
 * phone-like matches that sit inside an accepted card number are ignored.
 * The scanner holds no state; the same text always yields the same flags.
 */
@Component
public class PiiScanner {

    private static final Pattern EMAIL = Pattern.compile(
            "\\b[\\w.-]+@[\\w.-]+\\.\\w{2,}\\b");

    private static final Pattern PHONE = Pattern.compile(
            "\\b(?:\\+?\\d{1,3}[-.\\s]?)?(?:\\(?\\d{3}\\)?[-.\\s]?)?\\d{3}[-.\\s]?\\d{4}\\b");

    /** Digit groups joined by single spaces or dashes. */
    private static final Pattern DIGIT_RUN = Pattern.compile(
            "\\b\\d+(?:[ -]\\d+)*\\b");

    private static final Pattern DIGIT_GROUP = Pattern.compile("\\d+");

    private static final int CARD_MIN_DIGITS = 13;
    private static final int CARD_MAX_DIGITS = 19;

    private record Span(int start, int end) {
        boolean overlaps(int otherStart, int otherEnd) {
            return otherStart < end && start < otherEnd;
        }
    }

    /**
     * Scans the given text for PII-like patterns.
     *
     * @param text any text, may be null
     * @return the detected flags in priority order; empty when nothing matches
     */
    public Set<Flag> scan(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }

        EnumSet<Flag> found = EnumSet.noneOf(Flag.class);
        if (EMAIL.matcher(text).find()) {
            found.add(Flag.EMAIL);
        }

        List<Span> cards = cardSpans(text);
        if (!cards.isEmpty()) {
            found.add(Flag.CARD_ISH);
        }

        Matcher phone = PHONE.matcher(text);
        while (phone.find()) {
            int start = phone.start();
            int end = phone.end();
            if (cards.stream().noneMatch(card -> card.overlaps(start, end))) {
                found.add(Flag.PHONE);
                break;
            }
        }
        return Collections.unmodifiableSet(found);
    }

    private static List<Span> cardSpans(String text) {
        var spans = new ArrayList<Span>();
        Matcher run = DIGIT_RUN.matcher(text);
        while (run.find()) {
            var groups = new ArrayList<Span>();
            Matcher group = DIGIT_GROUP.matcher(text).region(run.start(), run.end());
            while (group.find()) {
                groups.add(new Span(group.start(), group.end()));
            }
            spans.addAll(cardWindows(text, groups));
        }
        return spans;
    }

    /**
     * Finds card numbers inside one run of digit groups. A window starts and ends on
     * a group boundary, holds 13 to 19 digits and passes the Luhn check; from each
     * starting group the longest such window wins, and the search resumes after it.
     * Digits before or after a card (a reference number, CVV or expiry) therefore do
     * not hide it.
     */
    private static List<Span> cardWindows(String text, List<Span> groups) {
        var windows = new ArrayList<Span>();
        int first = 0;
        while (first < groups.size()) {
            int accepted = -1;
            for (int last = groups.size() - 1; last >= first && accepted < 0; last--) {
                int digits = 0;
                for (int i = first; i <= last; i++) {
                    digits += groups.get(i).end() - groups.get(i).start();
                }
                int start = groups.get(first).start();
                int end = groups.get(last).end();
                if (digits >= CARD_MIN_DIGITS && digits <= CARD_MAX_DIGITS
                        && passesLuhn(text.substring(start, end))) {
                    windows.add(new Span(start, end));
                    accepted = last;
                }
            }
            first = accepted >= 0 ? accepted + 1 : first + 1;
        }
        return windows;
    }

    static boolean passesLuhn(String candidate) {
        int sum = 0;
        int digits = 0;
        boolean doubleIt = false;
        for (int i = candidate.length() - 1; i >= 0; i--) {
            char c = candidate.charAt(i);
            if (c < '0' || c > '9') {
                continue;
            }
            int d = c - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            digits++;
            doubleIt = !doubleIt;
        }
        return digits >= CARD_MIN_DIGITS && digits <= CARD_MAX_DIGITS && sum % 10 == 0;
    }
}
