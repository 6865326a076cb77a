package com.ai.intake.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns relative appointment phrases ("tomorrow at 3pm", "next Monday at 10am")
 * into calendar dates such as "October 20, 2026 at 3:00 PM". Never throws:
 * anything it does not recognize comes back unchanged.
 */
@Service
public class DateConverter {

    private static final Logger log = LoggerFactory.getLogger(DateConverter.class);

    private static final Pattern TIME = Pattern.compile("\\b(1[0-2]|0?[1-9])\\s*(am|pm)\\b");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private final Clock clock;

    public DateConverter(Clock clock) {
        this.clock = clock;
    }

    public String toAbsolute(String relativePhrase) {
        if (relativePhrase == null) {
            return null;
        }
        try {
            String phrase = relativePhrase.toLowerCase(Locale.ROOT).trim();
            LocalDate date = resolveDate(phrase, LocalDate.now(clock));
            if (date == null) {
                return relativePhrase;
            }
            return DATE_FORMAT.format(date) + timeSuffix(phrase);
        } catch (RuntimeException e) {
            log.warn("Could not convert '{}', keeping it as is", relativePhrase, e);
            return relativePhrase;
        }
    }

    private static LocalDate resolveDate(String phrase, LocalDate today) {
        if (phrase.contains("tomorrow")) {
            return today.plusDays(1);
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            if (phrase.contains(day.name().toLowerCase(Locale.ROOT))) {
                // strictly after today: "Monday" said on a Monday means next week
                return today.with(TemporalAdjusters.next(day));
            }
        }
        if (phrase.contains("next week")) {
            return today.plusWeeks(1);
        }
        if (phrase.contains("two weeks") || phrase.contains("2 weeks")) {
            return today.plusWeeks(2);
        }
        return null;
    }

    private static String timeSuffix(String phrase) {
        Matcher m = TIME.matcher(phrase);
        if (!m.find()) {
            return "";
        }
        int hour = Integer.parseInt(m.group(1));
        return " at " + hour + ":00 " + m.group(2).toUpperCase(Locale.ROOT);
    }
}
