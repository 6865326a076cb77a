package com.ai.intake.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps the caller's free-text answer to one of the offered slots. Rules are
 * evaluated in order and the first match wins; when several offered days are
 * mentioned the earliest-presented one is chosen. Anything unrecognized falls
 * back to the first offered slot.
 */
@Component
public class AppointmentChoiceClassifier {

    private static final Logger log = LoggerFactory.getLogger(AppointmentChoiceClassifier.class);

    static final class Rule {
        final String description;
        final Predicate<String> matches;
        final AppointmentSlot slot;

        Rule(String description, Predicate<String> matches, AppointmentSlot slot) {
            this.description = description;
            this.matches = matches;
            this.slot = slot;
        }
    }

    private static final AppointmentSlot DEFAULT_SLOT = AppointmentSlot.TOMORROW_3PM;

    private static final List<Rule> RULES = List.of(
            new Rule("nothing offered works", anyOf("nothing works", "none work", "not available"), AppointmentSlot.CUSTOM),
            new Rule("any offered time works", anyOf("anything works", "any time", "all work"), AppointmentSlot.TOMORROW_3PM),
            new Rule("tomorrow and monday", allOf("tomorrow", "monday"), AppointmentSlot.TOMORROW_3PM),
            new Rule("monday and wednesday", allOf("monday", "wednesday"), AppointmentSlot.NEXT_MONDAY_10AM),
            new Rule("tomorrow", anyOf("tomorrow"), AppointmentSlot.TOMORROW_3PM),
            new Rule("monday", anyOf("monday"), AppointmentSlot.NEXT_MONDAY_10AM),
            new Rule("wednesday", anyOf("wednesday"), AppointmentSlot.NEXT_WEDNESDAY_11AM)
    );

    public AppointmentSlot classify(String appointmentChoice) {
        String choice = appointmentChoice == null ? "" : appointmentChoice.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches.test(choice)) {
                log.debug("Choice '{}' matched rule '{}' -> {}", appointmentChoice, rule.description, rule.slot);
                return rule.slot;
            }
        }
        log.debug("Choice '{}' matched no rule, defaulting to {}", appointmentChoice, DEFAULT_SLOT);
        return DEFAULT_SLOT;
    }

    List<Rule> rules() {
        return RULES;
    }

    private static Predicate<String> anyOf(String... keywords) {
        return text -> {
            for (String k : keywords) {
                if (text.contains(k)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static Predicate<String> allOf(String... keywords) {
        return text -> {
            for (String k : keywords) {
                if (!text.contains(k)) {
                    return false;
                }
            }
            return true;
        };
    }
}
