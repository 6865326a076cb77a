package com.ai.intake.conversation;

/**
 * Appointment times offered to the caller, in the order they are presented,
 * plus the sentinel for "none of these, here is when I can come".
 */
public enum AppointmentSlot {
    TOMORROW_3PM("tomorrow at 3pm"),
    NEXT_MONDAY_10AM("next Monday at 10am"),
    NEXT_WEDNESDAY_11AM("next Wednesday at 11am"),
    CUSTOM(null);

    static final String CUSTOM_TIME_REQUESTED = "Custom time requested";

    private final String phrase;

    AppointmentSlot(String phrase) {
        this.phrase = phrase;
    }

    /**
     * Relative phrase for the slot; for {@link #CUSTOM} the caller's own time,
     * or a placeholder when they gave none.
     */
    public String phrase(String customTime) {
        if (this != CUSTOM) {
            return phrase;
        }
        return customTime != null && !customTime.isBlank() ? customTime : CUSTOM_TIME_REQUESTED;
    }
}
