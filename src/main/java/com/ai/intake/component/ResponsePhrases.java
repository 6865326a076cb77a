package com.ai.intake.component;

import org.springframework.stereotype.Component;

/**
 * Fixed lines spoken when the model cannot be asked, or when the caller could not be understood.
 */
@Component
public class ResponsePhrases {

    public String couldYouRepeat() {
        return "Sorry, I didn't catch that. Could you repeat?";
    }

    public String stillHere() {
        return "I'm still here, please go ahead.";
    }

    public String stillThere() {
        return "Are you still there?";
    }

    public String goodbye() {
        return "Alright, have a good day! Bye.";
    }

    public String technicalTrouble() {
        return "I'm having a little trouble on my end. Could you say that one more time?";
    }
}
