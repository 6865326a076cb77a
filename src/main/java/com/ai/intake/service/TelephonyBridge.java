package com.ai.intake.service;

/**
 * Control channel to a live phone call.
 */
public interface TelephonyBridge {

    /**
     * Speaks text on the call, then either resumes listening or hangs up.
     */
    void speak(String callSid, String text, boolean endCall);

    /**
     * Hands the call over to a SIP endpoint.
     *
     * @throws TelephonyException if the call could not be updated
     */
    void redirectToSip(String callSid, String sipUri);
}
