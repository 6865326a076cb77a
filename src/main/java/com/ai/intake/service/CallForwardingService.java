package com.ai.intake.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards a call to its SIP endpoint once. The dial-in-ready signal can fire
 * once per provisioned endpoint; only the first one is acted on.
 */
@Service
public class CallForwardingService {

    private static final Logger log = LoggerFactory.getLogger(CallForwardingService.class);

    private final Set<String> forwarded = ConcurrentHashMap.newKeySet();
    private final TelephonyBridge telephony;

    public CallForwardingService(TelephonyBridge telephony) {
        this.telephony = telephony;
    }

    /**
     * @return true if the call was forwarded now, false if it already had been
     * @throws TelephonyException if forwarding failed; a later request may retry
     */
    public boolean forward(String callSid, String sipUri) {
        if (!forwarded.add(callSid)) {
            log.warn("Call {} already forwarded, ignoring", callSid);
            return false;
        }
        log.info("Forwarding call {} to {}", callSid, sipUri);
        try {
            telephony.redirectToSip(callSid, sipUri);
            return true;
        } catch (TelephonyException e) {
            forwarded.remove(callSid);
            log.error("Failed to forward call {}", callSid, e);
            throw e;
        }
    }

    public void forget(String callSid) {
        forwarded.remove(callSid);
    }

    public boolean isForwarded(String callSid) {
        return forwarded.contains(callSid);
    }
}
