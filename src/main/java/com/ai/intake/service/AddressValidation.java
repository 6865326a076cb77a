package com.ai.intake.service;

import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Verdict of an {@link AddressValidator}. An invalid verdict is a normal
 * outcome that sends the caller back to re-state the address.
 */
@Value
public class AddressValidation {

    boolean valid;
    String canonicalAddress;
    String errorReason;
    Map<String, Object> details;

    public static AddressValidation valid(String canonicalAddress, Map<String, Object> details) {
        return new AddressValidation(true, canonicalAddress, null,
                details != null ? Collections.unmodifiableMap(details) : Collections.emptyMap());
    }

    public static AddressValidation invalid(String errorReason) {
        return new AddressValidation(false, null, errorReason, Collections.emptyMap());
    }
}
