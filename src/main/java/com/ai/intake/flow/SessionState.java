package com.ai.intake.flow;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything learned during one conversation. Handlers write fields, later
 * handlers and the terminal reporting read them. Owned by a single
 * {@link FlowManager}.
 */
@Getter
@Setter
@ToString
public class SessionState {

    static final String NOT_PROVIDED = "Not provided";

    private String name;
    private String dateOfBirth;
    private String payerName;
    private String payId;
    private String referralDoctor;
    private String chiefComplaint;
    private String address;
    private Map<String, Object> addressDetails;
    private String addressValidationError;
    private String phoneNumber;
    private String email;
    private String selectedAppointment;
    private String convertedAppointment;
    private String customTime;

    public SessionState copy() {
        SessionState copy = new SessionState();
        copy.copyFrom(this);
        return copy;
    }

    void copyFrom(SessionState other) {
        this.name = other.name;
        this.dateOfBirth = other.dateOfBirth;
        this.payerName = other.payerName;
        this.payId = other.payId;
        this.referralDoctor = other.referralDoctor;
        this.chiefComplaint = other.chiefComplaint;
        this.address = other.address;
        this.addressDetails = other.addressDetails;
        this.addressValidationError = other.addressValidationError;
        this.phoneNumber = other.phoneNumber;
        this.email = other.email;
        this.selectedAppointment = other.selectedAppointment;
        this.convertedAppointment = other.convertedAppointment;
        this.customTime = other.customTime;
    }

    void clear() {
        copyFrom(new SessionState());
    }

    /**
     * Patient fields for confirmations, with "Not provided" for anything the
     * caller never gave.
     */
    public Map<String, String> summary() {
        Map<String, String> summary = new LinkedHashMap<>();
        summary.put("name", orDefault(name, "Unknown"));
        summary.put("date_of_birth", orDefault(dateOfBirth, NOT_PROVIDED));
        summary.put("address", orDefault(address, NOT_PROVIDED));
        summary.put("phone_number", orDefault(phoneNumber, NOT_PROVIDED));
        summary.put("payer_name", orDefault(payerName, NOT_PROVIDED));
        summary.put("chief_complaint", orDefault(chiefComplaint, NOT_PROVIDED));
        return Collections.unmodifiableMap(summary);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
