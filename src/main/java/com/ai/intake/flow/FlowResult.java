package com.ai.intake.flow;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of a tool call. Echoes the validated or derived fields
 * back to the model so its next reply is grounded on what was recorded.
 */
public final class FlowResult {

    public enum Type {
        NAME_COLLECTED,
        DATE_OF_BIRTH_COLLECTED,
        INSURANCE_COLLECTED,
        REFERRAL_COLLECTED,
        CHIEF_COMPLAINT_COLLECTED,
        ADDRESS_COLLECTED,
        CONTACT_INFO_COLLECTED,
        APPOINTMENT_SCHEDULED,
        COMPLETED,
        ERROR
    }

    private final Type type;
    private final Map<String, Object> payload;

    private FlowResult(Type type, Map<String, Object> payload) {
        this.type = type;
        this.payload = payload == null ? Collections.emptyMap() : new LinkedHashMap<>(payload);
    }

    @JsonIgnore
    public Type getType() {
        return type;
    }

    @JsonProperty("status")
    public String getStatus() {
        return type == Type.ERROR ? "error" : "success";
    }

    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public static FlowResult name(String name) {
        return single(Type.NAME_COLLECTED, "name", name);
    }

    public static FlowResult dateOfBirth(String dateOfBirth) {
        return single(Type.DATE_OF_BIRTH_COLLECTED, "date_of_birth", dateOfBirth);
    }

    public static FlowResult insurance(String payerName, String payId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("payer_name", payerName);
        p.put("payID", payId);
        return new FlowResult(Type.INSURANCE_COLLECTED, p);
    }

    public static FlowResult referral(String referralDoctor) {
        return single(Type.REFERRAL_COLLECTED, "referral_doctor", referralDoctor);
    }

    public static FlowResult chiefComplaint(String chiefComplaint) {
        return single(Type.CHIEF_COMPLAINT_COLLECTED, "chief_complaint", chiefComplaint);
    }

    public static FlowResult address(String address) {
        return single(Type.ADDRESS_COLLECTED, "address", address);
    }

    public static FlowResult contactInfo(String phoneNumber, String email) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("phone_number", phoneNumber);
        p.put("email", email);
        return new FlowResult(Type.CONTACT_INFO_COLLECTED, p);
    }

    public static FlowResult appointment(String selectedAppointment, String convertedAppointment, String customTime) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("selected_appointment", selectedAppointment);
        p.put("converted_appointment", convertedAppointment);
        p.put("custom_time", customTime);
        return new FlowResult(Type.APPOINTMENT_SCHEDULED, p);
    }

    public static FlowResult completed() {
        return new FlowResult(Type.COMPLETED, null);
    }

    public static FlowResult error(String message) {
        return single(Type.ERROR, "error", message);
    }

    private static FlowResult single(Type type, String key, Object value) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(key, value);
        return new FlowResult(type, p);
    }

    @Override
    public String toString() {
        return type + payload.toString();
    }
}
