package com.ai.intake.service;

import lombok.Builder;
import lombok.Value;

/**
 * Fields of an appointment confirmation, built from the session state once an
 * appointment has been chosen.
 */
@Value
@Builder
public class AppointmentConfirmation {

    String patientName;
    String dateOfBirth;
    String address;
    String phoneNumber;
    String insurance;
    String chiefComplaint;
    String patientEmail;
    String appointmentTime;
}
