package com.ai.intake.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Intake collected on one completed call, kept for office staff.
 */
@Entity
@Table(name = "patient_intake", indexes = {
    @Index(name = "idx_patient_intake_call_sid", columnList = "call_sid", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientIntake {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "call_sid", nullable = false)
    private String callSid;

    private String callerNumber;

    private String name;

    private String dateOfBirth;

    private String payerName;

    private String payId;

    private String referralDoctor;

    @Column(length = 1000)
    private String chiefComplaint;

    private String address;

    private String phoneNumber;

    private String email;

    private String selectedAppointment;

    private String convertedAppointment;

    private String customTime;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
