package com.ai.intake.service;

import com.ai.intake.entity.PatientIntake;
import com.ai.intake.flow.SessionState;
import com.ai.intake.repository.PatientIntakeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Stores the intake of a call that reached the end of the flow.
 */
@Service
public class IntakeArchiveService {

    private static final Logger log = LoggerFactory.getLogger(IntakeArchiveService.class);

    private final PatientIntakeRepository repository;

    public IntakeArchiveService(PatientIntakeRepository repository) {
        this.repository = repository;
    }

    /**
     * Saves a snapshot of the state. Storage failures are logged, never thrown:
     * the caller is already being told goodbye.
     */
    public Optional<PatientIntake> archive(String callSid, String callerNumber, SessionState state) {
        PatientIntake intake = PatientIntake.builder()
                .callSid(callSid)
                .callerNumber(callerNumber)
                .name(state.getName())
                .dateOfBirth(state.getDateOfBirth())
                .payerName(state.getPayerName())
                .payId(state.getPayId())
                .referralDoctor(state.getReferralDoctor())
                .chiefComplaint(state.getChiefComplaint())
                .address(state.getAddress())
                .phoneNumber(state.getPhoneNumber())
                .email(state.getEmail())
                .selectedAppointment(state.getSelectedAppointment())
                .convertedAppointment(state.getConvertedAppointment())
                .customTime(state.getCustomTime())
                .build();
        try {
            PatientIntake saved = repository.save(intake);
            log.info("[{}] intake archived id={}", callSid, saved.getId());
            return Optional.of(saved);
        } catch (DataAccessException e) {
            log.error("[{}] failed to archive intake", callSid, e);
            return Optional.empty();
        }
    }
}
