package com.ai.intake.repository;

import com.ai.intake.entity.PatientIntake;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PatientIntakeRepository extends JpaRepository<PatientIntake, Long> {
    Optional<PatientIntake> findByCallSid(String callSid);
}
