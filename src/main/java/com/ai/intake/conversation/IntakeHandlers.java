package com.ai.intake.conversation;

import com.ai.intake.flow.FlowResult;
import com.ai.intake.flow.SessionState;
import com.ai.intake.flow.ToolArguments;
import com.ai.intake.flow.ToolInvocationResult;
import com.ai.intake.service.AddressValidation;
import com.ai.intake.service.AddressValidator;
import com.ai.intake.service.AppointmentConfirmation;
import com.ai.intake.service.AppointmentNotifier;
import com.ai.intake.service.DateConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Handlers bound to the intake tools. Each records what the caller said in the
 * session state and picks the next node; at most one collaborator call each.
 */
class IntakeHandlers {

    private static final Logger log = LoggerFactory.getLogger(IntakeHandlers.class);

    private final IntakeNodes nodes;
    private final AddressValidator addressValidator;
    private final DateConverter dateConverter;
    private final AppointmentNotifier appointmentNotifier;
    private final AppointmentChoiceClassifier choiceClassifier;

    IntakeHandlers(IntakeNodes nodes,
                   AddressValidator addressValidator,
                   DateConverter dateConverter,
                   AppointmentNotifier appointmentNotifier,
                   AppointmentChoiceClassifier choiceClassifier) {
        this.nodes = nodes;
        this.addressValidator = addressValidator;
        this.dateConverter = dateConverter;
        this.appointmentNotifier = appointmentNotifier;
        this.choiceClassifier = choiceClassifier;
    }

    ToolInvocationResult collectName(ToolArguments args, SessionState state) {
        String name = args.get("name");
        log.debug("collect_name: {}", name);
        state.setName(name);
        return ToolInvocationResult.of(FlowResult.name(name), nodes.dateOfBirthNode());
    }

    ToolInvocationResult collectDateOfBirth(ToolArguments args, SessionState state) {
        String dateOfBirth = args.get("date_of_birth");
        log.debug("collect_date_of_birth: {}", dateOfBirth);
        state.setDateOfBirth(dateOfBirth);
        return ToolInvocationResult.of(FlowResult.dateOfBirth(dateOfBirth), nodes.insuranceNode());
    }

    ToolInvocationResult collectInsurance(ToolArguments args, SessionState state) {
        String payerName = args.get("payer_name");
        String payId = args.get("payID");
        log.debug("collect_insurance: {}, {}", payerName, payId);
        state.setPayerName(payerName);
        state.setPayId(payId);
        return ToolInvocationResult.of(FlowResult.insurance(payerName, payId), nodes.referralNode());
    }

    ToolInvocationResult collectReferral(ToolArguments args, SessionState state) {
        String referral = args.get("referral");
        log.debug("collect_referral: {}", referral);
        state.setReferralDoctor(referral);
        return ToolInvocationResult.of(FlowResult.referral(referral), nodes.chiefComplaintNode());
    }

    ToolInvocationResult collectChiefComplaint(ToolArguments args, SessionState state) {
        String chiefComplaint = args.get("chief_complaint");
        log.debug("collect_chief_complaint: {}", chiefComplaint);
        state.setChiefComplaint(chiefComplaint);
        return ToolInvocationResult.of(FlowResult.chiefComplaint(chiefComplaint), nodes.addressNode());
    }

    /**
     * Invalid addresses loop back through a retry node carrying the reason. A
     * validator outage never blocks the call: the address is taken as spoken.
     */
    ToolInvocationResult collectAddress(ToolArguments args, SessionState state) {
        String address = args.get("address");
        log.debug("collect_address: {}", address);

        AddressValidation validation;
        try {
            validation = addressValidator.validate(address);
        } catch (RuntimeException e) {
            log.error("Address validation service error, accepting '{}' as given", address, e);
            state.setAddress(address);
            return ToolInvocationResult.of(FlowResult.address(address), nodes.contactInfoNode());
        }

        if (!validation.isValid()) {
            log.warn("Address validation failed: {}", validation.getErrorReason());
            state.setAddressValidationError(validation.getErrorReason());
            return ToolInvocationResult.of(FlowResult.address(""), nodes.addressRetryNode(validation.getErrorReason()));
        }

        String formatted = validation.getCanonicalAddress() != null ? validation.getCanonicalAddress() : address;
        log.info("Address validated: {}", formatted);
        state.setAddress(formatted);
        state.setAddressDetails(validation.getDetails());
        state.setAddressValidationError(null);
        return ToolInvocationResult.of(FlowResult.address(formatted), nodes.contactInfoNode());
    }

    ToolInvocationResult collectContactInfo(ToolArguments args, SessionState state) {
        String phoneNumber = args.get("phone_number");
        String email = args.getOrDefault("email", "");
        log.debug("collect_contact_info: phone={}, email={}", phoneNumber, email);
        state.setPhoneNumber(phoneNumber);
        state.setEmail(email);
        return ToolInvocationResult.of(FlowResult.contactInfo(phoneNumber, email), nodes.appointmentSchedulingNode());
    }

    /**
     * Picks a slot, converts it to a calendar date and emails a confirmation.
     * Always ends the conversation, whatever the conversion or email outcome.
     */
    ToolInvocationResult scheduleAppointment(ToolArguments args, SessionState state) {
        String choice = args.get("appointment_choice");
        String customTime = args.getOrDefault("custom_time", "");
        log.debug("schedule_appointment: choice={}, custom_time={}", choice, customTime);

        AppointmentSlot slot = choiceClassifier.classify(choice);
        String selected = slot.phrase(customTime);

        String converted;
        try {
            converted = dateConverter.toAbsolute(selected);
            log.info("Converted appointment: '{}' -> '{}'", selected, converted);
        } catch (RuntimeException e) {
            log.error("Error converting appointment date '{}'", selected, e);
            converted = selected;
        }
        if (converted == null) {
            converted = selected;
        }

        state.setSelectedAppointment(selected);
        state.setConvertedAppointment(converted);
        state.setCustomTime(customTime);

        sendConfirmation(state, converted);

        return ToolInvocationResult.of(FlowResult.appointment(selected, converted, customTime), nodes.endNode());
    }

    ToolInvocationResult endQuote(ToolArguments args, SessionState state) {
        log.debug("end_quote");
        return ToolInvocationResult.of(FlowResult.completed(), nodes.endNode());
    }

    private void sendConfirmation(SessionState state, String appointmentTime) {
        Map<String, String> summary = state.summary();
        AppointmentConfirmation confirmation = AppointmentConfirmation.builder()
                .patientName(summary.get("name"))
                .dateOfBirth(summary.get("date_of_birth"))
                .address(summary.get("address"))
                .phoneNumber(summary.get("phone_number"))
                .insurance(summary.get("payer_name"))
                .chiefComplaint(summary.get("chief_complaint"))
                .patientEmail(state.getEmail())
                .appointmentTime(appointmentTime)
                .build();
        try {
            if (appointmentNotifier.sendAppointmentConfirmation(confirmation)) {
                log.info("Appointment confirmation sent");
            } else {
                log.warn("Failed to send appointment confirmation email");
            }
        } catch (RuntimeException e) {
            log.error("Error sending appointment confirmation email", e);
        }
    }
}
