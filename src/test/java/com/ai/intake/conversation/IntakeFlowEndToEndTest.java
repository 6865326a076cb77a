package com.ai.intake.conversation;

import com.ai.intake.flow.FlowManager;
import com.ai.intake.service.AddressValidation;
import com.ai.intake.service.AddressValidator;
import com.ai.intake.service.AppointmentNotifier;
import com.ai.intake.service.DateConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntakeFlowEndToEndTest {

    private static final Clock TODAY = Clock.fixed(
            LocalDate.of(2026, 10, 19).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
    private static final String VALID = "1600 Amphitheatre Pkwy, Mountain View, CA 94043, USA";

    private AddressValidator addressValidator;
    private AppointmentNotifier notifier;
    private FlowManager flow;

    @BeforeEach
    void setUp() {
        addressValidator = mock(AddressValidator.class);
        notifier = mock(AppointmentNotifier.class);
        when(notifier.sendAppointmentConfirmation(any())).thenReturn(true);
        IntakeNodes nodes = new IntakeNodes(addressValidator, new DateConverter(TODAY), notifier,
                new AppointmentChoiceClassifier());
        flow = new FlowManager("CA-e2e");
        flow.initialize(nodes.initialNode());
    }

    @Test
    void happyPathVisitsNineDistinctNodes() {
        when(addressValidator.validate(any())).thenReturn(AddressValidation.valid(VALID, Map.of()));

        collectUpToAddress();
        flow.invokeTool(IntakeNodes.COLLECT_ADDRESS, Map.of("address", "1600 amphitheatre parkway mountain view"));
        finishAfterAddress();

        assertThat(flow.isEnded()).isTrue();
        assertThat(flow.getVisitedNodes()).containsExactly(
                IntakeNodes.INITIAL,
                IntakeNodes.DATE_OF_BIRTH,
                IntakeNodes.INSURANCE,
                IntakeNodes.REFERRAL,
                IntakeNodes.CHIEF_COMPLAINT,
                IntakeNodes.ADDRESS,
                IntakeNodes.CONTACT_INFO,
                IntakeNodes.APPOINTMENT_SCHEDULING,
                IntakeNodes.END);
        assertThat(flow.getVisitedNodes()).doesNotHaveDuplicates();
        assertThat(flow.getState().getAddress()).isEqualTo(VALID);
        assertThat(flow.getState().getConvertedAppointment()).isEqualTo("October 26, 2026 at 10:00 AM");
        verify(notifier, times(1)).sendAppointmentConfirmation(any());
    }

    @Test
    void invalidAddressLoopsThroughRetryUntilValid() {
        when(addressValidator.validate("Main Street")).thenReturn(
                AddressValidation.invalid("Please provide a complete address with street, city, and state."));
        when(addressValidator.validate("Main Street, Springfield")).thenReturn(
                AddressValidation.invalid("The address seems incomplete."));
        when(addressValidator.validate("12 Main Street, Springfield, IL")).thenReturn(
                AddressValidation.valid("12 Main St, Springfield, IL 62701, USA", Map.of()));

        collectUpToAddress();

        flow.invokeTool(IntakeNodes.COLLECT_ADDRESS, Map.of("address", "Main Street"));
        assertThat(flow.getCurrentNode().getName()).isEqualTo(IntakeNodes.ADDRESS_RETRY);
        assertThat(flow.getState().getAddress()).isNull();

        flow.invokeTool(IntakeNodes.COLLECT_ADDRESS, Map.of("address", "Main Street, Springfield"));
        assertThat(flow.getCurrentNode().getName()).isEqualTo(IntakeNodes.ADDRESS_RETRY);
        assertThat(flow.getState().getAddress()).isNull();

        flow.invokeTool(IntakeNodes.COLLECT_ADDRESS, Map.of("address", "12 Main Street, Springfield, IL"));
        assertThat(flow.getCurrentNode().getName()).isEqualTo(IntakeNodes.CONTACT_INFO);
        assertThat(flow.getState().getAddress()).isEqualTo("12 Main St, Springfield, IL 62701, USA");

        finishAfterAddress();

        assertThat(Collections.frequency(flow.getVisitedNodes(), IntakeNodes.ADDRESS_RETRY)).isEqualTo(2);
        assertThat(flow.isEnded()).isTrue();
    }

    @Test
    void referralNodeCanSkipStraightToChiefComplaint() {
        flow.invokeTool(IntakeNodes.COLLECT_NAME, Map.of("name", "Jane Doe"));
        flow.invokeTool(IntakeNodes.COLLECT_DATE_OF_BIRTH, Map.of("date_of_birth", "1990-04-12"));
        flow.invokeTool(IntakeNodes.COLLECT_INSURANCE, Map.of("payer_name", "Aetna", "payID", "A123"));

        flow.invokeTool(IntakeNodes.COLLECT_CHIEF_COMPLAINT, Map.of("chief_complaint", "knee pain"));

        assertThat(flow.getCurrentNode().getName()).isEqualTo(IntakeNodes.ADDRESS);
        assertThat(flow.getState().getReferralDoctor()).isNull();
        assertThat(flow.getState().getChiefComplaint()).isEqualTo("knee pain");
    }

    @Test
    void endQuoteFinishesWithoutScheduling() {
        when(addressValidator.validate(any())).thenReturn(AddressValidation.valid(VALID, Map.of()));
        collectUpToAddress();
        flow.invokeTool(IntakeNodes.COLLECT_ADDRESS, Map.of("address", VALID));
        flow.invokeTool(IntakeNodes.COLLECT_CONTACT_INFO, Map.of("phone_number", "555-0100"));

        flow.invokeTool(IntakeNodes.END_QUOTE, Map.of());

        assertThat(flow.isEnded()).isTrue();
        assertThat(flow.getState().getSelectedAppointment()).isNull();
        verify(notifier, times(0)).sendAppointmentConfirmation(any());
    }

    private void collectUpToAddress() {
        flow.invokeTool(IntakeNodes.COLLECT_NAME, Map.of("name", "Jane Doe"));
        flow.invokeTool(IntakeNodes.COLLECT_DATE_OF_BIRTH, Map.of("date_of_birth", "1990-04-12"));
        flow.invokeTool(IntakeNodes.COLLECT_INSURANCE, Map.of("payer_name", "Aetna", "payID", "A123"));
        flow.invokeTool(IntakeNodes.COLLECT_REFERRAL, Map.of("referral", "Dr. Adams"));
        flow.invokeTool(IntakeNodes.COLLECT_CHIEF_COMPLAINT, Map.of("chief_complaint", "knee pain"));
        assertThat(flow.getCurrentNode().getName()).isEqualTo(IntakeNodes.ADDRESS);
    }

    private void finishAfterAddress() {
        flow.invokeTool(IntakeNodes.COLLECT_CONTACT_INFO, Map.of("phone_number", "555-0100", "email", "jane@example.com"));
        flow.invokeTool(IntakeNodes.SCHEDULE_APPOINTMENT, Map.of("appointment_choice", "Monday"));
    }
}
