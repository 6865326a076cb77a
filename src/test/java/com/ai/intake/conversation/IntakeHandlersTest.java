package com.ai.intake.conversation;

import com.ai.intake.flow.FlowResult;
import com.ai.intake.flow.SessionState;
import com.ai.intake.flow.ToolArguments;
import com.ai.intake.flow.ToolInvocationResult;
import com.ai.intake.service.AddressValidation;
import com.ai.intake.service.AddressValidationException;
import com.ai.intake.service.AddressValidator;
import com.ai.intake.service.AppointmentConfirmation;
import com.ai.intake.service.AppointmentNotifier;
import com.ai.intake.service.DateConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntakeHandlersTest {

    // Monday
    private static final Clock TODAY = Clock.fixed(
            LocalDate.of(2026, 10, 19).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);

    private AddressValidator addressValidator;
    private AppointmentNotifier notifier;
    private DateConverter dateConverter;
    private IntakeHandlers handlers;
    private SessionState state;

    @BeforeEach
    void setUp() {
        addressValidator = mock(AddressValidator.class);
        notifier = mock(AppointmentNotifier.class);
        dateConverter = new DateConverter(TODAY);
        handlers = new IntakeNodes(addressValidator, dateConverter, notifier, new AppointmentChoiceClassifier()).handlers();
        state = new SessionState();
    }

    @Test
    void invalidAddressGoesToRetryNodeWithEmptyAddress() {
        when(addressValidator.validate("Main Street")).thenReturn(AddressValidation.invalid("Address not found."));

        ToolInvocationResult result = handlers.collectAddress(args("address", "Main Street"), state);

        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.ADDRESS_RETRY);
        assertThat(result.getNextNode().getToolNames()).containsExactly(IntakeNodes.COLLECT_ADDRESS);
        assertThat(result.getResult().getString("address")).isEmpty();
        assertThat(state.getAddress()).isNull();
        assertThat(state.getAddressValidationError()).isEqualTo("Address not found.");
    }

    @Test
    void validAddressStoresCanonicalForm() {
        when(addressValidator.validate("1600 amphitheatre")).thenReturn(AddressValidation.valid(
                "1600 Amphitheatre Pkwy, Mountain View, CA 94043, USA", Map.of("place_id", "abc")));

        ToolInvocationResult result = handlers.collectAddress(args("address", "1600 amphitheatre"), state);

        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.CONTACT_INFO);
        assertThat(state.getAddress()).isEqualTo("1600 Amphitheatre Pkwy, Mountain View, CA 94043, USA");
        assertThat(state.getAddressDetails()).containsEntry("place_id", "abc");
    }

    @Test
    void validatorOutageAcceptsAddressAsSpoken() {
        when(addressValidator.validate(any())).thenThrow(new AddressValidationException("Geocoding request failed"));

        ToolInvocationResult result = handlers.collectAddress(args("address", "12 Elm St, Springfield"), state);

        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.CONTACT_INFO);
        assertThat(state.getAddress()).isEqualTo("12 Elm St, Springfield");
    }

    @Test
    void schedulingConvertsSlotAndSendsConfirmation() {
        state.setName("Jane Doe");
        state.setEmail("jane@example.com");
        when(notifier.sendAppointmentConfirmation(any())).thenReturn(true);

        ToolInvocationResult result = handlers.scheduleAppointment(args("appointment_choice", "tomorrow works"), state);

        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.END);
        assertThat(result.getResult().getType()).isEqualTo(FlowResult.Type.APPOINTMENT_SCHEDULED);
        assertThat(state.getSelectedAppointment()).isEqualTo("tomorrow at 3pm");
        assertThat(state.getConvertedAppointment()).isEqualTo("October 20, 2026 at 3:00 PM");

        ArgumentCaptor<AppointmentConfirmation> sent = ArgumentCaptor.forClass(AppointmentConfirmation.class);
        verify(notifier).sendAppointmentConfirmation(sent.capture());
        assertThat(sent.getValue().getPatientName()).isEqualTo("Jane Doe");
        assertThat(sent.getValue().getPatientEmail()).isEqualTo("jane@example.com");
        assertThat(sent.getValue().getAppointmentTime()).isEqualTo("October 20, 2026 at 3:00 PM");
        assertThat(sent.getValue().getAddress()).isEqualTo("Not provided");
    }

    @Test
    void customTimeIsKeptWhenNothingOfferedWorks() {
        ToolInvocationResult result = handlers.scheduleAppointment(
                args("appointment_choice", "none work", "custom_time", "Friday at 2pm"), state);

        assertThat(state.getSelectedAppointment()).isEqualTo("Friday at 2pm");
        assertThat(state.getConvertedAppointment()).isEqualTo("October 23, 2026 at 2:00 PM");
        assertThat(result.getResult().getString("custom_time")).isEqualTo("Friday at 2pm");
    }

    @Test
    void notificationFailureDoesNotStopTheFlow() {
        when(notifier.sendAppointmentConfirmation(any())).thenThrow(new IllegalStateException("smtp down"));

        ToolInvocationResult result = handlers.scheduleAppointment(args("appointment_choice", "Wednesday"), state);

        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.END);
        assertThat(state.getConvertedAppointment()).isEqualTo("October 21, 2026 at 11:00 AM");
    }

    @Test
    void referralIsRecordedAsDoctorName() {
        ToolInvocationResult result = handlers.collectReferral(args("referral", "Dr. Adams"), state);

        assertThat(state.getReferralDoctor()).isEqualTo("Dr. Adams");
        assertThat(result.getResult().getString("referral_doctor")).isEqualTo("Dr. Adams");
        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.CHIEF_COMPLAINT);
    }

    @Test
    void contactInfoDefaultsEmailToEmpty() {
        ToolInvocationResult result = handlers.collectContactInfo(args("phone_number", "555-0100"), state);

        assertThat(state.getEmail()).isEmpty();
        assertThat(result.getNextNode().getName()).isEqualTo(IntakeNodes.APPOINTMENT_SCHEDULING);
    }

    private static ToolArguments args(String... keyValues) {
        Map<String, String> values = new java.util.LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return ToolArguments.of(values);
    }
}
