package com.ai.intake.conversation;

import com.ai.intake.flow.NodeConfig;
import com.ai.intake.flow.PostAction;
import com.ai.intake.flow.PromptMessage;
import com.ai.intake.flow.ToolBinding;
import com.ai.intake.flow.ToolParameter;
import com.ai.intake.flow.ToolSchema;
import com.ai.intake.service.AddressValidator;
import com.ai.intake.service.AppointmentNotifier;
import com.ai.intake.service.DateConverter;
import org.springframework.stereotype.Component;

/**
 * The intake conversation graph:
 * <pre>
 * initial -> date_of_birth -> insurance -> referral -> chief_complaint
 *         -> address [-> address_retry ...] -> contact_info
 *         -> appointment_scheduling -> end
 * </pre>
 * Each method builds a fresh, immutable node. Building a node does no I/O and
 * cannot fail.
 */
@Component
public class IntakeNodes {

    public static final String INITIAL = "initial";
    public static final String DATE_OF_BIRTH = "date_of_birth";
    public static final String INSURANCE = "insurance";
    public static final String REFERRAL = "referral";
    public static final String CHIEF_COMPLAINT = "chief_complaint";
    public static final String ADDRESS = "address";
    public static final String ADDRESS_RETRY = "address_retry";
    public static final String CONTACT_INFO = "contact_info";
    public static final String APPOINTMENT_SCHEDULING = "appointment_scheduling";
    public static final String END = "end";

    public static final String COLLECT_NAME = "collect_name";
    public static final String COLLECT_DATE_OF_BIRTH = "collect_date_of_birth";
    public static final String COLLECT_INSURANCE = "collect_insurance";
    public static final String COLLECT_REFERRAL = "collect_referral";
    public static final String COLLECT_CHIEF_COMPLAINT = "collect_chief_complaint";
    public static final String COLLECT_ADDRESS = "collect_address";
    public static final String COLLECT_CONTACT_INFO = "collect_contact_info";
    public static final String SCHEDULE_APPOINTMENT = "schedule_appointment";
    public static final String END_QUOTE = "end_quote";

    private final IntakeHandlers handlers;

    public IntakeNodes(AddressValidator addressValidator,
                       DateConverter dateConverter,
                       AppointmentNotifier appointmentNotifier,
                       AppointmentChoiceClassifier choiceClassifier) {
        this.handlers = new IntakeHandlers(this, addressValidator, dateConverter, appointmentNotifier, choiceClassifier);
    }

    IntakeHandlers handlers() {
        return handlers;
    }

    public NodeConfig initialNode() {
        return NodeConfig.builder()
                .name(INITIAL)
                .roleMessage(PromptMessage.system(
                        "You are a friendly medical agent. Your responses will be converted to audio, "
                                + "so avoid special characters. Always use the available functions to progress "
                                + "the conversation naturally. Introduce yourself as Dr. Smith's medical AI "
                                + "assistant, that's it. Do not ask for the patient's name yet."))
                .taskMessage(PromptMessage.system(
                        "Do not introduce yourself twice. Start by asking how they are doing today, "
                                + "wait for them to respond, then ask for their name."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(COLLECT_NAME)
                        .description("Record customer's name")
                        .parameter("name", ToolParameter.requiredString())
                        .build(), handlers::collectName))
                .build();
    }

    public NodeConfig dateOfBirthNode() {
        return NodeConfig.builder()
                .name(DATE_OF_BIRTH)
                .taskMessage(PromptMessage.system("Ask about the customer's date of birth."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(COLLECT_DATE_OF_BIRTH)
                        .description("Record date of birth")
                        .parameter("date_of_birth", ToolParameter.builder().required(true).format("date").build())
                        .build(), handlers::collectDateOfBirth))
                .build();
    }

    public NodeConfig insuranceNode() {
        return NodeConfig.builder()
                .name(INSURANCE)
                .taskMessage(PromptMessage.system("Ask about the customer's insurance information: "
                        + "the insurance company name and the member or payer ID."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(COLLECT_INSURANCE)
                        .description("Record insurance information")
                        .parameter("payer_name", ToolParameter.requiredString())
                        .parameter("payID", ToolParameter.requiredString())
                        .build(), handlers::collectInsurance))
                .build();
    }

    /**
     * The one branch point: the caller either names a referring doctor or goes
     * straight to why they are calling.
     */
    public NodeConfig referralNode() {
        return NodeConfig.builder()
                .name(REFERRAL)
                .taskMessage(PromptMessage.system("Ask about the customer's referral information. "
                        + "Wait for the customer to answer whether they have a referral or not. "
                        + "Record the referral name if they say so. "
                        + "If they say they do not have a referral, ask about their chief complaint."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(COLLECT_REFERRAL)
                        .description("Record referral information")
                        .parameter("referral", ToolParameter.builder().required(true)
                                .description("Name of the referring doctor").build())
                        .build(), handlers::collectReferral))
                .tool(chiefComplaintTool())
                .build();
    }

    public NodeConfig chiefComplaintNode() {
        return NodeConfig.builder()
                .name(CHIEF_COMPLAINT)
                .taskMessage(PromptMessage.system("Ask about the reason the customer is calling in today - "
                        + "their chief complaint or main concern."))
                .tool(chiefComplaintTool())
                .build();
    }

    public NodeConfig addressNode() {
        return NodeConfig.builder()
                .name(ADDRESS)
                .taskMessage(PromptMessage.system("Ask for the customer's address. "
                        + "Make sure you have the street number, street name, city, state and zip code, "
                        + "and ask for clarification if it seems incomplete."))
                .tool(addressTool("Record the patient's address"))
                .build();
    }

    /**
     * Re-asks for the address after the validator rejected it, with the reason
     * baked into the prompt.
     */
    public NodeConfig addressRetryNode(String errorReason) {
        String reason = errorReason == null ? "" : errorReason.trim();
        return NodeConfig.builder()
                .name(ADDRESS_RETRY)
                .taskMessage(PromptMessage.system("The address provided could not be validated. " + reason
                        + " Please ask the customer to provide their complete address again, including "
                        + "street number, street name, city, state, and zip code."))
                .tool(addressTool("Record the patient's address after retry"))
                .build();
    }

    public NodeConfig contactInfoNode() {
        return NodeConfig.builder()
                .name(CONTACT_INFO)
                .taskMessage(PromptMessage.system("Ask for the customer's contact information. "
                        + "Phone number is required, but email is optional. "
                        + "Make sure to get a valid phone number format."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(COLLECT_CONTACT_INFO)
                        .description("Record the patient's contact information")
                        .parameter("phone_number", ToolParameter.requiredString())
                        .parameter("email", ToolParameter.optionalString())
                        .build(), handlers::collectContactInfo))
                .build();
    }

    public NodeConfig appointmentSchedulingNode() {
        return NodeConfig.builder()
                .name(APPOINTMENT_SCHEDULING)
                .taskMessage(PromptMessage.system("Offer the patient available appointment times with Dr. Smith: "
                        + "tomorrow at 3pm, next Monday at 10am, or next Wednesday at 11am. "
                        + "Ask which time works best for them. If they say nothing works, ask when they are available. "
                        + "If they say anything works, offer tomorrow at 3pm. "
                        + "If they give multiple options, pick the first one mentioned. "
                        + "Do not tell the patient about converting the time to a calendar date."))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(SCHEDULE_APPOINTMENT)
                        .description("Schedule an appointment based on patient preference")
                        .parameter("appointment_choice", ToolParameter.requiredString())
                        .parameter("custom_time", ToolParameter.optionalString())
                        .build(), handlers::scheduleAppointment))
                .tool(new ToolBinding(ToolSchema.builder()
                        .name(END_QUOTE)
                        .description("Complete the intake without scheduling an appointment")
                        .build(), handlers::endQuote))
                .build();
    }

    public NodeConfig endNode() {
        return NodeConfig.builder()
                .name(END)
                .taskMessage(PromptMessage.system("Thank the customer for their time and end the conversation. "
                        + "Mention that an email has been sent to confirm their appointment, "
                        + "and mention the appointment date and time if one was scheduled."))
                .postAction(PostAction.END_CONVERSATION)
                .build();
    }

    private ToolBinding chiefComplaintTool() {
        return new ToolBinding(ToolSchema.builder()
                .name(COLLECT_CHIEF_COMPLAINT)
                .description("Record the patient's chief complaint or reason for visit")
                .parameter("chief_complaint", ToolParameter.requiredString())
                .build(), handlers::collectChiefComplaint);
    }

    private ToolBinding addressTool(String description) {
        return new ToolBinding(ToolSchema.builder()
                .name(COLLECT_ADDRESS)
                .description(description)
                .parameter("address", ToolParameter.requiredString())
                .build(), handlers::collectAddress);
    }
}
