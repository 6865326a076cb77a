package com.ai.intake.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;

/**
 * Emails an appointment confirmation to the office inbox and, when the caller
 * gave one, to the patient.
 */
@Service
public class EmailAppointmentNotifier implements AppointmentNotifier {

    private static final Logger log = LoggerFactory.getLogger(EmailAppointmentNotifier.class);

    private static final String NOT_PROVIDED = "Not provided";

    private final JavaMailSender mailSender;
    private final String officeRecipient;
    private final String senderEmail;
    private final String senderName;
    private final String officePhone;
    private final String officeEmail;

    public EmailAppointmentNotifier(JavaMailSender mailSender,
                                    @Value("${intake.notification.recipient:}") String officeRecipient,
                                    @Value("${intake.notification.sender:}") String senderEmail,
                                    @Value("${intake.notification.sender-name:Dr. Smith's Medical Office}") String senderName,
                                    @Value("${intake.notification.office-phone:(555) 123-4567}") String officePhone,
                                    @Value("${intake.notification.office-email:office@drsmith.com}") String officeEmail) {
        this.mailSender = mailSender;
        this.officeRecipient = officeRecipient;
        this.senderEmail = senderEmail;
        this.senderName = senderName;
        this.officePhone = officePhone;
        this.officeEmail = officeEmail;
    }

    @Override
    public boolean sendAppointmentConfirmation(AppointmentConfirmation confirmation) {
        List<String> recipients = recipients(confirmation);
        if (recipients.isEmpty()) {
            log.warn("No recipient configured for appointment confirmation; set intake.notification.recipient");
            return false;
        }
        if (StringUtils.isBlank(senderEmail)) {
            log.warn("intake.notification.sender is not set; skipping appointment confirmation");
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(senderEmail, senderName);
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject("Appointment Confirmation - " + senderName);
            helper.setText(textBody(confirmation), htmlBody(confirmation));
            mailSender.send(message);
            log.info("Appointment confirmation sent to {} for {} at {}",
                    recipients, confirmation.getPatientName(), confirmation.getAppointmentTime());
            return true;
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.error("Failed to send appointment confirmation for {}", confirmation.getPatientName(), e);
            return false;
        }
    }

    private List<String> recipients(AppointmentConfirmation confirmation) {
        List<String> recipients = new ArrayList<>();
        if (StringUtils.isNotBlank(officeRecipient)) {
            recipients.add(officeRecipient.trim());
        }
        if (StringUtils.isNotBlank(confirmation.getPatientEmail())) {
            recipients.add(confirmation.getPatientEmail().trim());
        }
        return recipients;
    }

    String textBody(AppointmentConfirmation c) {
        return "Dear " + value(c.getPatientName()) + ",\n\n"
                + "Thank you for scheduling your appointment with " + senderName + ".\n\n"
                + "APPOINTMENT CONFIRMATION\n"
                + "========================\n\n"
                + "Patient: " + value(c.getPatientName()) + "\n"
                + "Date of Birth: " + value(c.getDateOfBirth()) + "\n"
                + "Appointment Time: " + value(c.getAppointmentTime()) + "\n"
                + "Address: " + value(c.getAddress()) + "\n"
                + "Phone: " + value(c.getPhoneNumber()) + "\n"
                + "Insurance: " + value(c.getInsurance()) + "\n"
                + "Reason for Visit: " + value(c.getChiefComplaint()) + "\n\n"
                + "IMPORTANT REMINDERS:\n"
                + "- Please arrive 15 minutes early for check-in\n"
                + "- Bring a valid photo ID and insurance card\n"
                + "- Bring a list of current medications\n"
                + "- If you need to cancel or reschedule, please call us at least 24 hours in advance\n\n"
                + "Best regards,\n"
                + senderName + "\n"
                + "Phone: " + officePhone + "\n"
                + "Email: " + officeEmail + "\n\n"
                + "This is an automated message. Please do not reply to this email.\n";
    }

    String htmlBody(AppointmentConfirmation c) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body style=\"font-family: Arial, sans-serif; line-height: 1.6; color: #333;\">");
        html.append("<h2 style=\"color: #2c5aa0;\">Appointment Confirmation</h2>");
        html.append("<p>Dear <strong>").append(escape(c.getPatientName())).append("</strong>,</p>");
        html.append("<p>Thank you for scheduling your appointment with ").append(escape(senderName)).append(".</p>");
        html.append("<table style=\"width: 100%; border-collapse: collapse;\">");
        row(html, "Patient", c.getPatientName());
        row(html, "Date of Birth", c.getDateOfBirth());
        row(html, "Appointment Time", c.getAppointmentTime());
        row(html, "Address", c.getAddress());
        row(html, "Phone", c.getPhoneNumber());
        row(html, "Insurance", c.getInsurance());
        row(html, "Reason for Visit", c.getChiefComplaint());
        html.append("</table>");
        html.append("<h4>Important Reminders:</h4><ul>");
        html.append("<li>Please arrive 15 minutes early for check-in</li>");
        html.append("<li>Bring a valid photo ID and insurance card</li>");
        html.append("<li>Bring a list of current medications</li>");
        html.append("<li>If you need to cancel or reschedule, please call us at least 24 hours in advance</li>");
        html.append("</ul>");
        html.append("<p><strong>").append(escape(senderName)).append("</strong><br/>");
        html.append("Phone: ").append(escape(officePhone)).append("<br/>");
        html.append("Email: ").append(escape(officeEmail)).append("</p>");
        html.append("<p style=\"font-size: 12px; color: #666;\">This is an automated message. Please do not reply to this email.</p>");
        html.append("</body></html>");
        return html.toString();
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><td style=\"padding: 8px 0;\"><strong>").append(label).append(":</strong></td>")
                .append("<td style=\"padding: 8px 0;\">").append(escape(value)).append("</td></tr>");
    }

    private static String escape(String value) {
        return HtmlUtils.htmlEscape(value(value));
    }

    private static String value(String value) {
        return StringUtils.isBlank(value) ? NOT_PROVIDED : value;
    }
}
