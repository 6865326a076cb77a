package com.ai.intake.service;

public interface AppointmentNotifier {

    /**
     * @return true if the confirmation was handed off for delivery
     */
    boolean sendAppointmentConfirmation(AppointmentConfirmation confirmation);
}
