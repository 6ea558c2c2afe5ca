package ru.panic.orderautomationbot.service;

import lombok.Value;

@Value
public class SupportTicketResult {
    boolean success;

    // empty when the site did not report it
    String ticketId;

    public static SupportTicketResult failed() {
        return new SupportTicketResult(false, "");
    }
}
