package com.codegym.backend.email;

public interface EmailService {

    /**
     * Renders the message template and hands it to the delivery provider.
     * Provider failures surface as runtime exceptions.
     */
    void send(EmailMessage message);
}
