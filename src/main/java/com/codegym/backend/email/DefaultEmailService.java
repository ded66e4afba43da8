package com.codegym.backend.email;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.codegym.backend.email.provider.EmailProviderClient;
import com.codegym.backend.email.template.TemplateRenderer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class DefaultEmailService implements EmailService {

    private final EmailProviderClient providerClient;
    private final TemplateRenderer templateRenderer;

    @Value("${email.enabled:true}")
    private boolean enabled;

    @Value("${email.from:Code Gym <no-reply@codegym.local>}")
    private String from;

    public DefaultEmailService(EmailProviderClient providerClient, TemplateRenderer templateRenderer) {
        this.providerClient = providerClient;
        this.templateRenderer = templateRenderer;
    }

    @Override
    public void send(EmailMessage message) {
        if (!enabled) {
            log.debug("Email disabled, skipping {} to {}", message.getTemplate(), message.getRecipient());
            return;
        }

        String html = templateRenderer.renderHtml(message.getTemplate(), message.getModel());
        providerClient.sendHtml(message.getRecipient(), from, message.getSubject(), html);
        log.info("{} email sent to {}", message.getTemplate(), message.getRecipient());
    }
}
