package com.codegym.backend.email;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.codegym.backend.email.provider.EmailProviderClient;
import com.codegym.backend.email.template.TemplateRenderer;

@ExtendWith(MockitoExtension.class)
class DefaultEmailServiceTest {

    @Mock
    private EmailProviderClient providerClient;

    @Mock
    private TemplateRenderer templateRenderer;

    @InjectMocks
    private DefaultEmailService emailService;

    private static EmailMessage welcome() {
        return EmailMessage.builder()
                .recipient("an@example.com")
                .template(EmailTemplate.MEMBER_WELCOME)
                .model(Map.of("fullName", "Nguyen Van An"))
                .build();
    }

    @Test
    void send_enabled_rendersAndDelivers() {
        ReflectionTestUtils.setField(emailService, "enabled", true);
        ReflectionTestUtils.setField(emailService, "from", "Code Gym <no-reply@codegym.local>");
        when(templateRenderer.renderHtml(EmailTemplate.MEMBER_WELCOME, Map.of("fullName", "Nguyen Van An"))).thenReturn("<p>hi</p>");

        emailService.send(welcome());

        verify(providerClient).sendHtml("an@example.com", "Code Gym <no-reply@codegym.local>",
                "Registration confirmed - Code Gym", "<p>hi</p>");
    }

    @Test
    void send_disabled_doesNothing() {
        ReflectionTestUtils.setField(emailService, "enabled", false);

        emailService.send(welcome());

        verify(templateRenderer, never()).renderHtml(any(), any());
        verify(providerClient, never()).sendHtml(any(), any(), any(), any());
    }
}
