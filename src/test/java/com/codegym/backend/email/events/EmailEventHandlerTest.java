package com.codegym.backend.email.events;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.codegym.backend.email.EmailMessage;
import com.codegym.backend.email.EmailService;
import com.codegym.backend.email.EmailTemplate;

@ExtendWith(MockitoExtension.class)
class EmailEventHandlerTest {

    @Mock
    private EmailService emailService;

    @InjectMocks
    private EmailEventHandler handler;

    private static MemberRegisteredEvent event() {
        return new MemberRegisteredEvent(
                UUID.randomUUID(),
                "Nguyen Van An",
                "an@example.com",
                "3 Months",
                3,
                new BigDecimal("1200000"),
                LocalDate.of(2024, 4, 15)
        );
    }

    @Test
    void onMemberRegistered_sendsWelcomeEmailWithFormattedValues() {
        handler.onMemberRegistered(event());

        ArgumentCaptor<EmailMessage> captor = ArgumentCaptor.forClass(EmailMessage.class);
        verify(emailService).send(captor.capture());

        EmailMessage message = captor.getValue();
        assertEquals("an@example.com", message.getRecipient());
        assertEquals("Registration confirmed - Code Gym", message.getSubject());
        assertEquals(EmailTemplate.MEMBER_WELCOME, message.getTemplate());
        assertEquals("1,200,000 VND", message.getModel().get("amount"));
        assertEquals("15/04/2024", message.getModel().get("activeUntil"));
        assertEquals(3, message.getModel().get("durationMonths"));
    }

    @Test
    void onMemberRegistered_providerFailure_isNotPropagated() {
        doThrow(new IllegalStateException("email.resend.api-key is not configured"))
                .when(emailService).send(any(EmailMessage.class));

        assertDoesNotThrow(() -> handler.onMemberRegistered(event()));
    }
}
