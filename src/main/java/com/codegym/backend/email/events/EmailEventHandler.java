package com.codegym.backend.email.events;

import java.time.format.DateTimeFormatter;
import java.util.Map;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import com.codegym.backend.config.AsyncExecutorConfig;
import com.codegym.backend.email.EmailMessage;
import com.codegym.backend.email.EmailService;
import com.codegym.backend.email.EmailTemplate;
import com.codegym.backend.services.util.CurrencyFormatter;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class EmailEventHandler {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final EmailService emailService;

    public EmailEventHandler(EmailService emailService) {
        this.emailService = emailService;
    }

    // runs after commit so a rolled back registration never sends mail
    @Async(AsyncExecutorConfig.NOTIFICATION_EXECUTOR)
    @TransactionalEventListener(fallbackExecution = true)
    public void onMemberRegistered(MemberRegisteredEvent event) {
        EmailMessage message = EmailMessage.builder()
                .recipient(event.email())
                .template(EmailTemplate.MEMBER_WELCOME)
                .model(Map.of(
                        "fullName", event.fullName(),
                        "packageName", event.packageName(),
                        "durationMonths", event.durationMonths(),
                        "amount", CurrencyFormatter.formatVnd(event.amount()),
                        "activeUntil", event.activeUntil().format(DATE_FORMAT)
                ))
                .build();

        try {
            emailService.send(message);
        } catch (RuntimeException e) {
            log.warn("Registration email to {} for member {} failed: {}",
                    event.email(), event.memberId(), e.getMessage());
        }
    }
}
