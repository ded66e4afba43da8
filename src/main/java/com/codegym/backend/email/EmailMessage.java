package com.codegym.backend.email;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * One outgoing email. The subject comes from the template unless set explicitly.
 */
@Value
@Builder
public class EmailMessage {
    String recipient;
    EmailTemplate template;
    String subjectOverride;
    Map<String, Object> model;

    public String getSubject() {
        return subjectOverride != null ? subjectOverride : template.getSubject();
    }
}
