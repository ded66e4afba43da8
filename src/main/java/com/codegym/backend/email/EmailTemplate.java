package com.codegym.backend.email;

/**
 * Emails the gym sends. Each entry names a Thymeleaf file under
 * {@code templates/email/} and the subject line it goes out with.
 */
public enum EmailTemplate {

    MEMBER_WELCOME("member-welcome", "Registration confirmed - Code Gym");

    private final String fileName;
    private final String subject;

    EmailTemplate(String fileName, String subject) {
        this.fileName = fileName;
        this.subject = subject;
    }

    public String getFileName() {
        return fileName;
    }

    public String getSubject() {
        return subject;
    }
}
