package com.codegym.backend.email.template;

import java.util.Map;

import com.codegym.backend.email.EmailTemplate;

public interface TemplateRenderer {

    /**
     * @return the HTML body of {@code template} filled with {@code model}
     */
    String renderHtml(EmailTemplate template, Map<String, Object> model);
}
