package com.codegym.backend.email.template;

import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import com.codegym.backend.email.EmailTemplate;

@Component
public class ThymeleafTemplateRenderer implements TemplateRenderer {

    private static final Locale VIETNAM = new Locale("vi", "VN");

    private final TemplateEngine templateEngine;

    public ThymeleafTemplateRenderer(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    @Override
    public String renderHtml(EmailTemplate template, Map<String, Object> model) {
        Context context = new Context(VIETNAM);
        if (model != null) {
            model.forEach(context::setVariable);
        }
        return templateEngine.process("email/" + template.getFileName(), context);
    }
}
