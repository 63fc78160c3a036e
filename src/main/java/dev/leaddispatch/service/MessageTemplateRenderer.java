package dev.leaddispatch.service;

import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.model.MessageChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.util.Locale;
import java.util.Set;

/**
 * Renders outreach messages from the text templates under
 * {@code templates/outreach/<key>/<channel>.txt}.
 */
@Service
@RequiredArgsConstructor
public class MessageTemplateRenderer {

    public static final Set<String> TEMPLATE_KEYS =
            Set.of("intro_english", "intro_hindi", "followup_english", "followup_hindi");

    static final String DEFAULT_SUBJECT = "Business Inquiry";
    private static final String SUBJECT_PREFIX = "Subject:";

    private final TemplateEngine templateEngine;
    private final InputValidator validator;

    /**
     * A rendered message. {@code content} is the full template output as
     * stored in the message log; {@code body} excludes the subject line.
     */
    public record RenderedMessage(String subject, String body, String content) {
    }

    public RenderedMessage render(String templateKey, MessageChannel channel, String businessName,
                                  String city, String service, String sender, String phone) {
        if (templateKey == null || !TEMPLATE_KEYS.contains(templateKey)) {
            throw new InvalidInputException("Unknown template: " + templateKey);
        }

        String name = validator.sanitize(businessName, 100);
        Context context = new Context(Locale.ROOT);
        context.setVariable("businessName", name.isEmpty() ? "Sir/Madam" : name);
        context.setVariable("city", validator.sanitize(city, 50));
        context.setVariable("service", validator.sanitize(service, 50));
        context.setVariable("sender", validator.sanitize(sender, 50));
        context.setVariable("phone", validator.sanitize(phone, 20));

        String content = templateEngine.process("outreach/" + templateKey + "/" + channel.templateName(), context);
        return split(content.strip());
    }

    private RenderedMessage split(String content) {
        if (!content.startsWith(SUBJECT_PREFIX)) {
            return new RenderedMessage(DEFAULT_SUBJECT, content, content);
        }
        int lineEnd = content.indexOf('\n');
        if (lineEnd < 0) {
            return new RenderedMessage(content.substring(SUBJECT_PREFIX.length()).strip(), "", content);
        }
        String subject = content.substring(SUBJECT_PREFIX.length(), lineEnd).strip();
        String body = content.substring(lineEnd + 1).strip();
        return new RenderedMessage(subject, body, content);
    }
}
