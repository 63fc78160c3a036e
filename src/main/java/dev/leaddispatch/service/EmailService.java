package dev.leaddispatch.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Sends plain-text outreach emails over SMTP.
 */
@Slf4j
@Service
public class EmailService {

    private final JavaMailSender mailSender;
    private final String mailHost;
    private final String fromEmail;

    public EmailService(ObjectProvider<JavaMailSender> mailSender,
                        @Value("${spring.mail.host:}") String mailHost,
                        @Value("${outreach.email-from:}") String fromEmail) {
        this.mailSender = mailSender.getIfAvailable();
        this.mailHost = mailHost;
        this.fromEmail = fromEmail;
    }

    /**
     * SMTP is usable only when a host is configured.
     */
    public boolean isEnabled() {
        return mailSender != null && mailHost != null && !mailHost.isBlank();
    }

    /**
     * Send one email.
     *
     * @return Mono<Boolean> indicating success or failure
     */
    @SuppressWarnings("null")
    public Mono<Boolean> send(String to, String subject, String body) {
        if (mailSender == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");

                if (fromEmail != null && !fromEmail.isBlank()) {
                    helper.setFrom(fromEmail);
                }
                helper.setTo(to);
                helper.setSubject(subject);
                helper.setText(body, false);

                mailSender.send(message);
                log.info("Email sent successfully to {}", to);
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send email to {}: {}", to, e.getMessage());
                return false;
            }
        });
    }
}
