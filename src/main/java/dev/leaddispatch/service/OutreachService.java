package dev.leaddispatch.service;

import dev.leaddispatch.channel.ChatGateway;
import dev.leaddispatch.config.OutreachConfig;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.metrics.DispatchMetrics;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.MessageStatus;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.service.MessageTemplateRenderer.RenderedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Sends templated chat and email messages to leads and reports the outcome
 * back to the store.
 * <p>
 * Only a delivered message changes the lead. Undeliverable messages are
 * logged as pending (channel not configured) or failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutreachService {

    private final LeadRepository leadRepository;
    private final MessageTemplateRenderer renderer;
    private final ChatGateway chatGateway;
    private final EmailService emailService;
    private final MessageLogService messageLogService;
    private final OutreachConfig outreachConfig;
    private final DispatchMetrics metrics;
    private final AuditLogService auditLogService;

    /**
     * Outcome of a single send.
     */
    public record OutreachResult(MessageStatus status, Long messageId, String reason) {

        public static OutreachResult rejected(String reason) {
            return new OutreachResult(null, null, reason);
        }

        public boolean isDelivered() {
            return status == MessageStatus.SENT;
        }
    }

    public OutreachResult send(Long leadId, MessageChannel channel, String templateKey,
                               String city, String service, String sender) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> RecordNotFoundException.lead(leadId));

        if (channel == MessageChannel.CHAT && !lead.hasPhone()) {
            return reject(leadId, "Lead " + leadId + " has no phone number. Add phone or use email.");
        }
        if (channel == MessageChannel.EMAIL && !lead.hasEmail()) {
            return reject(leadId, "Lead " + leadId + " has no email. Add email or use chat.");
        }

        String senderName = sender == null || sender.isBlank() ? outreachConfig.getDefaultSender() : sender;
        RenderedMessage message = renderer.render(templateKey, channel, lead.getName(), city, service,
                senderName, outreachConfig.getSenderPhone());

        boolean enabled = channel == MessageChannel.CHAT ? chatGateway.isEnabled() : emailService.isEnabled();
        if (!enabled) {
            log.warn("{} channel not configured, message to lead {} kept as pending", channel, leadId);
            return record(lead, channel, templateKey, message, MessageStatus.PENDING,
                    channel + " channel not configured");
        }

        Boolean delivered = deliver(lead, channel, message);
        if (!Boolean.TRUE.equals(delivered)) {
            auditLogService.error(component(channel), "Send failed for lead " + leadId);
            return record(lead, channel, templateKey, message, MessageStatus.FAILED, "Delivery failed");
        }

        log.info("{} message sent to lead {} ({})", channel, leadId, lead.getName());
        auditLogService.info(component(channel), "Message sent to lead " + leadId);
        return record(lead, channel, templateKey, message, MessageStatus.SENT, null);
    }

    private Boolean deliver(Lead lead, MessageChannel channel, RenderedMessage message) {
        try {
            return channel == MessageChannel.CHAT
                    ? chatGateway.send(lead.getPhone(), message.content()).block()
                    : emailService.send(lead.getEmail(), message.subject(), message.body()).block();
        } catch (RuntimeException e) {
            log.error("{} delivery to lead {} failed: {}", channel, lead.getId(), e.getMessage());
            return false;
        }
    }

    private OutreachResult record(Lead lead, MessageChannel channel, String templateKey, RenderedMessage message,
                                  MessageStatus status, String reason) {
        Long messageId = status == MessageStatus.SENT
                ? messageLogService.recordDelivered(lead.getId(), channel, templateKey, message.content()).getId()
                : messageLogService.recordUndelivered(lead.getId(), channel, templateKey, message.content(), status)
                        .getId();
        metrics.recordMessage(channel, status);
        return new OutreachResult(status, messageId, reason);
    }

    private OutreachResult reject(Long leadId, String reason) {
        log.warn(reason);
        return OutreachResult.rejected(reason);
    }

    private String component(MessageChannel channel) {
        return channel.name().toLowerCase(Locale.ROOT);
    }
}
