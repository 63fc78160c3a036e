package dev.leaddispatch.service;

import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Message;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.MessageStatus;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Appends outreach attempts to the message log.
 */
@Service
@RequiredArgsConstructor
public class MessageLogService {

    private final MessageRepository messageRepository;
    private final LeadRepository leadRepository;
    private final Clock clock;

    /**
     * Log a delivered message and record the contact on the lead, in one
     * transaction.
     */
    @Transactional
    public Message recordDelivered(Long leadId, MessageChannel channel, String template, String content) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> RecordNotFoundException.lead(leadId));
        LocalDateTime now = LocalDateTime.now(clock);

        Message message = messageRepository.save(Message.builder()
                .lead(lead)
                .channel(channel)
                .template(template)
                .content(content)
                .status(MessageStatus.SENT)
                .sentAt(now)
                .build());

        lead.recordContact(now);
        leadRepository.save(lead);
        return message;
    }

    /**
     * Log a message that was not delivered. The lead is left untouched.
     */
    @Transactional
    public Message recordUndelivered(Long leadId, MessageChannel channel, String template, String content,
                                     MessageStatus status) {
        if (status == MessageStatus.SENT) {
            throw new IllegalArgumentException("Delivered messages must go through recordDelivered");
        }
        Lead lead = leadRepository.findById(leadId).orElseThrow(() -> RecordNotFoundException.lead(leadId));
        return messageRepository.save(Message.builder()
                .lead(lead)
                .channel(channel)
                .template(template)
                .content(content)
                .status(status)
                .sentAt(LocalDateTime.now(clock))
                .build());
    }
}
