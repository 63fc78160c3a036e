package dev.leaddispatch.service;

import dev.leaddispatch.channel.ChatGateway;
import dev.leaddispatch.config.OutreachConfig;
import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.entity.Message;
import dev.leaddispatch.exception.InvalidInputException;
import dev.leaddispatch.exception.RecordNotFoundException;
import dev.leaddispatch.metrics.DispatchMetrics;
import dev.leaddispatch.model.MessageChannel;
import dev.leaddispatch.model.MessageStatus;
import dev.leaddispatch.repository.LeadRepository;
import dev.leaddispatch.service.MessageTemplateRenderer.RenderedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutreachServiceTest {

    private static final RenderedMessage CHAT_MESSAGE = new RenderedMessage("Business Inquiry", "Hello", "Hello");
    private static final RenderedMessage EMAIL_MESSAGE =
            new RenderedMessage("Offer", "Dear shop", "Subject: Offer\n\nDear shop");

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private MessageTemplateRenderer renderer;

    @Mock
    private ChatGateway chatGateway;

    @Mock
    private EmailService emailService;

    @Mock
    private MessageLogService messageLogService;

    @Mock
    private DispatchMetrics metrics;

    @Mock
    private AuditLogService auditLogService;

    private OutreachService outreachService;
    private Lead lead;

    @BeforeEach
    void setUp() {
        OutreachConfig config = new OutreachConfig();
        outreachService = new OutreachService(leadRepository, renderer, chatGateway, emailService,
                messageLogService, config, metrics, auditLogService);
        lead = Lead.builder().id(1L).name("Sharma Residency").category("plumbing")
                .phone("+91 98765 43210").email("sharma@example.com").build();
    }

    @Nested
    @DisplayName("Chat")
    class ChatTests {

        @Test
        @DisplayName("Should record a delivered message and the contact")
        void shouldRecordDelivery() {
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));
            when(renderer.render(eq("intro_hindi"), eq(MessageChannel.CHAT), eq("Sharma Residency"), eq("Mumbai"),
                    eq("plumbing"), eq("Team"), anyString())).thenReturn(CHAT_MESSAGE);
            when(chatGateway.isEnabled()).thenReturn(true);
            when(chatGateway.send("+91 98765 43210", "Hello")).thenReturn(Mono.just(true));
            when(messageLogService.recordDelivered(1L, MessageChannel.CHAT, "intro_hindi", "Hello"))
                    .thenReturn(Message.builder().id(9L).build());

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.CHAT, "intro_hindi", "Mumbai", "plumbing", null);

            assertThat(result.isDelivered()).isTrue();
            assertThat(result.messageId()).isEqualTo(9L);
            verify(metrics).recordMessage(MessageChannel.CHAT, MessageStatus.SENT);
        }

        @Test
        @DisplayName("Should keep the message pending when no provider is configured")
        void shouldKeepPending() {
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));
            when(renderer.render(anyString(), any(), anyString(), anyString(), anyString(), anyString(), anyString()))
                    .thenReturn(CHAT_MESSAGE);
            when(chatGateway.isEnabled()).thenReturn(false);
            when(messageLogService.recordUndelivered(1L, MessageChannel.CHAT, "intro_hindi", "Hello",
                    MessageStatus.PENDING)).thenReturn(Message.builder().id(10L).build());

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.CHAT, "intro_hindi", "Mumbai", "plumbing", "Asha");

            assertThat(result.status()).isEqualTo(MessageStatus.PENDING);
            assertThat(result.isDelivered()).isFalse();
            verify(chatGateway, never()).send(anyString(), anyString());
            verify(messageLogService, never()).recordDelivered(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should log a failed delivery without touching the lead")
        void shouldRecordFailure() {
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));
            when(renderer.render(anyString(), any(), anyString(), anyString(), anyString(), anyString(), anyString()))
                    .thenReturn(CHAT_MESSAGE);
            when(chatGateway.isEnabled()).thenReturn(true);
            when(chatGateway.send(anyString(), anyString())).thenReturn(Mono.error(new IllegalStateException("down")));
            when(messageLogService.recordUndelivered(1L, MessageChannel.CHAT, "intro_hindi", "Hello",
                    MessageStatus.FAILED)).thenReturn(Message.builder().id(11L).build());

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.CHAT, "intro_hindi", "Mumbai", "plumbing", "Asha");

            assertThat(result.status()).isEqualTo(MessageStatus.FAILED);
            verify(messageLogService, never()).recordDelivered(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should fail closed for a lead without phone")
        void shouldRejectLeadWithoutPhone() {
            lead.setPhone(null);
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.CHAT, "intro_hindi", "Mumbai", "plumbing", "Asha");

            assertThat(result.status()).isNull();
            assertThat(result.reason()).contains("no phone number");
            verifyNoInteractions(renderer, chatGateway, messageLogService);
        }
    }

    @Nested
    @DisplayName("Email")
    class EmailTests {

        @Test
        @DisplayName("Should send subject and body separately")
        void shouldSendEmail() {
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));
            when(renderer.render(anyString(), any(), anyString(), anyString(), anyString(), anyString(), anyString()))
                    .thenReturn(EMAIL_MESSAGE);
            when(emailService.isEnabled()).thenReturn(true);
            when(emailService.send("sharma@example.com", "Offer", "Dear shop")).thenReturn(Mono.just(true));
            when(messageLogService.recordDelivered(1L, MessageChannel.EMAIL, "intro_english",
                    "Subject: Offer\n\nDear shop")).thenReturn(Message.builder().id(12L).build());

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.EMAIL, "intro_english", "Mumbai", "plumbing", "Asha");

            assertThat(result.isDelivered()).isTrue();
        }

        @Test
        @DisplayName("Should fail closed for a lead without email")
        void shouldRejectLeadWithoutEmail() {
            lead.setEmail("");
            when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));

            OutreachService.OutreachResult result =
                    outreachService.send(1L, MessageChannel.EMAIL, "intro_english", "Mumbai", "plumbing", "Asha");

            assertThat(result.reason()).contains("no email");
            verifyNoInteractions(emailService, messageLogService);
        }
    }

    @Test
    void shouldFailForUnknownLead() {
        when(leadRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> outreachService.send(5L, MessageChannel.CHAT, "intro_hindi", "Mumbai",
                "plumbing", "Team"))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void shouldPropagateUnknownTemplate() {
        when(leadRepository.findById(1L)).thenReturn(Optional.of(lead));
        when(renderer.render(eq("bogus"), any(), anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new InvalidInputException("Unknown template: bogus"));

        assertThatThrownBy(() -> outreachService.send(1L, MessageChannel.CHAT, "bogus", "Mumbai",
                "plumbing", "Team"))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(messageLogService);
    }
}
