package com.example.mailagent.integration.gmail;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.integration.ExternalErrors;
import com.example.mailagent.integration.MailboxClient;
import com.example.mailagent.integration.MailboxReceipt;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.integration.ReplyRequest;
import com.example.mailagent.integration.gmail.model.GmailMessage;
import com.example.mailagent.integration.gmail.model.MessageListResponse;
import com.example.mailagent.integration.gmail.model.ModifyMessageRequest;
import com.example.mailagent.integration.gmail.model.SendMessageRequest;
import com.example.mailagent.util.MessageSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Gmail REST v1 adapter for the mailbox side effects: label/move and reply send.
 */
@Service
public class GmailApiClient implements MailboxClient {

    private static final Logger log = LoggerFactory.getLogger(GmailApiClient.class);
    private static final String INBOX = "INBOX";
    private static final String SENT = "SENT";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String accessToken;
    private final String messageIdDomain;

    public GmailApiClient(RestTemplateBuilder restTemplateBuilder, MailAgentProperties properties) {
        Duration timeout = properties.getRetry().getCallTimeout();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
        this.baseUrl = properties.getGmail().getBaseUrl();
        this.accessToken = properties.getGmail().getAccessToken();
        this.messageIdDomain = properties.getGmail().getMessageIdDomain();
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }

    /**
     * Modify Message
     * curl --request POST
     * --url https://gmail.googleapis.com/gmail/v1/users/me/messages/{id}/modify
     * --header 'Authorization: Bearer 123'
     * --data '{ "addLabelIds": ["Label_1"], "removeLabelIds": ["INBOX"] }'
     */
    @Override
    public PortResult<MailboxReceipt> applyLabel(String messageId, String labelId) {
        String url = baseUrl + "/messages/" + messageId + "/modify";
        HttpHeaders headers = createHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<ModifyMessageRequest> entity = new HttpEntity<>(ModifyMessageRequest.builder()
                .addLabelIds(List.of(labelId))
                .removeLabelIds(List.of(INBOX))
                .build(), headers);
        try {
            ResponseEntity<GmailMessage> response = restTemplate.exchange(url, HttpMethod.POST, entity, GmailMessage.class);
            boolean confirmed = isFiled(response.getBody(), labelId);
            log.info("Applied label {} to message {}, confirmed: {}", labelId, messageId, confirmed);
            return PortResult.success(new MailboxReceipt(messageId, confirmed));
        } catch (RuntimeException e) {
            log.warn("Error while applying label {} to message {}: {}", labelId, messageId, e.getMessage());
            return PortResult.failure(ExternalErrors.classify("applyLabel", e));
        }
    }

    /**
     * Get Message
     * curl --request GET
     * --url 'https://gmail.googleapis.com/gmail/v1/users/me/messages/{id}?format=minimal'
     * --header 'Authorization: Bearer 123'
     */
    @Override
    public PortResult<MailboxReceipt> checkLabel(String messageId, String labelId) {
        String url = baseUrl + "/messages/" + messageId + "?format=minimal";
        try {
            ResponseEntity<GmailMessage> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(createHeaders()), GmailMessage.class);
            boolean confirmed = isFiled(response.getBody(), labelId);
            log.debug("Message {} carries label {}: {}", messageId, labelId, confirmed);
            return PortResult.success(new MailboxReceipt(messageId, confirmed));
        } catch (RuntimeException e) {
            log.warn("Error while reading labels of message {}: {}", messageId, e.getMessage());
            return PortResult.failure(ExternalErrors.classify("checkLabel", e));
        }
    }

    private static boolean isFiled(GmailMessage message, String labelId) {
        return message != null && message.getLabelIds() != null
                && message.getLabelIds().contains(labelId)
                && !message.getLabelIds().contains(INBOX);
    }

    /**
     * Send Message
     * curl --request POST
     * --url https://gmail.googleapis.com/gmail/v1/users/me/messages/send
     * --header 'Authorization: Bearer 123'
     * --data '{ "raw": "base64url", "threadId": "string" }'
     */
    @Override
    public PortResult<MailboxReceipt> sendReply(ReplyRequest request) {
        if (request.to() == null || request.to().isBlank()) {
            return PortResult.failure(PortFailure.permanentFailure("Reply " + request.idempotencyKey() + " has no recipient"));
        }
        String url = baseUrl + "/messages/send";
        HttpHeaders headers = createHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String raw = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(composeReply(request).getBytes(StandardCharsets.UTF_8));
        HttpEntity<SendMessageRequest> entity = new HttpEntity<>(SendMessageRequest.builder()
                .raw(raw)
                .threadId(request.threadId())
                .build(), headers);
        try {
            ResponseEntity<GmailMessage> response = restTemplate.exchange(url, HttpMethod.POST, entity, GmailMessage.class);
            GmailMessage sent = response.getBody();
            if (sent == null || sent.getId() == null) {
                return PortResult.failure(PortFailure.permanentFailure("sendReply returned no message id"));
            }
            boolean confirmed = sent.getLabelIds() != null && sent.getLabelIds().contains(SENT);
            log.info("Sent reply {} in thread {} as message {}", request.idempotencyKey(), request.threadId(), sent.getId());
            return PortResult.success(new MailboxReceipt(sent.getId(), confirmed));
        } catch (RuntimeException e) {
            log.warn("Error while sending reply {}: {}", request.idempotencyKey(), e.getMessage());
            return PortResult.failure(ExternalErrors.classify("sendReply", e));
        }
    }

    /**
     * List Messages
     * curl --request GET
     * --url 'https://gmail.googleapis.com/gmail/v1/users/me/messages?q=rfc822msgid:...&includeSpamTrash=true'
     */
    @Override
    public PortResult<Optional<MailboxReceipt>> findReply(String idempotencyKey) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl + "/messages")
                .queryParam("q", "rfc822msgid:" + messageIdFor(idempotencyKey))
                .queryParam("includeSpamTrash", true)
                .encode()
                .build()
                .toUri();
        try {
            ResponseEntity<MessageListResponse> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(createHeaders()), MessageListResponse.class);
            MessageListResponse body = response.getBody();
            if (body == null || body.getMessages() == null || body.getMessages().isEmpty()) {
                return PortResult.success(Optional.empty());
            }
            String existingId = body.getMessages().get(0).getId();
            log.info("Reply {} already present as message {}", idempotencyKey, existingId);
            return PortResult.success(Optional.of(new MailboxReceipt(existingId, true)));
        } catch (RuntimeException e) {
            log.warn("Error while looking up reply {}: {}", idempotencyKey, e.getMessage());
            return PortResult.failure(ExternalErrors.classify("findReply", e));
        }
    }

    /**
     * Message-ID derived from the idempotency key, so a sent reply can be found again after a crash.
     */
    String messageIdFor(String idempotencyKey) {
        return "<" + idempotencyKey.replace(':', '.') + "@" + messageIdDomain + ">";
    }

    String composeReply(ReplyRequest request) {
        String subject = MessageSanitizer.headerValue(request.subject());
        if (!subject.regionMatches(true, 0, "Re:", 0, 3)) {
            subject = "Re: " + subject;
        }
        StringBuilder message = new StringBuilder();
        message.append("To: ").append(MessageSanitizer.headerValue(request.to())).append("\r\n");
        message.append("Subject: ").append(encodeHeader(subject)).append("\r\n");
        message.append("Message-ID: ").append(messageIdFor(request.idempotencyKey())).append("\r\n");
        if (request.inReplyTo() != null && !request.inReplyTo().isBlank()) {
            String inReplyTo = MessageSanitizer.headerValue(request.inReplyTo());
            message.append("In-Reply-To: ").append(inReplyTo).append("\r\n");
            message.append("References: ").append(inReplyTo).append("\r\n");
        }
        message.append("MIME-Version: 1.0\r\n");
        message.append("Content-Type: text/plain; charset=UTF-8\r\n");
        message.append("Content-Transfer-Encoding: base64\r\n");
        message.append("\r\n");
        String body = request.body() == null ? "" : request.body();
        message.append(Base64.getMimeEncoder().encodeToString(body.getBytes(StandardCharsets.UTF_8)));
        message.append("\r\n");
        return message.toString();
    }

    private static String encodeHeader(String value) {
        boolean ascii = value.chars().allMatch(c -> c < 128);
        if (ascii) {
            return value;
        }
        return "=?UTF-8?B?" + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)) + "?=";
    }
}
