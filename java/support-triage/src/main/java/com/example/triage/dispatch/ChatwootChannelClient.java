package com.example.triage.dispatch;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.example.triage.config.ChannelProperties;
import com.example.triage.error.DispatchChannelUnavailableException;
import com.example.triage.error.DispatchRejectedException;
import com.example.triage.error.TriageException;

import reactor.core.publisher.Mono;

/**
 * {@link ChannelClient} over the Chatwoot REST API; conversation refs are Chatwoot conversation ids.
 * A 4xx answer other than 408 or 429 is a {@link DispatchRejectedException}; everything else that
 * fails is {@link DispatchChannelUnavailableException} and may be retried.
 */
@Component
public class ChatwootChannelClient implements ChannelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatwootChannelClient.class);
    private static final String CONVERSATION_PATH = "/accounts/{account}/conversations/{conversation}";

    private final WebClient web;
    private final ChannelProperties properties;

    public ChatwootChannelClient(WebClient.Builder builder, ChannelProperties properties) {
        this.properties = properties;
        String baseUrl = properties.baseUrl() != null ? properties.baseUrl() : "http://localhost:3000";
        this.web = builder
            .baseUrl(baseUrl + "/api/v1")
            .defaultHeader("api_access_token", properties.apiToken() != null ? properties.apiToken() : "")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public Mono<Void> sendPublicReply(String conversationRef, String text) {
        return post(conversationRef, "/messages", "send_public_reply",
            Map.of("content", text, "message_type", "outgoing", "private", false));
    }

    @Override
    public Mono<Void> createPrivateNote(String conversationRef, String text) {
        return post(conversationRef, "/messages", "create_private_note",
            Map.of("content", text, "message_type", "outgoing", "private", true));
    }

    @Override
    public Mono<Void> addLabels(String conversationRef, List<String> labels) {
        return post(conversationRef, "/labels", "add_labels", Map.of("labels", labels));
    }

    @Override
    public Mono<Void> setConversationStatus(String conversationRef, String status) {
        return post(conversationRef, "/toggle_status", "set_conversation_status", Map.of("status", status));
    }

    @Override
    public Mono<Void> assign(String conversationRef, long assigneeId) {
        return post(conversationRef, "/assignments", "assign", Map.of("assignee_id", assigneeId));
    }

    private Mono<Void> post(String conversationRef, String suffix, String operation, Object body) {
        return web.post()
            .uri(CONVERSATION_PATH + suffix, properties.accountId(), conversationRef)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.timeout())
            .doOnSuccess(response -> log.info("Chatwoot {} ok: conversation={}", operation, conversationRef))
            .then()
            .onErrorMap(ChatwootChannelClient::isRejection, e -> {
                int status = ((WebClientResponseException) e).getStatusCode().value();
                log.warn("Chatwoot {} rejected: conversation={} status={}", operation, conversationRef, status);
                return new DispatchRejectedException(operation, status, e);
            })
            .onErrorMap(e -> !(e instanceof TriageException), e -> new DispatchChannelUnavailableException(operation, e));
    }

    static boolean isRejection(Throwable e) {
        if (!(e instanceof WebClientResponseException response) || !response.getStatusCode().is4xxClientError()) {
            return false;
        }
        int status = response.getStatusCode().value();
        return status != 408 && status != 429;
    }
}
