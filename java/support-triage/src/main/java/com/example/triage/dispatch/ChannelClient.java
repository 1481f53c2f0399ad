package com.example.triage.dispatch;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Outbound writes to the support channel. Each method is one remote write, so a failed
 * call can be retried without repeating any other write. Failures surface as
 * {@link com.example.triage.error.DispatchChannelUnavailableException}.
 */
public interface ChannelClient {

    Mono<Void> sendPublicReply(String conversationRef, String text);

    Mono<Void> createPrivateNote(String conversationRef, String text);

    Mono<Void> addLabels(String conversationRef, List<String> labels);

    Mono<Void> setConversationStatus(String conversationRef, String status);

    Mono<Void> assign(String conversationRef, long assigneeId);
}
