package com.example.triage.dispatch;

import java.util.List;

import reactor.core.publisher.Mono;

/** One step of a dispatch plan. */
public interface ChannelOperation {

    String name();

    Mono<Void> apply(ChannelClient client, String conversationRef);

    record PublicReply(String text) implements ChannelOperation {
        public String name() { return "public_reply"; }

        public Mono<Void> apply(ChannelClient client, String conversationRef) {
            return client.sendPublicReply(conversationRef, text);
        }
    }

    record PrivateNote(String text) implements ChannelOperation {
        public String name() { return "private_note"; }

        public Mono<Void> apply(ChannelClient client, String conversationRef) {
            return client.createPrivateNote(conversationRef, text);
        }
    }

    record AddLabels(List<String> labels) implements ChannelOperation {
        public AddLabels {
            labels = List.copyOf(labels);
        }

        public String name() { return "labels"; }

        public Mono<Void> apply(ChannelClient client, String conversationRef) {
            return client.addLabels(conversationRef, labels);
        }
    }

    record SetStatus(String status) implements ChannelOperation {
        public String name() { return "status"; }

        public Mono<Void> apply(ChannelClient client, String conversationRef) {
            return client.setConversationStatus(conversationRef, status);
        }
    }

    record Assign(long assigneeId) implements ChannelOperation {
        public String name() { return "assign"; }

        public Mono<Void> apply(ChannelClient client, String conversationRef) {
            return client.assign(conversationRef, assigneeId);
        }
    }
}
