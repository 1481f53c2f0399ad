package com.example.triage.pipeline;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/** Catches generated replies that claim a cancellation, pause or refund already happened. */
@Component
public class ResponseGuard {

    private record UnsafePhrase(String violation, Pattern pattern) {}

    private static final List<UnsafePhrase> UNSAFE = List.of(
        new UnsafePhrase("confirmed_cancellation", Pattern.compile("(cancelled|canceled) your subscription", Pattern.CASE_INSENSITIVE)),
        new UnsafePhrase("confirmed_cancellation", Pattern.compile("subscription (has been|is now) (cancelled|canceled)", Pattern.CASE_INSENSITIVE)),
        new UnsafePhrase("confirmed_pause", Pattern.compile("(paused|suspended) your subscription", Pattern.CASE_INSENSITIVE)),
        new UnsafePhrase("confirmed_pause", Pattern.compile("subscription (has been|is now) (paused|suspended)", Pattern.CASE_INSENSITIVE)),
        new UnsafePhrase("confirmed_refund", Pattern.compile("(processed|issued|approved) (a |your )?(refund|reimbursement)", Pattern.CASE_INSENSITIVE)),
        new UnsafePhrase("confirmed_refund", Pattern.compile("refund (has been|is now|was) (processed|issued|approved)", Pattern.CASE_INSENSITIVE))
    );

    /** The first violation found, or empty when the reply may go out. */
    public Optional<String> check(String reply) {
        if (reply == null || reply.isEmpty()) {
            return Optional.empty();
        }
        return UNSAFE.stream()
            .filter(phrase -> phrase.pattern().matcher(reply).find())
            .map(UnsafePhrase::violation)
            .findFirst();
    }
}
