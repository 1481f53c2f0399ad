package com.example.triage.pipeline;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.triage.model.SafetySignal;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Red-line screen run before any routing. Threat and abuse language is checked in the
 * messages of the current cycle; repeated damage is checked across the whole session.
 */
@Component
public class SafetyScreen {

    private static final Logger log = LoggerFactory.getLogger(SafetyScreen.class);

    private record RedLine(String trigger, Pattern pattern) {}

    private static final List<RedLine> RED_LINES = List.of(
        new RedLine("death_threat", Pattern.compile("\\b(kill|murder|die|death threat)\\b", Pattern.CASE_INSENSITIVE)),
        new RedLine("legal_threat", Pattern.compile("\\b(sue|lawsuit|lawyer|legal action|court)\\b", Pattern.CASE_INSENSITIVE)),
        new RedLine("bank_dispute", Pattern.compile("\\b(bank dispute|chargeback|dispute the charge)\\b", Pattern.CASE_INSENSITIVE)),
        new RedLine("self_harm", Pattern.compile("\\b(suicide|end my life|harm myself)\\b", Pattern.CASE_INSENSITIVE)),
        new RedLine("violence_threat", Pattern.compile("\\b(bomb|weapon|attack)\\b", Pattern.CASE_INSENSITIVE))
    );

    static final String REPEATED_DAMAGE = "repeated_damage";

    private static final String DAMAGE_WORDS = "(?:damaged|broken|leak(?:ing|ed|s)?|cracked|smashed)";
    private static final String REPEAT_WORDS = "(?:second|third|again|another|every time)";

    private static final Pattern DAMAGE = Pattern.compile("\\b" + DAMAGE_WORDS + "\\b", Pattern.CASE_INSENSITIVE);

    // A repeat marker within a few words of damage language, in either order.
    private static final Pattern REPEAT_NEAR_DAMAGE = Pattern.compile(
        "\\b" + REPEAT_WORDS + "\\b(?:\\W+\\w+){0,4}?\\W+" + DAMAGE_WORDS + "\\b"
            + "|\\b" + DAMAGE_WORDS + "\\b(?:\\W+\\w+){0,4}?\\W+" + REPEAT_WORDS + "\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern HUMAN_REQUEST = Pattern.compile(
        "\\b(speak|talk|chat)\\s+(to|with)\\s+(a\\s+)?(human|person|manager|supervisor|agent|someone)\\b"
            + "|\\b(live|real)\\s+(person|agent|human)\\b"
            + "|\\b(manager|supervisor)\\s+please\\b",
        Pattern.CASE_INSENSITIVE);

    private final Tracer tracer;

    public SafetyScreen() {
        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
    }

    /**
     * @param currentMessages customer messages of the cycle being decided
     * @param allCustomerMessages every customer message of the session, oldest first
     */
    public SafetySignal screen(List<String> currentMessages, List<String> allCustomerMessages) {
        Span span = tracer.spanBuilder("safety_screen")
            .setAttribute("triage.stage", "safety")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            SafetySignal signal = check(currentMessages, allCustomerMessages);
            span.setAttribute("triage.safety_flagged", signal.flagged());
            if (signal.flagged()) {
                span.setAttribute("triage.safety_trigger", signal.trigger());
                log.info("Safety signal: trigger={}", signal.trigger());
            }
            return signal;

        } finally {
            span.end();
        }
    }

    SafetySignal check(List<String> currentMessages, List<String> allCustomerMessages) {
        for (String message : currentMessages) {
            for (RedLine redLine : RED_LINES) {
                if (redLine.pattern().matcher(message).find()) {
                    return SafetySignal.of(redLine.trigger());
                }
            }
        }

        long damageMessages = allCustomerMessages.stream()
            .filter(message -> DAMAGE.matcher(message).find())
            .count();
        if (damageMessages >= 2) {
            return SafetySignal.of(REPEATED_DAMAGE);
        }
        for (String message : allCustomerMessages) {
            if (REPEAT_NEAR_DAMAGE.matcher(message).find()) {
                return SafetySignal.of(REPEATED_DAMAGE);
            }
        }
        return SafetySignal.none();
    }

    /** Explicit request for a human in the customer's own words, independent of the classifier. */
    public boolean humanRequested(List<String> currentMessages) {
        return currentMessages.stream().anyMatch(message -> HUMAN_REQUEST.matcher(message).find());
    }
}
