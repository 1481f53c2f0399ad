package com.example.triage.filter;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;

/**
 * Last pass over every text that leaves the engine: channel replies, reviewer notes
 * and captured prompt content on spans.
 */
@Component
public class OutboundTextSanitizer {

    private static final Logger log = LoggerFactory.getLogger(OutboundTextSanitizer.class);
    private static final String REDACTED = "[REDACTED]";
    private static final String EMAIL_CHANNEL = "email";

    private record PiiPattern(String name, Pattern pattern) {}

    private static final List<PiiPattern> PATTERNS = List.of(
        new PiiPattern("email",
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
        new PiiPattern("ssn",
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")),
        new PiiPattern("credit_card",
            Pattern.compile("\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b")),
        new PiiPattern("phone",
            Pattern.compile("(?<![\\w-])(?:\\+?1[-.]?)?\\(?\\d{3}\\)?[-.]?\\d{3}[-.]?\\d{4}(?![\\w-])"))
    );

    private static final Pattern LINE_BREAK_TAGS = Pattern.compile("(?i)<br\\s*/?>|</div>|</p>|</li>");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");

    /** Scrubs PII and, for chat channels, flattens HTML to plain text. Email keeps its markup. */
    public String sanitize(String text, String channel) {
        if (text == null || text.isEmpty()) return text;
        String scrubbed = scrub(text);
        return EMAIL_CHANNEL.equalsIgnoreCase(channel) ? scrubbed : stripHtml(scrubbed);
    }

    public String scrub(String text) {
        if (text == null || text.isEmpty()) return text;

        String result = text;
        boolean piiFound = false;

        for (var pii : PATTERNS) {
            var matcher = pii.pattern().matcher(result);
            if (matcher.find()) {
                piiFound = true;
                log.warn("PII detected in outbound text (type={}), redacting", pii.name());
                result = matcher.replaceAll(REDACTED);
            }
        }

        if (piiFound) {
            Span.current().addEvent("triage.pii_detected", Attributes.of(
                AttributeKey.booleanKey("triage.pii_redacted"), true
            ));
        }

        return result;
    }

    public boolean containsPii(String text) {
        if (text == null || text.isEmpty()) return false;
        return PATTERNS.stream().anyMatch(p -> p.pattern().matcher(text).find());
    }

    static String stripHtml(String text) {
        String plain = LINE_BREAK_TAGS.matcher(text).replaceAll("\n");
        plain = TAGS.matcher(plain).replaceAll("");
        plain = BLANK_RUNS.matcher(plain).replaceAll("\n\n");
        return plain.strip();
    }
}
