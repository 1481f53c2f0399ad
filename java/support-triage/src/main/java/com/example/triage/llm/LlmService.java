package com.example.triage.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleCounter;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.example.triage.config.LlmProperties;
import com.example.triage.error.LlmUnavailableException;
import com.example.triage.filter.OutboundTextSanitizer;

/**
 * Chat completion over two routes: the primary provider with retries, then the fallback
 * provider with the same retry budget. Each route picks its model by {@link ModelTier}.
 * Calls block; callers run them on {@code Schedulers.boundedElastic()}.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final AttributeKey<String> PROVIDER = AttributeKey.stringKey("gen_ai.provider.name");
    private static final AttributeKey<String> MODEL = AttributeKey.stringKey("gen_ai.request.model");
    private static final AttributeKey<String> TIER = AttributeKey.stringKey("triage.llm_tier");
    private static final AttributeKey<String> STAGE = AttributeKey.stringKey("triage.stage");
    private static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");
    private static final AttributeKey<String> TOKEN_TYPE = AttributeKey.stringKey("gen_ai.token.type");

    private record Route(LlmProperties.Route models, ChatModel chatModel, boolean fallback) {}

    private record Call(ModelTier tier, String systemPrompt, String userPrompt, String stage) {}

    private final List<Route> routes;
    private final LlmProperties properties;
    private final Pricing pricing;
    private final OutboundTextSanitizer sanitizer;
    private final boolean captureContent;
    private final Tracer tracer;
    private final DoubleHistogram tokenUsage;
    private final DoubleHistogram operationDuration;
    private final DoubleCounter costCounter;
    private final LongCounter retryCounter;
    private final LongCounter fallbackCounter;
    private final LongCounter errorCounter;

    public LlmService(LlmConfig.ModelProviders providers, LlmProperties properties, Pricing pricing,
                      OutboundTextSanitizer sanitizer) {
        this.routes = List.of(
            new Route(properties.primary(), providers.primary(), false),
            new Route(properties.fallback(), providers.fallback(), true));
        this.properties = properties;
        this.pricing = pricing;
        this.sanitizer = sanitizer;
        this.captureContent = "true".equalsIgnoreCase(
            System.getenv("OTEL_INSTRUMENTATION_GENAI_CAPTURE_MESSAGE_CONTENT"));

        this.tracer = GlobalOpenTelemetry.getTracer("support-triage");
        Meter meter = GlobalOpenTelemetry.getMeter("support-triage");
        this.tokenUsage = meter.histogramBuilder("gen_ai.client.token.usage").setUnit("{token}").build();
        this.operationDuration = meter.histogramBuilder("gen_ai.client.operation.duration").setUnit("s").build();
        this.costCounter = meter.counterBuilder("gen_ai.client.cost").ofDoubles().setUnit("usd").build();
        this.retryCounter = meter.counterBuilder("gen_ai.client.retry.count").build();
        this.fallbackCounter = meter.counterBuilder("gen_ai.client.fallback.count").build();
        this.errorCounter = meter.counterBuilder("gen_ai.client.error.count").build();
    }

    /**
     * Runs one completion on the tier's model of the first route that answers.
     *
     * @throws LlmUnavailableException when both routes used up their attempts
     */
    public LlmResponse complete(ModelTier tier, String systemPrompt, String userPrompt, String stage) {
        var call = new Call(tier, systemPrompt, userPrompt, stage);
        RuntimeException last = null;
        for (Route route : routes) {
            if (route.fallback()) {
                log.warn("Primary provider {} exhausted, falling back to {} (stage={} tier={})",
                    routes.get(0).models().provider(), route.models().provider(), stage, tier);
                fallbackCounter.add(1, Attributes.of(STAGE, stage, TIER, tier.name()));
            }
            try {
                return onRoute(route, call);
            } catch (RuntimeException e) {
                last = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmUnavailableException(stage, e);
            }
        }
        throw new LlmUnavailableException(stage, last);
    }

    private LlmResponse onRoute(Route route, Call call) throws InterruptedException {
        String provider = route.models().provider();
        String model = route.models().model(call.tier());
        int maxAttempts = properties.maxAttempts();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callOnce(route, model, call, attempt);
            } catch (RuntimeException e) {
                last = e;
                log.warn("LLM call failed (attempt {}/{}): provider={} model={} stage={} error={}",
                    attempt, maxAttempts, provider, model, call.stage(), e.getMessage());
                if (attempt < maxAttempts) {
                    retryCounter.add(1, Attributes.of(PROVIDER, provider, MODEL, model));
                    Thread.sleep(backoff(attempt).toMillis());
                }
            }
        }
        log.error("Provider {} gave up after {} attempts (stage={})", provider, maxAttempts, call.stage(), last);
        throw last;
    }

    private LlmResponse callOnce(Route route, String model, Call call, int attempt) {
        String provider = route.models().provider();
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("gen_ai.chat " + model)
            .setAttribute("gen_ai.operation.name", "chat")
            .setAttribute(PROVIDER, provider)
            .setAttribute(MODEL, model)
            .setAttribute(TIER, call.tier().name())
            .setAttribute("server.address", LlmConfig.PROVIDER_SERVERS.getOrDefault(provider, "unknown"))
            .setAttribute("server.port", (long) LlmConfig.PROVIDER_PORTS.getOrDefault(provider, 443))
            .setAttribute("gen_ai.request.temperature", properties.temperature())
            .setAttribute("gen_ai.request.max_tokens", (long) properties.maxTokens())
            .setAttribute("triage.llm_attempt", (long) attempt)
            .setAttribute("triage.llm_fallback", route.fallback())
            .startSpan();
        if (StringUtils.hasText(call.stage())) {
            span.setAttribute(STAGE, call.stage());
        }

        try (Scope ignored = span.makeCurrent()) {
            if (captureContent) {
                span.addEvent("gen_ai.user.message", Attributes.of(
                    AttributeKey.stringKey("gen_ai.prompt"), truncate(sanitizer.scrub(call.userPrompt()), 1000)));
            }

            ChatResponse response = route.chatModel().call(prompt(call, model));
            var generation = response.getResult();
            var usage = response.getMetadata().getUsage();

            String content = generation.getOutput().getText();
            int inputTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            int outputTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            String responseModel = StringUtils.hasText(response.getMetadata().getModel())
                ? response.getMetadata().getModel() : model;
            String finishReason = generation.getMetadata().getFinishReason() != null
                ? generation.getMetadata().getFinishReason() : "";
            double costUsd = pricing.calculateCost(responseModel, inputTokens, outputTokens);

            span.setAttribute("gen_ai.response.model", responseModel);
            span.setAttribute("gen_ai.usage.input_tokens", (long) inputTokens);
            span.setAttribute("gen_ai.usage.output_tokens", (long) outputTokens);
            span.setAttribute("gen_ai.usage.cost_usd", costUsd);
            if (captureContent) {
                span.addEvent("gen_ai.assistant.message", Attributes.of(
                    AttributeKey.stringKey("gen_ai.completion"), truncate(sanitizer.scrub(content), 2000)));
            }

            var attrs = Attributes.of(PROVIDER, provider, MODEL, responseModel, TIER, call.tier().name());
            tokenUsage.record(inputTokens, attrs.toBuilder().put(TOKEN_TYPE, "input").build());
            tokenUsage.record(outputTokens, attrs.toBuilder().put(TOKEN_TYPE, "output").build());
            operationDuration.record((System.nanoTime() - start) / 1_000_000_000.0, attrs);
            costCounter.add(costUsd, attrs);

            return new LlmResponse(content, call.tier(), provider, responseModel, inputTokens, outputTokens,
                costUsd, finishReason, route.fallback(), attempt);

        } catch (RuntimeException e) {
            String errorType = classifyError(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute(ERROR_TYPE, errorType);
            errorCounter.add(1, Attributes.of(PROVIDER, provider, MODEL, model, ERROR_TYPE, errorType));
            throw e;
        } finally {
            span.end();
        }
    }

    private Prompt prompt(Call call, String model) {
        var messages = new ArrayList<Message>();
        if (StringUtils.hasText(call.systemPrompt())) {
            messages.add(new SystemMessage(call.systemPrompt()));
        }
        messages.add(new UserMessage(call.userPrompt()));
        return new Prompt(messages, ChatOptions.builder()
            .model(model)
            .temperature(properties.temperature())
            .maxTokens(properties.maxTokens())
            .build());
    }

    /** Doubling from {@code minBackoff}, capped at {@code maxBackoff}, plus up to a quarter of jitter. */
    Duration backoff(int attempt) {
        long base = Math.min(properties.minBackoff().toMillis() << (attempt - 1), properties.maxBackoff().toMillis());
        return Duration.ofMillis(base + ThreadLocalRandom.current().nextLong(0, base / 4 + 1));
    }

    static String classifyError(Exception e) {
        String msg = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        if (msg.contains("rate limit") || msg.contains("429")) return "rate_limit";
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("deadline")) return "timeout";
        if (msg.contains("401") || msg.contains("403") || msg.contains("api key")) return "auth_error";
        if (msg.contains("400") || msg.contains("422") || msg.contains("invalid")) return "invalid_request";
        if (msg.contains("500") || msg.contains("502") || msg.contains("503") || msg.contains("overloaded")) return "server_error";
        if (msg.contains("connect") || msg.contains("reset")) return "network_error";
        return "unknown_error";
    }

    private static String truncate(String s, int max) {
        return s != null && s.length() > max ? s.substring(0, max) : (s != null ? s : "");
    }
}
