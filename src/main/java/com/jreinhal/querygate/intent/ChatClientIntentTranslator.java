package com.jreinhal.querygate.intent;

import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.query.QueryIntent;
import com.jreinhal.querygate.util.LogSanitizer;
import com.jreinhal.querygate.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Intent translator backed by a chat model. The model only ever sees the caller's resource menu and question.
 */
@Service
public class ChatClientIntentTranslator implements IntentTranslator {
    private static final Logger log = LoggerFactory.getLogger(ChatClientIntentTranslator.class);
    private static final String UNSET_KEY = "unset";
    private final ChatClient chatClient;
    private final IntentPromptBuilder promptBuilder;
    private final IntentParser parser;
    private final boolean configured;
    private final long timeoutMs;
    private final SimpleCircuitBreaker circuitBreaker;

    public ChatClientIntentTranslator(ChatClient.Builder chatClientBuilder, IntentPromptBuilder promptBuilder, IntentParser parser,
                                      @Value("${spring.ai.openai.api-key:}") String apiKey,
                                      @Value("${querygate.translator.timeout-ms:20000}") long timeoutMs,
                                      @Value("${querygate.translator.circuit-breaker.failure-threshold:5}") int failureThreshold,
                                      @Value("${querygate.translator.circuit-breaker.open-seconds:30}") long openSeconds) {
        this.chatClient = chatClientBuilder.build();
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.configured = apiKey != null && !apiKey.isBlank() && !UNSET_KEY.equalsIgnoreCase(apiKey.trim());
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.circuitBreaker = new SimpleCircuitBreaker(failureThreshold, Duration.ofSeconds(openSeconds), 1);
        if (!this.configured) {
            log.warn("No chat model API key configured; natural language queries will be answered with a configuration notice");
        }
    }

    @Override
    public boolean isConfigured() {
        return this.configured;
    }

    @Override
    public QueryIntent translate(String question, List<ResourceMenuEntry> menu) {
        if (!this.configured) {
            throw new IntentTranslationException("Translator is not configured");
        }
        if (!this.circuitBreaker.allowRequest()) {
            throw new IntentTranslationException("Translator circuit is open");
        }
        long startTime = System.currentTimeMillis();
        String systemPrompt = this.promptBuilder.buildSystemPrompt(menu);
        String userMessage = this.promptBuilder.buildUserMessage(question);
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt().system(systemPrompt).user(userMessage).call().content());
        String reply;
        try {
            reply = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.recordFailure(e);
            log.warn("Intent translation timed out after {}ms", this.timeoutMs);
            throw new IntentTranslationException("Translator timed out", e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntentTranslationException("Translation interrupted", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            this.circuitBreaker.recordFailure(cause);
            log.warn("Intent translation failed: {}", cause.getClass().getSimpleName());
            throw new IntentTranslationException("Translator call failed", cause);
        }
        this.circuitBreaker.recordSuccess();
        if (reply == null || reply.isBlank()) {
            throw new MalformedIntentException("Translator returned an empty reply");
        }
        QueryIntent intent = this.parser.parse(reply);
        log.debug("Translated question {} in {}ms", LogSanitizer.querySummary(question), System.currentTimeMillis() - startTime);
        return intent;
    }

    SimpleCircuitBreaker.State circuitState() {
        return this.circuitBreaker.getState();
    }
}
