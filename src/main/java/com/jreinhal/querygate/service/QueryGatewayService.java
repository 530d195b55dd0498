package com.jreinhal.querygate.service;

import com.jreinhal.querygate.execution.ExecutionResult;
import com.jreinhal.querygate.execution.QueryExecutor;
import com.jreinhal.querygate.intent.IntentTranslationException;
import com.jreinhal.querygate.intent.IntentTranslator;
import com.jreinhal.querygate.intent.MalformedIntentException;
import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.model.UserContext;
import com.jreinhal.querygate.policy.GuardResult;
import com.jreinhal.querygate.policy.PolicyGuard;
import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.query.QueryIntent;
import com.jreinhal.querygate.query.SanitizedQuery;
import com.jreinhal.querygate.response.RenderedResponse;
import com.jreinhal.querygate.response.ResponseRenderer;
import com.jreinhal.querygate.sanitize.Clarifications;
import com.jreinhal.querygate.sanitize.IntentSanitizer;
import com.jreinhal.querygate.sanitize.SanitizeOutcome;
import com.jreinhal.querygate.util.LogSanitizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Question answering pipeline: identity, guard, translator, sanitizer, executor, renderer.
 *
 * <p>Every failure below the sanitizer collapses into the same no-data answer; translator problems become
 * fixed clarifications. The question text itself is only ever logged as a length and hash.</p>
 */
@Service
public class QueryGatewayService {
    private static final Logger log = LoggerFactory.getLogger(QueryGatewayService.class);
    private final IdentityResolver identityResolver;
    private final PolicyGuard policyGuard;
    private final IntentTranslator translator;
    private final IntentSanitizer sanitizer;
    private final QueryExecutor executor;
    private final ResponseRenderer renderer;
    private final ResultCache resultCache;

    public QueryGatewayService(IdentityResolver identityResolver, PolicyGuard policyGuard, IntentTranslator translator,
                               IntentSanitizer sanitizer, QueryExecutor executor, ResponseRenderer renderer, ResultCache resultCache) {
        this.identityResolver = identityResolver;
        this.policyGuard = policyGuard;
        this.translator = translator;
        this.sanitizer = sanitizer;
        this.executor = executor;
        this.renderer = renderer;
        this.resultCache = resultCache;
    }

    public RenderedResponse ask(String question, User caller) {
        long startTime = System.currentTimeMillis();
        UserContext context = this.identityResolver.resolve(caller);
        GuardResult guard = this.policyGuard.resolveGuard(context.role(), context);
        String trimmed = question == null ? "" : question.trim();
        if (trimmed.isEmpty()) {
            return this.clarify(Clarifications.EMPTY_QUESTION, "empty_question", context, guard, startTime);
        }
        if (!guard.hasResources()) {
            return this.clarify(Clarifications.NO_RESOURCES, "no_resources", context, guard, startTime);
        }
        if (!this.translator.isConfigured()) {
            return this.clarify(Clarifications.NOT_CONFIGURED, "not_configured", context, guard, startTime);
        }
        QueryIntent intent;
        try {
            intent = this.translator.translate(trimmed, guard.menu());
        }
        catch (MalformedIntentException e) {
            log.warn("Translator output rejected for {}: {}", LogSanitizer.querySummary(trimmed), LogSanitizer.sanitize(e.getMessage()));
            return this.clarify(Clarifications.MALFORMED, "malformed_intent", context, guard, startTime);
        }
        catch (IntentTranslationException e) {
            return this.clarify(Clarifications.TRANSLATION_FAILED, "translation_failed", context, guard, startTime);
        }
        catch (RuntimeException e) {
            log.warn("Translator failed unexpectedly: {}", e.getClass().getSimpleName());
            return this.clarify(Clarifications.TRANSLATION_FAILED, "translation_failed", context, guard, startTime);
        }
        SanitizeOutcome outcome = this.sanitizer.sanitize(intent, guard);
        if (outcome.isClarification()) {
            return this.clarify(outcome.clarification(), outcome.reason().name().toLowerCase(Locale.ROOT), context, guard, startTime);
        }
        SanitizedQuery query = outcome.query();
        try {
            ResultCache.CacheKey key = ResultCache.keyFor(context, guard.role(), query);
            Optional<ExecutionResult> cached = this.resultCache.get(key);
            ExecutionResult result = cached.orElseGet(() -> this.executor.execute(query, guard.scopeFilterFor(query.resourceKey()), context.tenantId()));
            if (cached.isEmpty()) {
                this.resultCache.put(key, result);
            }
            RenderedResponse response = this.renderer.render(result);
            String resultOutcome = result.isFailed() ? result.error().name().toLowerCase(Locale.ROOT) : (cached.isPresent() ? "cached" : "ok");
            this.logRequest(context, guard, query.resourceKey(), resultOutcome, startTime);
            return response;
        }
        catch (RuntimeException e) {
            log.error("Query pipeline failed after sanitization: {}", e.getClass().getSimpleName());
            this.logRequest(context, guard, query.resourceKey(), "pipeline_failure", startTime);
            return this.renderer.noData();
        }
    }

    /**
     * The resources, descriptions and fields the caller may ask about.
     */
    public List<ResourceMenuEntry> menuFor(User caller) {
        UserContext context = this.identityResolver.resolve(caller);
        return this.policyGuard.resolveGuard(context.role(), context).menu();
    }

    private RenderedResponse clarify(String text, String outcome, UserContext context, GuardResult guard, long startTime) {
        this.logRequest(context, guard, null, outcome, startTime);
        return this.renderer.clarification(text);
    }

    private void logRequest(UserContext context, GuardResult guard, String resourceKey, String outcome, long startTime) {
        log.info("ask caller={} role={} resource={} outcome={} ({}ms)",
                LogSanitizer.sanitize(context.callerId()), guard.role(), resourceKey == null ? "-" : resourceKey,
                outcome, System.currentTimeMillis() - startTime);
    }
}
