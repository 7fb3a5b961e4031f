package com.fermata.generation.logger;

import com.fermata.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.Consumer;

/**
 * Logs each stage of a generation request as it moves through the reactive pipeline.
 * Pure side effects; nothing here changes what is generated.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: request normalised and validated</li>
 *   <li>{@link #WORD_SOURCE_BUILT}: seed and fetched vocabulary normalised</li>
 *   <li>{@link #CANDIDATES_GENERATED}: template or fusion path produced candidates</li>
 *   <li>{@link #GUARD_FILTERED}: repetition guard and name memory applied</li>
 *   <li>{@link #FALLBACK_USED}: dynamic assembly or the curated pool filled a shortfall</li>
 *   <li>{@link #RESPONSE_ASSEMBLED}: final ranked list ready</li>
 * </ol>
 *
 * <p>With {@code doOnEach} the traceId comes from the Reactor Context of the signal:
 * <pre>
 *     .doOnEach(flowLogger.stage(GenerationFlowLogger.WORD_SOURCE_BUILT))
 * </pre>
 */
@Component
public class GenerationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(GenerationFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String WORD_SOURCE_BUILT    = "WORD_SOURCE_BUILT";
    public static final String CANDIDATES_GENERATED = "CANDIDATES_GENERATED";
    public static final String GUARD_FILTERED       = "GUARD_FILTERED";
    public static final String FALLBACK_USED        = "FALLBACK_USED";
    public static final String RESPONSE_ASSEMBLED   = "RESPONSE_ASSEMBLED";

    /**
     * A {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * MDC holds the traceId for the duration of the log call and no longer.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[GenerationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Stage log with a free-form detail, for calls made where the context view is at hand. */
    public void log(ContextView context, String stageName, String detail) {
        logWithTraceId(stageName, TraceContextUtil.getTraceId(context), detail);
    }

    public void logWithTraceId(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[GenerationFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }
}
