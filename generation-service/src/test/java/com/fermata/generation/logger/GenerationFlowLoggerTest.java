package com.fermata.generation.logger;

import com.fermata.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.context.Context;

import static org.junit.jupiter.api.Assertions.*;

class GenerationFlowLoggerTest {

    private final GenerationFlowLogger flowLogger = new GenerationFlowLogger();

    @Test
    @DisplayName("stage logging leaves the value and MDC untouched")
    void stage_passThrough() {
        Mono<String> mono = Mono.just("payload")
            .doOnEach(flowLogger.stage(GenerationFlowLogger.WORD_SOURCE_BUILT))
            .contextWrite(Context.of(TraceContextUtil.TRACE_ID_KEY, "trace-1"));

        StepVerifier.create(mono)
            .expectNext("payload")
            .verifyComplete();
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    @Test
    @DisplayName("missing traceId in the context does not fail the pipeline")
    void stage_withoutTraceId() {
        StepVerifier.create(Mono.just(1).doOnEach(flowLogger.stage(GenerationFlowLogger.RESPONSE_ASSEMBLED)))
            .expectNext(1)
            .verifyComplete();
        flowLogger.log(Context.empty(), GenerationFlowLogger.FALLBACK_USED, "source=fallback added=0");
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }
}
