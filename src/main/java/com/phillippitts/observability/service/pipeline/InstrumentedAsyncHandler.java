package com.phillippitts.observability.service.pipeline;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Decorates an asynchronous request handler with instrumentation.
 *
 * <p>Adapter for transports that hand requests to a {@code Function<InboundRequest,
 * CompletionStage<R>>}. Every invocation goes through
 * {@link InstrumentationPipeline#instrumentAsync}.
 *
 * <pre>{@code
 * Function<InboundRequest, CompletableFuture<Response>> handler =
 *         new InstrumentedAsyncHandler<>(pipeline, this::route, Response::status);
 * }</pre>
 *
 * @param <R> response type
 */
public class InstrumentedAsyncHandler<R> implements Function<InboundRequest, CompletableFuture<R>> {

    private final InstrumentationPipeline pipeline;
    private final Function<? super InboundRequest, ? extends CompletionStage<R>> delegate;
    private final ToIntFunction<? super R> statusOf;

    public InstrumentedAsyncHandler(InstrumentationPipeline pipeline,
                                    Function<? super InboundRequest, ? extends CompletionStage<R>> delegate,
                                    ToIntFunction<? super R> statusOf) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.statusOf = Objects.requireNonNull(statusOf, "statusOf");
    }

    @Override
    public CompletableFuture<R> apply(InboundRequest request) {
        return pipeline.instrumentAsync(request, () -> delegate.apply(request), statusOf);
    }
}
