package io.kneo.scheduler.util;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

/**
 * Moves blocking engine calls off the event loop. Checked exceptions surface as the Uni failure, unwrapped.
 */
public final class BlockingUni {

    @FunctionalInterface
    public interface Call<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private BlockingUni() {
    }

    public static <T> Uni<T> call(Call<T> call) {
        return Uni.createFrom().<T>emitter(emitter -> {
                    try {
                        emitter.complete(call.call());
                    } catch (Exception e) {
                        emitter.fail(e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public static Uni<Void> run(Action action) {
        return call(() -> {
            action.run();
            return null;
        });
    }
}
