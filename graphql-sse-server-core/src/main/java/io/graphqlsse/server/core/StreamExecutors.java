package io.graphqlsse.server.core;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class StreamExecutors {
    private StreamExecutors() {
    }

    static ExecutorService newCachedPool(String namePrefix) {
        return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
    }

    static ExecutorService newSingleThread(String namePrefix) {
        return Executors.newSingleThreadExecutor(new NamedThreadFactory(namePrefix));
    }

    static ScheduledExecutorService newScheduled(String namePrefix) {
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(namePrefix));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
