package io.mcpcompat.server.core;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class Threads {
    private Threads() {
    }

    /**
     * Virtual-thread-per-task executor when the runtime has one, else a cached pool of named daemon threads.
     */
    static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) method.invoke(null);
        } catch (ReflectiveOperationException e) {
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    static ScheduledExecutorService newScheduler(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(namePrefix));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
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
