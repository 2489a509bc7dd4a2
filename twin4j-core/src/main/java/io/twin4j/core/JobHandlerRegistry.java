package io.twin4j.core;

import io.twin4j.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps queue names to the single handler that processes their jobs.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByQueue;

    public JobHandlerRegistry(List<? extends JobHandler<?>> handlers) {
        this.handlersByQueue = handlers.stream()
                .<JobHandler<?>>map(h -> h)
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::queueName,
                        Function.<JobHandler<?>>identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler for queue: " + a.queueName());
                        }
                ));
    }

    public JobHandler<?> getRequired(String queueName) {
        JobHandler<?> handler = handlersByQueue.get(queueName);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for queue: " + queueName);
        }
        return handler;
    }

    public boolean contains(String queueName) {
        return handlersByQueue.containsKey(queueName);
    }

    public Set<String> queueNames() {
        return handlersByQueue.keySet();
    }
}
