package io.twin4j;


/**
 * Processes the jobs of one queue. Job data is converted to {@link #dataClass()} before
 * {@link #execute(Object, JobContext)} is called; jobs without data receive {@code null}.
 */
public interface JobHandler<T> {
    String queueName();

    Class<T> dataClass();

    void execute(T data, JobContext context) throws Exception;
}
