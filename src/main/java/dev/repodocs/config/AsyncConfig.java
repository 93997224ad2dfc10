package dev.repodocs.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Async execution configuration.
 *
 * <p>Streaming responses are written from the MVC async executor (Spring Boot's
 * {@code applicationTaskExecutor}), not from the request thread. Boot applies a single
 * {@link TaskDecorator} bean to that executor, so the relay id placed in the MDC by
 * {@link RelayIdFilter} follows the relay onto the thread that actually forwards the bytes.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public TaskDecorator mdcPropagatingTaskDecorator() {
        return new MdcPropagatingTaskDecorator();
    }

    /**
     * Copies the caller's MDC into the task and clears it afterwards.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
