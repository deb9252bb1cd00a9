package lab.swapdesk.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Named pools: swap-executor runs one swap or withdrawal per task, quote-executor bounds provider calls.
 */
@Configuration
public class AsyncConfig {

    public static final String SWAP_EXECUTOR = "swap-executor";
    public static final String QUOTE_EXECUTOR = "quote-executor";

    @Bean(name = SWAP_EXECUTOR)
    public Executor swapExecutor(SwapDeskProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(properties.getExecution().getWorkerThreads());
        e.setMaxPoolSize(properties.getExecution().getWorkerThreads());
        e.setQueueCapacity(properties.getExecution().getQueueCapacity());
        e.setThreadNamePrefix("swap-");
        e.setTaskDecorator(mdcPropagation());
        e.initialize();
        return e;
    }

    @Bean(name = QUOTE_EXECUTOR)
    public Executor quoteExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(64);
        e.setThreadNamePrefix("quote-");
        e.setTaskDecorator(mdcPropagation());
        e.initialize();
        return e;
    }

    // Carry correlationId / swapRef onto pool threads so provider and chain logs stay attributable.
    static TaskDecorator mdcPropagation() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
