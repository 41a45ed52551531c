package dev.opscrew.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opscrew.domain.service.ToolInputValidator;
import dev.opscrew.domain.service.ToolResultRenderer;
import dev.opscrew.infrastructure.config.CrewProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolLoopSystem (domain loop + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(CrewProperties properties) {
        return new DefaultToolExecutor(properties.getLoop().getToolTimeoutMs());
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(ToolExecutorPort toolExecutorPort, HistoryWriter historyWriter,
            ToolInputValidator inputValidator, ToolResultRenderer resultRenderer, ObjectMapper objectMapper) {
        return new DefaultToolLoopSystem(toolExecutorPort, historyWriter, inputValidator, resultRenderer,
                objectMapper);
    }
}
