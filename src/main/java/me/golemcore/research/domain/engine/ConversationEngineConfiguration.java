package me.golemcore.research.domain.engine;

import me.golemcore.research.domain.service.ToolRegistry;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the conversation engine (domain orchestrator + ports). */
@Configuration
public class ConversationEngineConfiguration {

    @Bean
    public ConversationEngine conversationEngine(LlmPort llmPort, ToolRegistry toolRegistry,
            ResearchProperties properties, Clock clock) {
        LlmPort logged = new UsageLoggingLlmPortDecorator(llmPort);
        return new DefaultConversationEngine(logged, toolRegistry, properties, clock);
    }
}
