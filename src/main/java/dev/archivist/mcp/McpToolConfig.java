package dev.archivist.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes {@code search_knowledge_base} to MCP clients.
 *
 * <p>The tool takes a query and the id of the user it searches for, and answers with that user's
 * readable files only; every call goes through the access-filtered retrieval pipeline.
 *
 * @see McpToolService#searchKnowledgeBase
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider archivistTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
