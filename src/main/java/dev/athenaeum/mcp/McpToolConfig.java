package dev.athenaeum.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @Tool} methods of {@link McpToolService} with the Spring AI MCP server
 * auto-configuration.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider athenaeumTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
