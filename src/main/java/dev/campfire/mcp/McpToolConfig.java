package dev.campfire.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} methods as MCP tools via Spring AI auto-configuration.
 *
 * <p>The {@link ToolCallbackProvider} bean is picked up by the MCP server auto-configuration, which
 * exposes each {@code @Tool}-annotated method over the configured transport.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider campfireTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
