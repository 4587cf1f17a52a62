package dev.fileops.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

import io.modelcontextprotocol.server.transport.WebMvcStreamableServerTransportProvider;

/**
 * Streamable HTTP transport on Spring MVC, routed through the servlet's router functions so the
 * basic-auth filter chain applies to it.
 */
@Configuration
public class WebMvcTransportConfig {

	@Bean
	public WebMvcStreamableServerTransportProvider streamableTransportProvider(
			McpTransportProperties transportProperties) {
		WebMvcStreamableServerTransportProvider.Builder builder = WebMvcStreamableServerTransportProvider.builder()
			.mcpEndpoint(transportProperties.getEndpoint())
			.disallowDelete(transportProperties.isDisallowDelete());
		if (transportProperties.getKeepAliveInterval() != null) {
			builder.keepAliveInterval(transportProperties.getKeepAliveInterval());
		}
		return builder.build();
	}

	@Bean
	public RouterFunction<ServerResponse> mcpRouter(WebMvcStreamableServerTransportProvider transportProvider) {
		return transportProvider.getRouterFunction();
	}

}
