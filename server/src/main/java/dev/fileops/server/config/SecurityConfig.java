package dev.fileops.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Basic HTTP authentication in front of every mutating MCP tool.
 */
@Configuration
@EnableConfigurationProperties(McpSecurityProperties.class)
public class SecurityConfig {

	private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

	@Bean
	public UserDetailsService userDetailsService(McpSecurityProperties securityProperties) {
		if (securityProperties.usesDefaultPassword()) {
			logger.warn("MCP endpoint is protected by the default password, set mcp.files.security.password");
		}
		UserDetails user = User.withUsername(securityProperties.username())
			.password("{noop}" + securityProperties.password())
			.roles("FILEOPS_CLIENT")
			.build();
		return new InMemoryUserDetailsManager(user);
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
		http.csrf(AbstractHttpConfigurer::disable);
		http.sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
		http.authorizeHttpRequests(registry -> registry.anyRequest().hasRole("FILEOPS_CLIENT"));
		http.httpBasic(Customizer.withDefaults());
		return http.build();
	}

}
