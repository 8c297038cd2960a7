package dev.athenaeum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Athenaeum paper discovery service.
 *
 * <p>Serves {@code POST /api/papers/search} and the {@code search_papers} MCP tool.
 */
@SpringBootApplication
public class AthenaeumApplication {
  public static void main(String[] args) {
    SpringApplication.run(AthenaeumApplication.class, args);
  }
}
