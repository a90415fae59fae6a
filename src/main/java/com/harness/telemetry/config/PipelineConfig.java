package com.harness.telemetry.config;

import com.harness.telemetry.source.ServerManager;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class PipelineConfig {

  @Bean
  public ServerManager serverManager() {
    return new ServerManager();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RestTemplate ingestRestTemplate(IngestProperties properties) {
    // Shared by every delivery; the read timeout bounds how long a hung ingest stalls the flusher.
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) properties.effectiveConnectTimeout().toMillis());
    requestFactory.setReadTimeout((int) properties.effectiveReadTimeout().toMillis());
    return new RestTemplate(requestFactory);
  }
}
