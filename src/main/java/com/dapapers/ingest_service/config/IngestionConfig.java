package com.dapapers.ingest_service.config;

import com.dapapers.ingest_service.client.Sleeper;
import com.dapapers.ingest_service.sources.Mappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfig {

  /** Real waits; unit tests construct their components with a recording sleeper. */
  @Bean
  public Sleeper sleeper() {
    return Sleeper.system();
  }

  /** Mapper for the JSON stored in index fields. */
  @Bean
  public ObjectMapper objectMapper() {
    return Mappers.json();
  }
}
