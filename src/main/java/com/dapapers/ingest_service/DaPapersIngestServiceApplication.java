package com.dapapers.ingest_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DaPapersIngestServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(DaPapersIngestServiceApplication.class, args);
  }
}
