package com.flamingo.ai.chunkgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Chunk quality gate service. */
@SpringBootApplication
public class ChunkGateApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChunkGateApplication.class, args);
  }
}
