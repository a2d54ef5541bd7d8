package com.adinsight;

import com.adinsight.memory.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class AdaptiveMemoryApplication {

  private static final Logger log = LoggerFactory.getLogger(AdaptiveMemoryApplication.class);

  public static void main(String[] args) {
    SpringApplication.run(AdaptiveMemoryApplication.class, args);
  }

  @Bean
  CommandLineRunner reportMemoryTiers(MemoryManager memoryManager) {
    return args -> memoryManager.getStats().forEach((tier, stats) ->
        log.info("Memory tier={} type={} keys={}", tier, stats.type(), stats.keysCount()));
  }
}
