package com.example.podpairing.config;

import com.example.podpairing.pairing.RandomSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PodProperties.class)
public class PodConfig {

  @Bean
  public RandomSource randomSource() {
    return RandomSource.secure();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
