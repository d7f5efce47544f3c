/*
 * Where: shared configuration
 * What: exposes the Clock used by every service as a bean
 * Why: lets tests pin time instead of reading the system clock
 */
package io.paysync.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
