package io.b2mash.toil.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** System clock used for every "today" calculation; tests replace it with a fixed clock. */
@Configuration
public class ClockConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
