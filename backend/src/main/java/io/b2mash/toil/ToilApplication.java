package io.b2mash.toil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ToilApplication {

  public static void main(String[] args) {
    SpringApplication.run(ToilApplication.class, args);
  }
}
