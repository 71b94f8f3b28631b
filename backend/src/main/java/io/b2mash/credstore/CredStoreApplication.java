package io.b2mash.credstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CredStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(CredStoreApplication.class, args);
  }
}
