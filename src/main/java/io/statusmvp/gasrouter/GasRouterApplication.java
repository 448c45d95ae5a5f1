package io.statusmvp.gasrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GasRouterApplication {
  public static void main(String[] args) {
    SpringApplication.run(GasRouterApplication.class, args);
  }
}
