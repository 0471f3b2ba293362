package io.b2mash.boq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BoqEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(BoqEngineApplication.class, args);
  }
}
