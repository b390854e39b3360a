package io.b2mash.formlogic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormLogicApplication {

  public static void main(String[] args) {
    SpringApplication.run(FormLogicApplication.class, args);
  }
}
