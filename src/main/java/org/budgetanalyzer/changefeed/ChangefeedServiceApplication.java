package org.budgetanalyzer.changefeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChangefeedServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChangefeedServiceApplication.class, args);
  }
}
