package com.ospicorp.migrationflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MigrationFlowApplication {

  public static void main(String[] args) {
    SpringApplication.run(MigrationFlowApplication.class, args);
  }
}
