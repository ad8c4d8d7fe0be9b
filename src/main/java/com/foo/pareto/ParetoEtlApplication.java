package com.foo.pareto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ParetoEtlApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ParetoEtlApplication.class, args)));
  }
}
