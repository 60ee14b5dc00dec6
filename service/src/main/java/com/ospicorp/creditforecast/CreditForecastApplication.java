package com.ospicorp.creditforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreditForecastApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(CreditForecastApplication.class, args)));
  }
}
