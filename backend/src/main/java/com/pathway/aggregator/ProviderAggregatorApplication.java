package com.pathway.aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProviderAggregatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProviderAggregatorApplication.class, args);
  }
}
