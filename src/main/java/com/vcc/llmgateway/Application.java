package com.vcc.llmgateway;

import com.vcc.llmgateway.config.GwProperties;
import com.vcc.llmgateway.config.StoreBootstrap;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(GwProperties.class)
public class Application {
  public static void main(String[] args) {
    SpringApplication.run(Application.class, args);
  }

  // Seeds the store once per process, before traffic is expected.
  @Bean
  ApplicationRunner storeBootstrapRunner(StoreBootstrap bootstrap) {
    return args -> bootstrap.seed().block();
  }
}
