package com.polycopy;

import com.polycopy.config.CopyTradeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CopyTradeProperties.class)
public class CopyTradeServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(CopyTradeServiceApplication.class, args);
  }
}
