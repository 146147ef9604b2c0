package io.ledgerbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

// spring security is only here for its oauth2 client types, the local endpoints are not secured
@SpringBootConfiguration
@EnableAutoConfiguration(
    exclude = {
      SecurityAutoConfiguration.class,
      SecurityFilterAutoConfiguration.class,
      UserDetailsServiceAutoConfiguration.class
    })
@ComponentScan(basePackages = {"io.ledgerbridge"})
public class LedgerBridgeWebApplication {

  public static void main(String[] args) {
    SpringApplication.run(LedgerBridgeWebApplication.class, args);
  }
}
