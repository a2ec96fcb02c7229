package io.b2mash.crm.crmcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrmCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(CrmCoreApplication.class, args);
  }
}
