package uk.ac.ebi.orthoviewer.ortholog_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrthologServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrthologServiceApplication.class, args);
  }
}
