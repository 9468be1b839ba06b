package com.flamingo.ai.docrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document question answering service. */
@SpringBootApplication
public class DocRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocRagApplication.class, args);
  }
}
