package com.flamingo.ai.chatarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point wiring the export readers, ranking engine and statistics into one context. */
@SpringBootApplication
public class ChatArchiveApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatArchiveApplication.class, args);
  }
}
