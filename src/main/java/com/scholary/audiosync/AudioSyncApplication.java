package com.scholary.audiosync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioSyncApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(AudioSyncApplication.class, args)));
  }
}
