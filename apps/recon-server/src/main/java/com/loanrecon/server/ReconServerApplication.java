package com.loanrecon.server;

import com.loanrecon.server.session.StdioSessionRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReconServerApplication {
  public static void main(String[] args) throws InterruptedException {
    ConfigurableApplicationContext context =
        SpringApplication.run(ReconServerApplication.class, args);
    StdioSessionRunner sessionRunner =
        context.getBeanProvider(StdioSessionRunner.class).getIfAvailable();
    if (sessionRunner == null) {
      return;
    }
    int exitCode = 0;
    try {
      sessionRunner.awaitCompletion();
    } catch (IllegalStateException ex) {
      exitCode = 1;
    }
    int code = exitCode;
    System.exit(SpringApplication.exit(context, () -> code));
  }
}
