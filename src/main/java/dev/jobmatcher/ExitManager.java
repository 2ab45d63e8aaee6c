package dev.jobmatcher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ends the JVM once the CLI run is over. Does nothing under a test runner.
 */
@Slf4j
@Component
public class ExitManager {
  public void exit(int status) {
    if (isTest()) {
      log.debug("Test runner detected, ignoring exit({})", status);
      return;
    }
    log.info("Exiting with status {}", status);
    System.exit(status);
  }

  protected boolean isTest() {
    String classPath = System.getProperty("java.class.path", "");
    return classPath.contains("junit") || classPath.contains("surefire") || classPath.contains("intellij");
  }
}
