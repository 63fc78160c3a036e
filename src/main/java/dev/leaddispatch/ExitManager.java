package dev.leaddispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the context and terminates the JVM with the command's status.
 * Kept separate so tests can replace it instead of killing the runner.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExitManager {

    private final ApplicationContext context;

    public void exit(int status) {
        if (isTest()) {
            log.debug("Exit {} suppressed under test", status);
            return;
        }
        System.exit(SpringApplication.exit(context, () -> status));
    }

    protected boolean isTest() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
    }
}
