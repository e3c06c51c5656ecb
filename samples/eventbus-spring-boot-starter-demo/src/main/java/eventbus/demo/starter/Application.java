package eventbus.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Two modules, {@code projects} and {@code tasks}, that share nothing but event names.
 *
 * <pre>
 * curl -X POST 'localhost:8080/projects?name=Website&amp;createdBy=alice&amp;ownerId=bob'
 * curl localhost:8080/tasks
 * curl -X POST localhost:8080/projects/{id}/republish   # idempotent: no second task
 * curl localhost:8080/actuator/metrics/eventbus.handler.success
 * </pre>
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
