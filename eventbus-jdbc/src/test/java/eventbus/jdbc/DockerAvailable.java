package eventbus.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Container-backed tests carry this so a machine without Docker reports them as skipped
 * rather than failed.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Condition.class)
@interface DockerAvailable {

  final class Condition implements ExecutionCondition {
    // Checked once per JVM; every container test class asks.
    private static volatile ConditionEvaluationResult result;

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      ConditionEvaluationResult cached = result;
      if (cached == null) {
        cached = check();
        result = cached;
      }
      return cached;
    }

    private static ConditionEvaluationResult check() {
      if (DockerClientFactory.instance().isDockerAvailable()) {
        return ConditionEvaluationResult.enabled("docker daemon reachable");
      }
      return ConditionEvaluationResult.disabled("no docker daemon, skipping container test");
    }
  }
}
