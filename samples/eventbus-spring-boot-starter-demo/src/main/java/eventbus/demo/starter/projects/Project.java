package eventbus.demo.starter.projects;

import java.time.Instant;

public record Project(String id, String name, String createdBy, String ownerId, Instant createdAt) {
}
