package eventbus.demo.starter.projects;

/**
 * Payload of {@code projects:project.created}. Part of the Projects module's public contract.
 */
public record ProjectCreated(String projectId, String name, String createdBy, String ownerId) {

    public static final String EVENT_NAME = "projects:project.created";
}
