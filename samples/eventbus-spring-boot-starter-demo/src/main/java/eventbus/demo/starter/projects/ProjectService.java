package eventbus.demo.starter.projects;

import com.github.f4b6a3.ulid.UlidCreator;
import eventbus.Event;
import eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class ProjectService {

    static final String MODULE = "projects";

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final EventBus eventBus;
    private final Map<String, Project> projects = new ConcurrentHashMap<>();

    public ProjectService(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Project createProject(String name, String createdBy, String ownerId) {
        Project project = new Project(UlidCreator.getMonotonicUlid().toString(), name, createdBy,
                ownerId, Instant.now());
        projects.put(project.id(), project);

        Event event = eventBus.publish(ProjectCreated.EVENT_NAME,
                new ProjectCreated(project.id(), name, createdBy, ownerId), MODULE);
        log.info("[Projects] Created project {} ({}), published event {}",
                project.id(), name, event.eventId());
        return project;
    }

    /**
     * Publishes {@code projects:project.created} again for an existing project, as a retrying
     * client or a replay would. Handlers with an idempotency key do not run twice.
     */
    public void republish(String projectId) {
        Project project = projects.get(projectId);
        if (project == null) {
            throw new IllegalArgumentException("Unknown project: " + projectId);
        }
        eventBus.publish(ProjectCreated.EVENT_NAME, new ProjectCreated(project.id(), project.name(),
                project.createdBy(), project.ownerId()), MODULE);
    }

    public List<Project> listProjects() {
        return List.copyOf(projects.values());
    }
}
