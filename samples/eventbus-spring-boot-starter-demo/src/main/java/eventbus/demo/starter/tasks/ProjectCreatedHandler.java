package eventbus.demo.starter.tasks;

import eventbus.Event;
import eventbus.EventHandler;
import eventbus.IdempotencyKeyFunction;
import eventbus.PayloadValidator;
import eventbus.demo.starter.projects.ProjectCreated;
import eventbus.spring.boot.EventSubscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the initial task of every new project, at most once per project. Events without a
 * project name are rejected before a task is created.
 */
@Component
@EventSubscriber(eventName = ProjectCreated.EVENT_NAME, module = "tasks",
        handlerId = "tasks-project-created-handler",
        maxAttempts = 3, backoffMs = 1000, exponentialBackoff = true, timeoutMs = 10_000)
public class ProjectCreatedHandler implements EventHandler, IdempotencyKeyFunction, PayloadValidator {

    private static final Logger log = LoggerFactory.getLogger(ProjectCreatedHandler.class);

    private final TaskService taskService;

    public ProjectCreatedHandler(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void handle(Event event) {
        ProjectCreated project = event.dataAs(ProjectCreated.class);
        String assignee = project.ownerId() != null ? project.ownerId() : project.createdBy();
        Task task = taskService.createTask(project.projectId(),
                "Initial task for project: " + project.name(), assignee);
        log.info("[Tasks] Created task {} for project {} assigned to {}",
                task.id(), project.projectId(), assignee);
    }

    @Override
    public String keyFor(Event event) {
        return "task-created-for-project-" + event.dataAs(ProjectCreated.class).projectId();
    }

    @Override
    public void validate(Event event) {
        ProjectCreated project = event.dataAs(ProjectCreated.class);
        if (project.name() == null || project.name().isBlank()) {
            throw new IllegalArgumentException("project " + project.projectId() + " has no name");
        }
    }
}
