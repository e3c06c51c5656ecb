package eventbus.demo.starter.tasks;

public record Task(String id, String projectId, String title, String assignee) {
}
