package eventbus.demo.starter.tasks;

import com.github.f4b6a3.ulid.UlidCreator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class TaskService {

    private final List<Task> tasks = new CopyOnWriteArrayList<>();

    public Task createTask(String projectId, String title, String assignee) {
        Task task = new Task(UlidCreator.getMonotonicUlid().toString(), projectId, title, assignee);
        tasks.add(task);
        return task;
    }

    public List<Task> listTasks() {
        return List.copyOf(tasks);
    }

    public List<Task> tasksForProject(String projectId) {
        return tasks.stream().filter(t -> t.projectId().equals(projectId)).toList();
    }
}
