package eventbus.demo.starter.projects;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public Project create(@RequestParam String name,
            @RequestParam String createdBy,
            @RequestParam(required = false) String ownerId) {
        return projectService.createProject(name, createdBy, ownerId);
    }

    @PostMapping("/{id}/republish")
    public Map<String, String> republish(@PathVariable String id) {
        projectService.republish(id);
        return Map.of("status", "ok", "projectId", id);
    }

    @GetMapping
    public List<Project> list() {
        return projectService.listProjects();
    }
}
