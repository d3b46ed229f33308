package com.bastion.accessservice.infrastructure.directory;

import com.bastion.accessservice.domain.port.ProjectDirectory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Project lookups backed by maps, filled by local setup code and tests.
 */
public class InMemoryProjectDirectory implements ProjectDirectory {

    private final Map<String, Project> projects = new ConcurrentHashMap<>();
    private final Map<String, ProjectGrant> projectGrants = new ConcurrentHashMap<>();

    public InMemoryProjectDirectory addProject(String instanceId, Project project) {
        projects.put(key(instanceId, project.id()), project);
        return this;
    }

    public InMemoryProjectDirectory addProjectGrant(String instanceId, ProjectGrant projectGrant) {
        projectGrants.put(key(instanceId, projectGrant.id()), projectGrant);
        return this;
    }

    @Override
    public Optional<Project> findProject(String instanceId, String projectId) {
        return Optional.ofNullable(projects.get(key(instanceId, projectId)));
    }

    @Override
    public Optional<ProjectGrant> findProjectGrant(String instanceId, String projectGrantId) {
        return Optional.ofNullable(projectGrants.get(key(instanceId, projectGrantId)));
    }

    private static String key(String instanceId, String id) {
        return instanceId + "/" + id;
    }
}
