package com.bastion.accessservice.domain.port;

import java.util.List;
import java.util.Optional;

/**
 * Read access to projects and project grants, which are managed outside this service.
 */
public interface ProjectDirectory {

    Optional<Project> findProject(String instanceId, String projectId);

    Optional<ProjectGrant> findProjectGrant(String instanceId, String projectGrantId);

    /**
     * @param roleKeys role keys defined on the project
     */
    record Project(String id, String resourceOwner, List<String> roleKeys) {
        public Project {
            roleKeys = List.copyOf(roleKeys);
        }
    }

    /**
     * A project shared with another organization.
     *
     * @param grantedOrgId     organization the project was granted to
     * @param grantedRoleKeys  subset of the project's roles the granted organization may hand out
     */
    record ProjectGrant(String id, String projectId, String grantedOrgId, boolean active,
                        List<String> grantedRoleKeys) {
        public ProjectGrant {
            grantedRoleKeys = List.copyOf(grantedRoleKeys);
        }
    }
}
