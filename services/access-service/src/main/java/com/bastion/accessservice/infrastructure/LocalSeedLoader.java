package com.bastion.accessservice.infrastructure;

import com.bastion.accessservice.config.AccessServiceProperties;
import com.bastion.accessservice.domain.idp.AutoLinkingOption;
import com.bastion.accessservice.domain.idp.IdentityProviderType;
import com.bastion.accessservice.domain.port.ProjectDirectory;
import com.bastion.accessservice.infrastructure.directory.InMemoryProjectDirectory;
import com.bastion.accessservice.infrastructure.directory.InMemoryUserDirectory;
import com.bastion.accessservice.infrastructure.idp.EventSourcedIdentityProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.List;
import java.util.Locale;

/**
 * Loads the configured seed into the in-memory directories and the journal at startup.
 */
public class LocalSeedLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LocalSeedLoader.class);

    private final AccessServiceProperties properties;
    private final InMemoryProjectDirectory projects;
    private final InMemoryUserDirectory users;
    private final EventSourcedIdentityProviderRegistry identityProviders;

    public LocalSeedLoader(AccessServiceProperties properties, InMemoryProjectDirectory projects,
                           InMemoryUserDirectory users, EventSourcedIdentityProviderRegistry identityProviders) {
        this.properties = properties;
        this.projects = projects;
        this.users = users;
        this.identityProviders = identityProviders;
    }

    @Override
    public void run(ApplicationArguments args) {
        var seed = properties.seed();
        if (seed.isEmpty()) {
            return;
        }
        String instanceId = properties.instanceId();
        seed.users().forEach(userId -> users.addUser(instanceId, userId));
        seed.projects().forEach(p -> projects.addProject(instanceId,
                new ProjectDirectory.Project(p.id(), p.owner(), orEmpty(p.roleKeys()))));
        seed.projectGrants().forEach(g -> projects.addProjectGrant(instanceId,
                new ProjectDirectory.ProjectGrant(g.id(), g.projectId(), g.grantedOrg(), true, orEmpty(g.roleKeys()))));
        for (var idp : seed.identityProviders()) {
            var definition = new EventSourcedIdentityProviderRegistry.Definition(idp.name(),
                    IdentityProviderType.valueOf(idp.type().toUpperCase(Locale.ROOT)), idp.linkingAllowed(),
                    idp.creationAllowed(), idp.autoCreation(), idp.autoUpdate(), autoLinking(idp.autoLinking()));
            if (idp.active()) {
                identityProviders.addActive(instanceId, definition);
            } else {
                identityProviders.add(instanceId, definition);
            }
        }
        log.info("Loaded seed for instance {}: {} users, {} projects, {} project grants, {} identity providers",
                instanceId, seed.users().size(), seed.projects().size(), seed.projectGrants().size(),
                seed.identityProviders().size());
    }

    private static AutoLinkingOption autoLinking(String value) {
        return value == null || value.isBlank()
                ? AutoLinkingOption.UNSPECIFIED
                : AutoLinkingOption.valueOf(value.toUpperCase(Locale.ROOT));
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
