package com.bastion.accessservice.infrastructure.directory;

import com.bastion.accessservice.domain.port.UserDirectory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryUserDirectory implements UserDirectory {

    private final Set<String> users = ConcurrentHashMap.newKeySet();

    public InMemoryUserDirectory addUser(String instanceId, String userId) {
        users.add(instanceId + "/" + userId);
        return this;
    }

    @Override
    public boolean userExists(String instanceId, String userId) {
        return users.contains(instanceId + "/" + userId);
    }
}
