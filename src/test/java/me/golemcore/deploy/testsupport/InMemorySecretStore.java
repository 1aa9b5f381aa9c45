package me.golemcore.deploy.testsupport;

import me.golemcore.deploy.domain.model.StoredCredential;
import me.golemcore.deploy.port.outbound.SecretStorePort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySecretStore implements SecretStorePort {

    private final Map<String, StoredCredential> records = new ConcurrentHashMap<>();

    @Override
    public Optional<StoredCredential> findActive(String principal) {
        StoredCredential stored = records.get(principal);
        return stored != null && stored.isActive() ? Optional.of(stored) : Optional.empty();
    }

    @Override
    public void saveActive(StoredCredential credential) {
        records.put(credential.getPrincipal(), credential);
    }

    public Map<String, StoredCredential> records() {
        return records;
    }
}
