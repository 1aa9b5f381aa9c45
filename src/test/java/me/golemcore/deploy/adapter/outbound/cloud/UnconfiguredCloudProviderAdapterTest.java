package me.golemcore.deploy.adapter.outbound.cloud;

import me.golemcore.deploy.domain.model.CloudProviderException;
import me.golemcore.deploy.port.outbound.CloudProviderPort.CloudRequest;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UnconfiguredCloudProviderAdapterTest {

    private final UnconfiguredCloudProviderAdapter adapter = new UnconfiguredCloudProviderAdapter();

    @Test
    void shouldRefuseEveryCall() {
        CloudProviderException error = assertThrows(CloudProviderException.class,
                () -> adapter.call(new CloudRequest("s3", "ListObjectsV2", "us-east-1", Map.of(), null, false)));

        assertEquals("ProviderNotConfigured", error.getProviderCode());
        assertEquals("ListObjectsV2", error.getOperation());
        assertFalse(adapter.isConfigured());
        assertEquals("none", adapter.getProviderId());
    }
}
