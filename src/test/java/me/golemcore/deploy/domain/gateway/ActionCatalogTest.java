package me.golemcore.deploy.domain.gateway;

import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.StageCapability;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionCatalogTest {

    @Test
    void shouldIndexActionsByNameInSortedOrder() {
        ActionProvider compute = () -> List.of(action("run_ec2"), action("describe_instances"));
        ActionProvider storage = () -> List.of(action("upload_to_s3"));

        ActionCatalog catalog = new ActionCatalog(List.of(compute, storage));

        assertEquals(List.of("describe_instances", "run_ec2", "upload_to_s3"), catalog.names());
        assertTrue(catalog.find("run_ec2").isPresent());
        assertEquals(3, catalog.definitions().size());
    }

    @Test
    void shouldNotFindMalformedOrUnknownNames() {
        ActionProvider provider = () -> List.of(action("run_ec2"));
        ActionCatalog catalog = new ActionCatalog(List.of(provider));

        assertTrue(catalog.find("RUN_EC2").isEmpty());
        assertTrue(catalog.find("run_ec2; rm").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
        assertTrue(catalog.find("stop_ec2").isEmpty());
    }

    @Test
    void shouldRejectDuplicateActions() {
        ActionProvider first = () -> List.of(action("run_ec2"));
        ActionProvider second = () -> List.of(action("run_ec2"));

        assertThrows(IllegalStateException.class, () -> new ActionCatalog(List.of(first, second)));
    }

    private static ActionDefinition action(String name) {
        return ActionDefinition.builder()
                .name(name)
                .category(ActionCategory.COMPUTE)
                .capability(StageCapability.READ_ONLY)
                .handler(request -> Map.of())
                .build();
    }
}
