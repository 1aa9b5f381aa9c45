package me.golemcore.deploy.adapter.inbound.web.controller;

import me.golemcore.deploy.adapter.inbound.web.dto.ActionInvocationRequest;
import me.golemcore.deploy.domain.gateway.ActionCatalog;
import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ToolGateway;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.DeploymentException;
import me.golemcore.deploy.domain.model.ErrorCode;
import me.golemcore.deploy.domain.model.InvocationContext;
import me.golemcore.deploy.domain.model.InvocationMode;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.domain.model.ToolResult;
import me.golemcore.deploy.domain.service.CredentialBroker;
import me.golemcore.deploy.infrastructure.config.DeployProperties;
import me.golemcore.deploy.testsupport.InMemorySecretStore;
import me.golemcore.deploy.testsupport.MutableClock;
import me.golemcore.deploy.testsupport.TestCredentialBrokers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActionsControllerTest {

    private ToolGateway toolGateway;
    private ActionCatalog actionCatalog;
    private CredentialBroker credentialBroker;
    private ActionsController controller;

    @BeforeEach
    void setUp() {
        toolGateway = mock(ToolGateway.class);
        actionCatalog = mock(ActionCatalog.class);
        credentialBroker = TestCredentialBrokers.create(new DeployProperties(), new InMemorySecretStore(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        controller = new ActionsController(toolGateway, actionCatalog, credentialBroker);
    }

    @Test
    void shouldListActionsWithoutHandlers() {
        when(actionCatalog.definitions()).thenReturn(List.of(ActionDefinition.builder()
                .name("terminate_ec2")
                .category(ActionCategory.COMPUTE)
                .capability(StageCapability.MUTATE)
                .destructive(true)
                .description("Terminate instances")
                .build()));

        StepVerifier.create(controller.listActions())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    Map<String, Object> entry = response.getBody().get(0);
                    assertEquals("terminate_ec2", entry.get("name"));
                    assertEquals(true, entry.get("destructive"));
                    assertFalse(entry.containsKey("handler"));
                })
                .verifyComplete();
    }

    @Test
    void shouldInvokeThroughGatewayAsDirectCall() {
        ToolResult result = ToolResult.success("describe_images", "2 images", Map.of());
        when(toolGateway.invoke(any(InvocationContext.class), eq("describe_images"), any(), eq(false)))
                .thenReturn(result);
        ActionInvocationRequest request = ActionInvocationRequest.builder()
                .action(" describe_images ")
                .params(Map.of("region", "us-east-1"))
                .principal("alice")
                .build();

        StepVerifier.create(controller.invoke(request))
                .assertNext(response -> assertEquals(result, response.getBody()))
                .verifyComplete();

        ArgumentCaptor<InvocationContext> context = ArgumentCaptor.forClass(InvocationContext.class);
        verify(toolGateway).invoke(context.capture(), eq("describe_images"), any(), eq(false));
        assertEquals("direct:alice", context.getValue().sessionId());
        assertEquals(InvocationMode.LIVE, context.getValue().mode());
        assertNull(context.getValue().stage());
        assertEquals(Optional.of("alice"), credentialBroker.boundPrincipal("direct:alice"));
    }

    @Test
    void shouldRefuseToRebindSessionOwnedByAnotherPrincipal() {
        credentialBroker.bindSession("s1", "alice");
        ActionInvocationRequest request = ActionInvocationRequest.builder()
                .action("describe_images")
                .sessionId("s1")
                .principal("mallory")
                .build();

        StepVerifier.create(controller.invoke(request))
                .expectErrorSatisfies(error -> {
                    DeploymentException denied = assertInstanceOf(DeploymentException.class, error);
                    assertEquals(ErrorCode.CAPABILITY_DENIED, denied.getErrorCode());
                })
                .verify();

        assertEquals(Optional.of("alice"), credentialBroker.boundPrincipal("s1"));
        verify(toolGateway, never()).invoke(any(), anyString(), any(), anyBoolean());
    }

    @Test
    void shouldAllowOwnerToUseExistingSession() {
        credentialBroker.bindSession("s1", "alice");
        when(toolGateway.invoke(any(InvocationContext.class), eq("describe_images"), any(), eq(false)))
                .thenReturn(ToolResult.success("describe_images", "0 images", Map.of()));

        StepVerifier.create(controller.invoke(ActionInvocationRequest.builder()
                .action("describe_images")
                .sessionId("s1")
                .principal("alice")
                .build()))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectMissingAction() {
        StepVerifier.create(controller.invoke(ActionInvocationRequest.builder().action(" ").build()))
                .expectError(ParameterValidationException.class)
                .verify();

        verify(toolGateway, never()).invoke(any(), anyString(), any(), anyBoolean());
    }
}
