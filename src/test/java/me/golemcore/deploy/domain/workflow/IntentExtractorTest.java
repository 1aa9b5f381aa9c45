package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.model.DeploymentIntent;
import me.golemcore.deploy.domain.model.DeploymentTarget;
import me.golemcore.deploy.domain.workflow.IntentExtractor.Command;
import me.golemcore.deploy.domain.workflow.IntentExtractor.ParsedMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentExtractorTest {

    private final IntentExtractor extractor = new IntentExtractor();

    @Test
    void shouldExtractInstanceLaunchParameters() {
        ParsedMessage parsed = extractor.parse("Launch 2 instances of t3.small in eu-west-1 from ami-0abc1234 "
                + "with key pair dev-key, subnet-0aa sg-0bb tag team=platform");

        DeploymentIntent intent = parsed.intent();
        assertTrue(parsed.hasIntent());
        assertEquals(Command.NONE, parsed.command());
        assertEquals(DeploymentTarget.INSTANCE, intent.getTarget());
        assertEquals("eu-west-1", intent.getRegion());
        assertEquals("t3.small", intent.getInstanceType());
        assertEquals("ami-0abc1234", intent.getImageId());
        assertEquals("dev-key", intent.getKeyName());
        assertEquals(2, intent.getInstanceCount());
        assertEquals(List.of("subnet-0aa"), intent.getSubnetIds());
        assertEquals(List.of("sg-0bb"), intent.getSecurityGroupIds());
        assertEquals(Map.of("team", "platform"), intent.getTags());
        assertNull(intent.getContainerImage());
    }

    @Test
    void shouldExtractFunctionParameters() {
        DeploymentIntent intent = extractor.parse("deploy lambda function named hello-api with runtime python3.12 "
                + "handler app.handler role arn:aws:iam::123456789012:role/lambda-exec from zip /tmp/hello.zip")
                .intent();

        assertEquals(DeploymentTarget.FUNCTION, intent.getTarget());
        assertEquals("hello-api", intent.getFunctionName());
        assertEquals("python3.12", intent.getRuntime());
        assertEquals("app.handler", intent.getHandler());
        assertEquals("arn:aws:iam::123456789012:role/lambda-exec", intent.getRoleArn());
        assertEquals("/tmp/hello.zip", intent.getLocalPath());
    }

    @Test
    void shouldExtractContainerParameters() {
        DeploymentIntent intent = extractor.parse("run container image nginx:1.27 on ecs cluster demo service web "
                + "with 3 tasks").intent();

        assertEquals(DeploymentTarget.CONTAINER, intent.getTarget());
        assertEquals("nginx:1.27", intent.getContainerImage());
        assertEquals("demo", intent.getClusterName());
        assertEquals("web", intent.getServiceName());
        assertEquals(3, intent.getDesiredCount());
    }

    @Test
    void shouldExtractRepositoryAndBucketFromS3Uri() {
        DeploymentIntent intent = extractor.parse("upload https://github.com/acme/site.git branch main "
                + "to s3://acme-site/releases/v1.zip.").intent();

        assertEquals(DeploymentTarget.STORAGE, intent.getTarget());
        assertEquals("https://github.com/acme/site.git", intent.getRepoUrl());
        assertEquals("main", intent.getBranch());
        assertEquals("acme-site", intent.getBucketName());
        assertEquals("releases/v1.zip", intent.getObjectKey());
    }

    @Test
    void shouldReportNoIntentForSmallTalk() {
        ParsedMessage parsed = extractor.parse("thanks, that looks good");

        assertFalse(parsed.hasIntent());
        assertEquals(Command.NONE, parsed.command());
        assertFalse(extractor.parse("   ").hasIntent());
        assertFalse(extractor.parse(null).hasIntent());
    }

    @ParameterizedTest
    @CsvSource({
            "confirm, CONFIRM",
            "yes please, CONFIRM",
            "Go ahead, CONFIRM",
            "no, DECLINE",
            "reject it, DECLINE",
            "cancel, CANCEL",
            "Abort now, CANCEL",
            "new deployment, NEW_DEPLOYMENT",
            "start over, NEW_DEPLOYMENT",
            "nothing to add, NONE"
    })
    void shouldRecogniseCommands(String message, Command expected) {
        assertEquals(expected, extractor.parse(message).command());
    }

    @Test
    void shouldDetectTargetFromKeywords() {
        assertEquals(DeploymentTarget.CONTAINER, IntentExtractor.detectTarget("fargate service"));
        assertEquals(DeploymentTarget.FUNCTION, IntentExtractor.detectTarget("serverless api"));
        assertEquals(DeploymentTarget.INSTANCE, IntentExtractor.detectTarget("a small vm"));
        assertEquals(DeploymentTarget.STORAGE, IntentExtractor.detectTarget("publish my static site"));
        assertEquals(DeploymentTarget.STORAGE, IntentExtractor.detectTarget("target=bucket"));
        assertNull(IntentExtractor.detectTarget("hello"));
    }
}
