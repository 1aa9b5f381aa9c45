package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.model.DeploymentIntent;
import me.golemcore.deploy.domain.model.DeploymentTarget;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword extraction of deployment parameters and control commands from a
 * user message. Only recognised fields are filled; everything else is left
 * null so that {@link DeploymentIntent#mergeFrom(DeploymentIntent)} keeps
 * what earlier turns supplied.
 */
@Component
public class IntentExtractor {

    private static final Set<String> STOP_WORDS = Set.of(
            "in", "on", "with", "and", "for", "using", "to", "from", "the", "a", "an", "named", "called", "of",
            "at", "into", "that", "is");

    private static final Pattern REGION = Pattern.compile("\\b([a-z]{2}(?:-gov)?-[a-z]+-\\d)\\b");
    private static final Pattern INSTANCE_TYPE = Pattern.compile(
            "\\b([a-z][0-9][a-z]{0,2}\\.(?:nano|micro|small|medium|large|\\d*xlarge))\\b");
    private static final Pattern AMI = Pattern.compile("\\b(ami-[0-9a-z]+)\\b");
    private static final Pattern KEY_NAME = Pattern.compile(
            "\\bkey(?:[ _-]?pair|[ _]name)?(?:\\s+named\\s+|\\s*[=:]\\s*|\\s+)([A-Za-z0-9][A-Za-z0-9._-]*)");
    private static final Pattern REPO = Pattern.compile(
            "((?:https?://|git@)[^\\s,]+?\\.git|https?://(?:www\\.)?(?:github\\.com|gitlab\\.com|bitbucket\\.org)/[^\\s,]+)");
    private static final Pattern BRANCH = Pattern.compile("\\bbranch\\s*(?:[=:]\\s*)?([A-Za-z0-9._/-]+)");
    private static final Pattern PATH = Pattern.compile(
            "\\b(?:path|file|archive|zip|directory|dir)\\s*(?:[=:]\\s*)?((?:/|\\./|~/)[^\\s,]+)");
    private static final Pattern S3_URI = Pattern.compile("\\bs3://([a-z0-9][a-z0-9.-]{1,61}[a-z0-9])(?:/([^\\s,]+))?");
    private static final Pattern BUCKET = Pattern.compile(
            "\\bbucket(?:[ _]name)?(?:\\s+named\\s+|\\s+called\\s+|\\s*[=:]\\s*|\\s+)([a-z0-9][a-z0-9.-]{1,61}[a-z0-9])");
    private static final Pattern OBJECT_KEY = Pattern.compile("\\bobject(?:[ _]key|[ _]name)?\\s*[=:]\\s*([^\\s,]+)");
    private static final Pattern FUNCTION_NAME = Pattern.compile(
            "\\bfunction(?:[ _]name)?(?:\\s+named\\s+|\\s+called\\s+|\\s*[=:]\\s*)([A-Za-z0-9_-]+)");
    private static final Pattern RUNTIME = Pattern.compile(
            "\\b(python3\\.\\d+|nodejs\\d+\\.x|java\\d+|ruby\\d\\.\\d+|dotnet\\d+|provided\\.al2(?:023)?)\\b");
    private static final Pattern HANDLER = Pattern.compile(
            "\\bhandler\\s*(?:[=:]\\s*)?([A-Za-z0-9_/-]+(?:\\.[A-Za-z0-9_]+)+(?:::[A-Za-z0-9_]+)?)");
    private static final Pattern ROLE_ARN = Pattern.compile("(arn:aws:iam::\\d{12}:role/[A-Za-z0-9+=,.@_/-]+)");
    private static final Pattern CLUSTER = Pattern.compile(
            "\\bcluster(?:[ _]name)?(?:\\s+named\\s+|\\s+called\\s+|\\s*[=:]\\s*|\\s+)([A-Za-z0-9_-]+)");
    private static final Pattern SERVICE = Pattern.compile(
            "\\bservice(?:[ _]name)?(?:\\s+named\\s+|\\s+called\\s+|\\s*[=:]\\s*|\\s+)([A-Za-z0-9_-]+)");
    private static final Pattern CONTAINER_IMAGE = Pattern.compile(
            "\\bimage(?:[ _]id)?\\s*(?:[=:]\\s*)?([a-z0-9][a-z0-9._/-]*(?::[A-Za-z0-9._-]+)?)");
    private static final Pattern INSTANCE_COUNT = Pattern.compile("\\b(\\d{1,3})\\s+(?:ec2\\s+)?instances\\b");
    private static final Pattern DESIRED_COUNT = Pattern.compile(
            "\\b(?:desired(?:[ _]count)?|replicas|tasks)\\s*(?:[=:]\\s*|of\\s+)?(\\d{1,3})\\b"
                    + "|\\b(\\d{1,3})\\s+(?:replicas|tasks)\\b");
    private static final Pattern SUBNET = Pattern.compile("\\b(subnet-[0-9a-z]+)\\b");
    private static final Pattern SECURITY_GROUP = Pattern.compile("\\b(sg-[0-9a-z]+)\\b");
    private static final Pattern TAG = Pattern.compile("\\btag\\s+([A-Za-z0-9_-]+)=([A-Za-z0-9_.:/-]+)");

    private static final Pattern CONFIRM = Pattern.compile("^(?:confirm|confirmed|yes|y|approve|proceed|go ahead)\\b.*");
    private static final Pattern DECLINE = Pattern.compile("^(?:no|n|decline|deny|reject)\\b.*");
    private static final Pattern CANCEL = Pattern.compile("^(?:cancel|abort|stop)\\b.*");
    private static final Pattern NEW_DEPLOYMENT = Pattern.compile("^(?:new deployment|start over|reset)\\b.*");

    public ParsedMessage parse(String message) {
        if (message == null || message.isBlank()) {
            return new ParsedMessage(Command.NONE, new DeploymentIntent(), false);
        }
        String text = message.trim();
        String lower = text.toLowerCase(Locale.ROOT);
        Command command = parseCommand(lower);
        DeploymentIntent intent = extract(text, lower);
        return new ParsedMessage(command, intent, !intent.equals(new DeploymentIntent()));
    }

    private static Command parseCommand(String lower) {
        if (CANCEL.matcher(lower).matches()) {
            return Command.CANCEL;
        }
        if (NEW_DEPLOYMENT.matcher(lower).matches()) {
            return Command.NEW_DEPLOYMENT;
        }
        if (CONFIRM.matcher(lower).matches()) {
            return Command.CONFIRM;
        }
        if (DECLINE.matcher(lower).matches()) {
            return Command.DECLINE;
        }
        return Command.NONE;
    }

    private DeploymentIntent extract(String text, String lower) {
        DeploymentIntent intent = new DeploymentIntent();
        intent.setTarget(detectTarget(lower));
        intent.setRegion(first(REGION, lower));
        intent.setInstanceType(first(INSTANCE_TYPE, lower));
        intent.setImageId(first(AMI, lower));
        intent.setRoleArn(first(ROLE_ARN, text));
        intent.setRuntime(first(RUNTIME, lower));
        intent.setHandler(first(HANDLER, text));

        String repo = first(REPO, text);
        if (repo != null) {
            intent.setRepoUrl(stripTrailingPunctuation(repo));
        }
        intent.setBranch(first(BRANCH, text));
        String path = first(PATH, text);
        if (path != null) {
            intent.setLocalPath(stripTrailingPunctuation(path));
        }

        Matcher s3 = S3_URI.matcher(text);
        if (s3.find()) {
            intent.setBucketName(s3.group(1));
            if (s3.group(2) != null) {
                intent.setObjectKey(stripTrailingPunctuation(s3.group(2)));
            }
        } else {
            intent.setBucketName(first(BUCKET, lower));
        }
        String objectKey = first(OBJECT_KEY, text);
        if (objectKey != null) {
            intent.setObjectKey(stripTrailingPunctuation(objectKey));
        }

        intent.setKeyName(first(KEY_NAME, text));
        intent.setFunctionName(first(FUNCTION_NAME, text));
        intent.setClusterName(first(CLUSTER, text));
        intent.setServiceName(first(SERVICE, text));

        String image = first(CONTAINER_IMAGE, lower);
        if (image != null && !image.startsWith("ami-")) {
            intent.setContainerImage(image);
        }

        String count = first(INSTANCE_COUNT, lower);
        if (count != null) {
            intent.setInstanceCount(Integer.parseInt(count));
        }
        Matcher desired = DESIRED_COUNT.matcher(lower);
        if (desired.find()) {
            String value = desired.group(1) != null ? desired.group(1) : desired.group(2);
            intent.setDesiredCount(Integer.parseInt(value));
        }

        intent.setSubnetIds(all(SUBNET, lower));
        intent.setSecurityGroupIds(all(SECURITY_GROUP, lower));
        Map<String, String> tags = new LinkedHashMap<>();
        Matcher tag = TAG.matcher(text);
        while (tag.find()) {
            tags.put(tag.group(1), tag.group(2));
        }
        intent.setTags(tags);
        return intent;
    }

    static DeploymentTarget detectTarget(String lower) {
        if (containsWord(lower, "ecs") || containsWord(lower, "fargate") || containsWord(lower, "container")) {
            return DeploymentTarget.CONTAINER;
        }
        if (containsWord(lower, "lambda") || containsWord(lower, "serverless") || containsWord(lower, "function")) {
            return DeploymentTarget.FUNCTION;
        }
        if (containsWord(lower, "ec2") || containsWord(lower, "instance") || containsWord(lower, "instances")
                || containsWord(lower, "vm") || containsWord(lower, "server")) {
            return DeploymentTarget.INSTANCE;
        }
        if (containsWord(lower, "s3") || lower.contains("static site") || lower.contains("upload")) {
            return DeploymentTarget.STORAGE;
        }
        Matcher explicit = Pattern.compile("\\btarget\\s*[=:]\\s*([a-z0-9]+)").matcher(lower);
        return explicit.find() ? DeploymentTarget.parse(explicit.group(1)) : null;
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static String first(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1);
            if (value != null && !STOP_WORDS.contains(value.toLowerCase(Locale.ROOT))) {
                return value;
            }
        }
        return null;
    }

    private static List<String> all(Pattern pattern, String text) {
        List<String> values = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (!values.contains(matcher.group(1))) {
                values.add(matcher.group(1));
            }
        }
        return values;
    }

    private static String stripTrailingPunctuation(String value) {
        String result = value;
        while (!result.isEmpty() && ".,;:)!?".indexOf(result.charAt(result.length() - 1)) >= 0) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    public enum Command {
        NONE, CONFIRM, DECLINE, CANCEL, NEW_DEPLOYMENT
    }

    /**
     * Parsed user turn. {@code hasIntent} is true when at least one deployment
     * field was recognised.
     */
    public record ParsedMessage(Command command, DeploymentIntent intent, boolean hasIntent) {
    }
}
