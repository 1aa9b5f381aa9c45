package me.golemcore.deploy.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.deploy.domain.gateway.ActionDefinition;
import me.golemcore.deploy.domain.gateway.ActionRequest;
import me.golemcore.deploy.domain.gateway.ParameterSupport;
import me.golemcore.deploy.domain.model.ActionCategory;
import me.golemcore.deploy.domain.model.ParameterValidationException;
import me.golemcore.deploy.domain.model.StageCapability;
import me.golemcore.deploy.port.outbound.CloudProviderPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object storage actions.
 */
@Component
public class StorageActions extends CloudActionSupport {

    private static final String S3 = "s3";
    private static final String BUCKET_NAME = "bucket_name";
    private static final String FILE_PATH = "file_path";
    private static final String OBJECT_NAME = "object_name";

    public StorageActions(CloudProviderPort cloud) {
        super(cloud);
    }

    @Override
    public List<ActionDefinition> getActions() {
        return List.of(
                define("create_bucket", ActionCategory.STORAGE, StageCapability.MUTATE,
                        "Create an S3 bucket in the region", this::createBucket),
                define("upload_s3", ActionCategory.STORAGE, StageCapability.MUTATE,
                        "Upload a local file to a bucket", this::upload),
                define("download_s3", ActionCategory.STORAGE, StageCapability.READ_ONLY,
                        "Download an object to a local path", this::download),
                define("list_s3_objects", ActionCategory.STORAGE, StageCapability.READ_ONLY,
                        "List objects in a bucket", this::listObjects));
    }

    private Map<String, Object> createBucket(ActionRequest request) {
        String bucket = ParameterSupport.validateBucketName(
                ParameterSupport.requireString(request.params(), BUCKET_NAME, "create_bucket"));
        String region = ParameterSupport.validateRegion(request.region());
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("Bucket", bucket);
        if (!"us-east-1".equals(region)) {
            args.put("CreateBucketConfiguration", Map.of("LocationConstraint", region));
        }
        Map<String, Object> response = call(request, S3, "CreateBucket", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        return Map.of("bucket", bucket, "region", region);
    }

    private Map<String, Object> upload(ActionRequest request) {
        String bucket = ParameterSupport.requireString(request.params(), BUCKET_NAME, "upload_s3");
        Path file = Paths.get(ParameterSupport.requireString(request.params(), FILE_PATH, "upload_s3"));
        if (!Files.isRegularFile(file)) {
            throw new ParameterValidationException("File not found: " + file,
                    "Point 'file_path' at an existing local file");
        }
        String objectName = ParameterSupport.optionalString(request.params(), OBJECT_NAME);
        if (objectName == null) {
            objectName = file.getFileName().toString();
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("Bucket", bucket);
        args.put("Key", objectName);
        args.put("ContentLength", size);
        Map<String, Object> response = call(request, S3, "PutObject", args);
        if (isPreview(response)) {
            return preview(request, response);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("bucket", bucket);
        result.put("object", objectName);
        result.put("size_bytes", size);
        return result;
    }

    private Map<String, Object> download(ActionRequest request) {
        String bucket = ParameterSupport.requireString(request.params(), BUCKET_NAME, "download_s3");
        String objectName = ParameterSupport.requireString(request.params(), OBJECT_NAME, "download_s3");
        Path destination = Paths.get(ParameterSupport.requireString(request.params(), FILE_PATH, "download_s3"));
        Map<String, Object> response = call(request, S3, "GetObject", Map.of("Bucket", bucket, "Key", objectName));
        try {
            if (destination.getParent() != null) {
                Files.createDirectories(destination.getParent());
            }
            Files.writeString(destination, String.valueOf(response.getOrDefault("Body", "")));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + destination, e);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("bucket", bucket);
        result.put("object", objectName);
        result.put("downloaded_to", destination.toString());
        result.put("size_bytes", response.get("ContentLength"));
        return result;
    }

    private Map<String, Object> listObjects(ActionRequest request) {
        Map<String, Object> params = request.params();
        String bucket = ParameterSupport.optionalString(params, BUCKET_NAME);
        if (bucket == null) {
            bucket = ParameterSupport.optionalString(params, "bucket");
        }
        if (bucket == null) {
            throw new ParameterValidationException("'bucket_name' parameter is required for list_s3_objects");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("Bucket", bucket);
        String prefix = ParameterSupport.optionalString(params, "prefix");
        if (prefix != null) {
            args.put("Prefix", prefix);
        }
        Map<String, Object> response = call(request, S3, "ListObjectsV2", args);
        List<Map<String, Object>> listing = new ArrayList<>();
        for (Map<String, Object> object : listOfMaps(response.get("Contents"))) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("key", object.get("Key"));
            item.put("size", object.get("Size"));
            item.put("last_modified", object.get("LastModified"));
            item.put("storage_class", object.get("StorageClass"));
            listing.add(item);
        }
        return Map.of("objects", listing);
    }
}
