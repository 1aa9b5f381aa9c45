package me.golemcore.deploy.port.outbound;

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

import java.nio.file.Path;

/**
 * Port that fetches a source repository and packages it as a zip artifact.
 */
public interface ArtifactPackagerPort {

    /**
     * @param subdirectory
     *            optional directory inside the repository to package instead of
     *            its root
     * @param artifactBaseName
     *            prefix of the archive name; the checkout directory name when
     *            null
     */
    PackagedArtifact cloneAndPackage(String repoUrl, String branch, String subdirectory, String artifactBaseName);

    void cleanup(PackagedArtifact artifact);

    record PackagedArtifact(Path archive, Path workDir, String objectName, long sizeBytes) {
    }
}
