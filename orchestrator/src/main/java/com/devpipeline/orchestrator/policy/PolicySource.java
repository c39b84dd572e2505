package com.devpipeline.orchestrator.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the policy document from disk on every call.
 *
 * The document is edited out-of-band and evaluations are rare, so nothing is
 * cached between calls.
 */
@Component
public class PolicySource {

    private static final Logger log = LoggerFactory.getLogger(PolicySource.class);

    private final Path path;

    public PolicySource(@Value("${devpipeline.policy.path:.devpipeline/POLICY.md}") Path path) {
        this.path = path;
    }

    /**
     * @return the parsed policy, or empty if the document does not exist
     * @throws PolicyParseException if the document exists but cannot be read or parsed
     */
    public Optional<Policy> load() {
        if (!Files.isRegularFile(path)) {
            log.warn("Policy document {} not found", path.toAbsolutePath());
            return Optional.empty();
        }
        try {
            return Optional.of(PolicyDocumentParser.parse(Files.readString(path, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new PolicyParseException("Could not read policy document " + path, e);
        }
    }

    public Path path() {
        return path;
    }
}
