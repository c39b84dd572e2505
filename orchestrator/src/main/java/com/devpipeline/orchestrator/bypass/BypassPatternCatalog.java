package com.devpipeline.orchestrator.bypass;

import com.devpipeline.orchestrator.bypass.pattern.CompletenessPattern;
import com.devpipeline.orchestrator.bypass.pattern.CongruencePattern;
import com.devpipeline.orchestrator.bypass.pattern.ContentPattern;
import com.devpipeline.orchestrator.bypass.pattern.ContractViolationPattern;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Known bypass patterns, loaded once from a JSON catalog:
 * <pre>
 *   { "patterns": [
 *       { "id": "INCOMPLETE-STANDARD", "kind": "completeness", "severity": "critical",
 *         "mode": "standard", "expected_actions": ["commit", "push", "pr-create"],
 *         "suggested_fix": "..." },
 *       { "id": "...", "kind": "congruence", "left": "**&#47;schemas/*.json", "right": "**&#47;validators/*.py", ... },
 *       { "id": "...", "kind": "content", "stages": ["implementation"], "markers": ["NotImplementedError"], ... },
 *       { "id": "...", "kind": "contract", ... } ] }
 * </pre>
 */
@Component
public class BypassPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(BypassPatternCatalog.class);

    record CatalogFile(List<PatternSpec> patterns) {}

    record PatternSpec(
            String       id,
            String       kind,
            String       severity,
            String       description,
            String       mode,
            List<String> expected_actions,
            String       left,
            String       right,
            List<String> stages,
            List<String> markers,
            String       suggested_fix) {}

    private final List<BypassPattern> patterns;

    public BypassPatternCatalog(
            @Value("${devpipeline.bypass.catalog:classpath:bypass-patterns.json}") Resource catalog,
            ObjectMapper json) {
        try (InputStream in = catalog.getInputStream()) {
            this.patterns = parse(in, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read bypass pattern catalog " + catalog, e);
        }
        log.info("Loaded {} bypass patterns from {}", patterns.size(), catalog);
    }

    public List<BypassPattern> patterns() {
        return patterns;
    }

    /**
     * @throws IllegalArgumentException on unknown kinds, duplicate ids or missing fields
     */
    static List<BypassPattern> parse(InputStream in, ObjectMapper json) throws IOException {
        CatalogFile file = json.readValue(in, CatalogFile.class);
        if (file.patterns() == null) {
            return List.of();
        }
        Set<String> ids = new HashSet<>();
        for (PatternSpec spec : file.patterns()) {
            if (spec.id() == null || spec.id().isBlank()) {
                throw new IllegalArgumentException("Pattern without id");
            }
            if (spec.id().equals(BypassFinding.NEW_BYPASS) || !ids.add(spec.id())) {
                throw new IllegalArgumentException("Duplicate or reserved pattern id " + spec.id());
            }
        }
        return file.patterns().stream().map(BypassPatternCatalog::toPattern).toList();
    }

    private static BypassPattern toPattern(PatternSpec spec) {
        Severity severity = Severity.parse(spec.severity());
        String kind = spec.kind() == null ? "" : spec.kind().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "completeness" -> new CompletenessPattern(spec.id(), severity,
                    require(spec.mode(), spec, "mode"),
                    require(spec.expected_actions(), spec, "expected_actions"),
                    spec.suggested_fix());
            case "congruence" -> new CongruencePattern(spec.id(), severity,
                    require(spec.left(), spec, "left"),
                    require(spec.right(), spec, "right"),
                    spec.suggested_fix());
            case "content" -> new ContentPattern(spec.id(), severity,
                    Set.copyOf(require(spec.stages(), spec, "stages")),
                    require(spec.markers(), spec, "markers"),
                    spec.suggested_fix());
            case "contract" -> new ContractViolationPattern(spec.id(), severity, spec.suggested_fix());
            default -> throw new IllegalArgumentException(
                    "Pattern " + spec.id() + " has unknown kind '" + spec.kind() + "'");
        };
    }

    private static <T> T require(T value, PatternSpec spec, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Pattern " + spec.id() + " is missing '" + field + "'");
        }
        return value;
    }
}
