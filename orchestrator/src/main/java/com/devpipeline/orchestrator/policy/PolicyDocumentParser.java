package com.devpipeline.orchestrator.policy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the markdown policy document.
 *
 * Recognised layout:
 * <pre>
 *   ## GOALS
 *   - Reliable stage orchestration
 *   ## SCOPE
 *   ### In Scope          (or a line "**In Scope**:")
 *   - Workflow engine
 *   ### Out of Scope      (or a line "**Out of Scope**:")
 *   - Payment processing
 *   ## CONSTRAINTS
 *   - No external database dependencies
 *   ## PIPELINE
 *   - skip: doc-sync
 * </pre>
 * "## SCOPE IN" / "## SCOPE OUT" headings are accepted too. Only bullet lines
 * become entries; prose between them is ignored.
 */
public final class PolicyDocumentParser {

    private enum Section { NONE, GOALS, SCOPE_IN, SCOPE_OUT, CONSTRAINTS, PIPELINE }

    private static final Pattern HEADING = Pattern.compile("^(#{1,4})\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern BULLET  = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(.+)$");
    private static final Pattern LABEL   = Pattern.compile("^\\s*\\**\\s*(in scope|included|out of scope|excluded)\\s*\\**\\s*:?\\s*\\**\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIP    = Pattern.compile("^skip\\s*:\\s*([\\w-]+)$", Pattern.CASE_INSENSITIVE);

    private PolicyDocumentParser() {}

    /**
     * @throws PolicyParseException if the document has none of the recognised sections
     */
    public static Policy parse(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            throw new PolicyParseException("Policy document is empty");
        }

        List<String> goals       = new ArrayList<>();
        List<String> scopeIn     = new ArrayList<>();
        List<String> scopeOut    = new ArrayList<>();
        List<String> constraints = new ArrayList<>();
        Set<String>  skippable   = new LinkedHashSet<>();

        Section section = Section.NONE;
        boolean sawSection = false;
        boolean inScopeBlock = false;

        for (String line : markdown.lines().toList()) {
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                String title = heading.group(2).replace("*", "").trim().toUpperCase(Locale.ROOT);
                int level = heading.group(1).length();
                if (level >= 3 && inScopeBlock) {
                    section = scopeSubsection(title, section);
                    continue;
                }
                section = topSection(title);
                inScopeBlock = title.equals("SCOPE");
                sawSection |= section != Section.NONE || inScopeBlock;
                continue;
            }

            Matcher label = LABEL.matcher(line);
            if (inScopeBlock && label.matches()) {
                section = scopeSubsection(label.group(1).toUpperCase(Locale.ROOT), section);
                continue;
            }

            Matcher bullet = BULLET.matcher(line);
            if (!bullet.matches() || section == Section.NONE) {
                continue;
            }
            String entry = clean(bullet.group(1));
            if (entry.isEmpty()) {
                continue;
            }
            switch (section) {
                case GOALS       -> goals.add(entry);
                case SCOPE_IN    -> scopeIn.add(entry);
                case SCOPE_OUT   -> scopeOut.add(entry);
                case CONSTRAINTS -> constraints.add(entry);
                case PIPELINE    -> {
                    Matcher skip = SKIP.matcher(entry);
                    if (skip.matches()) {
                        skippable.add(skip.group(1).toLowerCase(Locale.ROOT));
                    }
                }
                case NONE -> { }
            }
        }

        if (!sawSection) {
            throw new PolicyParseException(
                    "Policy document has none of the sections GOALS, SCOPE, CONSTRAINTS");
        }
        return new Policy(goals, scopeIn, scopeOut, constraints, skippable);
    }

    private static Section topSection(String title) {
        if (title.startsWith("GOAL"))                                  return Section.GOALS;
        if (title.equals("SCOPE IN") || title.equals("IN SCOPE"))      return Section.SCOPE_IN;
        if (title.equals("SCOPE OUT") || title.equals("OUT OF SCOPE")) return Section.SCOPE_OUT;
        if (title.startsWith("CONSTRAINT"))                            return Section.CONSTRAINTS;
        if (title.equals("PIPELINE"))                                  return Section.PIPELINE;
        return Section.NONE;
    }

    private static Section scopeSubsection(String title, Section current) {
        if (title.contains("OUT OF SCOPE") || title.contains("EXCLUDED")) return Section.SCOPE_OUT;
        if (title.contains("IN SCOPE") || title.contains("INCLUDED"))     return Section.SCOPE_IN;
        return current;
    }

    // Strip markdown emphasis, inline code and checkbox prefixes.
    private static String clean(String raw) {
        return raw.replace("**", "")
                  .replace("`", "")
                  .replaceFirst("^\\[[ xX]]\\s*", "")
                  .trim();
    }
}
