package com.devpipeline.orchestrator.publish;

import java.util.List;

/**
 * What the git service did with a completed workflow.
 *
 * @param commitId       commit created, or null when nothing was committed
 * @param issueReference issue or pull request reference, if any
 * @param actions        terminal actions performed, e.g. "commit", "push", "pr-create", "issue-close"
 */
public record PublishResult(String commitId, String issueReference, List<String> actions) {

    public PublishResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
