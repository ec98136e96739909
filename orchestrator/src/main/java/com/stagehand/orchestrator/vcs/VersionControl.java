package com.stagehand.orchestrator.vcs;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The repository operations stage side effects and task cleanup need.
 * Every method throws {@link VersionControlException} on failure.
 */
public interface VersionControl {

    /**
     * Stages everything and commits.
     *
     * @return the new commit hash, or empty when the tree was clean
     */
    Optional<String> commitAll(Path dir, String message);

    /** Creates {@code name} from HEAD and checks it out. */
    void createBranch(Path dir, String name);

    void checkoutBranch(Path dir, String name);

    boolean branchExists(Path dir, String name);

    String currentBranch(Path dir);

    /** The remote's default branch, if origin/HEAD is known. */
    Optional<String> defaultBranch(Path dir);

    /**
     * Pushes {@code branch} and opens a pull request for it.
     *
     * @return the pull request URL
     */
    String openPullRequest(Path dir, String branch, String title, String body);

    void removeWorktree(Path repoDir, Path worktree);

    void deleteBranch(Path repoDir, String name);
}
