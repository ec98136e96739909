package com.stagehand.orchestrator.vcs;

import com.stagehand.orchestrator.config.StagehandProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link VersionControl} backed by the {@code git} and {@code gh} executables.
 */
@Component
public class GitCliVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitCliVersionControl.class);

    private static final long   COMMAND_TIMEOUT_SECONDS = 120;
    private static final String ORIGIN_HEAD_PREFIX      = "refs/remotes/origin/";

    private final String git;
    private final String gh;

    public GitCliVersionControl(StagehandProperties props) {
        this.git = props.vcs().gitCommand();
        this.gh  = props.vcs().ghCommand();
    }

    @Override
    public Optional<String> commitAll(Path dir, String message) {
        exec(dir, git, "add", "-A");
        if (exec(dir, git, "status", "--porcelain").isBlank()) {
            log.info("Nothing to commit in {}", dir);
            return Optional.empty();
        }
        exec(dir, git, "commit", "-m", message);
        String hash = exec(dir, git, "rev-parse", "HEAD").trim();
        log.info("Committed {} in {}: {}", hash, dir, message);
        return Optional.of(hash);
    }

    @Override
    public void createBranch(Path dir, String name) {
        exec(dir, git, "checkout", "-b", name);
    }

    @Override
    public void checkoutBranch(Path dir, String name) {
        exec(dir, git, "checkout", name);
    }

    @Override
    public boolean branchExists(Path dir, String name) {
        return !exec(dir, git, "branch", "--list", name).isBlank();
    }

    @Override
    public String currentBranch(Path dir) {
        return exec(dir, git, "branch", "--show-current").trim();
    }

    @Override
    public Optional<String> defaultBranch(Path dir) {
        try {
            String ref = exec(dir, git, "symbolic-ref", ORIGIN_HEAD_PREFIX + "HEAD").trim();
            String branch = ref.replace(ORIGIN_HEAD_PREFIX, "");
            return branch.isEmpty() ? Optional.empty() : Optional.of(branch);
        } catch (VersionControlException e) {
            log.debug("No origin/HEAD in {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String openPullRequest(Path dir, String branch, String title, String body) {
        exec(dir, git, "push", "-u", "origin", branch);
        String url = exec(dir, gh, "pr", "create", "--head", branch, "--title", title, "--body", body).trim();
        log.info("Opened pull request {} for branch {}", url, branch);
        return url;
    }

    @Override
    public void removeWorktree(Path repoDir, Path worktree) {
        exec(repoDir, git, "worktree", "remove", "--force", worktree.toString());
    }

    @Override
    public void deleteBranch(Path repoDir, String name) {
        exec(repoDir, git, "branch", "-D", name);
    }

    // ------------------------------------------------------------------

    private String exec(Path dir, String... command) {
        List<String> cmd = new ArrayList<>(List.of(command));
        ProcessBuilder pb = new ProcessBuilder(cmd)
                .directory(dir.toFile())
                .redirectErrorStream(true);
        try {
            Process process = pb.start();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new VersionControlException("Timed out: " + describe(cmd), -1);
            }
            if (process.exitValue() != 0) {
                throw new VersionControlException(
                        "%s exited with %d: %s".formatted(describe(cmd), process.exitValue(), output.trim()),
                        process.exitValue());
            }
            return output;
        } catch (IOException e) {
            throw new VersionControlException("Could not run " + describe(cmd), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VersionControlException("Interrupted running " + describe(cmd), e);
        }
    }

    // Commit messages and PR bodies can be long; only the verb matters in errors.
    private static String describe(List<String> cmd) {
        return String.join(" ", cmd.subList(0, Math.min(3, cmd.size())));
    }
}
