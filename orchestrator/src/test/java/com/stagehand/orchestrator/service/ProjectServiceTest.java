package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.model.Project;
import com.stagehand.orchestrator.model.StageTemplate;
import com.stagehand.orchestrator.tracker.IssueTracker;
import com.stagehand.orchestrator.vcs.VersionControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ProjectServiceTest {

    @TempDir
    Path dir;

    private ServiceFixture fx;

    @BeforeEach
    void setUp() {
        fx = new ServiceFixture(dir, mock(IssueTracker.class), mock(VersionControl.class));
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    // ------------------------------------------------------------------
    // createProject
    // ------------------------------------------------------------------

    @Test
    void createProject_seedsDefaultPipelineAndOpensStore() {
        Project p = fx.newProject("webapp");

        List<StageTemplate> stages = fx.templates.listTemplates(p.getId());

        assertThat(stages).extracting(StageTemplate::getName).containsExactly(
                "Research", "High-Level Approaches", "Planning", "Implementation",
                "Refinement", "Security Review", "PR Preparation", "PR Review");
        assertThat(stages).extracting(StageTemplate::getSortOrder).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(fx.stores.isOpen(p.getId())).isTrue();
        assertThat(Files.exists(dir.resolve("data-dir").resolve("data").resolve(p.getId() + ".db"))).isTrue();
    }

    @Test
    void createProject_blankName_throws() {
        assertThatThrownBy(() -> fx.projects.createProject("  ", dir.toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createProject_pathNotDirectory_throws() {
        assertThatThrownBy(() -> fx.projects.createProject("x", dir.resolve("missing").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
    }

    // ------------------------------------------------------------------
    // Lookup and archival
    // ------------------------------------------------------------------

    @Test
    void requireProject_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> fx.projects.requireProject("does-not-exist"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void requireProject_idWithPathSeparators_isRejected() {
        assertThatThrownBy(() -> fx.projects.requireProject("../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void archiveProject_hidesFromDefaultListing() {
        Project kept = fx.newProject("kept");
        Project gone = fx.newProject("gone");

        fx.projects.archiveProject(gone.getId());

        assertThat(fx.projects.listProjects(false)).extracting(Project::getId).containsExactly(kept.getId());
        assertThat(fx.projects.listProjects(true)).hasSize(2);

        fx.projects.unarchiveProject(gone.getId());
        assertThat(fx.projects.listProjects(false)).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Settings
    // ------------------------------------------------------------------

    @Test
    void projectSettings_areScopedPerProject() {
        Project a = fx.newProject("a");
        Project b = fx.newProject("b");

        fx.projects.putProjectSetting(a.getId(), "linear_api_key", "lin_123");

        assertThat(fx.projects.getProjectSetting(a.getId(), "linear_api_key")).contains("lin_123");
        assertThat(fx.projects.getProjectSetting(b.getId(), "linear_api_key")).isEmpty();
    }

    @Test
    void projectSetting_nullValueRemovesIt() {
        Project a = fx.newProject("a");
        fx.projects.putProjectSetting(a.getId(), "theme", "dark");

        fx.projects.putProjectSetting(a.getId(), "theme", null);

        assertThat(fx.projects.getProjectSetting(a.getId(), "theme")).isEmpty();
    }

    @Test
    void appSettings_roundTrip() {
        fx.projects.putAppSetting("agent", "claude");
        fx.projects.putAppSetting("agent", "codex");

        assertThat(fx.projects.getAppSetting("agent")).contains("codex");
    }
}
