package com.stagehand.orchestrator.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LinearIssueTracker against a mocked {@link HttpClient}. The retry policy
 * from the test properties uses three attempts with millisecond delays.
 */
@ExtendWith(MockitoExtension.class)
class LinearIssueTrackerTest {

    @Mock HttpClient http;
    @Mock HttpResponse<String> response;
    @Mock HttpResponse<String> unavailableResponse;

    private LinearIssueTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new LinearIssueTracker(http, TestStores.properties(Path.of("unused")), new ObjectMapper());
    }

    private static HttpResponse<String> respond(HttpResponse<String> r, int status, String body) {
        when(r.statusCode()).thenReturn(status);
        if (status >= 200 && status < 300) {
            when(r.body()).thenReturn(body);
        }
        return r;
    }

    // ------------------------------------------------------------------
    // verifyApiKey
    // ------------------------------------------------------------------

    @Test
    void verifyApiKey_returnsViewerAndSendsKey() throws Exception {
        doReturn(respond(response, 200, """
                {"data":{"viewer":{"name":"Ann","organization":{"id":"o1","name":"Acme"}}}}"""))
                .when(http).send(any(), any());

        ViewerInfo viewer = tracker.verifyApiKey("lin_api_123");

        assertThat(viewer).isEqualTo(new ViewerInfo("Ann", "Acme"));
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("lin_api_123");
    }

    @Test
    void unauthorized_failsWithoutRetry() throws Exception {
        doReturn(respond(response, 401, null)).when(http).send(any(), any());

        assertThatThrownBy(() -> tracker.verifyApiKey("bad"))
                .isInstanceOf(IssueTrackerException.class)
                .hasMessage("Invalid API key")
                .satisfies(e -> assertThat(((IssueTrackerException) e).status()).isEqualTo(401));
        verify(http, times(1)).send(any(), any());
    }

    @Test
    void serverError_isRetriedThenSucceeds() throws Exception {
        HttpResponse<String> unavailable = respond(unavailableResponse, 503, null);
        HttpResponse<String> ok = respond(response, 200, "{\"data\":{\"viewer\":{\"name\":\"Ann\",\"organization\":{\"name\":\"Acme\"}}}}");
        doReturn(unavailable).doReturn(ok).when(http).send(any(), any());

        assertThat(tracker.verifyApiKey("k").name()).isEqualTo("Ann");
        verify(http, times(2)).send(any(), any());
    }

    @Test
    void transportFailure_exhaustsRetries() throws Exception {
        doThrow(new IOException("connection reset")).when(http).send(any(), any());

        assertThatThrownBy(() -> tracker.verifyApiKey("k"))
                .isInstanceOf(IssueTrackerException.class)
                .hasMessageContaining("connection reset");
        verify(http, times(3)).send(any(), any());
    }

    @Test
    void graphqlError_surfacesFirstMessage() throws Exception {
        doReturn(respond(response, 200, "{\"errors\":[{\"message\":\"Entity not found\"},{\"message\":\"other\"}]}"))
                .when(http).send(any(), any());

        assertThatThrownBy(() -> tracker.fetchIssueDetail("k", "x"))
                .isInstanceOf(IssueTrackerException.class)
                .hasMessage("Entity not found");
        verify(http, times(1)).send(any(), any());
    }

    // ------------------------------------------------------------------
    // Issues
    // ------------------------------------------------------------------

    @Test
    void fetchAssignedIssues_mapsNodesAndPageInfo() throws Exception {
        doReturn(respond(response, 200, """
                {"data":{"viewer":{"assignedIssues":{
                  "nodes":[
                    {"id":"i1","identifier":"ENG-1","title":"Fix login","description":null,"priority":2,
                     "url":"https://linear.app/acme/issue/ENG-1","state":{"name":"Todo"},"branchName":"eng-1-fix-login"}],
                  "pageInfo":{"hasNextPage":true,"endCursor":"c2"}}}}}"""))
                .when(http).send(any(), any());

        IssuePage page = tracker.fetchAssignedIssues("k", "c1");

        assertThat(page.hasNextPage()).isTrue();
        assertThat(page.endCursor()).isEqualTo("c2");
        assertThat(page.issues()).hasSize(1);
        TrackerIssue issue = page.issues().get(0);
        assertThat(issue.identifier()).isEqualTo("ENG-1");
        assertThat(issue.description()).isNull();
        assertThat(issue.status()).isEqualTo("Todo");
        assertThat(issue.priority()).isEqualTo(2);
        assertThat(issue.branchName()).isEqualTo("eng-1-fix-login");
    }

    @Test
    void fetchIssueDetail_formatsComments() throws Exception {
        doReturn(respond(response, 200, """
                {"data":{"issue":{"id":"i1","identifier":"ENG-1","title":"Fix login","description":"Broken",
                  "branchName":"eng-1","comments":{"nodes":[
                    {"body":"Repro on Safari","user":{"name":"Bo"}},
                    {"body":"Bot note","user":null}]}}}}"""))
                .when(http).send(any(), any());

        IssueDetail detail = tracker.fetchIssueDetail("k", "i1");

        assertThat(detail.title()).isEqualTo("Fix login");
        assertThat(detail.comments()).containsExactly("Bo: Repro on Safari", "Unknown: Bot note");
    }

    @Test
    void fetchIssueDetail_missingIssue_throws() throws Exception {
        doReturn(respond(response, 200, "{\"data\":{\"issue\":null}}")).when(http).send(any(), any());

        assertThatThrownBy(() -> tracker.fetchIssueDetail("k", "gone"))
                .isInstanceOf(IssueTrackerException.class)
                .hasMessageContaining("gone");
    }
}
