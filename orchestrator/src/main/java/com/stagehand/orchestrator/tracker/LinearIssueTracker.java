package com.stagehand.orchestrator.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagehand.orchestrator.config.RetryPolicies;
import com.stagehand.orchestrator.config.StagehandProperties;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link IssueTracker} over Linear's GraphQL API.
 *
 * Every request goes through a resilience4j retry that only fires for
 * {@link IssueTrackerException#isRetryable()} failures.
 */
@Component
public class LinearIssueTracker implements IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(LinearIssueTracker.class);

    static final int PAGE_SIZE = 50;

    private static final String VIEWER_QUERY = "{ viewer { name organization { id name } } }";

    private static final String ASSIGNED_QUERY = """
            query ($filter: IssueFilter, $first: Int!, $after: String) {
              viewer {
                assignedIssues(filter: $filter, first: $first, after: $after) {
                  nodes { id identifier title description priority url state { name } branchName }
                  pageInfo { hasNextPage endCursor }
                }
              }
            }""";

    private static final String DETAIL_QUERY = """
            query ($id: String!) {
              issue(id: $id) {
                id identifier title description branchName
                comments(first: %d) { nodes { body user { name } createdAt } }
              }
            }""".formatted(PAGE_SIZE);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          endpoint;
    private final Duration     requestTimeout;
    private final Retry        retry;

    public LinearIssueTracker(StagehandProperties props, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), props, objectMapper);
    }

    LinearIssueTracker(HttpClient http, StagehandProperties props, ObjectMapper objectMapper) {
        this.http           = http;
        this.json           = objectMapper;
        this.endpoint       = URI.create(props.tracker().baseUrl());
        this.requestTimeout = props.tracker().requestTimeout();
        this.retry          = RetryPolicies.exponential("linear", props.tracker().retry(),
                e -> e instanceof IssueTrackerException && ((IssueTrackerException) e).isRetryable());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying Linear call (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    @Override
    public ViewerInfo verifyApiKey(String apiKey) {
        JsonNode viewer = query(apiKey, VIEWER_QUERY, null).path("viewer");
        return new ViewerInfo(viewer.path("name").asText(), viewer.path("organization").path("name").asText());
    }

    @Override
    public IssuePage fetchAssignedIssues(String apiKey, String cursor) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("filter", Map.of("state", Map.of("type", Map.of("nin", List.of("completed", "canceled")))));
        variables.put("first", PAGE_SIZE);
        if (cursor != null) variables.put("after", cursor);

        JsonNode assigned = query(apiKey, ASSIGNED_QUERY, variables).path("viewer").path("assignedIssues");
        List<TrackerIssue> issues = new ArrayList<>();
        for (JsonNode n : assigned.path("nodes")) {
            issues.add(new TrackerIssue(
                    n.path("id").asText(),
                    n.path("identifier").asText(),
                    n.path("title").asText(),
                    textOrNull(n, "description"),
                    n.path("state").path("name").asText("Unknown"),
                    n.path("priority").asInt(0),
                    n.path("url").asText(),
                    textOrNull(n, "branchName")));
        }
        JsonNode pageInfo = assigned.path("pageInfo");
        return new IssuePage(issues, pageInfo.path("hasNextPage").asBoolean(false), textOrNull(pageInfo, "endCursor"));
    }

    @Override
    public IssueDetail fetchIssueDetail(String apiKey, String issueId) {
        JsonNode issue = query(apiKey, DETAIL_QUERY, Map.of("id", issueId)).path("issue");
        if (issue.isMissingNode() || issue.isNull()) {
            throw new IssueTrackerException("Issue not found: " + issueId, IssueTrackerException.GRAPHQL);
        }
        List<String> comments = new ArrayList<>();
        for (JsonNode c : issue.path("comments").path("nodes")) {
            String author = c.path("user").path("name").asText("Unknown");
            comments.add(author + ": " + c.path("body").asText());
        }
        return new IssueDetail(
                issue.path("id").asText(issueId),
                issue.path("identifier").asText(),
                issue.path("title").asText(),
                textOrNull(issue, "description"),
                textOrNull(issue, "branchName"),
                comments);
    }

    // ------------------------------------------------------------------

    private JsonNode query(String apiKey, String query, Map<String, Object> variables) {
        String body = toJson(variables == null
                ? Map.of("query", query)
                : Map.of("query", query, "variables", variables));
        return Retry.decorateSupplier(retry, () -> send(apiKey, body)).get();
    }

    private JsonNode send(String apiKey, String body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Authorization", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IssueTrackerException("Linear request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IssueTrackerException("Interrupted calling Linear", IssueTrackerException.GRAPHQL);
        }

        int status = response.statusCode();
        if (status == 401) throw new IssueTrackerException("Invalid API key", 401);
        if (status < 200 || status >= 300) {
            throw new IssueTrackerException("Linear API error: " + status, status);
        }

        JsonNode root;
        try {
            root = json.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new IssueTrackerException("Linear returned malformed JSON: " + e.getOriginalMessage(),
                    IssueTrackerException.GRAPHQL);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new IssueTrackerException(errors.get(0).path("message").asText("GraphQL error"),
                    IssueTrackerException.GRAPHQL);
        }
        return root.path("data");
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize GraphQL request", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
