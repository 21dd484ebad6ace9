package com.bloom.recommender.service.content;

import com.bloom.recommender.config.SourceProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.service.recommend.SourceFetchException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GitHubRepositorySourceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);

    private static final String SEARCH_JSON = "{\"total_count\":2,\"items\":["
            + "{\"html_url\":\"https://github.com/acme/llm-kit\",\"full_name\":\"acme/llm-kit\","
            + "\"description\":\"A toolkit for building LLM apps quickly.\",\"topics\":[\"ai\",\"llm\",\"python\"],"
            + "\"stargazers_count\":999,\"pushed_at\":\"2026-10-01T00:00:00Z\"},"
            + "{\"full_name\":\"broken/no-url\",\"stargazers_count\":5}"
            + "]}";

    private static WebClient client(List<ClientRequest> seen, HttpStatus status, String body) {
        return WebClient.builder()
                .baseUrl("https://api.github.com")
                .exchangeFunction(request -> {
                    seen.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    @Test
    public void mapsRepositoriesAndScoresThem() {
        List<ClientRequest> seen = new ArrayList<>();
        SourceProperties props = new SourceProperties();
        props.getGithub().setMaxTopics(1);
        GitHubRepositorySource source = new GitHubRepositorySource(client(seen, HttpStatus.OK, SEARCH_JSON), props, CLOCK);

        List<CandidateItem> items = source.fetch(List.of(Category.AI_TOOLS)).collectList().block();

        assertEquals(1, items.size());
        CandidateItem item = items.get(0);
        assertEquals("https://github.com/acme/llm-kit", item.getCanonicalId());
        assertEquals("acme/llm-kit", item.getTitle());
        assertEquals(List.of("ai", "llm", "python"), item.getTags());
        assertEquals(999, item.getPopularity());
        assertEquals("github", item.getSourceName());
        // topics 20 + stars 30 + activity 15 + description 4
        assertEquals(69.0, item.getRawScore());

        assertEquals(1, seen.size());
        String query = seen.get(0).url().getQuery();
        assertTrue(query.contains("q=topic:ai stars:>50 pushed:>2026-04-04"), query);
        assertTrue(query.contains("sort=stars"), query);
        assertTrue(query.contains("per_page=40"), query);
        assertEquals("/search/repositories", seen.get(0).url().getPath());
    }

    @Test
    public void serverErrorsAreRetriedThenTheSourceFails() {
        List<ClientRequest> seen = new ArrayList<>();
        SourceProperties props = new SourceProperties();
        props.getGithub().setMaxRetries(1);
        GitHubRepositorySource source = new GitHubRepositorySource(
                client(seen, HttpStatus.INTERNAL_SERVER_ERROR, "{}"), props, CLOCK);

        SourceFetchException ex = assertThrows(SourceFetchException.class,
                () -> source.fetch(List.of(Category.AI_TOOLS)).collectList().block());
        assertEquals("github", ex.getSourceName());
        assertEquals(6, seen.size(), "3 topics, each tried twice");
    }

    @Test
    public void clientErrorsAreNotRetried() {
        List<ClientRequest> seen = new ArrayList<>();
        GitHubRepositorySource source = new GitHubRepositorySource(
                client(seen, HttpStatus.FORBIDDEN, "{}"), new SourceProperties(), CLOCK);

        assertThrows(SourceFetchException.class, () -> source.fetch(List.of(Category.AI_TOOLS)).collectList().block());
        assertEquals(3, seen.size());
    }

    @Test
    public void oneFailingTopicDoesNotLoseTheOthers() {
        AtomicInteger calls = new AtomicInteger();
        WebClient http = WebClient.builder()
                .exchangeFunction(request -> {
                    boolean fail = calls.getAndIncrement() == 0;
                    return Mono.just(ClientResponse.create(fail ? HttpStatus.BAD_GATEWAY : HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(fail ? "{}" : SEARCH_JSON)
                            .build());
                })
                .build();
        SourceProperties props = new SourceProperties();
        props.getGithub().setMaxTopics(2);
        props.getGithub().setMaxRetries(0);
        GitHubRepositorySource source = new GitHubRepositorySource(http, props, CLOCK);

        List<CandidateItem> items = source.fetch(List.of(Category.AI_TOOLS)).collectList().block();
        assertEquals(1, items.size());
        assertEquals(2, calls.get());
    }

    @Test
    public void disabledSourceReturnsNothing() {
        List<ClientRequest> seen = new ArrayList<>();
        SourceProperties props = new SourceProperties();
        props.getGithub().setEnabled(false);
        GitHubRepositorySource source = new GitHubRepositorySource(client(seen, HttpStatus.OK, SEARCH_JSON), props, CLOCK);
        assertTrue(source.fetch(List.of(Category.AI_TOOLS)).collectList().block().isEmpty());
        assertTrue(seen.isEmpty());
    }

    @Test
    public void topicsAreTakenRoundRobinAcrossCategories() {
        assertEquals(List.of("ai", "health", "artificial-intelligence"),
                GitHubRepositorySource.searchTopics(List.of(Category.AI_TOOLS, Category.WELLNESS), 3));
        assertEquals(List.of(), GitHubRepositorySource.searchTopics(List.of(), 3));
    }

    @Test
    public void starScoreIsLogScaledAndCapped() {
        assertEquals(0.0, GitHubRepositorySource.starScore(0));
        assertEquals(30.0, GitHubRepositorySource.starScore(999));
        assertEquals(30.0, GitHubRepositorySource.starScore(1_000_000));
    }
}
