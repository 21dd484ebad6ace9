package com.bloom.recommender.service.content;

import com.bloom.recommender.config.SourceProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.service.recommend.ContentSourceAdapter;
import com.bloom.recommender.service.recommend.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Searches GitHub repositories by the topics of the profile's categories.
 *
 * <p>Each repository gets a preliminary relevance score out of 100: topic overlap (40),
 * log-scaled stars (30), recent activity (15) and description quality (15).
 */
@Component
@Order(2)
public class GitHubRepositorySource implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(GitHubRepositorySource.class);

    public static final String NAME = "github";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final WebClient http;
    private final SourceProperties.Github props;
    private final Clock clock;

    @Autowired
    public GitHubRepositorySource(@Qualifier("githubClient") WebClient http, SourceProperties sourceProperties) {
        this(http, sourceProperties, Clock.systemUTC());
    }

    GitHubRepositorySource(WebClient http, SourceProperties sourceProperties, Clock clock) {
        this.http = http;
        this.props = sourceProperties.getGithub();
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Flux<CandidateItem> fetch(List<Category> queryHints) {
        if (!props.isEnabled()) {
            return Flux.empty();
        }
        List<String> topics = searchTopics(queryHints, props.getMaxTopics());
        if (topics.isEmpty()) {
            log.info("No GitHub topics for categories {}", queryHints);
            return Flux.empty();
        }
        Set<String> userTopics = allTopics(queryHints);
        int perPage = Math.max(1, (int) Math.ceil(props.getLimit() / (double) topics.size()));

        return Flux.defer(() -> {
            AtomicInteger failures = new AtomicInteger();
            AtomicReference<Throwable> firstFailure = new AtomicReference<>();
            return Flux.fromIterable(topics)
                    .concatMap(topic -> searchTopic(topic, perPage)
                            .onErrorResume(e -> {
                                log.warn("GitHub search failed for topic={}: {}", topic, e.toString());
                                firstFailure.compareAndSet(null, e);
                                failures.incrementAndGet();
                                return Mono.just(List.<Map<String, Object>>of());
                            }))
                    .collectList()
                    .flatMapMany(pages -> {
                        if (failures.get() == topics.size()) {
                            return Flux.<CandidateItem>error(new SourceFetchException(NAME,
                                    "all " + topics.size() + " topic searches failed", firstFailure.get()));
                        }
                        List<CandidateItem> items = new ArrayList<>();
                        for (List<Map<String, Object>> page : pages) {
                            for (Map<String, Object> repo : page) {
                                CandidateItem item = toCandidate(repo, userTopics);
                                if (item != null) items.add(item);
                            }
                        }
                        log.info("GitHub search topics={} returned {} repositories", topics, items.size());
                        return Flux.fromIterable(items);
                    });
        });
    }

    private Mono<List<Map<String, Object>>> searchTopic(String topic, int perPage) {
        LocalDate since = LocalDate.now(clock).minusDays(props.getPushedWithinDays());
        String query = "topic:" + topic + " stars:>" + props.getMinStars() + " pushed:>" + since;
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/search/repositories")
                        .queryParam("q", "{q}")
                        .queryParam("sort", "stars")
                        .queryParam("order", "desc")
                        .queryParam("per_page", perPage)
                        .build(query))
                .retrieve()
                .bodyToMono(JSON_MAP)
                .retryWhen(Retry.max(props.getMaxRetries())
                        .filter(GitHubRepositorySource::isRetryable)
                        .doBeforeRetry(sig -> log.warn("Retrying GitHub search topic={} attempt={}", topic, sig.totalRetriesInARow() + 1)))
                .map(GitHubRepositorySource::items);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> items(Map<String, Object> body) {
        Object items = body.get("items");
        if (!(items instanceof List<?> list)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) out.add((Map<String, Object>) m);
        }
        return out;
    }

    CandidateItem toCandidate(Map<String, Object> repo, Set<String> userTopics) {
        Object url = repo.get("html_url");
        if (url == null) return null;
        String title = String.valueOf(repo.getOrDefault("full_name", repo.getOrDefault("name", "")));
        String description = repo.get("description") == null ? "" : String.valueOf(repo.get("description"));
        List<String> topics = new ArrayList<>();
        if (repo.get("topics") instanceof List<?> ts) {
            for (Object t : ts) if (t != null) topics.add(String.valueOf(t));
        }
        int stars = repo.get("stargazers_count") instanceof Number n ? n.intValue() : 0;
        Object pushed = repo.get("pushed_at") != null ? repo.get("pushed_at") : repo.get("updated_at");

        double score = topicScore(topics, userTopics)
                + starScore(stars)
                + activityScore(pushed == null ? null : String.valueOf(pushed))
                + descriptionScore(description);
        double rawScore = Math.min(Math.round(score), 100);
        return new CandidateItem(String.valueOf(url), title, description, topics, stars, NAME, rawScore);
    }

    static double topicScore(List<String> repoTopics, Set<String> userTopics) {
        long matches = repoTopics.stream().filter(t -> userTopics.contains(t.toLowerCase(Locale.ROOT))).count();
        return Math.min(matches * 10, 40);
    }

    /** 100 stars = 20, 1000 stars = 30 (capped). */
    static double starScore(int stars) {
        return Math.min(Math.log10(Math.max(0, stars) + 1) * 10, 30);
    }

    double activityScore(String pushedAt) {
        if (pushedAt == null) return 0;
        try {
            long days = Duration.between(Instant.parse(pushedAt), clock.instant()).toDays();
            return Math.max(15 - Math.max(0, days) / 30.0, 0);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable pushed_at {}", pushedAt);
            return 0;
        }
    }

    static double descriptionScore(String description) {
        return description == null ? 0 : Math.min(description.length() / 10.0, 15);
    }

    /**
     * Topics to query: the first topic of every category, then the second of every category and
     * so on, so that the strongest categories are all represented before the topic budget runs out.
     */
    static List<String> searchTopics(List<Category> categories, int max) {
        Set<String> out = new LinkedHashSet<>();
        int depth = 0;
        for (Category c : categories) depth = Math.max(depth, c.getSourceTopics().size());
        for (int i = 0; i < depth && out.size() < max; i++) {
            for (Category c : categories) {
                if (i < c.getSourceTopics().size() && out.size() < max) out.add(c.getSourceTopics().get(i));
            }
        }
        return new ArrayList<>(out);
    }

    private static Set<String> allTopics(List<Category> categories) {
        Set<String> out = new LinkedHashSet<>();
        for (Category c : categories) out.addAll(c.getSourceTopics());
        return out;
    }

    private static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException w) return w.getStatusCode().is5xxServerError();
        return e instanceof WebClientRequestException;
    }
}
