package com.bloom.recommender.service.content;

import com.bloom.recommender.config.SourceProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.service.recommend.ContentSourceAdapter;
import com.bloom.recommender.service.recommend.SourceFetchException;
import com.bloom.recommender.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Searches the ClawHub skill registry, one semantic search per profile category.
 *
 * <p>The registry returns a similarity score in [0, 1] per skill. The preliminary score is that
 * similarity scaled to 100, plus {@link #CATEGORY_MATCH_POINTS} when the skill's inferred
 * categories include one of the query categories.
 */
@Component
@Order(3)
public class ClawHubSkillSource implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ClawHubSkillSource.class);

    public static final String NAME = "clawhub";

    static final int CATEGORY_MATCH_POINTS = 10;

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {};

    private final WebClient http;
    private final SourceProperties.Clawhub props;

    public ClawHubSkillSource(@Qualifier("clawhubClient") WebClient http, SourceProperties sourceProperties) {
        this.http = http;
        this.props = sourceProperties.getClawhub();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Flux<CandidateItem> fetch(List<Category> queryHints) {
        if (!props.isEnabled() || queryHints.isEmpty()) {
            return Flux.empty();
        }
        return Flux.defer(() -> {
            AtomicInteger failures = new AtomicInteger();
            AtomicReference<Throwable> firstFailure = new AtomicReference<>();
            return Flux.fromIterable(queryHints)
                    .flatMapSequential(category -> search(category.getLabel())
                            .onErrorResume(e -> {
                                log.warn("ClawHub search failed for category={}: {}", category.getLabel(), e.toString());
                                firstFailure.compareAndSet(null, e);
                                failures.incrementAndGet();
                                return Mono.just(List.<Map<String, Object>>of());
                            }))
                    .collectList()
                    .flatMapMany(pages -> {
                        if (failures.get() == queryHints.size()) {
                            return Flux.<CandidateItem>error(new SourceFetchException(NAME,
                                    "all " + queryHints.size() + " skill searches failed", firstFailure.get()));
                        }
                        List<Skill> skills = merge(pages);
                        List<CandidateItem> items = new ArrayList<>();
                        for (int i = 0; i < skills.size() && i < props.getLimit(); i++) {
                            items.add(skills.get(i).toCandidate(queryHints));
                        }
                        log.info("ClawHub returned {} distinct skills, keeping {}", skills.size(), items.size());
                        return Flux.fromIterable(items);
                    });
        });
    }

    private Mono<List<Map<String, Object>>> search(String query) {
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/search")
                        .queryParam("q", "{q}")
                        .queryParam("limit", props.getPerCategory())
                        .build(query))
                .retrieve()
                .bodyToMono(JSON_MAP)
                .retryWhen(Retry.max(props.getMaxRetries())
                        .filter(ClawHubSkillSource::isRetryable)
                        .doBeforeRetry(sig -> log.warn("Retrying ClawHub search q={} attempt={}", query, sig.totalRetriesInARow() + 1)))
                .map(ClawHubSkillSource::results);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> results(Map<String, Object> body) {
        if (!(body.get("results") instanceof List<?> list)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) out.add((Map<String, Object>) m);
        }
        return out;
    }

    /** First occurrence of each slug wins; the result is ordered by similarity, highest first. */
    private List<Skill> merge(List<List<Map<String, Object>>> pages) {
        Map<String, Skill> bySlug = new LinkedHashMap<>();
        for (List<Map<String, Object>> page : pages) {
            for (Map<String, Object> result : page) {
                Skill skill = toSkill(result);
                if (skill != null) bySlug.putIfAbsent(skill.slug, skill);
            }
        }
        List<Skill> skills = new ArrayList<>(bySlug.values());
        skills.sort(Comparator.comparingDouble((Skill s) -> s.similarity).reversed());
        return skills;
    }

    Skill toSkill(Map<String, Object> result) {
        String slug = text(result.get("slug"));
        if (slug.isBlank()) return null;
        String summary = text(result.get("summary"));
        if (summary.isBlank()) summary = text(result.get("description"));
        String name = text(result.get("displayName"));
        if (name.isBlank()) name = text(result.get("name"));
        if (name.isBlank()) name = summary.split("-", 2)[0].trim();
        double similarity = result.get("score") instanceof Number n ? n.doubleValue() : 0.0;
        List<String> tags = new ArrayList<>();
        if (result.get("tags") instanceof List<?> ts) {
            for (Object t : ts) if (t != null) tags.add(String.valueOf(t));
        }
        String url = trimSlash(props.getBaseUrl()) + "/skills/" + slug;
        return new Skill(slug, name, summary, url, similarity,
                inferCategories(slug + " " + summary + " " + String.join(" ", tags)));
    }

    /** Categories whose keywords occur in the skill's slug, summary and tags. */
    static List<Category> inferCategories(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<Category> out = new ArrayList<>();
        for (Category c : Category.values()) {
            if (!KeywordMatcher.matched(lower, c.getKeywords()).isEmpty()) out.add(c);
        }
        return out;
    }

    static double matchScore(double similarity, List<Category> skillCategories, List<Category> queryHints) {
        double score = similarity * 100;
        if (skillCategories.stream().anyMatch(queryHints::contains)) score += CATEGORY_MATCH_POINTS;
        return Math.min(Math.round(score), 100);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static String trimSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException w) return w.getStatusCode().is5xxServerError();
        return e instanceof WebClientRequestException;
    }

    static final class Skill {
        final String slug;
        final String name;
        final String summary;
        final String url;
        final double similarity;
        final List<Category> categories;

        Skill(String slug, String name, String summary, String url, double similarity, List<Category> categories) {
            this.slug = slug;
            this.name = name;
            this.summary = summary;
            this.url = url;
            this.similarity = similarity;
            this.categories = categories;
        }

        CandidateItem toCandidate(List<Category> queryHints) {
            List<String> tags = categories.stream().map(Category::getLabel).toList();
            return new CandidateItem(url, name, summary, tags, null, NAME,
                    matchScore(similarity, categories, queryHints));
        }
    }
}
