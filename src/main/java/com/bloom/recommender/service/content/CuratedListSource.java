package com.bloom.recommender.service.content;

import com.bloom.recommender.config.SourceProperties;
import com.bloom.recommender.config.SourceProperties.CuratedList;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.service.recommend.ContentSourceAdapter;
import com.bloom.recommender.service.recommend.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads curated awesome-list READMEs from GitHub and keeps the entries that mention one of the
 * profile's categories.
 *
 * <p>Registered ahead of repository search, so on a duplicate URL with an equal preliminary score
 * the curated entry is the one kept.
 */
@Component
@Order(1)
public class CuratedListSource implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CuratedListSource.class);

    public static final String NAME = "curated";

    static final int LABEL_POINTS = 10;
    static final int WORD_POINTS = 2;
    static final int OFFICIAL_POINTS = 5;

    private static final MediaType RAW = MediaType.parseMediaType("application/vnd.github.v3.raw");

    private final WebClient http;
    private final SourceProperties.Curated props;

    public CuratedListSource(@Qualifier("githubClient") WebClient http, SourceProperties sourceProperties) {
        this.http = http;
        this.props = sourceProperties.getCurated();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Flux<CandidateItem> fetch(List<Category> queryHints) {
        List<CuratedList> lists = props.getLists();
        if (!props.isEnabled() || lists.isEmpty() || queryHints.isEmpty()) {
            return Flux.empty();
        }
        return Flux.defer(() -> {
            AtomicInteger failures = new AtomicInteger();
            AtomicReference<Throwable> firstFailure = new AtomicReference<>();
            return Flux.fromIterable(lists)
                    .flatMapSequential(list -> readme(list)
                            .map(markdown -> score(list, CuratedListParser.parse(markdown), queryHints))
                            .onErrorResume(e -> {
                                log.warn("Curated list {} unavailable: {}", list.slug(), e.toString());
                                firstFailure.compareAndSet(null, e);
                                failures.incrementAndGet();
                                return Mono.just(List.<Scored>of());
                            }))
                    .collectList()
                    .flatMapMany(perList -> {
                        if (failures.get() == lists.size()) {
                            return Flux.<CandidateItem>error(new SourceFetchException(NAME,
                                    "all " + lists.size() + " curated lists failed", firstFailure.get()));
                        }
                        List<Scored> all = new ArrayList<>();
                        for (List<Scored> l : perList) all.addAll(l);
                        all.sort(Comparator.comparingInt((Scored s) -> s.score).reversed());
                        List<CandidateItem> out = new ArrayList<>();
                        for (int i = 0; i < all.size() && i < props.getLimit(); i++) out.add(all.get(i).toCandidate());
                        log.info("Curated lists matched {} entries, returning {}", all.size(), out.size());
                        return Flux.fromIterable(out);
                    });
        });
    }

    private Mono<String> readme(CuratedList list) {
        return http.get()
                .uri("/repos/{owner}/{repo}/readme", list.getOwner(), list.getRepo())
                .accept(RAW)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("");
    }

    private List<Scored> score(CuratedList list, List<CuratedListParser.Entry> entries, List<Category> categories) {
        List<Scored> out = new ArrayList<>();
        for (CuratedListParser.Entry e : entries) {
            int score = matchScore(e, categories);
            if (score == 0) continue;
            if (list.isOfficial()) score += OFFICIAL_POINTS;
            String url = absoluteUrl(list, e.getUrl());
            if (url == null) continue;
            out.add(new Scored(e, url, score, props.getScoreCeiling()));
        }
        log.debug("Curated list {}: parsed={} matched={}", list.slug(), entries.size(), out.size());
        return out;
    }

    /** +10 for a category label in the entry text, +2 for every label word longer than three letters. */
    static int matchScore(CuratedListParser.Entry entry, List<Category> categories) {
        String text = (entry.getName() + " " + entry.getDescription() + " " + entry.getSection()).toLowerCase(Locale.ROOT);
        int score = 0;
        for (Category c : categories) {
            String label = c.getLabel().toLowerCase(Locale.ROOT);
            if (text.contains(label)) score += LABEL_POINTS;
            for (String word : label.split(" ")) {
                if (word.length() > 3 && text.contains(word)) score += WORD_POINTS;
            }
        }
        return score;
    }

    /** Resolves repository-relative links against the list's GitHub page; drops in-page anchors. */
    static String absoluteUrl(CuratedList list, String url) {
        if (url == null || url.isBlank() || url.startsWith("#")) return null;
        if (url.startsWith("http://") || url.startsWith("https://")) return url;
        String path = url.startsWith("./") ? url.substring(2) : url.startsWith("/") ? url.substring(1) : url;
        return "https://github.com/" + list.slug() + "/tree/main/" + path;
    }

    static double normalise(int score, int ceiling) {
        return Math.min(Math.round(score * 100.0 / Math.max(1, ceiling)), 100);
    }

    private static final class Scored {
        private final CuratedListParser.Entry entry;
        private final String url;
        private final int score;
        private final int ceiling;

        Scored(CuratedListParser.Entry entry, String url, int score, int ceiling) {
            this.entry = entry;
            this.url = url;
            this.score = score;
            this.ceiling = ceiling;
        }

        CandidateItem toCandidate() {
            return new CandidateItem(url, entry.getName(), entry.getDescription(), List.of(entry.getSection()),
                    null, NAME, normalise(score, ceiling));
        }
    }
}
