package com.williamcallahan.verified_media_engine.source.mediawiki;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.verified_media_engine.model.image.CandidateMetadata;
import com.williamcallahan.verified_media_engine.model.image.FetchedImage;
import com.williamcallahan.verified_media_engine.source.ImageSourceFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Shared lookup-then-download flow for MediaWiki {@code api.php} backed sources
 * - Subclasses build the search query and pick the image URL out of each result page
 * - Lookup errors fail the future so the caller can record a transport failure
 * - A search with no usable page completes with an empty result
 */
public abstract class MediaWikiImageFetcher implements ImageSourceFetcher {

    private static final Logger logger = LoggerFactory.getLogger(MediaWikiImageFetcher.class);
    static final String USER_AGENT = "VerifiedMediaEngine/1.0 (historical event illustration)";

    private final WebClient webClient;

    protected MediaWikiImageFetcher(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.clone()
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    }

    /**
     * Issues the search request for the term
     */
    protected abstract Mono<JsonNode> search(WebClient client, String searchTerm);

    /**
     * Image found on one result page, empty when the page carries no usable image
     */
    protected abstract Optional<PageImage> imageOf(JsonNode page);

    @Override
    public CompletableFuture<Optional<FetchedImage>> fetch(String searchTerm, Integer year) {
        if (searchTerm == null || searchTerm.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return search(webClient, searchTerm)
            .map(this::bestImage)
            .flatMap(found -> found
                .map(image -> download(image, searchTerm, year))
                .orElseGet(() -> {
                    logger.debug("{} found no image for '{}'", sourceName(), searchTerm);
                    return Mono.just(Optional.<FetchedImage>empty());
                }))
            .defaultIfEmpty(Optional.empty())
            .toFuture();
    }

    private Optional<PageImage> bestImage(JsonNode response) {
        JsonNode pages = response.path("query").path("pages");
        List<JsonNode> ordered = new ArrayList<>();
        Iterator<JsonNode> elements = pages.elements();
        while (elements.hasNext()) {
            ordered.add(elements.next());
        }
        ordered.sort(Comparator.comparingInt(page -> page.path("index").asInt(Integer.MAX_VALUE)));
        for (JsonNode page : ordered) {
            Optional<PageImage> image = imageOf(page);
            if (image.isPresent()) {
                return image;
            }
        }
        return Optional.empty();
    }

    private Mono<Optional<FetchedImage>> download(PageImage image, String searchTerm, Integer year) {
        return webClient.get()
            .uri(image.url())
            .retrieve()
            .bodyToMono(byte[].class)
            .map(bytes -> {
                logger.debug("{} downloaded {} bytes for '{}' from {}", sourceName(), bytes.length, searchTerm, image.url());
                CandidateMetadata metadata = new CandidateMetadata(image.title(), image.url(),
                    year == null ? null : String.valueOf(year), searchTerm);
                return Optional.of(new FetchedImage(bytes, metadata));
            })
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                logger.warn("{} image vanished before download for '{}': {}", sourceName(), searchTerm, image.url());
                return Mono.just(Optional.empty());
            });
    }

    /**
     * Image candidate located on a result page
     */
    protected record PageImage(String title, String url) {
    }
}
