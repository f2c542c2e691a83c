package com.williamcallahan.verified_media_engine.source.mediawiki;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Lead image of the best matching English Wikipedia articles
 */
@Component
@ConditionalOnProperty(prefix = "app.media.fetchers.mediawiki", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WikipediaImageFetcher extends MediaWikiImageFetcher {

    static final String SOURCE_NAME = "Wikipedia";

    private final String apiUrl;
    private final int thumbnailWidth;

    public WikipediaImageFetcher(WebClient.Builder webClientBuilder,
                                 @Value("${app.media.fetchers.mediawiki.wikipedia-api-url:https://en.wikipedia.org/w/api.php}") String apiUrl,
                                 @Value("${app.media.fetchers.mediawiki.thumbnail-width:1200}") int thumbnailWidth) {
        super(webClientBuilder);
        this.apiUrl = apiUrl;
        this.thumbnailWidth = thumbnailWidth;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    protected Mono<JsonNode> search(WebClient client, String searchTerm) {
        return client.get()
            .uri(apiUrl + "?action=query&format=json&generator=search&gsrlimit=5&gsrsearch={term}"
                + "&prop=pageimages&piprop=thumbnail&pithumbsize={width}", searchTerm, thumbnailWidth)
            .retrieve()
            .bodyToMono(JsonNode.class);
    }

    @Override
    protected Optional<PageImage> imageOf(JsonNode page) {
        String source = page.path("thumbnail").path("source").asText("");
        if (source.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PageImage(page.path("title").asText(null), source));
    }
}
