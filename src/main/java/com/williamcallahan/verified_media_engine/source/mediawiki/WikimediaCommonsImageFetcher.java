package com.williamcallahan.verified_media_engine.source.mediawiki;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Optional;

/**
 * Files from the Wikimedia Commons file namespace, scaled to the thumbnail width
 * - Vector files are skipped
 */
@Component
@ConditionalOnProperty(prefix = "app.media.fetchers.mediawiki", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WikimediaCommonsImageFetcher extends MediaWikiImageFetcher {

    static final String SOURCE_NAME = "WikimediaCommons";
    private static final int FILE_NAMESPACE = 6;

    private final String apiUrl;
    private final int thumbnailWidth;

    public WikimediaCommonsImageFetcher(WebClient.Builder webClientBuilder,
                                        @Value("${app.media.fetchers.mediawiki.commons-api-url:https://commons.wikimedia.org/w/api.php}") String apiUrl,
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
            .uri(apiUrl + "?action=query&format=json&generator=search&gsrnamespace={ns}&gsrlimit=5&gsrsearch={term}"
                + "&prop=imageinfo&iiprop=url|mime&iiurlwidth={width}", FILE_NAMESPACE, searchTerm, thumbnailWidth)
            .retrieve()
            .bodyToMono(JsonNode.class);
    }

    @Override
    protected Optional<PageImage> imageOf(JsonNode page) {
        JsonNode info = page.path("imageinfo").path(0);
        String mime = info.path("mime").asText("").toLowerCase(Locale.ROOT);
        if (mime.contains("svg") || !mime.startsWith("image/")) {
            return Optional.empty();
        }
        String url = info.path("thumburl").asText("");
        if (url.isEmpty()) {
            url = info.path("url").asText("");
        }
        if (url.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PageImage(page.path("title").asText(null), url));
    }
}
