package com.williamcallahan.verified_media_engine.source.mediawiki;

import com.williamcallahan.verified_media_engine.model.image.FetchedImage;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaWikiImageFetcherTest {

    private static final String WIKIPEDIA_API = "https://en.wikipedia.org/w/api.php";
    private static final String COMMONS_API = "https://commons.wikimedia.org/w/api.php";
    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x10, 0x20, 0x30};

    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClient.Builder webClient(Function<ClientRequest, ClientResponse> responder) {
        return WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(responder.apply(request));
        });
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    private static ClientResponse image() {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_JPEG_VALUE)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(IMAGE)))
            .build();
    }

    private static boolean isApiCall(ClientRequest request) {
        return request.url().getPath().endsWith("/api.php");
    }

    @Test
    void wikipediaDownloadsTheFirstRankedPageWithALeadImage() {
        String search = """
            {"query": {"pages": {
              "11": {"index": 2, "title": "Buzz Aldrin", "thumbnail": {"source": "https://upload.example/aldrin.jpg"}},
              "22": {"index": 1, "title": "Apollo program"},
              "33": {"index": 3, "title": "Saturn V", "thumbnail": {"source": "https://upload.example/saturn.jpg"}}
            }}}
            """;
        WikipediaImageFetcher fetcher = new WikipediaImageFetcher(
            webClient(request -> isApiCall(request) ? json(search) : image()), WIKIPEDIA_API, 1200);

        Optional<FetchedImage> result = fetcher.fetch("Apollo lands Moon", 1969).join();

        assertThat(result).isPresent();
        assertThat(result.get().bytes()).isEqualTo(IMAGE);
        assertThat(result.get().metadata().title()).isEqualTo("Buzz Aldrin");
        assertThat(result.get().metadata().url()).isEqualTo("https://upload.example/aldrin.jpg");
        assertThat(result.get().metadata().date()).isEqualTo("1969");
        assertThat(result.get().metadata().searchTerm()).isEqualTo("Apollo lands Moon");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(0).url().getRawQuery()).contains("gsrsearch=Apollo%20lands%20Moon", "pithumbsize=1200");
    }

    @Test
    void noMatchingPagesIsAnEmptyResult() {
        WikipediaImageFetcher fetcher = new WikipediaImageFetcher(
            webClient(request -> json("{\"batchcomplete\": \"\"}")), WIKIPEDIA_API, 1200);

        assertThat(fetcher.fetch("Nothing matches this", 1901).join()).isEmpty();
        assertThat(requests).hasSize(1);
    }

    @Test
    void blankTermsAreNotSearched() {
        WikipediaImageFetcher fetcher = new WikipediaImageFetcher(webClient(request -> image()), WIKIPEDIA_API, 1200);

        assertThat(fetcher.fetch("  ", 1969).join()).isEmpty();
        assertThat(requests).isEmpty();
    }

    @Test
    void commonsSkipsVectorFilesAndPrefersTheThumbnail() {
        String search = """
            {"query": {"pages": {
              "1": {"index": 1, "title": "File:Apollo patch.svg",
                    "imageinfo": [{"mime": "image/svg+xml", "url": "https://upload.example/patch.svg"}]},
              "2": {"index": 2, "title": "File:Aldrin Apollo 11.jpg",
                    "imageinfo": [{"mime": "image/jpeg", "url": "https://upload.example/full.jpg",
                                   "thumburl": "https://upload.example/1200px.jpg"}]}
            }}}
            """;
        WikimediaCommonsImageFetcher fetcher = new WikimediaCommonsImageFetcher(
            webClient(request -> isApiCall(request) ? json(search) : image()), COMMONS_API, 1200);

        Optional<FetchedImage> result = fetcher.fetch("Apollo Aldrin", null).join();

        assertThat(result).isPresent();
        assertThat(result.get().metadata().url()).isEqualTo("https://upload.example/1200px.jpg");
        assertThat(result.get().metadata().date()).isNull();
        assertThat(requests.get(1).url().toString()).isEqualTo("https://upload.example/1200px.jpg");
    }

    @Test
    void vanishedImageIsAnEmptyResult() {
        String search = """
            {"query": {"pages": {"1": {"index": 1, "title": "Moon", "thumbnail": {"source": "https://upload.example/moon.jpg"}}}}}
            """;
        WikipediaImageFetcher fetcher = new WikipediaImageFetcher(
            webClient(request -> isApiCall(request) ? json(search) : ClientResponse.create(HttpStatus.NOT_FOUND).build()),
            WIKIPEDIA_API, 1200);

        assertThat(fetcher.fetch("Moon", 1969).join()).isEmpty();
    }

    @Test
    void searchFailuresFailTheFuture() {
        WikipediaImageFetcher fetcher = new WikipediaImageFetcher(
            webClient(request -> ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()), WIKIPEDIA_API, 1200);

        assertThatThrownBy(() -> fetcher.fetch("Moon", 1969).join())
            .isInstanceOf(CompletionException.class);
    }
}
