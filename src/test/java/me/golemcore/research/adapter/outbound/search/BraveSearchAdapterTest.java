package me.golemcore.research.adapter.outbound.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.research.domain.model.SearchHit;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import me.golemcore.research.port.outbound.SearchProviderException;
import me.golemcore.research.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BraveSearchAdapterTest {

    private static final String API_KEY = "brave-key";
    private static final String RESPONSE = """
            {"web": {"results": [
              {"title": "Java", "url": "https://www.java.com/", "description": "Java is a language.", "age": "1d"},
              {"title": "No URL", "description": "skipped"},
              {"title": "OpenJDK", "url": "https://openjdk.org/"}
            ]}}
            """;

    private OkHttpMockEngine httpEngine;
    private ResearchProperties properties;
    private List<Long> sleeps;
    private BraveSearchAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new ResearchProperties();
        properties.getTools().getSearch().setBraveApiKey(API_KEY);
        sleeps = new ArrayList<>();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        adapter = new BraveSearchAdapter(new FeignClientFactory(client, new ObjectMapper()), properties) {
            @Override
            protected void sleepBeforeRetry(long millis) {
                sleeps.add(millis);
            }
        };
        adapter.init();
    }

    @Test
    void shouldMapWebResultsToRankedHits() throws Exception {
        httpEngine.enqueueJson(200, RESPONSE);

        List<SearchHit> hits = adapter.search("java", 5);

        assertEquals(2, hits.size());
        assertEquals(new SearchHit(1, "Java", "Java is a language.", "https://www.java.com/"), hits.get(0));
        assertEquals(new SearchHit(2, "OpenJDK", "", "https://openjdk.org/"), hits.get(1));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("/res/v1/web/search", request.path());
        assertEquals("java", request.queryParameter("q"));
        assertEquals("5", request.queryParameter("count"));
        assertEquals(API_KEY, request.header("X-Subscription-Token"));
    }

    @Test
    void shouldReturnEmptyListWithoutWebSection() throws Exception {
        httpEngine.enqueueJson(200, "{\"query\": {\"original\": \"java\"}}");

        assertTrue(adapter.search("java", 5).isEmpty());
    }

    @Test
    void shouldRetryRateLimitWithExponentialBackoff() throws Exception {
        httpEngine.enqueueJson(429, "{}");
        httpEngine.enqueueJson(429, "{}");
        httpEngine.enqueueJson(200, RESPONSE);

        List<SearchHit> hits = adapter.search("java", 5);

        assertEquals(2, hits.size());
        assertEquals(List.of(2000L, 4000L), sleeps);
        assertEquals(3, httpEngine.getRequestCount());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        for (int i = 0; i < 4; i++) {
            httpEngine.enqueueJson(429, "{}");
        }

        SearchProviderException e = assertThrows(SearchProviderException.class, () -> adapter.search("java", 5));

        assertEquals(ToolFailureKind.NETWORK_ERROR, e.getKind());
        assertEquals(4, httpEngine.getRequestCount());
        assertEquals(3, sleeps.size());
    }

    @Test
    void shouldNotRetryOtherHttpErrors() {
        httpEngine.enqueueJson(401, "{\"error\": \"unauthorized\"}");

        SearchProviderException e = assertThrows(SearchProviderException.class, () -> adapter.search("java", 5));

        assertEquals("Brave Search returned HTTP 401", e.getMessage());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldClassifyMalformedJsonAsParseError() {
        httpEngine.enqueueJson(200, "{not json");

        SearchProviderException e = assertThrows(SearchProviderException.class, () -> adapter.search("java", 5));

        assertEquals(ToolFailureKind.PARSE_ERROR, e.getKind());
    }

    @Test
    void shouldClassifyTransportTimeout() {
        httpEngine.enqueueFailure(new InterruptedIOException("timeout"));

        SearchProviderException e = assertThrows(SearchProviderException.class, () -> adapter.search("java", 5));

        assertEquals(ToolFailureKind.TIMEOUT, e.getKind());
    }
}
