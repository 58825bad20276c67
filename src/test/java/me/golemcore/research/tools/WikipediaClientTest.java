package me.golemcore.research.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import me.golemcore.research.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WikipediaClientTest {

    static final String JAVA_PAGE = """
            {"batchcomplete": true, "query": {"pages": [{
              "pageid": 15881,
              "title": "Java (programming language)",
              "fullurl": "https://en.wikipedia.org/wiki/Java_(programming_language)",
              "extract": "Java is a programming language. It was released in 1995. It runs on the JVM.\\n\\n== History ==\\nJames Gosling started the project.\\n\\n=== Oak ===\\nThe language was first called Oak.\\n\\n== Syntax ==\\nThe syntax is similar to C++.",
              "links": [{"ns": 0, "title": "C++"}, {"ns": 0, "title": "James Gosling"}]
            }]}}
            """;
    static final String MISSING_PAGE = """
            {"query": {"pages": [{"title": "Jvaa", "missing": true}]}}
            """;

    private OkHttpMockEngine httpEngine;
    private WikipediaClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient okHttpClient = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        client = new WikipediaClient(new FeignClientFactory(okHttpClient, new ObjectMapper()),
                new ResearchProperties());
        client.init();
    }

    @Test
    void shouldParseArticleSections() {
        httpEngine.enqueueJson(200, JAVA_PAGE);

        WikipediaClient.Article article = client.findArticle("Java (programming language)").orElseThrow();

        assertEquals("Java (programming language)", article.title());
        assertEquals("https://en.wikipedia.org/wiki/Java_(programming_language)", article.url());
        assertEquals("Java is a programming language. It was released in 1995. It runs on the JVM.",
                article.summary());
        assertEquals(List.of("History", "Syntax"), article.topLevelSectionTitles());
        assertEquals(3, article.sections().size());
        assertEquals("James Gosling started the project.\n\n=== Oak ===\nThe language was first called Oak.",
                article.findSection("history").orElseThrow().content());
        assertEquals(3, article.findSection("Oak").orElseThrow().level());
        assertEquals(List.of("C++", "James Gosling"), article.links());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("/w/api.php", request.path());
        assertEquals("Java (programming language)", request.queryParameter("titles"));
        assertEquals("GolemCore-Research-Bot/1.0", request.header("User-Agent"));
    }

    @Test
    void shouldFallBackToSearchWhenTitleMissing() {
        httpEngine.enqueueJson(200, MISSING_PAGE);
        httpEngine.enqueueJson(200, "{\"query\": {\"search\": [{\"ns\": 0, \"title\": \"Java (programming language)\"}]}}");
        httpEngine.enqueueJson(200, JAVA_PAGE);

        Optional<WikipediaClient.Article> article = client.findArticle("Jvaa");

        assertTrue(article.isPresent());
        assertEquals(3, httpEngine.getRequestCount());
        httpEngine.takeRequest();
        assertEquals("Jvaa", httpEngine.takeRequest().queryParameter("srsearch"));
        assertEquals("Java (programming language)", httpEngine.takeRequest().queryParameter("titles"));
    }

    @Test
    void shouldReturnEmptyWhenSearchFindsNothing() {
        httpEngine.enqueueJson(200, MISSING_PAGE);
        httpEngine.enqueueJson(200, "{\"query\": {\"search\": []}}");

        assertTrue(client.findArticle("Jvaa").isEmpty());
    }

    @Test
    void shouldPropagateHttpErrors() {
        httpEngine.enqueueJson(503, "{}");

        FeignException e = assertThrows(FeignException.class, () -> client.findArticle("Java"));

        assertEquals(503, e.status());
        assertEquals(ToolFailureKind.NETWORK_ERROR, WikipediaClient.classify(e));
    }

    @Test
    void shouldClassifyUnreadableBodyAsParseError() {
        httpEngine.enqueueJson(200, "{broken");

        FeignException e = assertThrows(FeignException.class, () -> client.findArticle("Java"));

        assertEquals(ToolFailureKind.PARSE_ERROR, WikipediaClient.classify(e));
    }

    @Test
    void shouldKeepArticleWithoutSections() {
        WikipediaClient.WikiPage page = new WikipediaClient.WikiPage();
        page.setTitle("Oak");
        page.setExtract("Oak is a tree.");

        WikipediaClient.Article article = WikipediaClient.toArticle(page);

        assertEquals("Oak is a tree.", article.summary());
        assertTrue(article.sections().isEmpty());
        assertTrue(article.links().isEmpty());
    }
}
