package me.golemcore.research.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.research.domain.model.TextTruncator;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.domain.model.WikipediaSection;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.infrastructure.http.FeignClientFactory;
import me.golemcore.research.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WikipediaSectionToolTest {

    private static final String PAGE_TITLE = "page_title";
    private static final String SECTION_TITLE = "section_title";
    private static final String JAVA = "Java (programming language)";

    private OkHttpMockEngine httpEngine;
    private ResearchProperties properties;
    private ExecutorService executor;
    private WikipediaSectionTool tool;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new ResearchProperties();
        executor = Executors.newSingleThreadExecutor();
        OkHttpClient okHttpClient = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        WikipediaClient client = new WikipediaClient(new FeignClientFactory(okHttpClient, new ObjectMapper()),
                properties);
        client.init();
        tool = new WikipediaSectionTool(client, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void execute_returnsSectionContent() throws Exception {
        httpEngine.enqueueJson(200, WikipediaClientTest.JAVA_PAGE);

        ToolResult result = tool.execute(Map.of(PAGE_TITLE, JAVA, SECTION_TITLE, "syntax")).get();

        assertTrue(result.isSuccess());
        WikipediaSection section = (WikipediaSection) result.getData();
        assertTrue(section.found());
        assertEquals("Syntax", section.sectionTitle());
        assertEquals("The syntax is similar to C++.", section.content());
        assertTrue(result.getOutput().startsWith("**Java (programming language) - Syntax**"));
    }

    @Test
    void execute_listsAvailableSectionsWhenMissing() throws Exception {
        httpEngine.enqueueJson(200, WikipediaClientTest.JAVA_PAGE);

        ToolResult result = tool.execute(Map.of(PAGE_TITLE, JAVA, SECTION_TITLE, "Reception")).get();

        assertTrue(result.isSuccess());
        WikipediaSection section = (WikipediaSection) result.getData();
        assertFalse(section.found());
        assertEquals(List.of("History", "Oak", "Syntax"), section.availableSections());
        assertTrue(result.getOutput().contains("Available sections: History, Oak, Syntax"));
    }

    @Test
    void execute_truncatesLongSections() throws Exception {
        properties.getTools().getWikipedia().setMaxSectionChars(10);
        httpEngine.enqueueJson(200, WikipediaClientTest.JAVA_PAGE);

        ToolResult result = tool.execute(Map.of(PAGE_TITLE, JAVA, SECTION_TITLE, "History")).get();

        String content = ((WikipediaSection) result.getData()).content();
        assertEquals("James Gosl" + TextTruncator.MARKER, content);
    }

    @Test
    void execute_failsWhenPageMissing() throws Exception {
        httpEngine.enqueueJson(200, WikipediaClientTest.MISSING_PAGE);
        httpEngine.enqueueJson(200, "{\"query\": {\"search\": []}}");

        ToolResult result = tool.execute(Map.of(PAGE_TITLE, "Jvaa", SECTION_TITLE, "History")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.PROVIDER_ERROR, result.getFailureKind());
        assertEquals("Page 'Jvaa' not found", result.getError());
    }
}
