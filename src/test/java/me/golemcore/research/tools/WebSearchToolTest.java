package me.golemcore.research.tools;

import me.golemcore.research.domain.model.SearchHit;
import me.golemcore.research.domain.model.SearchResults;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.SearchProviderException;
import me.golemcore.research.port.outbound.WebSearchPort;
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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSearchToolTest {

    private static final String QUERY = "query";

    private WebSearchPort duckDuckGo;
    private WebSearchPort brave;
    private ResearchProperties properties;
    private ExecutorService executor;
    private WebSearchTool tool;

    @BeforeEach
    void setUp() {
        duckDuckGo = mock(WebSearchPort.class);
        when(duckDuckGo.getProviderId()).thenReturn("duckduckgo");
        brave = mock(WebSearchPort.class);
        when(brave.getProviderId()).thenReturn("brave");
        properties = new ResearchProperties();
        executor = Executors.newSingleThreadExecutor();
        tool = new WebSearchTool(List.of(duckDuckGo, brave), properties, executor);
        tool.init();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void getDefinition_requiresQuery() {
        assertEquals("web_search", tool.getDefinition().getName());
        assertEquals(List.of(QUERY), tool.getDefinition().getRequired());
    }

    @Test
    void init_selectsConfiguredProvider() throws Exception {
        properties.getTools().getSearch().setProvider("Brave");
        tool.init();
        when(brave.search(anyString(), anyInt())).thenReturn(List.of());

        tool.execute(Map.of(QUERY, "java")).get();

        verify(brave).search("java", 5);
    }

    @Test
    void isEnabled_falseForUnknownProvider() {
        properties.getTools().getSearch().setProvider("bing");
        tool.init();

        assertFalse(tool.isEnabled());
    }

    @Test
    void execute_formatsRankedResults() throws Exception {
        when(duckDuckGo.search("java", 5)).thenReturn(List.of(
                new SearchHit(1, "Java", "A language.", "https://www.java.com/"),
                new SearchHit(2, "OpenJDK", "Open source.", "https://openjdk.org/")));

        ToolResult result = tool.execute(Map.of(QUERY, "  java ")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("(2 results)"));
        assertTrue(result.getOutput().contains("1. **Java**"));
        assertTrue(result.getOutput().contains("URL: https://openjdk.org/"));
        SearchResults data = (SearchResults) result.getData();
        assertEquals(2, data.hits().size());
    }

    @Test
    void execute_treatsNoHitsAsSuccess() throws Exception {
        when(duckDuckGo.search(anyString(), anyInt())).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of(QUERY, "xyzzy")).get();

        assertTrue(result.isSuccess());
        assertEquals("No results found for \"xyzzy\". Try different keywords or rephrase your search",
                result.getOutput());
        assertTrue(((SearchResults) result.getData()).isEmpty());
    }

    @Test
    void execute_clampsResultCount() throws Exception {
        when(duckDuckGo.search(anyString(), anyInt())).thenReturn(List.of());

        tool.execute(Map.of(QUERY, "java", "max_results", 50)).get();
        tool.execute(Map.of(QUERY, "java", "max_results", 0)).get();

        verify(duckDuckGo).search("java", 20);
        verify(duckDuckGo).search("java", 1);
    }

    @Test
    void execute_trimsProviderOverflow() throws Exception {
        when(duckDuckGo.search(eq("java"), anyInt())).thenReturn(List.of(
                new SearchHit(1, "a", "", "https://a.example/"),
                new SearchHit(2, "b", "", "https://b.example/")));

        ToolResult result = tool.execute(Map.of(QUERY, "java", "max_results", 1)).get();

        assertEquals(1, ((SearchResults) result.getData()).hits().size());
    }

    @Test
    void execute_reportsProviderFailureKind() throws Exception {
        when(duckDuckGo.search(anyString(), anyInt()))
                .thenThrow(new SearchProviderException(ToolFailureKind.TIMEOUT, "DuckDuckGo request timed out"));

        ToolResult result = tool.execute(Map.of(QUERY, "java")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.TIMEOUT, result.getFailureKind());
        assertEquals("Search failed: DuckDuckGo request timed out", result.getError());
        assertEquals(Map.of(QUERY, "java"), result.getData());
    }
}
