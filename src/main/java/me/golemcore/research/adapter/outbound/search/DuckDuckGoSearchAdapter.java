/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.research.adapter.outbound.search;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.SearchHit;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.SearchProviderException;
import me.golemcore.research.port.outbound.WebSearchPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * DuckDuckGo search through the keyless HTML endpoint. Result blocks are parsed
 * with jsoup; sponsored results are skipped and redirect links are unwrapped
 * to the target URL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuckDuckGoSearchAdapter implements WebSearchPort {

    private static final String REDIRECT_PARAM = "uddg";

    private final OkHttpClient okHttpClient;
    private final ResearchProperties properties;

    private OkHttpClient client;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getSearch();
        this.client = okHttpClient.newBuilder()
                .callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String getProviderId() {
        return "duckduckgo";
    }

    @Override
    public List<SearchHit> search(String query, int count) throws SearchProviderException {
        String endpoint = properties.getTools().getSearch().getDuckDuckGoUrl();
        HttpUrl base = HttpUrl.parse(endpoint);
        if (base == null) {
            throw new SearchProviderException(ToolFailureKind.PROVIDER_ERROR, "Invalid DuckDuckGo URL: " + endpoint);
        }
        Request request = new Request.Builder()
                .url(base.newBuilder().addQueryParameter("q", query).build())
                .header("User-Agent", properties.getTools().getCrawl().getUserAgent())
                .header("Accept", "text/html")
                .get()
                .build();

        log.debug("[Search] DuckDuckGo: query='{}', count={}", query, count);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SearchProviderException(ToolFailureKind.NETWORK_ERROR,
                        "DuckDuckGo returned HTTP " + response.code());
            }
            ResponseBody body = response.body();
            return parseResults(body != null ? body.string() : "", endpoint, count);
        } catch (SearchProviderException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new SearchProviderException(ToolFailureKind.TIMEOUT, "DuckDuckGo request timed out", e);
        } catch (IOException e) {
            throw new SearchProviderException(ToolFailureKind.NETWORK_ERROR,
                    "DuckDuckGo request failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SearchProviderException(ToolFailureKind.PARSE_ERROR,
                    "Failed to parse DuckDuckGo results: " + e.getMessage(), e);
        }
    }

    List<SearchHit> parseResults(String html, String baseUri, int count) {
        Document document = Jsoup.parse(html, baseUri);
        List<SearchHit> hits = new ArrayList<>();
        for (Element result : document.select("div.result")) {
            if (hits.size() >= count) {
                break;
            }
            if (result.hasClass("result--ad")) {
                continue;
            }
            Element link = result.selectFirst("a.result__a");
            if (link == null) {
                continue;
            }
            String url = unwrapRedirect(link.attr("href"));
            if (url.isBlank()) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            hits.add(new SearchHit(hits.size() + 1, link.text(), snippet != null ? snippet.text() : "", url));
        }
        return hits;
    }

    static String unwrapRedirect(String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String absolute = href.startsWith("//") ? "https:" + href : href;
        HttpUrl url = HttpUrl.parse(absolute);
        if (url != null && url.queryParameter(REDIRECT_PARAM) != null) {
            return url.queryParameter(REDIRECT_PARAM);
        }
        return absolute;
    }
}
