package com.freelance.jobalerts.pipeline.source;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.http.HttpFetchResult;
import com.freelance.jobalerts.pipeline.http.PoliteHttpClient;
import com.freelance.jobalerts.pipeline.model.RawListing;
import com.freelance.jobalerts.pipeline.model.SourceFetchResult;
import com.freelance.jobalerts.pipeline.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Skywalker.gr publishes a plain RSS 2.0 feed with no server-side search, so keywords are
 * ignored and the newest page is returned as-is.
 */
@Component
public class SkywalkerRssSourceAdapter implements JobSourceAdapter {
    public static final String SOURCE_ID = "skywalker";

    private static final String DEFAULT_URL = "https://www.skywalker.gr/jobs/feed";

    private final PoliteHttpClient httpClient;
    private final AlertsProperties properties;

    public SkywalkerRssSourceAdapter(PoliteHttpClient httpClient, AlertsProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public SourceFetchResult fetch(List<String> keywords) {
        AlertsProperties.Source config = properties.source(SOURCE_ID);
        String url = TextUtils.firstNonBlank(config.getUrl(), DEFAULT_URL);
        HttpFetchResult response = httpClient.get(url, "application/rss+xml, application/xml;q=0.9, */*;q=0.5");
        if (!response.isSuccessful()) {
            return SourceFetchResult.failure(SOURCE_ID, response.failureCode(), response.errorMessage());
        }
        if (response.body() == null || response.body().isBlank()) {
            return SourceFetchResult.failure(SOURCE_ID, "invalid_payload", "empty body");
        }

        Document document = Jsoup.parse(response.body(), url, Parser.xmlParser());
        if (document.selectFirst("rss > channel, channel") == null) {
            return SourceFetchResult.failure(SOURCE_ID, "invalid_payload", "no RSS channel element");
        }

        List<RawListing> listings = new ArrayList<>();
        for (Element item : document.select("item")) {
            if (listings.size() >= config.getMaxItems()) {
                break;
            }
            listings.add(new RawListing(
                SOURCE_ID,
                childText(item, "guid"),
                childText(item, "title"),
                childText(item, "description"),
                childText(item, "link"),
                null,
                null,
                null,
                childText(item, "pubDate")
            ));
        }
        return SourceFetchResult.success(SOURCE_ID, listings);
    }

    private String childText(Element item, String tag) {
        for (Element child : item.children()) {
            if (child.tagName().equalsIgnoreCase(tag)) {
                return TextUtils.blankToNull(child.text());
            }
        }
        return null;
    }
}
