package com.freelance.jobalerts.pipeline.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.http.HttpFetchResult;
import com.freelance.jobalerts.pipeline.http.PoliteHttpClient;
import com.freelance.jobalerts.pipeline.model.RawListing;
import com.freelance.jobalerts.pipeline.model.SourceFetchResult;
import com.freelance.jobalerts.pipeline.util.JobUrlUtils;
import com.freelance.jobalerts.pipeline.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Component
public class FreelancerSourceAdapter implements JobSourceAdapter {
    public static final String SOURCE_ID = "freelancer";

    private static final Logger log = LoggerFactory.getLogger(FreelancerSourceAdapter.class);
    private static final String DEFAULT_URL = "https://www.freelancer.com/api/projects/0.1/projects/active/";
    private static final String PROJECT_BASE_URL = "https://www.freelancer.com/projects/";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AlertsProperties properties;

    public FreelancerSourceAdapter(PoliteHttpClient httpClient, ObjectMapper objectMapper, AlertsProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public SourceFetchResult fetch(List<String> keywords) {
        AlertsProperties.Source config = properties.source(SOURCE_ID);
        String requestUrl = buildRequestUrl(config, keywords);
        HttpFetchResult response = httpClient.get(requestUrl, "application/json");
        if (!response.isSuccessful()) {
            return SourceFetchResult.failure(SOURCE_ID, response.failureCode(), response.errorMessage());
        }
        if (response.body() == null || response.body().isBlank()) {
            return SourceFetchResult.failure(SOURCE_ID, "invalid_payload", "empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return SourceFetchResult.failure(SOURCE_ID, "invalid_payload", e.getOriginalMessage());
        }
        String status = root.path("status").asText("");
        if (!"success".equalsIgnoreCase(status)) {
            return SourceFetchResult.failure(SOURCE_ID, "api_error", root.path("message").asText(status));
        }
        JsonNode projects = root.path("result").path("projects");
        if (!projects.isArray()) {
            return SourceFetchResult.failure(SOURCE_ID, "invalid_payload", "result.projects missing");
        }

        List<RawListing> listings = new ArrayList<>();
        for (JsonNode project : projects) {
            if (listings.size() >= config.getMaxItems()) {
                break;
            }
            listings.add(toListing(project));
        }
        log.debug("Freelancer returned {} projects", listings.size());
        return SourceFetchResult.success(SOURCE_ID, listings);
    }

    private String buildRequestUrl(AlertsProperties.Source config, List<String> keywords) {
        String base = TextUtils.firstNonBlank(config.getUrl(), DEFAULT_URL);
        StringBuilder url = new StringBuilder(base);
        url.append(base.contains("?") ? '&' : '?');
        url.append("limit=").append(config.getMaxItems());
        url.append("&full_description=true&job_details=true&sort_field=time_submitted");
        if (keywords != null && !keywords.isEmpty()) {
            String query = String.join(",", keywords);
            url.append("&query=").append(URLEncoder.encode(query, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    private RawListing toListing(JsonNode project) {
        String seoUrl = text(project, "seo_url");
        JsonNode budget = project.path("budget");
        return new RawListing(
            SOURCE_ID,
            text(project, "id"),
            text(project, "title"),
            TextUtils.firstNonBlank(text(project, "description"), text(project, "preview_description")),
            JobUrlUtils.resolve(PROJECT_BASE_URL, seoUrl),
            decimal(budget, "minimum"),
            decimal(budget, "maximum"),
            text(project.path("currency"), "code"),
            text(project, "time_submitted")
        );
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
