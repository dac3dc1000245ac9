package com.community.tracker.client;

import com.community.tracker.exception.TrackerException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ProfileClient} 的 AniList GraphQL 实现。
 */
@Component
public class AniListProfileClient implements ProfileClient {

    private static final Logger log = LoggerFactory.getLogger(AniListProfileClient.class);

    private static final String PROFILE_QUERY = """
            query ($username: String) {
              User(name: $username) {
                id
                name
                avatar { large }
                siteUrl
              }
            }
            """;

    private static final String STATISTICS_QUERY = """
            query ($username: String) {
              User(name: $username) {
                name
                statistics {
                  anime { ...stats }
                  manga { ...stats }
                }
              }
            }
            fragment stats on UserStatistics {
              count
              statuses { status count }
              scores { score count }
              genres { genre count }
              formats { format count }
              countries { country count }
            }
            """;

    private final WebClient webClient;
    private final Clock clock;

    public AniListProfileClient(@Qualifier("aniListWebClient") WebClient webClient, Clock clock) {
        this.webClient = webClient;
        this.clock = clock;
    }

    @Override
    public Optional<ExternalProfile> fetchProfile(String externalHandle) {
        JsonNode user = queryUser(PROFILE_QUERY, externalHandle);
        if (user == null || user.isNull() || user.isMissingNode()) {
            log.info("AniList has no user named {}", externalHandle);
            return Optional.empty();
        }
        ExternalProfile profile = new ExternalProfile(
                user.path("id").asLong(),
                user.path("name").asText(externalHandle),
                user.path("avatar").path("large").asText(null),
                user.path("siteUrl").asText(null));
        return Optional.of(profile);
    }

    @Override
    public CatalogSnapshot fetchCatalogSnapshot(String externalHandle) {
        JsonNode user = queryUser(STATISTICS_QUERY, externalHandle);
        if (user == null || user.isNull() || user.isMissingNode()) {
            throw TrackerException.handleNotFound(externalHandle);
        }
        JsonNode statistics = user.path("statistics");
        return CatalogSnapshot.of(
                user.path("name").asText(externalHandle),
                toStatistics(statistics.path("anime")),
                toStatistics(statistics.path("manga")),
                clock);
    }

    private JsonNode queryUser(String query, String externalHandle) {
        Map<String, Object> body = Map.of(
                "query", query,
                "variables", Map.of("username", externalHandle));
        try {
            JsonNode response = webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            return response == null ? null : response.path("data").path("User");
        } catch (WebClientResponseException.NotFound ex) {
            // 未知用户：AniList 返回 404 与 GraphQL 错误体
            return null;
        } catch (WebClientException | CodecException ex) {
            log.error("AniList request failed for {}: {}", externalHandle, ex.getMessage());
            throw TrackerException.upstreamUnavailable("AniList request failed for " + externalHandle, ex);
        }
    }

    private MediaStatistics toStatistics(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return MediaStatistics.empty();
        }
        MediaStatistics stats = new MediaStatistics();
        stats.setCount(node.path("count").asInt(0));
        stats.setStatuses(toCounts(node.path("statuses"), "status"));
        stats.setGenres(toCounts(node.path("genres"), "genre"));
        stats.setFormats(toCounts(node.path("formats"), "format"));
        stats.setCountries(toCounts(node.path("countries"), "country"));

        Map<Integer, Integer> scores = new LinkedHashMap<>();
        for (JsonNode bucket : node.path("scores")) {
            scores.merge(bucket.path("score").asInt(), bucket.path("count").asInt(0), Integer::sum);
        }
        stats.setScores(scores);
        return stats;
    }

    private Map<String, Integer> toCounts(JsonNode array, String keyField) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (JsonNode item : array) {
            String key = item.path(keyField).asText(null);
            if (key != null) {
                counts.merge(key, item.path("count").asInt(0), Integer::sum);
            }
        }
        return counts;
    }
}
