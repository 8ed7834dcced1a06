package dev.jobmatcher.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * APNs-shaped notification body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushPayload(
        @JsonProperty("aps") Aps aps,
        @JsonProperty("custom_data") CustomData customData) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Aps(
            Alert alert,
            Integer badge,
            String sound,
            String category,
            @JsonProperty("thread-id") String threadId) {
    }

    public record Alert(String title, String subtitle, String body) {
    }

    public record CustomData(
            String type,
            @JsonProperty("match_id") String matchId,
            @JsonProperty("job_id") String jobId,
            @JsonProperty("matched_keywords") List<String> matchedKeywords,
            @JsonProperty("deep_link") String deepLink) {
    }
}
