package dev.jobmatcher.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class RecommendationRequest {

    @NotEmpty
    private List<String> keywords;

    @Min(1)
    @Max(100)
    private int limit = 20;

    @Min(0)
    @Max(100)
    private int minScore = 0;
}
