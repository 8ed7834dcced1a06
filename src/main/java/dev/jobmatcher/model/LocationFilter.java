package dev.jobmatcher.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured location preferences. Stored and exposed, but not yet enforced during matching.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationFilter {
    @Builder.Default
    private List<String> cities = new ArrayList<>();
    private boolean remoteOnly;
}
