package com.example.UniScout.config;

import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.CompositionMode;
import com.example.UniScout.model.SearchDepth;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Process-wide orchestration settings, bound once at startup.
 *
 * @param allowedDomains     allow-listed domains; the first one is used for site-restricted queries
 * @param evidenceCap        maximum size of the merged evidence bundle
 * @param defaultLimit       results requested from each backend when the caller gives no limit
 * @param searchDepth        default search depth
 * @param classifyTimeout    bound on each classify capability call
 * @param generateTimeout    bound on each generate capability call
 * @param backendTimeout     bound on each backend search call
 * @param parallelBackends   search backends concurrently instead of in order
 * @param keywordExtraction  refine search expressions with extracted keywords
 * @param compositionMode    default composition mode
 * @param enabledBackends    backends searched when the caller does not choose
 */
@ConfigurationProperties(prefix = "uniscout.orchestrator")
@Validated
public record OrchestratorProperties(
        @DefaultValue({"policy.vinuni.edu.vn", "vinuni.edu.vn"}) @NotEmpty List<String> allowedDomains,
        @DefaultValue("6") @Min(1) @Max(50) int evidenceCap,
        @DefaultValue("5") @Min(1) @Max(20) int defaultLimit,
        @DefaultValue("ADVANCED") @NotNull SearchDepth searchDepth,
        @DefaultValue("10s") @NotNull Duration classifyTimeout,
        @DefaultValue("60s") @NotNull Duration generateTimeout,
        @DefaultValue("15s") @NotNull Duration backendTimeout,
        @DefaultValue("false") boolean parallelBackends,
        @DefaultValue("false") boolean keywordExtraction,
        @DefaultValue("MERGED") @NotNull CompositionMode compositionMode,
        @DefaultValue("TAVILY") Set<BackendId> enabledBackends
) {
}
