package com.example.UniScout.service;

import com.example.UniScout.TestFixtures;
import com.example.UniScout.model.AllowedDomainSet;
import com.example.UniScout.model.CompositionMode;
import com.example.UniScout.model.QueryPlan;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueryPlannerTest {

    private final AllowedDomainSet domains = AllowedDomainSet.of("policy.vinuni.edu.vn", "vinuni.edu.vn");

    @Test
    void rawQueryPassesThroughWithSiteRestrictionOnPrimaryDomain() {
        KeywordExtractor extractor = mock(KeywordExtractor.class);
        QueryPlanner planner = new QueryPlanner(extractor, TestFixtures.properties());

        QueryPlan plan = planner.plan("  What financial aid options exist? ", domains);

        assertThat(plan.restricted()).isEqualTo("site:policy.vinuni.edu.vn What financial aid options exist?");
        assertThat(plan.unrestricted()).isEqualTo("What financial aid options exist?");
        verifyNoInteractions(extractor);
    }

    @Test
    void keywordsReplaceRawQueryWhenExtractionEnabled() {
        KeywordExtractor extractor = mock(KeywordExtractor.class);
        when(extractor.extract(anyString())).thenReturn(List.of("financial aid", "options"));
        QueryPlanner planner = new QueryPlanner(extractor,
                TestFixtures.properties(false, CompositionMode.MERGED, Duration.ofSeconds(5), true));

        QueryPlan plan = planner.plan("What financial aid options exist?", domains);

        assertThat(plan.unrestricted()).isEqualTo("\"financial aid\" \"options\"");
        assertThat(plan.restricted()).isEqualTo("site:policy.vinuni.edu.vn \"financial aid\" \"options\"");
    }

    @Test
    void emptyKeywordListFallsBackToRawQuery() {
        KeywordExtractor extractor = mock(KeywordExtractor.class);
        when(extractor.extract(anyString())).thenReturn(List.of());
        QueryPlanner planner = new QueryPlanner(extractor,
                TestFixtures.properties(false, CompositionMode.MERGED, Duration.ofSeconds(5), true));

        assertThat(planner.plan("Hi?", domains).unrestricted()).isEqualTo("Hi?");
    }

    @Test
    void noAllowedDomainsMeansNoSiteToken() {
        QueryPlanner planner = new QueryPlanner(mock(KeywordExtractor.class), TestFixtures.properties());

        QueryPlan plan = planner.plan("library hours", AllowedDomainSet.of(List.of()));

        assertThat(plan.restricted()).isEqualTo("library hours");
    }
}
