/* (C)2026 */
package com.ammann.impact.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ammann.impact.dto.ImpactTimingDTO;
import com.ammann.impact.dto.PeriodicPatternsDTO;
import com.ammann.impact.enumeration.AggregationMethod;
import com.ammann.impact.enumeration.SignificanceTestType;
import com.ammann.impact.exception.ValidationException;
import com.ammann.impact.properties.ApiProperties;
import com.ammann.impact.service.TemporalImpactAnalysisService;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImpactWindowResourceTest {

    private static final String EVENT_ID = "evt-1";

    private TemporalImpactAnalysisService analysisService;
    private ImpactWindowResource resource;

    @BeforeEach
    void setUp() {
        analysisService = mock(TemporalImpactAnalysisService.class);
        resource = new ImpactWindowResource();
        resource.analysisService = analysisService;
    }

    @Test
    void resourceIsMountedUnderEventTemporalPath() {
        Path path = ImpactWindowResource.class.getAnnotation(Path.class);

        assertThat(path.value()).isEqualTo("/api/v1/events/{eventId}/temporal");
        assertThat(ApiProperties.BASE_URL_V1 + ApiProperties.Temporal.BASE).isEqualTo(path.value());
    }

    @Test
    void periodicityReturnsServiceResult() {
        PeriodicPatternsDTO dto = new PeriodicPatternsDTO(
                List.of("24h"), Map.of("24h", 0.9), "24h", List.of(), List.of());
        when(analysisService.detectPeriodicPatterns(EVENT_ID, "sentiment", List.of("24h"), 0.5)).thenReturn(dto);

        Response response = resource.getPeriodicPatterns(EVENT_ID, "sentiment", List.of("24h"), 0.5);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getEntity()).isSameAs(dto);
    }

    @Test
    void impactTimingWithoutTimestampDefersToEventStart() {
        ImpactTimingDTO dto = new ImpactTimingDTO(1.0,
                new ImpactTimingDTO.ImpactOnset(false, "0m", Instant.EPOCH),
                new ImpactTimingDTO.RecoveryTiming("0m", "0m"), "0m", 0.0, 0.0);
        when(analysisService.calculateImpactTiming(EVENT_ID, "sentiment", null, 0.1, 0.9, 1)).thenReturn(dto);

        Response response = resource.getImpactTiming(EVENT_ID, "sentiment", "", 0.1, 0.9, 1);

        assertThat(response.getEntity()).isSameAs(dto);
    }

    @Test
    void listOptionsAreParsedFromWireKeys() {
        resource.getAggregation(EVENT_ID, "sentiment", List.of("1h"), List.of("mean", "percentile_95"), null);
        resource.getChangePointSignificance(EVENT_ID, "sentiment", "2024-01-01T00:00:00Z", "1h", "1h",
                List.of("permutation", "PARAMETRIC"));

        verify(analysisService).aggregateTemporalData(EVENT_ID, "sentiment", List.of("1h"),
                List.of(AggregationMethod.MEAN, AggregationMethod.PERCENTILE_95), null);
        verify(analysisService).analyzeChangePointSignificance(EVENT_ID, "sentiment",
                Instant.parse("2024-01-01T00:00:00Z"), "1h", "1h",
                List.of(SignificanceTestType.PERMUTATION, SignificanceTestType.PARAMETRIC));
    }

    @Test
    void comparisonRequiresEveryBound() {
        assertThatThrownBy(() -> resource.compareWindows(EVENT_ID, List.of("sentiment"),
                        "2024-01-01T00:00:00Z", null, "2024-01-02T00:00:00Z", "2024-01-03T00:00:00Z"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("beforeEnd");

        verifyNoInteractions(analysisService);
    }

    @Test
    void unknownOptionIsRejectedBeforeAnalysis() {
        assertThatThrownBy(() -> resource.getGaps(EVENT_ID, "sentiment", "1h", "cubic", "6h", false))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(analysisService);
    }

    @Test
    void parseInstantValidatesFormat() {
        assertThat(ImpactWindowResource.parseInstant("ts", "2024-05-01T12:00:00Z"))
                .isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(ImpactWindowResource.parseOptionalInstant("ts", null)).isNull();
        assertThatThrownBy(() -> ImpactWindowResource.parseInstant("ts", "yesterday"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ISO-8601");
        assertThatThrownBy(() -> ImpactWindowResource.parseInstant("ts", " "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void serviceErrorsPropagate() {
        when(analysisService.detectTrendBreakpoints(anyString(), any(), anyInt(), anyInt()))
                .thenThrow(ValidationException.missingParameter("field"));

        assertThatThrownBy(() -> resource.getTrendBreakpoints(EVENT_ID, null, 5, 1))
                .isInstanceOf(ValidationException.class);
    }
}
