package in.co.bhava.services;

import in.co.bhava.pojos.AnalysisErrorKind;
import in.co.bhava.pojos.AnalysisResult;
import in.co.bhava.pojos.ArudhaPadaReport;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.HouseAnalysisReport;
import in.co.bhava.pojos.Planet;
import in.co.bhava.pojos.ZodiacSign;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ChartBatchAnalyzerTest {

    private final ChartAnalysisService analysisService = new ChartAnalysisService();

    private static List<Chart> charts(int count) {
        List<Chart> charts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            charts.add(Chart.builder()
                    .id("batch-" + i)
                    .ascendant((String) null, (i * 29.0) % 360.0)
                    .planet(Planet.SUN, (i * 13.0) % 360.0)
                    .planet(Planet.MARS, (i * 47.0 + 5.0) % 360.0)
                    .planet(Planet.VENUS, (i * 71.0 + 11.0) % 360.0)
                    .planet(Planet.JUPITER, (i * 97.0 + 3.0) % 360.0)
                    .build());
        }
        return charts;
    }

    @Test
    void testAnalyzeHouses_ResultsInInputOrderAndMatchSequential() {
        List<Chart> charts = charts(25);
        try (ChartBatchAnalyzer batch = new ChartBatchAnalyzer(analysisService, 4, 30)) {
            List<AnalysisResult<HouseAnalysisReport>> results = batch.analyzeHouses(charts);

            assertEquals(charts.size(), results.size());
            for (int i = 0; i < charts.size(); i++) {
                HouseAnalysisReport expected = analysisService.analyzeHouses(charts.get(i)).getValue();
                assertEquals(expected, results.get(i).getValue(), "chart " + i);
            }
        }
    }

    @Test
    void testAnalyzeArudhaPadas_NullChartBecomesFailureAtItsIndex() {
        Chart chart = Chart.builder().ascendant(ZodiacSign.ARIES, 0.0).planet(Planet.MARS, 190.0).build();
        try (ChartBatchAnalyzer batch = new ChartBatchAnalyzer(analysisService, 2, 30)) {
            List<AnalysisResult<ArudhaPadaReport>> results = batch.analyzeArudhaPadas(Arrays.asList(chart, null, chart));

            assertEquals(3, results.size());
            assertTrue(results.get(0).isSuccess());
            assertEquals(AnalysisErrorKind.MALFORMED_CHART, results.get(1).getErrorKind());
            assertEquals(10, results.get(2).getValue().getArudhaLagna().orElseThrow().getCorrectedHouse());
        }
    }

    @Test
    void testEmptyBatch_ReturnsEmptyList() {
        try (ChartBatchAnalyzer batch = new ChartBatchAnalyzer(analysisService)) {
            assertTrue(batch.analyzeHouses(List.of()).isEmpty());
        }
    }

    @Test
    void testUnexpectedFailure_Rethrown() {
        ChartAnalysisService failing = mock(ChartAnalysisService.class);
        when(failing.analyzeHouses(any())).thenThrow(new IllegalArgumentException("Invalid house number: 13"));

        try (ChartBatchAnalyzer batch = new ChartBatchAnalyzer(failing, 2, 30)) {
            List<Chart> charts = charts(3);
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> batch.analyzeHouses(charts));
            assertEquals("Invalid house number: 13", e.getMessage());
        }
    }

    @Test
    void testInvalidPoolSettings_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChartBatchAnalyzer(analysisService, 0, 30));
        assertThrows(IllegalArgumentException.class, () -> new ChartBatchAnalyzer(analysisService, 2, 0));
    }
}
