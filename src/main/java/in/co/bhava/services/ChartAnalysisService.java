package in.co.bhava.services;

import in.co.bhava.pojos.AnalysisErrorKind;
import in.co.bhava.pojos.AnalysisResult;
import in.co.bhava.pojos.ArudhaLagnaProfile;
import in.co.bhava.pojos.ArudhaPadaReport;
import in.co.bhava.pojos.AspectResult;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.HouseAnalysisReport;
import in.co.bhava.pojos.MalformedChartException;
import in.co.bhava.pojos.Planet;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for chart analysis.
 *
 * <p>Malformed input never escapes as an exception: every analysis returns an
 * {@link AnalysisResult} carrying either the report or {@link AnalysisErrorKind#MALFORMED_CHART}
 * with a message. Missing planets are not an error; they are logged and reported on the result.
 * An invalid house number is a caller bug and is thrown as {@link IllegalArgumentException}.</p>
 */
public class ChartAnalysisService {

    private final ChartParser chartParser;
    private final AspectCalculationService aspectCalculationService;
    private final HouseStrengthService houseStrengthService;
    private final ArudhaPadaService arudhaPadaService;

    public ChartAnalysisService() {
        this(new ChartParser(), new AspectCalculationService());
    }

    private ChartAnalysisService(ChartParser chartParser, AspectCalculationService aspectCalculationService) {
        this(chartParser, aspectCalculationService,
                new HouseStrengthService(aspectCalculationService),
                new ArudhaPadaService(aspectCalculationService));
    }

    public ChartAnalysisService(ChartParser chartParser, AspectCalculationService aspectCalculationService,
                                HouseStrengthService houseStrengthService, ArudhaPadaService arudhaPadaService) {
        this.chartParser = chartParser;
        this.aspectCalculationService = aspectCalculationService;
        this.houseStrengthService = houseStrengthService;
        this.arudhaPadaService = arudhaPadaService;
    }

    // =========================================================================
    // Chart entry points
    // =========================================================================

    public AnalysisResult<HouseAnalysisReport> analyzeHouses(Chart chart) {
        return run("analyze_houses", chart, houseStrengthService::analyzeHouses);
    }

    public AnalysisResult<ArudhaPadaReport> analyzeArudhaPadas(Chart chart) {
        return run("analyze_arudha_padas", chart, arudhaPadaService::analyzeArudhaPadas);
    }

    /**
     * Arudha Lagna profile; the value is empty when the lagna lord has no position.
     */
    public AnalysisResult<Optional<ArudhaLagnaProfile>> analyzeArudhaLagna(Chart chart) {
        return run("analyze_arudha_lagna", chart, arudhaPadaService::arudhaLagnaProfile);
    }

    /**
     * Aspects reaching a house; a missing chart has none and is logged rather than thrown.
     *
     * @throws IllegalArgumentException if the house is outside 1..12
     */
    public List<AspectResult> aspectsOnHouse(Chart chart, int houseNumber) {
        HouseGeometry.requireHouse(houseNumber);
        if (chart == null) {
            LoggingService.setFunction("aspects_on_house");
            LoggingService.warn("aspects_on_house_rejected", LoggingService.data("errorMessage", "Chart is missing"));
            return List.of();
        }
        return aspectCalculationService.aspectsOnHouse(chart, houseNumber);
    }

    // =========================================================================
    // JSON entry points
    // =========================================================================

    public AnalysisResult<HouseAnalysisReport> analyzeHousesFromJson(String chartJson) {
        return parseThen("analyze_houses", chartJson, this::analyzeHouses);
    }

    public AnalysisResult<ArudhaPadaReport> analyzeArudhaPadasFromJson(String chartJson) {
        return parseThen("analyze_arudha_padas", chartJson, this::analyzeArudhaPadas);
    }

    public AnalysisResult<Optional<ArudhaLagnaProfile>> analyzeArudhaLagnaFromJson(String chartJson) {
        return parseThen("analyze_arudha_lagna", chartJson, this::analyzeArudhaLagna);
    }

    /**
     * Parse without analysing.
     */
    public AnalysisResult<Chart> parseChart(String chartJson) {
        try {
            return AnalysisResult.success(chartParser.parse(chartJson));
        } catch (MalformedChartException e) {
            LoggingService.warn("chart_parse_failed", LoggingService.data("errorMessage", e.getMessage()));
            return AnalysisResult.failure(AnalysisErrorKind.MALFORMED_CHART, e.getMessage());
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> AnalysisResult<T> parseThen(String operation, String chartJson,
                                            Function<Chart, AnalysisResult<T>> analysis) {
        AnalysisResult<Chart> parsed = parseChart(chartJson);
        if (!parsed.isSuccess()) {
            LoggingService.setFunction(operation);
            return AnalysisResult.failure(parsed.getErrorKind(), parsed.getErrorMessage());
        }
        return analysis.apply(parsed.getValue());
    }

    private <T> AnalysisResult<T> run(String operation, Chart chart, Function<Chart, T> analysis) {
        LoggingService.setFunction(operation);
        if (chart == null) {
            LoggingService.warn(operation + "_rejected", LoggingService.data("errorMessage", "Chart is missing"));
            return AnalysisResult.failure(AnalysisErrorKind.MALFORMED_CHART, "Chart is missing");
        }
        LoggingService.setChartId(chart.getId());

        Set<Planet> missing = chart.getMissingPlanets();
        if (!missing.isEmpty()) {
            LoggingService.warn("chart_planets_missing", LoggingService.data("planets", missing.toString()));
        }

        long startTime = LoggingService.logOperationStart(operation,
                LoggingService.data("ascendant", chart.getAscendantSign().getDisplayName()));
        try {
            T value = analysis.apply(chart);
            LoggingService.logOperationEnd(operation, startTime);
            return AnalysisResult.success(value);
        } catch (MalformedChartException e) {
            LoggingService.logOperationFailed(operation, startTime, e.getMessage());
            return AnalysisResult.failure(AnalysisErrorKind.MALFORMED_CHART, e.getMessage());
        }
    }
}
