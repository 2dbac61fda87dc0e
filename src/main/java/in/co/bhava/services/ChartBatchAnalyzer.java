package in.co.bhava.services;

import in.co.bhava.pojos.AnalysisResult;
import in.co.bhava.pojos.ArudhaPadaReport;
import in.co.bhava.pojos.Chart;
import in.co.bhava.pojos.HouseAnalysisReport;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs chart analyses on a fixed worker pool. Results come back in input order and are the same
 * as calling {@link ChartAnalysisService} once per chart.
 *
 * <p>Pool size and per-batch timeout come from {@code batch.threads} and
 * {@code batch.timeoutSeconds} in {@value EngineConfig#CONFIG_RESOURCE}.</p>
 */
public class ChartBatchAnalyzer implements AutoCloseable {

    private final ChartAnalysisService analysisService;
    private final ExecutorService executor;
    private final long timeoutSeconds;

    public ChartBatchAnalyzer(ChartAnalysisService analysisService) {
        this(analysisService,
                EngineConfigProvider.getInt(EngineConfig.KEY_BATCH_THREADS, EngineConfig.DEFAULT_BATCH_THREADS),
                EngineConfigProvider.getInt(EngineConfig.KEY_BATCH_TIMEOUT_SECONDS, EngineConfig.DEFAULT_BATCH_TIMEOUT_SECONDS));
    }

    public ChartBatchAnalyzer(ChartAnalysisService analysisService, int threads, long timeoutSeconds) {
        if (threads < 1) {
            throw new IllegalArgumentException("Batch thread count must be positive: " + threads);
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("Batch timeout must be positive: " + timeoutSeconds);
        }
        this.analysisService = analysisService;
        this.executor = Executors.newFixedThreadPool(threads);
        this.timeoutSeconds = timeoutSeconds;
    }

    public List<AnalysisResult<HouseAnalysisReport>> analyzeHouses(List<Chart> charts) {
        return runAll("batch_analyze_houses", charts, analysisService::analyzeHouses);
    }

    public List<AnalysisResult<ArudhaPadaReport>> analyzeArudhaPadas(List<Chart> charts) {
        return runAll("batch_analyze_arudha_padas", charts, analysisService::analyzeArudhaPadas);
    }

    private <T> List<AnalysisResult<T>> runAll(String operation, List<Chart> charts,
                                               Function<Chart, AnalysisResult<T>> analysis) {
        long startTime = LoggingService.logOperationStart(operation, LoggingService.data("charts", charts.size()));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);

        String requestId = ThreadContext.get(LoggingService.KEY_REQUEST_ID);
        List<Future<AnalysisResult<T>>> futures = new ArrayList<>(charts.size());
        for (Chart chart : charts) {
            futures.add(executor.submit(() -> {
                // pool threads are reused, so each task starts from a clean context
                LoggingService.initRequest(requestId);
                try {
                    return analysis.apply(chart);
                } finally {
                    LoggingService.clearContext();
                }
            }));
        }

        List<AnalysisResult<T>> results = new ArrayList<>(charts.size());
        try {
            for (Future<AnalysisResult<T>> future : futures) {
                long remaining = deadline - System.nanoTime();
                results.add(future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS));
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            LoggingService.logOperationFailed(operation, startTime, e);
            throw new IllegalStateException("Batch analysis interrupted", e);
        } catch (TimeoutException e) {
            cancelAll(futures);
            LoggingService.logOperationFailed(operation, startTime, e);
            throw new IllegalStateException("Batch analysis did not finish within " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            LoggingService.logOperationFailed(operation, startTime, e.getCause());
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Batch analysis failed", e.getCause());
        }

        LoggingService.logOperationEnd(operation, startTime, LoggingService.data("charts", charts.size()));
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
