package org.refactor.graphdiff.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 在固定大小的线程池上并行比较多对源码。
 * <p>
 * 每次比较互不共享可变状态（图、搜索状态、代价缓存都是每次新建的）。
 * 结果顺序与输入顺序一致；某次比较整体失败时，它的所有度量记为失败，不影响其他比较。
 */
public class BatchAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final ChangeAnalyzer analyzer;
    private final int threads;

    public BatchAnalyzer(ChangeAnalyzer analyzer) {
        this(analyzer, analyzer.options().getThreads());
    }

    public BatchAnalyzer(ChangeAnalyzer analyzer, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("thread count must be positive: " + threads);
        }
        this.analyzer = analyzer;
        this.threads = threads;
    }

    public List<ComparisonReport> analyzeAll(List<SourcePair> pairs) {
        LOG.info("analyzing {} changes on {} threads", pairs.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ComparisonReport>> futures = new ArrayList<>();
            for (SourcePair pair : pairs) {
                futures.add(executor.submit(() -> analyzer.analyze(pair.path(), pair.before(), pair.after())));
            }

            List<ComparisonReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                SourcePair pair = pairs.get(i);
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOG.warn("comparison of {} failed", pair.path(), e.getCause());
                    reports.add(analyzer.failedReport(pair.path(), e.getCause()));
                }
            }
            LOG.info("finished {} changes", reports.size());
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch analysis interrupted", e);
        } finally {
            executor.shutdownNow();
            try {
                executor.awaitTermination(1, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
