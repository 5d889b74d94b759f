package fun.fengwk.msh.core.facade.search.runtime;

import fun.fengwk.msh.core.facade.search.exception.SearchCancelledException;
import fun.fengwk.msh.core.facade.search.model.QueryOutcome;
import fun.fengwk.msh.core.facade.search.model.SearchQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * Fans independent queries out to a bounded number of workers and collects the outcomes
 * in input order.
 *
 * @author fengwk
 */
@Slf4j
public class ParallelQueryDispatcher {

    private final ExecutorService executorService;
    private final int maxParallel;

    public ParallelQueryDispatcher(ExecutorService executorService, int maxParallel) {
        if (maxParallel <= 0) {
            throw new IllegalArgumentException("maxParallel must be positive");
        }
        this.executorService = executorService;
        this.maxParallel = maxParallel;
    }

    /**
     * Execute every query and return the outcomes, {@code outcomes[i]} belongs to {@code queries[i]}.
     *
     * @param task runs the fallback chain of one query, must not block past cancellation
     * @throws SearchCancelledException when the signal fired or the caller was interrupted
     */
    public List<QueryOutcome> dispatch(List<SearchQuery> queries,
                                       BiFunction<SearchQuery, SearchCancellation, QueryOutcome> task,
                                       SearchCancellation cancellation) {
        int total = queries.size();
        if (total == 0) {
            return List.of();
        }

        BlockingQueue<QueryWork> queue = new LinkedBlockingQueue<>(total);
        for (int i = 0; i < total; i++) {
            queue.add(new QueryWork(i, queries.get(i)));
        }

        QueryOutcome[] outcomes = new QueryOutcome[total];
        ReentrantLock writeLock = new ReentrantLock();
        int workers = Math.min(maxParallel, total);
        CountDownLatch done = new CountDownLatch(workers);

        log.debug("dispatching search queries, total={}, workers={}", total, workers);
        for (int w = 0; w < workers; w++) {
            Runnable worker = () -> {
                try {
                    QueryWork work;
                    while ((work = queue.poll()) != null) {
                        QueryOutcome outcome = runGuarded(task, work.query(), cancellation);
                        writeLock.lock();
                        try {
                            outcomes[work.index()] = outcome;
                        } finally {
                            writeLock.unlock();
                        }
                    }
                } finally {
                    done.countDown();
                }
            };
            try {
                executorService.execute(worker);
            } catch (RejectedExecutionException ex) {
                cancellation.cancel("search executor rejected work");
                throw new SearchCancelledException("search executor rejected work", ex);
            }
        }

        try {
            done.await();
        } catch (InterruptedException ex) {
            cancellation.cancel("interrupted");
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("interrupted", ex);
        }
        cancellation.throwIfCancelled();

        writeLock.lock();
        try {
            return List.copyOf(Arrays.asList(outcomes));
        } finally {
            writeLock.unlock();
        }
    }

    private static QueryOutcome runGuarded(BiFunction<SearchQuery, SearchCancellation, QueryOutcome> task,
                                           SearchQuery query, SearchCancellation cancellation) {
        try {
            QueryOutcome outcome = task.apply(query, cancellation);
            if (outcome == null) {
                return QueryOutcome.failure(query.getText(), "no providers could complete the search");
            }
            return outcome;
        } catch (SearchCancelledException ex) {
            return QueryOutcome.failure(query.getText(), "search cancelled: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("search query task failed, query={}", query.getText(), ex);
            return QueryOutcome.failure(query.getText(), "search failed: " + ex.getMessage());
        }
    }

    private record QueryWork(int index, SearchQuery query) {
    }

}
