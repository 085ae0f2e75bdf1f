package utils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.apache.log4j.Logger;

/**
 * Chunked fan-out of independent work items over a fixed thread pool.
 *
 * Each worker processes one contiguous chunk into its own result list; the
 * lists are concatenated in chunk order afterwards, so results come back in
 * the order of the input and no result list is shared between threads.
 */
public class Threading {

    private static final Logger logger = Logger.getLogger(Threading.class);

    private Threading(){
    }

    public static int defaultThreads(){
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Applies {@code processor} to every item and returns the results in input
     * order. Runs sequentially when fewer than two threads or two items are
     * available. The first exception thrown by a worker is rethrown.
     */
    public static <T, R> List<R> processListParallelWithResults(List<T> items, Function<T, R> processor, int numThreads){
        List<R> results = new ArrayList<>();
        if(items.isEmpty())
            return results;

        int threads = Math.min(numThreads, items.size());
        if(threads < 2){
            logger.debug("Processing " + items.size() + " items sequentially");
            for(T item : items)
                results.add(processor.apply(item));
            return results;
        }

        int chunkSize = (items.size() + threads - 1) / threads;
        int chunks = (items.size() + chunkSize - 1) / chunkSize;
        logger.debug("Processing " + items.size() + " items with " + chunks + " threads");

        ExecutorService eService = Executors.newFixedThreadPool(chunks);
        CountDownLatch latch = new CountDownLatch(chunks);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        List<List<R>> threadResults = new ArrayList<>(chunks);

        for(int i = 0; i < chunks; i++){
            final int startIdx = i * chunkSize;
            final int endIdx = Math.min(startIdx + chunkSize, items.size());
            final List<R> threadResultList = new ArrayList<>(endIdx - startIdx);
            threadResults.add(threadResultList);

            eService.execute(() -> {
                try{
                    for(int j = startIdx; j < endIdx; j++)
                        threadResultList.add(processor.apply(items.get(j)));
                }
                catch(RuntimeException e){
                    failure.compareAndSet(null, e);
                }
                finally{
                    latch.countDown();
                }
            });
        }

        try{
            latch.await();
        }
        catch(InterruptedException e){
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parallel processing was interrupted", e);
        }
        finally{
            eService.shutdown();
        }

        if(failure.get() != null)
            throw failure.get();
        for(List<R> threadResultList : threadResults)
            results.addAll(threadResultList);
        return results;
    }
}
