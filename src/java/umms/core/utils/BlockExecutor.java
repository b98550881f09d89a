package umms.core.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

import umms.core.exception.CoexpressionException;

/**
 * Splits an index range into contiguous chunks and runs them on a fixed thread pool.
 * Chunks write to disjoint rows of their output, so no synchronization is needed
 * until all of them have finished.
 * <p>
 * The pool is created on first use and reused by every later call until {@link #shutdown()}.
 * Tasks must not call back into the same executor.
 */
public class BlockExecutor {

	static Logger logger = Logger.getLogger(BlockExecutor.class.getName());

	/* chunks per thread, smooths out uneven chunk costs */
	private static final int CHUNKS_PER_THREAD = 4;

	public interface RangeTask {
		/**
		 * Processes indices start (inclusive) to end (exclusive).
		 */
		void run(int start, int end);
	}

	private final int numThreads;
	private ExecutorService pool;
	private boolean shutdown;

	public BlockExecutor(int numThreads) {
		if(numThreads < 1) {
			throw new IllegalArgumentException("Number of threads must be positive, got " + numThreads);
		}
		this.numThreads = numThreads;
	}

	public static BlockExecutor withAvailableProcessors() {
		return new BlockExecutor(Runtime.getRuntime().availableProcessors());
	}

	public int getNumThreads() {
		return numThreads;
	}

	public void forEachRange(int size, final RangeTask task) {
		if(isShutdown()) {
			throw new IllegalStateException("Block executor has been shut down");
		}
		if(size <= 0) {
			return;
		}
		if(numThreads == 1 || size == 1) {
			task.run(0, size);
			return;
		}

		int chunk = Math.max(1, (size + numThreads * CHUNKS_PER_THREAD - 1) / (numThreads * CHUNKS_PER_THREAD));
		ExecutorService workers = pool();
		List<Future<Void>> futures = new ArrayList<Future<Void>>();
		try {
			for(int start = 0; start < size; start += chunk) {
				final int s = start;
				final int e = Math.min(size, start + chunk);
				futures.add(workers.submit(new Callable<Void>() {
					public Void call() {
						task.run(s, e);
						return null;
					}
				}));
			}
			logger.debug("Submitted " + futures.size() + " chunks of " + chunk + " over " + size + " rows");
			for(Future<Void> f : futures) {
				f.get();
			}
		} catch (InterruptedException ie) {
			cancel(futures);
			Thread.currentThread().interrupt();
			throw new CoexpressionException("Interrupted while waiting for worker threads", ie);
		} catch (ExecutionException ee) {
			cancel(futures);
			Throwable cause = ee.getCause();
			if(cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if(cause instanceof Error) {
				throw (Error) cause;
			}
			throw new CoexpressionException("Worker thread failed", cause);
		}
	}

	/**
	 * Stops the worker threads. Later calls to {@link #forEachRange} fail.
	 */
	public synchronized void shutdown() {
		shutdown = true;
		if(pool != null) {
			pool.shutdownNow();
			pool = null;
		}
	}

	public synchronized boolean isShutdown() {
		return shutdown;
	}

	/**
	 * @return true once a thread pool has been started and not yet shut down
	 */
	public synchronized boolean hasPool() {
		return pool != null;
	}

	private synchronized ExecutorService pool() {
		if(pool == null) {
			final AtomicInteger count = new AtomicInteger();
			pool = Executors.newFixedThreadPool(numThreads, new ThreadFactory() {
				public Thread newThread(Runnable r) {
					Thread t = new Thread(r, "BlockExecutor-" + count.incrementAndGet());
					t.setDaemon(true);
					return t;
				}
			});
			logger.debug("Started " + numThreads + " worker threads");
		}
		return pool;
	}

	private static void cancel(List<Future<Void>> futures) {
		for(Future<Void> f : futures) {
			f.cancel(true);
		}
	}
}
