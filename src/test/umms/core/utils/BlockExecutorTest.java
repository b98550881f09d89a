package umms.core.utils;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import umms.core.exception.CoexpressionException;

public class BlockExecutorTest {

	@Test(dataProvider = "sizes")
	public void testEveryIndexVisitedOnce(final int threads, final int size) {
		final int[] visits = new int[size];
		new BlockExecutor(threads).forEachRange(size, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				for(int i = start; i < end; i++) {
					visits[i]++;
				}
			}
		});
		for(int i = 0; i < size; i++) {
			Assert.assertEquals(visits[i], 1, "index " + i);
		}
	}

	@DataProvider(name = "sizes")
	public Object[][] sizes() {
		return new Object[][] {
			new Object[] {1, 17},
			new Object[] {4, 1},
			new Object[] {4, 3},
			new Object[] {4, 1001},
			new Object[] {3, 0},
		};
	}

	@Test
	public void testRuntimeExceptionKeepsItsType() {
		final AtomicInteger calls = new AtomicInteger();
		try {
			new BlockExecutor(2).forEachRange(100, new BlockExecutor.RangeTask() {
				public void run(int start, int end) {
					calls.incrementAndGet();
					if(start == 0) {
						throw new IllegalStateException("chunk failed");
					}
				}
			});
			Assert.fail("Expected the chunk failure to propagate");
		} catch (IllegalStateException e) {
			Assert.assertEquals(e.getMessage(), "chunk failed");
		}
		Assert.assertTrue(calls.get() >= 1);
	}

	@Test(expectedExceptions = CoexpressionException.class)
	public void testCoexpressionExceptionPropagates() {
		new BlockExecutor(3).forEachRange(50, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				throw new CoexpressionException("failed on " + start);
			}
		});
	}

	@Test
	public void testWorkerThreadsAreReusedAcrossCalls() {
		final Set<String> threads = Collections.synchronizedSet(new HashSet<String>());
		BlockExecutor executor = new BlockExecutor(3);
		Assert.assertFalse(executor.hasPool());
		for(int call = 0; call < 5; call++) {
			executor.forEachRange(200, new BlockExecutor.RangeTask() {
				public void run(int start, int end) {
					threads.add(Thread.currentThread().getName());
				}
			});
		}
		Assert.assertTrue(executor.hasPool());
		Assert.assertTrue(threads.size() <= 3, threads.toString());
		executor.shutdown();
		Assert.assertFalse(executor.hasPool());
		Assert.assertTrue(executor.isShutdown());
	}

	@Test
	public void testPoolSurvivesFailedCall() {
		BlockExecutor executor = new BlockExecutor(2);
		try {
			executor.forEachRange(10, new BlockExecutor.RangeTask() {
				public void run(int start, int end) {
					throw new IllegalStateException("chunk failed");
				}
			});
			Assert.fail("Expected the chunk failure to propagate");
		} catch (IllegalStateException e) {
			Assert.assertEquals(e.getMessage(), "chunk failed");
		}
		final AtomicInteger visited = new AtomicInteger();
		executor.forEachRange(10, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
				visited.addAndGet(end - start);
			}
		});
		Assert.assertEquals(visited.get(), 10);
		executor.shutdown();
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void testRejectsWorkAfterShutdown() {
		BlockExecutor executor = new BlockExecutor(2);
		executor.forEachRange(4, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
			}
		});
		executor.shutdown();
		executor.forEachRange(4, new BlockExecutor.RangeTask() {
			public void run(int start, int end) {
			}
		});
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testRejectsNoThreads() {
		new BlockExecutor(0);
	}
}
