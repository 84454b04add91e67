package com.elphel.spatialstats.common;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

public class MultiThreading {
	public static final int THREADS_MAX = 100;
	/* Create a Thread[] array as large as the number of processors available, but not more than maxCPUs.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray() {
		return newThreadArray (THREADS_MAX);
	}
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		if (n_cpus < 1) n_cpus = 1;
		return new Thread[n_cpus];
	}
/* Start all given threads and wait on each of them until all are done.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	/**
	 * Run task for every index 0..num_tasks-1, distributing indices between threads with a shared counter.
	 * Runs in the caller thread when only one thread is allowed or there is a single task.
	 * A failure (exception or error) in any worker stops the others and is rethrown in the caller thread
	 * after all workers are joined.
	 * @param num_tasks number of independent tasks
	 * @param threadsMax maximal number of threads to use
	 * @param task consumer of the task index, must be safe to call concurrently for different indices
	 */
	public static void runTasks(
			final int         num_tasks,
			final int         threadsMax,
			final IntConsumer task) {
		if ((threadsMax <= 1) || (num_tasks <= 1)) {
			for (int i = 0; i < num_tasks; i++) {
				task.accept(i);
			}
			return;
		}
		final Thread[] threads = newThreadArray(Math.min(threadsMax, num_tasks));
		final AtomicInteger ai = new AtomicInteger(0);
		final Throwable [] failure = new Throwable[1];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				@Override
				public void run() {
					try {
						for (int nTask = ai.getAndIncrement(); nTask < num_tasks; nTask = ai.getAndIncrement()) {
							task.accept(nTask);
						}
					} catch (Throwable e) { // including Errors
						synchronized (failure) {
							if (failure[0] == null) failure[0] = e;
						}
						ai.set(num_tasks); // stop other threads
					}
				}
			};
		}
		startAndJoin(threads);
		Throwable e = failure[0];
		if (e instanceof RuntimeException) throw (RuntimeException) e;
		if (e instanceof Error)            throw (Error) e;
		if (e != null)                     throw new RuntimeException(e); // sneaky checked exception
	}
}
