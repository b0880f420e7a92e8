package org.stress;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class WorkpoolTest {

    private static List<Integer> range(int fromInclusive, int toInclusive) {
        return IntStream.rangeClosed(fromInclusive, toInclusive).boxed().collect(Collectors.toList());
    }

    private static void waitFor(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(5);
        }
    }

    @Nested
    class Construction {
        @ParameterizedTest
        @ValueSource(ints = {1, 2, 4, 8, 16})
        void everyWorkerCompletesSetupBeforeConstructorReturns(int workers) throws Exception {
            AtomicInteger setups = new AtomicInteger();
            Workpool<Object, Integer> pool = new Workpool<>(workers, () -> {
                setups.incrementAndGet();
                return new Object();
            }, (s, job) -> {}, s -> {}, false, null);

            assertEquals(workers, setups.get());
            assertEquals(workers, pool.workerCount());
            assertEquals(workers, pool.liveWorkers());
            pool.close();
            assertEquals(0, pool.liveWorkers());
        }

        @Test
        void zeroWorkers_IAE() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Workpool<Object, Integer>(0, Object::new, (s, job) -> {}, s -> {}, false, null));
        }

        @Test
        void zeroQueueCapacity_IAE() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Workpool<Object, Integer>(1, Object::new, (s, job) -> {}, s -> {}, false, 0));
        }

        @Test
        void setupFailureReportsExpectedAndStarted() {
            AtomicInteger setups = new AtomicInteger();
            AtomicInteger teardowns = new AtomicInteger();

            WorkpoolException e = assertThrows(WorkpoolException.class, () -> new Workpool<Integer, Integer>(4, () -> {
                int n = setups.incrementAndGet();
                if (n == 3) {
                    throw new IOException("no connection");
                }
                return n;
            }, (s, job) -> {}, s -> teardowns.incrementAndGet(), false, null));

            assertEquals(4, e.getExpected());
            assertEquals(3, e.getStarted());
            assertEquals("couldn't start all threads. expected 4 but started 3", e.getMessage());
            assertInstanceOf(IOException.class, e.getCause());
            // the workers that did start are stopped again
            assertEquals(3, teardowns.get());
        }

        @Test
        void everySetupFailingReportsZeroStarted() {
            WorkpoolException e = assertThrows(WorkpoolException.class, () -> new Workpool<Object, Integer>(3, () -> {
                throw new IllegalStateException("down");
            }, (s, job) -> {}, s -> {}, true, 2));

            assertEquals(3, e.getExpected());
            assertEquals(0, e.getStarted());
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertEquals(2, e.getSuppressed().length);
        }

        @Test
        void interruptDuringStartupStopsWorkersAndRestoresFlag() throws Exception {
            CountDownLatch entered = new CountDownLatch(2);
            CountDownLatch never = new CountDownLatch(1);
            AtomicInteger setupExits = new AtomicInteger();
            AtomicReference<WorkpoolException> thrown = new AtomicReference<>();
            AtomicBoolean interruptedAfter = new AtomicBoolean();
            Thread builder = new Thread(() -> {
                try {
                    new Workpool<Object, Integer>(2, () -> {
                        entered.countDown();
                        try {
                            never.await();
                            return new Object();
                        } finally {
                            setupExits.incrementAndGet();
                        }
                    }, (s, job) -> {}, s -> {}, false, 1);
                } catch (WorkpoolException e) {
                    thrown.set(e);
                    interruptedAfter.set(Thread.currentThread().isInterrupted());
                }
            }, "builder");

            builder.start();
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            waitFor(() -> builder.getState() == Thread.State.WAITING, "the constructor to wait for startup");
            builder.interrupt();
            builder.join(10_000);

            assertFalse(builder.isAlive());
            WorkpoolException e = thrown.get();
            assertNotNull(e);
            assertEquals(2, e.getExpected());
            assertEquals(0, e.getStarted());
            assertInstanceOf(InterruptedException.class, e.getCause());
            assertTrue(interruptedAfter.get());
            // both workers left setup before the constructor returned
            assertEquals(2, setupExits.get());
        }

        @Test
        void iteratorPoolFailureStartsNoWorkers() {
            AtomicInteger setups = new AtomicInteger();

            // above the fork/join parallelism limit
            assertThrows(IllegalArgumentException.class, () -> new Workpool<Object, Integer>(40_000, () -> {
                setups.incrementAndGet();
                return new Object();
            }, (s, job) -> {}, s -> {}, true, null));

            assertEquals(0, setups.get());
        }

        @Test
        void defaultThreadsIsTwicePerProcessor() throws Exception {
            Workpool<Object, Integer> pool = Workpool.newDefaultThreads(Object::new, (s, job) -> {}, s -> {}, false, null);

            assertEquals(Math.max(1, Runtime.getRuntime().availableProcessors() * 2), pool.workerCount());
            pool.close();
        }
    }

    @Nested
    class Submission {
        @Test
        void everyJobProcessedExactlyOnce() throws Exception {
            ConcurrentHashMap<Integer, Integer> counts = new ConcurrentHashMap<>();
            Workpool<Object, Integer> pool = new Workpool<>(8, Object::new,
                    (s, job) -> counts.merge(job, 1, Integer::sum), s -> {}, false, null);

            for (int i = 0; i < 10_000; i++) {
                pool.execute(i);
            }
            pool.close();

            assertEquals(10_000, counts.size());
            assertTrue(counts.values().stream().allMatch(c -> c == 1), "some job ran more than once");
        }

        @Test
        void bulkSubmitUnionOfAccumulatorsIsComplete() throws Exception {
            List<Integer> union = Collections.synchronizedList(new ArrayList<>());
            Workpool<List<Integer>, Integer> pool = new Workpool<>(4, ArrayList::new, List::add, union::addAll, true, null);

            pool.executeAndFinishIter(range(1, 100));

            List<Integer> sorted = new ArrayList<>(union);
            Collections.sort(sorted);
            assertEquals(range(1, 100), sorted);
            assertEquals(0, pool.liveWorkers());
        }

        @Test
        void bulkSubmitWithoutIteratorPoolKeepsSubmissionOrderOnOneWorker() throws Exception {
            List<Integer> seen = new ArrayList<>();
            Workpool<List<Integer>, Integer> pool = new Workpool<>(1, ArrayList::new, List::add, seen::addAll, false, 4);

            pool.executeAndFinishIter(range(1, 50));

            assertEquals(range(1, 50), seen);
        }

        @Test
        void boundedQueueBlocksSubmitterUntilRoomFrees() throws Exception {
            CountDownLatch processing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
            Workpool<Object, Integer> pool = new Workpool<>(1, Object::new, (s, job) -> {
                processing.countDown();
                release.await();
                seen.add(job);
            }, s -> {}, false, 1);

            pool.execute(1);
            assertTrue(processing.await(5, TimeUnit.SECONDS));
            // the worker holds job 1, job 2 fills the only slot
            pool.execute(2);

            ExecutorService submitter = Executors.newSingleThreadExecutor();
            Future<?> third = submitter.submit(() -> pool.execute(3));
            Thread.sleep(200);
            assertFalse(third.isDone(), "submitter should be blocked on a full queue");

            release.countDown();
            third.get(5, TimeUnit.SECONDS);
            pool.close();
            submitter.shutdownNow();

            assertEquals(Arrays.asList(1, 2, 3), seen);
        }

        @Test
        void blockedSubmittersAreAdmittedInArrivalOrder() throws Exception {
            CountDownLatch processing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
            Workpool<Object, Integer> pool = new Workpool<>(1, Object::new, (s, job) -> {
                processing.countDown();
                release.await();
                seen.add(job);
            }, s -> {}, false, 1);

            pool.execute(1);
            assertTrue(processing.await(5, TimeUnit.SECONDS));
            pool.execute(2);

            Thread first = new Thread(() -> pool.execute(3), "submitter-3");
            first.start();
            waitFor(() -> first.getState() == Thread.State.TIMED_WAITING, "submitter 3 to wait for room");
            Thread second = new Thread(() -> pool.execute(4), "submitter-4");
            second.start();
            waitFor(() -> second.getState() == Thread.State.WAITING, "submitter 4 to queue behind submitter 3");
            // let submitter 3 go through several liveness polls
            Thread.sleep(200);

            release.countDown();
            first.join(5_000);
            second.join(5_000);
            pool.close();

            assertEquals(Arrays.asList(1, 2, 3, 4), seen);
        }

        @Test
        void interruptedSubmitterGetsIseWithFlagRestored() throws Exception {
            CountDownLatch processing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
            Workpool<Object, Integer> pool = new Workpool<>(1, Object::new, (s, job) -> {
                processing.countDown();
                release.await();
                seen.add(job);
            }, s -> {}, false, 1);
            pool.execute(1);
            assertTrue(processing.await(5, TimeUnit.SECONDS));
            pool.execute(2);

            AtomicReference<IllegalStateException> thrown = new AtomicReference<>();
            AtomicBoolean interruptedAfter = new AtomicBoolean();
            Thread submitter = new Thread(() -> {
                try {
                    pool.execute(3);
                } catch (IllegalStateException e) {
                    thrown.set(e);
                    interruptedAfter.set(Thread.currentThread().isInterrupted());
                }
            }, "submitter-3");
            submitter.start();
            waitFor(() -> submitter.getState() == Thread.State.TIMED_WAITING, "submitter to wait for room");
            submitter.interrupt();
            submitter.join(5_000);

            assertNotNull(thrown.get());
            assertInstanceOf(InterruptedException.class, thrown.get().getCause());
            assertTrue(interruptedAfter.get());

            release.countDown();
            pool.close();
            assertEquals(Arrays.asList(1, 2), seen);
        }

        @Test
        void executeIterAfterClose_ISE() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {}, s -> {}, true, null);
            pool.close();

            assertThrows(IllegalStateException.class, () -> pool.executeIter(range(1, 3)));
        }

        @Test
        void nullJob_NPE() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(1, Object::new, (s, job) -> {}, s -> {}, false, null);

            assertThrows(NullPointerException.class, () -> pool.execute(null));
            pool.close();
        }

        @Test
        void executeAfterClose_ISE() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {}, s -> {}, false, null);
            pool.close();

            assertThrows(IllegalStateException.class, () -> pool.execute(1));
        }

        @Test
        void workerStateIsPrivateToItsThread() throws Exception {
            ConcurrentHashMap<Object, Set<String>> threadsPerState = new ConcurrentHashMap<>();
            Workpool<Object, Integer> pool = new Workpool<>(4, Object::new, (s, job) ->
                    threadsPerState.computeIfAbsent(s, k -> ConcurrentHashMap.newKeySet()).add(Thread.currentThread().getName()),
                    s -> {}, true, 16);

            pool.executeAndFinishIter(range(1, 2_000));

            assertTrue(threadsPerState.size() <= 4);
            threadsPerState.values().forEach(threads -> assertEquals(1, threads.size()));
        }
    }

    @Nested
    class Faults {
        @Test
        void faultedJobIsNotRedeliveredAndOtherWorkersCarryOn() throws Exception {
            AtomicInteger poisonAttempts = new AtomicInteger();
            Queue<Integer> processed = new ConcurrentLinkedQueue<>();
            ConcurrentHashMap<String, Queue<Integer>> byThread = new ConcurrentHashMap<>();
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {
                if (job < 0) {
                    poisonAttempts.incrementAndGet();
                    throw new IllegalStateException("poison " + job);
                }
                processed.add(job);
                byThread.computeIfAbsent(Thread.currentThread().getName(), k -> new ConcurrentLinkedQueue<>()).add(job);
            }, s -> {}, false, null);

            pool.execute(-1);
            waitFor(() -> pool.liveWorkers() == 1, "the poisoned worker to exit");
            for (int job : range(1, 50)) {
                pool.execute(job);
            }

            WorkerFaultException e = assertThrows(WorkerFaultException.class, pool::close);

            assertEquals(1, poisonAttempts.get());
            List<Integer> sorted = new ArrayList<>(processed);
            Collections.sort(sorted);
            assertEquals(range(1, 50), sorted);
            assertEquals(1, e.getFaultedWorkers().size());
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertFalse(byThread.containsKey("worker-" + e.getFaultedWorkers().get(0)));
        }

        @Test
        void faultsStaySilentUntilShutdown() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {
                if (job == 0) throw new RuntimeException("boom");
            }, s -> {}, false, null);

            pool.execute(0);
            waitFor(() -> pool.liveWorkers() == 1, "the faulted worker to exit");
            // still accepted: one worker is alive
            pool.execute(1);

            assertThrows(WorkerFaultException.class, pool::close);
        }

        @Test
        void shutdownWithSomeWorkersDeadTerminatesAndReportsEachFault() throws Exception {
            Workpool<Object, String> pool = new Workpool<>(3, Object::new, (s, job) -> {
                if (job.startsWith("boom")) throw new RuntimeException(job);
            }, s -> {}, false, null);

            pool.execute("boom-1");
            waitFor(() -> pool.liveWorkers() == 2, "first worker to fault");
            pool.execute("boom-2");
            waitFor(() -> pool.liveWorkers() == 1, "second worker to fault");
            pool.execute("fine");

            WorkerFaultException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(WorkerFaultException.class, pool::close));

            assertEquals(2, e.getFaultedWorkers().size());
            assertEquals(1, e.getSuppressed().length);
            assertEquals(0, pool.liveWorkers());
        }

        @Test
        void shutdownOnBoundedQueueWithAllWorkersDeadDoesNotHang() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {
                throw new RuntimeException("boom " + job);
            }, s -> {}, false, 1);

            pool.execute(1);
            waitFor(() -> pool.liveWorkers() == 1, "first worker to fault");
            pool.execute(2);
            waitFor(() -> pool.liveWorkers() == 0, "second worker to fault");

            assertThrows(IllegalStateException.class, () -> pool.execute(3));
            WorkerFaultException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(WorkerFaultException.class, pool::close));
            assertEquals(2, e.getFaultedWorkers().size());
        }

        @Test
        void teardownFaultSurfacesAtShutdown() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {}, s -> {
                throw new IOException("close failed");
            }, false, null);

            WorkerFaultException e = assertThrows(WorkerFaultException.class, pool::close);

            assertInstanceOf(IOException.class, e.getCause());
            assertEquals(Arrays.asList(0, 1), e.getFaultedWorkers());
        }

        @Test
        void closeIsIdempotent() throws Exception {
            Workpool<Object, Integer> pool = new Workpool<>(2, Object::new, (s, job) -> {}, s -> {
                throw new IOException("close failed");
            }, false, null);

            assertThrows(WorkerFaultException.class, pool::close);
            assertDoesNotThrow(pool::close);
        }
    }

    @Nested
    class Cloning {
        @Test
        void clonedPoolOutlivesTheOriginal() throws Exception {
            AtomicInteger setups = new AtomicInteger();
            AtomicInteger processed = new AtomicInteger();
            Workpool<Object, Integer> original = new Workpool<>(3, () -> {
                setups.incrementAndGet();
                return new Object();
            }, (s, job) -> processed.incrementAndGet(), s -> {}, true, 4);

            Workpool<Object, Integer> copy = original.clonePool();
            assertEquals(6, setups.get());
            assertEquals(3, copy.workerCount());

            original.close();
            assertEquals(0, original.liveWorkers());
            assertEquals(3, copy.liveWorkers());

            copy.executeAndFinishIter(range(1, 10));
            assertEquals(10, processed.get());
        }
    }
}
