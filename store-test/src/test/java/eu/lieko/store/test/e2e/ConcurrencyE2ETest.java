package eu.lieko.store.test.e2e;

import eu.lieko.store.CollectionRef;
import eu.lieko.store.StoreContext;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.record.DataRecord;
import eu.lieko.store.test.containers.BackendContainer;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static eu.lieko.store.test.e2e.BackendTestContext.fields;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * E2E concurrent writers against ALL backends: writes to one collection never lose updates
 * and collection deletion never leaves the registry out of step with storage.
 */
public class ConcurrencyE2ETest extends E2ETestBase {

    private static final int THREADS = 8;
    private static final int ITERATIONS = 25;

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_concurrent_increments_are_not_lost(BackendTestContext btc) throws Exception {
        btc.set("counters", "c1", "value", 0);

        runConcurrently(() -> {
            for (int i = 0; i < ITERATIONS; i++) {
                btc.getStore().increment(btc.getWrite(), "counters", "c1", "value", 1);
            }
            return null;
        });

        DataRecord counter = btc.getStore().get(btc.getRead(), "counters", "c1");
        assertThat(counter.get("value")).isEqualTo((long) (THREADS * ITERATIONS));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_concurrent_inserts_into_new_collection(BackendTestContext btc) throws Exception {
        List<Integer> workers = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            workers.add(i);
        }

        runIndexed(workers, worker -> {
            for (int i = 0; i < ITERATIONS; i++) {
                btc.getStore().insert(btc.getWrite(), "events", fields("id", "w" + worker + "-" + i, "worker", worker));
            }
        });

        assertThat(btc.getStore().size(btc.getRead(), "events")).isEqualTo(THREADS * ITERATIONS);
        assertThat(btc.getStore().listCollections(btc.getRead())).extracting("name").containsExactly("events");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_collection_deletion_racing_writers_keeps_registry_consistent(BackendTestContext btc) throws Exception {
        List<String> names = List.of("c0", "c1", "c2", "c3");
        List<Integer> workers = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            workers.add(i);
        }

        runIndexed(workers, worker -> {
            for (int i = 0; i < ITERATIONS; i++) {
                if (worker < 2) {
                    btc.getStore().deleteCollections(btc.getFull(), names);
                } else {
                    String collection = names.get((worker + i) % names.size());
                    btc.getStore().set(btc.getWrite(), collection, "w" + worker + "-" + i, fields("worker", worker));
                }
            }
        });

        StoreContext context = btc.getStore().getContext();
        List<String> registered = btc.getStore().listCollections(btc.getRead()).stream()
            .map(CollectionInfo::getName)
            .collect(Collectors.toList());
        for (String name : names) {
            CollectionRef ref = CollectionRef.of(BackendContainer.PROJECT_ID, name);
            boolean inMetadata = registered.contains(name);

            assertThat(context.getStorage().exists(ref)).as("container of %s", name).isEqualTo(inMetadata);
            assertThat(context.getRegistry().isCached(ref)).as("cache entry of %s", name).isEqualTo(inMetadata);
            assertThat(btc.getStore().hasCollection(btc.getNone(), name)).isEqualTo(inMetadata);
        }

        // every collection keeps accepting writes once the race is over
        for (String name : names) {
            btc.getStore().set(btc.getWrite(), name, "last", fields("final", true));
            assertThat(btc.getStore().keys(btc.getRead(), name)).contains("last");
        }
        assertThat(btc.getStore().listCollections(btc.getRead())).extracting("name").containsExactlyInAnyOrderElementsOf(names);
    }

    private static void runConcurrently(Callable<Void> task) throws Exception {
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(task);
        }
        run(tasks);
    }

    private static void runIndexed(List<Integer> workers, WorkerTask task) throws Exception {
        List<Callable<Void>> tasks = new ArrayList<>();
        for (Integer worker : workers) {
            tasks.add(() -> {
                task.run(worker);
                return null;
            });
        }
        run(tasks);
    }

    private static void run(List<Callable<Void>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (Callable<Void> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private interface WorkerTask {
        void run(int worker);
    }
}
