package kvd.db;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class StoreConcurrencyTest {

    @Test
    public void testConcurrentSetSameKeyLeavesOneWrittenValue() throws InterruptedException {
        Store store = new Store();
        int threadCount = 16;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        Set<String> written = new HashSet<>();

        for (int i = 0; i < threadCount; i++) {
            String value = "value-" + i;
            written.add(value);
            es.submit(() -> {
                try {
                    latch.await();
                    for (int j = 0; j < 100; j++) {
                        store.set("shared", value.getBytes(StandardCharsets.UTF_8));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        latch.countDown();
        es.shutdown();
        assertTrue(es.awaitTermination(10, TimeUnit.SECONDS));

        String result = new String(store.get("shared"), StandardCharsets.UTF_8);
        assertTrue(written.contains(result), "unexpected value " + result);
        assertEquals(1, store.size());
    }

    @Test
    public void testNxHasExactlyOneWinner() throws InterruptedException {
        Store store = new Store(true);
        int threadCount = 8;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        SetOptions nx = SetOptions.of(SetOptions.Condition.NX, SetOptions.ExpiryMode.CLEAR, -1);

        for (int i = 0; i < threadCount; i++) {
            byte[] value = ("v" + i).getBytes(StandardCharsets.UTF_8);
            es.submit(() -> {
                try {
                    latch.await();
                    if (store.set("lock", value, nx).isApplied()) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        latch.countDown();
        es.shutdown();
        assertTrue(es.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
    }

    @Test
    public void testReadersNeverSeeTornValues() throws InterruptedException {
        Store store = new Store();
        byte[] a = new byte[4096];
        byte[] b = new byte[4096];
        Arrays.fill(a, (byte) 'a');
        Arrays.fill(b, (byte) 'b');
        store.set("k", a);

        List<String> failures = new CopyOnWriteArrayList<>();
        ExecutorService es = Executors.newFixedThreadPool(4);
        CountDownLatch latch = new CountDownLatch(1);

        es.submit(() -> {
            try {
                latch.await();
                for (int i = 0; i < 2000; i++) {
                    store.set("k", i % 2 == 0 ? b : a);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int r = 0; r < 3; r++) {
            es.submit(() -> {
                try {
                    latch.await();
                    for (int i = 0; i < 2000; i++) {
                        byte[] seen = store.get("k");
                        byte first = seen[0];
                        for (byte x : seen) {
                            if (x != first) {
                                failures.add("mixed value at read " + i);
                                return;
                            }
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        latch.countDown();
        es.shutdown();
        assertTrue(es.awaitTermination(10, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), failures.toString());
    }
}
