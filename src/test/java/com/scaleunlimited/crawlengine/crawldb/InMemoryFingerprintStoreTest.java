package com.scaleunlimited.crawlengine.crawldb;

import static org.junit.Assert.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.scaleunlimited.crawlengine.pojos.Fingerprint;

public class InMemoryFingerprintStoreTest {

    @Test
    public void testMarkSeen() throws Exception {
        BaseFingerprintStore store = new InMemoryFingerprintStore();
        store.open();

        Fingerprint fp = new Fingerprint("GET http://example.com/");
        assertFalse(store.contains(fp));
        assertTrue(store.markSeen(fp));
        assertFalse(store.markSeen(new Fingerprint("GET http://example.com/")));
        assertTrue(store.contains(fp));
        assertEquals(1, store.size());

        store.close();
        assertEquals(0, store.size());
    }

    @Test
    public void testConcurrentMarkSeen() throws Exception {
        final BaseFingerprintStore store = new InMemoryFingerprintStore();
        store.open();

        final int numThreads = 8;
        final int numKeys = 500;
        final AtomicInteger numNew = new AtomicInteger();
        final CountDownLatch start = new CountDownLatch(1);
        final CountDownLatch done = new CountDownLatch(numThreads);

        for (int i = 0; i < numThreads; i++) {
            Thread t = new Thread(new Runnable() {

                @Override
                public void run() {
                    try {
                        start.await();
                        for (int j = 0; j < numKeys; j++) {
                            if (store.markSeen(new Fingerprint("key-" + j))) {
                                numNew.incrementAndGet();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                }
            });
            t.start();
        }

        start.countDown();
        done.await();

        // Each key is new for exactly one thread.
        assertEquals(numKeys, numNew.get());
        assertEquals(numKeys, store.size());
    }
}
