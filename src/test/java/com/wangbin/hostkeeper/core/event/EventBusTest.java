package com.wangbin.hostkeeper.core.event;

import com.wangbin.hostkeeper.common.enums.Criticality;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @AfterEach
    void tearDown() {
        if (eventBus != null) {
            eventBus.stop();
        }
    }

    @Test
    void deliversEventsInPublicationOrder() throws InterruptedException {
        eventBus = new EventBus(100, OverflowStrategy.BLOCK);
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(50);
        eventBus.subscribe(KeeperEvent.UpdateReceived.class, event -> {
            received.add(event.hostId());
            latch.countDown();
        });
        eventBus.start();

        for (int i = 0; i < 50; i++) {
            eventBus.publish(new KeeperEvent.UpdateReceived("h" + i));
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < 50; i++) {
            assertEquals("h" + i, received.get(i));
        }
    }

    @Test
    void typedSubscribersOnlySeeTheirEvents() throws InterruptedException {
        eventBus = new EventBus(100, OverflowStrategy.BLOCK);
        List<KeeperEvent> all = new CopyOnWriteArrayList<>();
        List<KeeperEvent.ErrorReceived> errors = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        eventBus.subscribe(KeeperEvent.ErrorReceived.class, errors::add);
        eventBus.subscribeAll(event -> {
            all.add(event);
            latch.countDown();
        });
        eventBus.start();

        eventBus.publish(new KeeperEvent.HostInitialized("h1"));
        eventBus.publish(new KeeperEvent.ErrorReceived("h1", Criticality.CRITICAL, "boom"));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(2, all.size());
        assertEquals(1, errors.size());
        assertEquals(Criticality.CRITICAL, errors.get(0).criticality());
    }

    @Test
    void failingSubscriberDoesNotStopDelivery() throws InterruptedException {
        eventBus = new EventBus(100, OverflowStrategy.BLOCK);
        CountDownLatch latch = new CountDownLatch(2);
        eventBus.subscribe(KeeperEvent.UpdateReceived.class, event -> {
            throw new IllegalStateException("listener failure");
        });
        eventBus.subscribe(KeeperEvent.UpdateReceived.class, event -> latch.countDown());
        eventBus.start();

        eventBus.publish(new KeeperEvent.UpdateReceived("h1"));
        eventBus.publish(new KeeperEvent.UpdateReceived("h2"));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void dropOldestNeverBlocksPublisher() throws InterruptedException {
        eventBus = new EventBus(2, OverflowStrategy.DROP_OLDEST);
        CountDownLatch blocker = new CountDownLatch(1);
        CountDownLatch firstDelivered = new CountDownLatch(1);
        List<String> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(KeeperEvent.UpdateReceived.class, event -> {
            firstDelivered.countDown();
            try {
                blocker.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            received.add(event.hostId());
        });
        eventBus.start();

        eventBus.publish(new KeeperEvent.UpdateReceived("first"));
        assertTrue(firstDelivered.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < 10; i++) {
            eventBus.publish(new KeeperEvent.UpdateReceived("e" + i));
        }

        assertTrue(eventBus.getDroppedCount() >= 8);
        blocker.countDown();
        long deadline = System.currentTimeMillis() + 2000;
        while (received.size() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(List.of("first", "e8", "e9"), received);
    }

    @Test
    void dropLatestDiscardsNewEvents() throws InterruptedException {
        eventBus = new EventBus(1, OverflowStrategy.DROP_LATEST);
        CountDownLatch blocker = new CountDownLatch(1);
        CountDownLatch firstDelivered = new CountDownLatch(1);
        eventBus.subscribe(KeeperEvent.UpdateReceived.class, event -> {
            firstDelivered.countDown();
            try {
                blocker.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        eventBus.start();

        eventBus.publish(new KeeperEvent.UpdateReceived("first"));
        assertTrue(firstDelivered.await(2, TimeUnit.SECONDS));
        eventBus.publish(new KeeperEvent.UpdateReceived("queued"));
        eventBus.publish(new KeeperEvent.UpdateReceived("dropped"));

        assertEquals(1, eventBus.getDroppedCount());
        blocker.countDown();
    }

    @Test
    void publishBeforeStartIsIgnored() {
        eventBus = new EventBus(10, OverflowStrategy.BLOCK);
        eventBus.publish(new KeeperEvent.UpdateReceived("h1"));
        assertEquals(0, eventBus.getPendingCount());
        assertFalse(eventBus.isRunning());
    }

    @Test
    void overflowStrategyParsesLeniently() {
        assertEquals(OverflowStrategy.DROP_OLDEST, OverflowStrategy.from(" drop_oldest "));
        assertEquals(OverflowStrategy.BLOCK, OverflowStrategy.from("unknown"));
        assertEquals(OverflowStrategy.BLOCK, OverflowStrategy.from(null));
    }
}
