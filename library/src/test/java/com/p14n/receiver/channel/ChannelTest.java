package com.p14n.receiver.channel;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.InOrder;

import com.p14n.receiver.data.ConfigData;
import com.p14n.receiver.disposal.Disposable;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChannelTest {

    @SuppressWarnings("unchecked")
    private static Consumer<Integer> mockHandler() {
        return mock(Consumer.class);
    }

    @Test
    void shouldDeliverToOneListener() {
        ChannelPair<Integer> pair = Channels.make();
        Consumer<Integer> handler = mockHandler();

        pair.channel().listen(handler);
        pair.emitter().broadcast(1);

        verify(handler).accept(1);
        verifyNoMoreInteractions(handler);
    }

    @Test
    void shouldDeliverToMultipleListenersExactlyOnce() {
        ChannelPair<Integer> pair = Channels.make();
        Consumer<Integer> first = mockHandler();
        Consumer<Integer> second = mockHandler();

        pair.channel().listen(first);
        pair.emitter().broadcast(1);
        pair.channel().listen(second);
        pair.emitter().broadcast(2);

        verify(first).accept(1);
        verify(first).accept(2);
        verify(second, never()).accept(1);
        verify(second).accept(2);
        verifyNoMoreInteractions(first, second);
    }

    @Test
    void noBufferingDropsValuesBroadcastBeforeListening() {
        ChannelPair<Integer> pair = Channels.make(Strategy.noBuffering());
        pair.emitter().broadcastAll(List.of(1, 2, 3));

        Consumer<Integer> handler = mockHandler();
        pair.channel().listen(handler);

        verifyNoInteractions(handler);
        assertEquals(0, pair.channel().bufferedCount());
    }

    @Test
    void boundedReplayOfZeroReplaysNothing() {
        ChannelPair<Integer> pair = Channels.make(Strategy.boundedReplay(0));
        pair.emitter().broadcastAll(List.of(1, 2, 3));

        List<Integer> received = new ArrayList<>();
        pair.channel().listen(received::add);
        pair.emitter().broadcast(4);

        assertEquals(List.of(4), received);
    }

    @Test
    void boundedReplayReplaysLastValuesThenFollowsLive() {
        ChannelPair<Integer> pair = Channels.make(Strategy.boundedReplay(2));
        pair.emitter().broadcastAll(List.of(1, 2, 3, 4));

        List<Integer> first = new ArrayList<>();
        pair.channel().listen(first::add);
        assertEquals(List.of(3, 4), first);

        pair.emitter().broadcast(5);
        assertEquals(List.of(3, 4, 5), first);

        List<Integer> second = new ArrayList<>();
        pair.channel().listen(second::add);
        assertEquals(List.of(4, 5), second);
    }

    @Test
    void boundedReplayLargerThanHistoryReplaysEverything() {
        ChannelPair<Integer> pair = Channels.make(Strategy.boundedReplay(5));
        pair.emitter().broadcastAll(List.of(1, 2, 3));

        List<Integer> received = new ArrayList<>();
        pair.channel().listen(received::add);

        assertEquals(List.of(1, 2, 3), received);
    }

    @Test
    void unboundedReplayReplaysEverythingInOrder() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        pair.emitter().broadcastAll(List.of(1, 2, 3));

        Consumer<Integer> handler = mockHandler();
        pair.channel().listen(handler);
        pair.emitter().broadcast(4);

        InOrder inOrder = inOrder(handler);
        inOrder.verify(handler).accept(1);
        inOrder.verify(handler).accept(2);
        inOrder.verify(handler).accept(3);
        inOrder.verify(handler).accept(4);
        verifyNoMoreInteractions(handler);
    }

    @Test
    void replayGoesOnlyToTheNewListener() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        pair.emitter().broadcast(1);

        List<Integer> early = new ArrayList<>();
        pair.channel().listen(early::add);
        pair.channel().listen(value -> {
        });

        assertEquals(List.of(1), early);
    }

    @Test
    void disposeStopsDelivery() {
        ChannelPair<Integer> pair = Channels.make();
        Consumer<Integer> handler = mockHandler();

        Disposable subscription = pair.channel().listen(handler);
        subscription.dispose();
        pair.emitter().broadcast(1);

        verifyNoInteractions(handler);
        assertTrue(subscription.isDisposed());
        assertEquals(0, pair.channel().listenerCount());
    }

    @Test
    void disposeTwiceIsTheSameAsOnce() {
        ChannelPair<Integer> pair = Channels.make();
        Disposable subscription = pair.channel().listen(value -> {
        });
        Consumer<Integer> other = mockHandler();
        pair.channel().listen(other);

        subscription.dispose();
        subscription.dispose();
        pair.emitter().broadcast(1);

        assertEquals(1, pair.channel().listenerCount());
        verify(other).accept(1);
    }

    @Test
    void disposingOneListenerLeavesNewOnesWorking() {
        ChannelPair<Integer> pair = Channels.make();
        AtomicInteger value = new AtomicInteger();

        Disposable first = pair.channel().listen(v -> value.set(1));
        first.dispose();
        pair.emitter().broadcast(1);
        assertEquals(0, value.get());

        pair.channel().listen(v -> value.set(2));
        pair.emitter().broadcast(1);
        assertEquals(2, value.get());
    }

    @Test
    void listenerAddedInsideHandlerStartsWithTheNextBroadcast() {
        ChannelPair<Integer> pair = Channels.make();
        Channel<Integer> channel = pair.channel();
        AtomicInteger outerCalled = new AtomicInteger();
        AtomicInteger innerCalled = new AtomicInteger();

        channel.listen(value -> {
            outerCalled.incrementAndGet();
            channel.listen(inner -> innerCalled.incrementAndGet());
        });

        pair.emitter().broadcast(1);
        assertEquals(1, outerCalled.get());
        assertEquals(0, innerCalled.get());

        pair.emitter().broadcast(2);
        assertEquals(2, outerCalled.get());
        assertEquals(1, innerCalled.get());

        pair.emitter().broadcast(3);
        assertEquals(3, outerCalled.get());
        assertEquals(3, innerCalled.get());
    }

    @Test
    void listenerAddedInsideHandlerOfAnotherChannel() {
        ChannelPair<Integer> outer = Channels.make();
        ChannelPair<Integer> inner = Channels.make();
        AtomicInteger outerCalled = new AtomicInteger();
        AtomicInteger innerCalled = new AtomicInteger();

        outer.channel().listen(value -> {
            outerCalled.incrementAndGet();
            inner.channel().listen(v -> innerCalled.incrementAndGet());
        });

        outer.emitter().broadcast(1);
        assertEquals(1, outerCalled.get());
        assertEquals(0, innerCalled.get());

        inner.emitter().broadcast(10);
        assertEquals(1, innerCalled.get());

        outer.emitter().broadcast(2);
        assertEquals(2, outerCalled.get());

        inner.emitter().broadcast(20);
        assertEquals(3, innerCalled.get());
    }

    @Test
    void listenerAddedInsideHandlerReplaysTheValueBeingDelivered() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        Channel<Integer> channel = pair.channel();
        List<Integer> late = new ArrayList<>();
        AtomicReference<Disposable> lateSubscription = new AtomicReference<>();

        channel.listen(value -> {
            if (value == 2 && lateSubscription.get() == null) {
                lateSubscription.set(channel.listen(late::add));
            }
        });

        pair.emitter().broadcastAll(List.of(1, 2, 3));

        // 2 arrives through replay only, never twice
        assertEquals(List.of(1, 2, 3), late);
    }

    @Test
    void broadcastFromReplayedValueArrivesAfterTheReplay() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        pair.emitter().broadcastAll(List.of(1, 2));
        List<Integer> received = new ArrayList<>();
        List<Integer> other = new ArrayList<>();
        pair.channel().listen(other::add);

        pair.channel().listen(value -> {
            received.add(value);
            if (value == 1) {
                pair.emitter().broadcast(99);
            }
        });
        pair.emitter().broadcast(3);

        assertEquals(List.of(1, 2, 99, 3), received);
        assertEquals(List.of(1, 2, 99, 3), other);
    }

    @Test
    void chainedBroadcastsDuringReplayKeepTheirOrder() {
        ChannelPair<Integer> pair = Channels.make(Strategy.boundedReplay(1));
        pair.emitter().broadcast(1);
        List<Integer> received = new ArrayList<>();

        pair.channel().listen(value -> {
            received.add(value);
            if (value < 4) {
                pair.emitter().broadcast(value + 1);
            }
        });

        assertEquals(List.of(1, 2, 3, 4), received);
        assertEquals(1, pair.channel().bufferedCount());
    }

    @Test
    void nestedBroadcastRunsInline() {
        ChannelPair<Integer> pair = Channels.make();
        List<Integer> received = new ArrayList<>();

        pair.channel().listen(value -> {
            received.add(value);
            if (value < 3) {
                pair.emitter().broadcast(value + 1);
            }
        });

        pair.emitter().broadcast(1);

        assertEquals(List.of(1, 2, 3), received);
    }

    @Test
    void handlerCanDisposeItselfDuringDelivery() {
        ChannelPair<Integer> pair = Channels.make();
        AtomicReference<Disposable> self = new AtomicReference<>();
        AtomicInteger calls = new AtomicInteger();
        Consumer<Integer> other = mockHandler();

        self.set(pair.channel().listen(value -> {
            calls.incrementAndGet();
            self.get().dispose();
        }));
        pair.channel().listen(other);

        pair.emitter().broadcast(1);
        pair.emitter().broadcast(2);

        assertEquals(1, calls.get());
        verify(other).accept(1);
        verify(other).accept(2);
    }

    @Test
    void handlerCanDisposeAnotherListenerOfTheSameSnapshot() {
        ChannelPair<Integer> pair = Channels.make();
        AtomicReference<Disposable> second = new AtomicReference<>();
        List<Integer> secondReceived = new ArrayList<>();

        pair.channel().listen(value -> second.get().dispose());
        second.set(pair.channel().listen(secondReceived::add));

        pair.emitter().broadcast(1);
        pair.emitter().broadcast(2);

        // the in-flight snapshot still reaches it once, never afterwards
        assertTrue(secondReceived.size() <= 1);
        assertFalse(secondReceived.contains(2));
    }

    @Test
    void failingListenerDoesNotStarveOthers() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        Consumer<Integer> healthy = mockHandler();

        pair.channel().listen(value -> {
            throw new IllegalStateException("boom");
        });
        pair.channel().listen(healthy);

        pair.emitter().broadcast(1);
        pair.emitter().broadcast(2);

        verify(healthy).accept(1);
        verify(healthy).accept(2);
    }

    @Test
    void failingListenerDuringReplayStillReceivesLaterValues() {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        pair.emitter().broadcastAll(List.of(1, 2));
        List<Integer> received = new ArrayList<>();

        pair.channel().listen(value -> {
            received.add(value);
            if (value == 1) {
                throw new IllegalStateException("boom");
            }
        });
        pair.emitter().broadcast(3);

        assertEquals(List.of(1, 2, 3), received);
    }

    @Test
    void shouldRejectNullValuesAndHandlers() {
        ChannelPair<Integer> pair = Channels.make();
        assertThrows(NullPointerException.class, () -> pair.emitter().broadcast(null));
        assertThrows(NullPointerException.class, () -> pair.channel().listen(null));
    }

    @Test
    void exposesConfiguration() {
        ChannelPair<String> pair = Channels.make(new ConfigData("prices", Strategy.boundedReplay(3)));

        assertEquals("prices", pair.channel().name());
        assertEquals(Strategy.boundedReplay(3), pair.channel().strategy());
        assertEquals("prices", pair.channel().config().name());
    }

    @Test
    void defaultStrategyIsNoBuffering() {
        ChannelPair<String> pair = Channels.make();
        assertEquals(Strategy.noBuffering(), pair.channel().strategy());
    }

    @Test
    @Timeout(10)
    void subscriptionDoesNotKeepTheChannelAlive() throws InterruptedException {
        List<Disposable> subscriptions = new ArrayList<>();
        WeakReference<Channel<?>> channel = subscribeToUnreachableChannel(subscriptions);

        while (channel.get() != null) {
            System.gc();
            Thread.sleep(10);
        }

        assertDoesNotThrow(subscriptions.get(0)::dispose);
        assertTrue(subscriptions.get(0).isDisposed());
    }

    @Test
    void emitterKeepsTheChannelAlive() throws InterruptedException {
        ChannelPair<Integer> pair = Channels.make();
        List<Integer> received = new ArrayList<>();
        pair.channel().listen(received::add);
        WeakReference<Channel<?>> channel = new WeakReference<>(pair.channel());
        Emitter<Integer> emitter = pair.emitter();
        pair = null;

        for (int i = 0; i < 10; i++) {
            System.gc();
            Thread.sleep(10);
        }

        assertNotNull(channel.get());
        emitter.broadcast(1);
        assertEquals(List.of(1), received);
        Reference.reachabilityFence(emitter);
    }

    private static WeakReference<Channel<?>> subscribeToUnreachableChannel(List<Disposable> subscriptions) {
        ChannelPair<Integer> pair = Channels.make(Strategy.unboundedReplay());
        subscriptions.add(pair.channel().listen(value -> {
        }));
        return new WeakReference<>(pair.channel());
    }
}
