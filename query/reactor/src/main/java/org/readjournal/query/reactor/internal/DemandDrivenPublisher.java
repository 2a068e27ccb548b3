/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.readjournal.query.reactor.internal;

import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Operators;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Publisher} that pulls its elements from a {@link Poller}, only as fast as the subscriber asks for them.
 * <p>
 * At most {@code maxBufferSize} elements are buffered ahead of demand, and a poll never asks for more than the free
 * capacity of the buffer. There's at most one poll in flight. Once the poller reports that it has caught up, the next
 * poll is scheduled after {@code refreshInterval}. All state of a subscription is confined to a single
 * {@link Scheduler.Worker} so that no thread is ever blocked.
 * </p>
 * <p>
 * The publisher supports a single subscriber. Errors from the poller terminate the subscription as-is, they're never retried.
 * </p>
 *
 * @param <T> The type of the elements
 */
public class DemandDrivenPublisher<T> implements Publisher<T> {
    private static final Logger log = LoggerFactory.getLogger(DemandDrivenPublisher.class);

    private final String name;
    private final Poller<T> poller;
    private final int maxBufferSize;
    private final boolean autoAck;
    private final Duration refreshInterval;
    private final Scheduler scheduler;
    private final AtomicBoolean subscribed = new AtomicBoolean();

    public DemandDrivenPublisher(String name, Poller<T> poller, int maxBufferSize, boolean autoAck, Duration refreshInterval, Scheduler scheduler) {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(poller, Poller.class.getSimpleName() + " cannot be null");
        requireNonNull(refreshInterval, "Refresh interval cannot be null");
        requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("Max buffer size must be greater than or equal to 1");
        }
        if (refreshInterval.isZero() || refreshInterval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be greater than 0");
        }
        this.name = name;
        this.poller = poller;
        this.maxBufferSize = maxBufferSize;
        this.autoAck = autoAck;
        this.refreshInterval = refreshInterval;
        this.scheduler = scheduler;
    }

    @Override
    public void subscribe(Subscriber<? super T> subscriber) {
        requireNonNull(subscriber, Subscriber.class.getSimpleName() + " cannot be null");
        if (!subscribed.compareAndSet(false, true)) {
            Operators.error(subscriber, new IllegalStateException(name + " allows only a single subscriber"));
            return;
        }
        log.debug("Starting {}", name);
        PollingSubscription subscription = new PollingSubscription(subscriber, scheduler.createWorker());
        subscriber.onSubscribe(subscription);
        subscription.execute(subscription::drain);
    }

    enum State {
        IDLE, POLLING, AWAITING_SUBSCRIBER_DEMAND, AWAITING_REFRESH, COMPLETED, FAILED, CANCELLED;

        boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    private class PollingSubscription implements Subscription {
        private final Subscriber<? super T> subscriber;
        private final Scheduler.Worker worker;
        private final Deque<T> buffer = new ArrayDeque<>();
        // Acknowledgements of pages that still have elements in the buffer, oldest first
        private final Deque<PendingAcknowledgement> pendingAcknowledgements = new ArrayDeque<>();

        private volatile State state = State.IDLE;
        private volatile boolean cancelled;
        // Set by whoever signals onComplete or onError, the worker or a thread whose task was rejected
        private final AtomicBoolean terminalSignalled = new AtomicBoolean();

        // The fields below are only accessed from the worker
        private long demand;
        private long enqueued;
        private long delivered;
        private @Nullable Disposable inFlight;
        private @Nullable Disposable refreshTimer;

        private PollingSubscription(Subscriber<? super T> subscriber, Scheduler.Worker worker) {
            this.subscriber = subscriber;
            this.worker = worker;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                execute(() -> fail(Exceptions.nullOrNegativeRequestException(n)));
                return;
            }
            execute(() -> {
                demand = Operators.addCap(demand, n);
                drain();
            });
        }

        @Override
        public void cancel() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            execute(() -> {
                if (state.isTerminal()) {
                    return;
                }
                log.debug("{} was cancelled", name);
                state = State.CANCELLED;
                dispose();
            });
        }

        private void drain() {
            if (isTerminated()) {
                return;
            }

            while (demand > 0 && !buffer.isEmpty()) {
                T element = buffer.poll();
                if (demand != Long.MAX_VALUE) {
                    demand--;
                }
                delivered++;
                subscriber.onNext(element);
                if (cancelled) {
                    return;
                }
                if (!acknowledgeDeliveredPages()) {
                    return;
                }
            }

            if (state == State.POLLING || state == State.AWAITING_REFRESH) {
                return;
            }

            if (poller.isExhausted()) {
                if (buffer.isEmpty()) {
                    complete();
                } else {
                    state = State.AWAITING_SUBSCRIBER_DEMAND;
                }
                return;
            }

            int capacity = maxBufferSize - buffer.size();
            if (demand == 0 || capacity == 0) {
                state = State.AWAITING_SUBSCRIBER_DEMAND;
                return;
            }
            poll(capacity);
        }

        private void poll(int maxItems) {
            state = State.POLLING;
            log.trace("{} polling for at most {} elements", name, maxItems);
            inFlight = Mono.defer(() -> poller.poll(maxItems))
                    .single()
                    .subscribe(result -> execute(() -> onPollResult(result, maxItems)),
                            error -> execute(() -> onPollError(error)));
        }

        private void onPollResult(PollResult<T> result, int requested) {
            inFlight = null;
            if (isTerminated()) {
                return;
            }

            int size = result.items().size();
            if (size > requested) {
                fail(new IllegalStateException(name + " received " + size + " elements but only " + requested + " were requested"));
                return;
            }
            log.trace("{} received {} elements", name, size);

            buffer.addAll(result.items());
            enqueued += size;
            if (autoAck) {
                if (size == 0) {
                    if (!acknowledge(result::acknowledge)) {
                        return;
                    }
                } else {
                    pendingAcknowledgements.add(new PendingAcknowledgement(enqueued, result::acknowledge));
                }
            }

            if (result.awaitRefresh() && !poller.isExhausted()) {
                state = State.AWAITING_REFRESH;
                refreshTimer = worker.schedule(this::onRefresh, refreshInterval.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                state = State.IDLE;
            }
            drain();
        }

        private void onPollError(Throwable error) {
            inFlight = null;
            if (isTerminated()) {
                log.debug("Ignoring error from {} since it has already terminated", name, error);
                return;
            }
            fail(error);
        }

        private void onRefresh() {
            refreshTimer = null;
            if (isTerminated()) {
                return;
            }
            log.trace("Refreshing {}", name);
            state = State.IDLE;
            drain();
        }

        private boolean acknowledgeDeliveredPages() {
            while (!pendingAcknowledgements.isEmpty() && pendingAcknowledgements.peek().deliveredThreshold <= delivered) {
                if (!acknowledge(pendingAcknowledgements.poll().acknowledgement)) {
                    return false;
                }
            }
            return true;
        }

        private boolean acknowledge(Runnable acknowledgement) {
            try {
                acknowledgement.run();
                return true;
            } catch (RuntimeException e) {
                fail(e);
                return false;
            }
        }

        private void complete() {
            if (!terminalSignalled.compareAndSet(false, true)) {
                return;
            }
            log.debug("{} completed after {} elements", name, delivered);
            state = State.COMPLETED;
            dispose();
            subscriber.onComplete();
        }

        private void fail(Throwable error) {
            if (isTerminated() || !terminalSignalled.compareAndSet(false, true)) {
                return;
            }
            log.warn("{} failed", name, error);
            state = State.FAILED;
            dispose();
            subscriber.onError(error);
        }

        private boolean isTerminated() {
            return cancelled || state.isTerminal();
        }

        private void dispose() {
            if (inFlight != null) {
                inFlight.dispose();
                inFlight = null;
            }
            if (refreshTimer != null) {
                refreshTimer.dispose();
                refreshTimer = null;
            }
            buffer.clear();
            pendingAcknowledgements.clear();
            worker.dispose();
        }

        private void execute(Runnable task) {
            try {
                worker.schedule(task);
            } catch (RejectedExecutionException e) {
                if (cancelled || !terminalSignalled.compareAndSet(false, true)) {
                    log.debug("{} has already terminated, skipping task", name);
                } else {
                    // The scheduler itself was shut down so there's no worker left to run the subscription on
                    log.warn("{} failed since its scheduler rejected a task", name, e);
                    state = State.FAILED;
                    subscriber.onError(e);
                }
            }
        }
    }

    private static class PendingAcknowledgement {
        private final long deliveredThreshold;
        private final Runnable acknowledgement;

        private PendingAcknowledgement(long deliveredThreshold, Runnable acknowledgement) {
            this.deliveredThreshold = deliveredThreshold;
            this.acknowledgement = acknowledgement;
        }
    }
}
