package com.appetite.kitchen.controller;

import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.dto.TicketStreamEvent;
import com.appetite.kitchen.service.stream.TicketEventSink;
import com.appetite.kitchen.service.stream.TicketStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-sent events view of the ticket stream. Each open connection holds one thread of
 * the stream executor until the client disconnects or the emitter times out.
 */
@Slf4j
@RestController
@RequestMapping("/api/tickets")
public class TicketStreamController {

    private final TicketStreamService ticketStreamService;
    private final ThreadPoolTaskExecutor streamExecutor;
    private final long emitterTimeoutMillis;

    public TicketStreamController(TicketStreamService ticketStreamService,
                                  @Qualifier("kitchenStreamExecutor") ThreadPoolTaskExecutor streamExecutor,
                                  KitchenProperties properties) {
        this.ticketStreamService = ticketStreamService;
        this.streamExecutor = streamExecutor;
        this.emitterTimeoutMillis = properties.getStream().getEmitterTimeout().toMillis();
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String station) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        StreamTask task = new StreamTask();
        emitter.onCompletion(task::cancel);
        emitter.onTimeout(task::cancel);
        emitter.onError(error -> task.cancel());

        try {
            task.attach(streamExecutor.submit(() -> {
                ticketStreamService.stream(station, new EmitterSink(emitter));
                emitter.complete();
            }));
        } catch (TaskRejectedException e) {
            log.warn("Rejecting ticket stream for station={}: all stream slots in use", station);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many open ticket streams");
        }
        return emitter;
    }

    /**
     * Links emitter callbacks to the stream's worker. A cancel that arrives before the
     * worker is attached is remembered and applied on attach.
     */
    static final class StreamTask {

        private final AtomicReference<Future<?>> future = new AtomicReference<>();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        void attach(Future<?> running) {
            future.set(running);
            if (cancelled.get()) {
                running.cancel(true);
            }
        }

        void cancel() {
            cancelled.set(true);
            Future<?> running = future.get();
            if (running != null) {
                running.cancel(true);
            }
        }
    }

    /**
     * Writes stream events as named SSE events and heartbeats as SSE comments.
     */
    static final class EmitterSink implements TicketEventSink {

        private final SseEmitter emitter;

        EmitterSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void send(TicketStreamEvent event) throws IOException {
            emitter.send(SseEmitter.event()
                    .name(event.getEventType())
                    .data(event, MediaType.APPLICATION_JSON));
        }

        @Override
        public void heartbeat() throws IOException {
            emitter.send(SseEmitter.event().comment("heartbeat"));
        }
    }
}
