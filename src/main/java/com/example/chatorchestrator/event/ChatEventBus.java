package com.example.chatorchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe bus with one channel per {@link ChatEventType}.
 * <p>
 * Publishing is synchronous: by the time {@link #publish} returns every subscriber of
 * the event's channel has seen it, on the publishing thread. No lock is held while
 * subscribers run, so publishers of different sessions never wait on each other; events of
 * one session keep the order its serializing owner published them in. A subscriber that
 * throws is logged and stays subscribed; the other subscribers are not affected.
 * <p>
 * The {@link Flux} views ({@link #events(ChatEventType)}, {@link #allEvents()},
 * {@link #events(String)}) are fed from thread-safe multicast sinks for streaming consumers.
 */
@Component
public class ChatEventBus {

    private static final Logger logger = LoggerFactory.getLogger(ChatEventBus.class);

    private static final Duration STREAM_EMIT_RETRY = Duration.ofSeconds(1);

    private final Map<ChatEventType, List<Handler<?>>> handlers = new EnumMap<>(ChatEventType.class);
    private final Map<ChatEventType, Sinks.Many<ChatEvent>> streams = new EnumMap<>(ChatEventType.class);

    public ChatEventBus() {
        for (ChatEventType type : ChatEventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
            streams.put(type, Sinks.many().multicast().directBestEffort());
        }
    }

    public void publish(ChatEvent event) {
        ChatEventType type = event.getType();
        for (Handler<?> handler : handlers.get(type)) {
            handler.dispatch(event);
        }
        Sinks.Many<ChatEvent> stream = streams.get(type);
        if (stream.currentSubscriberCount() > 0) {
            try {
                stream.emitNext(event, Sinks.EmitFailureHandler.busyLooping(STREAM_EMIT_RETRY));
            } catch (Sinks.EmissionException e) {
                logger.warn("Dropped {} event for session {} from streams: {}",
                        event.getEventName(), event.getSessionId(), e.getReason());
            }
        }
        logger.debug("Published {} for session {}", event.getEventName(), event.getSessionId());
    }

    public <E extends ChatEvent> Disposable subscribe(Class<E> eventClass, Consumer<? super E> handler) {
        return register(ChatEventType.of(eventClass), eventClass, handler);
    }

    /**
     * Subscribes by wire name, e.g. {@code "participantJoined"}.
     */
    public Disposable subscribe(String eventName, Consumer<ChatEvent> handler) {
        ChatEventType type = ChatEventType.fromEventName(eventName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event name: " + eventName));
        return register(type, ChatEvent.class, handler);
    }

    public Flux<ChatEvent> events(ChatEventType type) {
        return streams.get(type).asFlux();
    }

    public Flux<ChatEvent> allEvents() {
        return Flux.merge(streams.values().stream().map(Sinks.Many::asFlux).toList());
    }

    public Flux<ChatEvent> events(String sessionId) {
        return allEvents().filter(event -> sessionId.equals(event.getSessionId()));
    }

    /**
     * Handlers registered through {@code subscribe}; stream consumers are not counted.
     */
    public int subscriberCount(ChatEventType type) {
        return handlers.get(type).size();
    }

    private <E extends ChatEvent> Disposable register(ChatEventType type, Class<E> eventClass, Consumer<? super E> consumer) {
        List<Handler<?>> channel = handlers.get(type);
        Handler<E> handler = new Handler<>(type, eventClass, consumer, channel);
        channel.add(handler);
        return handler;
    }

    private static final class Handler<E extends ChatEvent> implements Disposable {

        private final ChatEventType type;
        private final Class<E> eventClass;
        private final Consumer<? super E> consumer;
        private final List<Handler<?>> channel;
        private volatile boolean disposed;

        Handler(ChatEventType type, Class<E> eventClass, Consumer<? super E> consumer, List<Handler<?>> channel) {
            this.type = type;
            this.eventClass = eventClass;
            this.consumer = consumer;
            this.channel = channel;
        }

        void dispatch(ChatEvent event) {
            if (disposed) {
                return;
            }
            try {
                consumer.accept(eventClass.cast(event));
            } catch (RuntimeException e) {
                logger.warn("Subscriber of {} failed, continuing dispatch", type.getEventName(), e);
            }
        }

        @Override
        public void dispose() {
            disposed = true;
            channel.remove(this);
        }

        @Override
        public boolean isDisposed() {
            return disposed;
        }
    }
}
