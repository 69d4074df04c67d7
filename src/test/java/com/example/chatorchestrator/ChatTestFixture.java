package com.example.chatorchestrator;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.event.ChatEvent;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.kv.InMemoryKvClient;
import com.example.chatorchestrator.participant.ParticipantRegistry;
import com.example.chatorchestrator.participant.StoreIdentityResolver;
import com.example.chatorchestrator.presence.PresenceTracker;
import com.example.chatorchestrator.routing.DirectDeliveryChannel;
import com.example.chatorchestrator.routing.HybridDeliveryChannel;
import com.example.chatorchestrator.routing.MessageRouter;
import com.example.chatorchestrator.routing.SharedDeliveryChannel;
import com.example.chatorchestrator.service.ChatOrchestrator;
import com.example.chatorchestrator.service.SessionSynchronizer;
import com.example.chatorchestrator.session.SessionSerializer;
import com.example.chatorchestrator.session.SessionStateMachine;
import com.example.chatorchestrator.store.InMemoryStoreClient;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * The orchestrator wired by hand over the in-memory store and key/value clients, with
 * every published event recorded.
 */
public class ChatTestFixture implements AutoCloseable {

    public final ChatProperties properties = new ChatProperties();
    public final ChatEventBus eventBus = new ChatEventBus();
    public final SessionSerializer serializer = new SessionSerializer();
    public final InMemoryStoreClient store;
    public final InMemoryKvClient kv = new InMemoryKvClient();
    public final SessionSynchronizer synchronizer;
    public final PresenceTracker presenceTracker;
    public final ParticipantRegistry registry;
    public final DirectDeliveryChannel directChannel;
    public final SharedDeliveryChannel sharedChannel;
    public final HybridDeliveryChannel hybridChannel;
    public final MessageRouter router;
    public final SessionStateMachine stateMachine;
    public final ChatOrchestrator orchestrator;

    private final List<ChatEvent> events = new CopyOnWriteArrayList<>();
    private final Disposable recorder;

    public ChatTestFixture() {
        this(new InMemoryStoreClient());
    }

    public ChatTestFixture(InMemoryStoreClient store) {
        this.store = store;
        this.recorder = eventBus.allEvents().subscribe(events::add);
        this.synchronizer = new SessionSynchronizer(store, kv, properties);
        ReflectionTestUtils.setField(synchronizer, "asyncTimeoutMs", 1000L);
        ReflectionTestUtils.setField(synchronizer, "maxAsyncThreads", 4);
        this.presenceTracker = new PresenceTracker(eventBus, serializer, properties);
        this.registry = new ParticipantRegistry(presenceTracker, new StoreIdentityResolver(store), eventBus, properties);
        this.directChannel = new DirectDeliveryChannel(synchronizer);
        this.sharedChannel = new SharedDeliveryChannel(synchronizer);
        this.hybridChannel = new HybridDeliveryChannel(sharedChannel, synchronizer);
        this.router = new MessageRouter(registry, presenceTracker, eventBus, properties,
                List.of(directChannel, sharedChannel, hybridChannel));
        this.stateMachine = new SessionStateMachine(registry, eventBus, List.of(presenceTracker, router));
        this.orchestrator = new ChatOrchestrator(stateMachine, registry, presenceTracker, router,
                synchronizer, serializer, eventBus, properties);
    }

    public List<ChatEvent> events() {
        return List.copyOf(events);
    }

    public <E extends ChatEvent> List<E> events(Class<E> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clearEvents() {
        events.clear();
    }

    @Override
    public void close() {
        recorder.dispose();
        orchestrator.shutdown();
        router.shutdown();
        presenceTracker.shutdown();
        directChannel.shutdown();
        sharedChannel.shutdown();
        synchronizer.cleanup();
    }
}
