package landscape.pipeline.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of pipeline events to registered listeners.
 * A failing listener is logged and does not affect the others or the publisher.
 */
public final class PipelineEventBus implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<PipelineEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<PipelineEvent> listener) {
        listeners.remove(listener);
    }

    @Override
    public void publish(PipelineEvent event) {
        for (Consumer<PipelineEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {} for {}: {}", event.type(), event.executionId(),
                        e.getMessage(), e);
            }
        }
    }
}
