package landscape.pipeline.events;

/**
 * Outbound channel for pipeline status changes. Must not block the caller.
 */
@FunctionalInterface
public interface NotificationSink {

    NotificationSink NONE = event -> {
    };

    void publish(PipelineEvent event);
}
