package landscape.pipeline.scheduler;

import landscape.pipeline.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that returns queue entries held by dead workers.
 *
 * A lease expires when its worker crashed or its process died. Entries with attempts
 * left go back to pending, the rest are dead-lettered.
 */
public class QueueReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueReaper.class);

    private final JobQueueService queue;

    public QueueReaper(JobQueueService queue) {
        this.queue = queue;
    }

    @Override
    public void run() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Queue reaper error", e);
        }
    }

    /**
     * @return number of entries recovered or dead-lettered
     */
    public int reap() {
        int reaped = queue.reapExpiredLeases();
        if (reaped > 0) {
            log.info("Queue reaper: {} expired leases recovered", reaped);
        } else {
            log.debug("No expired leases found");
        }
        return reaped;
    }
}
