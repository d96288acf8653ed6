package org.speeches.common;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

public class MergeChannel {

    private static final IngestEvent END_OF_STREAM = () -> "";

    private final BlockingQueue<IngestEvent> queue = new LinkedBlockingQueue<>();
    private boolean closed;

    public synchronized void publish(IngestEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (closed) {
            throw new IllegalStateException("Channel already closed, dropping event from " + event.source());
        }
        queue.add(event);
    }

    public synchronized void close() {
        if (!closed) {
            closed = true;
            queue.add(END_OF_STREAM);
        }
    }

    /**
     * Blocks while the channel is empty and open.
     *
     * @return the next event, or {@code null} once the channel is closed and drained
     */
    public IngestEvent take() throws InterruptedException {
        IngestEvent event = queue.take();
        if (event == END_OF_STREAM) {
            // keep the marker so repeated calls stay at end of stream
            queue.add(END_OF_STREAM);
            return null;
        }
        return event;
    }
}
