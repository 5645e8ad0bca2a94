package com.llmrelay.relay_backend.provider;

import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.llm.StreamChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, one-directional channel of {@link StreamChunk}s.
 *
 * <p>A producer runs on a worker and pushes text through a {@link Sink}; the consumer iterates.
 * The producer blocks when the consumer falls behind. Whatever the producer does, the consumer
 * sees zero or more CONTENT chunks and then exactly one END or ERROR, after which
 * {@link #hasNext()} is false. Closing the stream tells the producer to stop at its next emit
 * and releases a consumer waiting in {@link #hasNext()}, which then reports no more chunks.
 * Not restartable.
 */
@Slf4j
public class ChunkStream implements Iterator<StreamChunk>, AutoCloseable {

    static final int DEFAULT_CAPACITY = 64;
    private static final long OFFER_POLL_MS = 100;
    private static final long TAKE_POLL_MS = 100;

    @FunctionalInterface
    public interface Producer {
        void produce(Sink sink) throws Exception;
    }

    @FunctionalInterface
    public interface Sink {
        void emit(String text);
    }

    private final BlockingQueue<StreamChunk> queue;
    private volatile boolean closed;
    private StreamChunk lookahead;
    private boolean finished;

    private ChunkStream(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public static ChunkStream open(Executor executor, Producer producer) {
        return open(executor, DEFAULT_CAPACITY, producer);
    }

    public static ChunkStream open(Executor executor, int capacity, Producer producer) {
        ChunkStream stream = new ChunkStream(capacity);
        try {
            executor.execute(() -> stream.run(producer));
        } catch (RejectedExecutionException e) {
            stream.queue.offer(StreamChunk.error(
                    new ProviderException(ErrorKind.INTERNAL, "Streaming worker pool is saturated", null, e)));
        }
        return stream;
    }

    /** A stream that fails before producing anything. */
    public static ChunkStream failed(ProviderException error) {
        ChunkStream stream = new ChunkStream(1);
        stream.queue.offer(StreamChunk.error(error));
        return stream;
    }

    private void run(Producer producer) {
        try {
            producer.produce(text -> put(StreamChunk.content(text)));
            put(StreamChunk.end());
        } catch (StreamClosedException e) {
            log.debug("Consumer closed the stream; producer stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            putQuietly(StreamChunk.error(new ProviderException(ErrorKind.INTERNAL, "Stream producer interrupted", null, e)));
        } catch (Exception e) {
            ProviderException pe = ProviderException.wrap(e);
            log.warn("Stream producer failed with {}: {}", pe.getKind(), pe.getMessage());
            putQuietly(StreamChunk.error(pe));
        }
    }

    private void put(StreamChunk chunk) {
        try {
            while (!closed) {
                if (queue.offer(chunk, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        throw new StreamClosedException();
    }

    private void putQuietly(StreamChunk chunk) {
        try {
            put(chunk);
        } catch (StreamClosedException e) {
            log.debug("Dropped terminal chunk {} for a closed stream", chunk);
        }
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (finished) return false;
        while (lookahead == null) {
            if (closed) {
                finished = true;
                return false;
            }
            try {
                lookahead = queue.poll(TAKE_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lookahead = StreamChunk.error(new ProviderException(ErrorKind.INTERNAL, "Interrupted while waiting for the next chunk"));
            }
        }
        if (lookahead.isTerminal()) finished = true;
        return true;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) throw new NoSuchElementException("Stream already terminated");
        StreamChunk chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    private static final class StreamClosedException extends RuntimeException {
        StreamClosedException() {
            super("stream closed", null, false, false);
        }
    }
}
