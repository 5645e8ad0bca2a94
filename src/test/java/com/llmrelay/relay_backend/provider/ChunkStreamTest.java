package com.llmrelay.relay_backend.provider;

import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.UpstreamException;
import com.llmrelay.relay_backend.model.llm.StreamChunk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStreamTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private static List<StreamChunk> drain(ChunkStream stream) {
        List<StreamChunk> out = new ArrayList<>();
        stream.forEachRemaining(out::add);
        return out;
    }

    @Test
    void producerOutput_isFollowedByExactlyOneEnd() {
        ChunkStream stream = ChunkStream.open(pool, sink -> {
            sink.emit("a");
            sink.emit("b");
            sink.emit("c");
        });

        List<StreamChunk> chunks = drain(stream);

        assertThat(chunks).extracting(StreamChunk::getText).containsExactly("a", "b", "c", null);
        assertThat(chunks.get(3).getType()).isEqualTo(StreamChunk.Type.END);
        assertThat(stream.hasNext()).isFalse();
        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void producerFailure_becomesTerminalErrorChunk() {
        ChunkStream stream = ChunkStream.open(pool, sink -> {
            sink.emit("partial");
            throw new UpstreamException(429, "slow down");
        });

        List<StreamChunk> chunks = drain(stream);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).getText()).isEqualTo("partial");
        assertThat(chunks.get(1).getType()).isEqualTo(StreamChunk.Type.ERROR);
        assertThat(chunks.get(1).errorKind()).isEqualTo(ErrorKind.UPSTREAM_RATE_LIMIT);
    }

    @Test
    void unexpectedProducerException_isWrappedAsInternal() {
        ChunkStream stream = ChunkStream.open(pool, sink -> {
            throw new IllegalStateException("boom");
        });

        List<StreamChunk> chunks = drain(stream);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).errorKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(chunks.get(0).getError().getMessage()).isEqualTo("boom");
    }

    @Test
    void failed_yieldsOnlyTheError() {
        ChunkStream stream = ChunkStream.failed(new UpstreamException(401, "bad key"));

        List<StreamChunk> chunks = drain(stream);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).errorKind()).isEqualTo(ErrorKind.UPSTREAM_AUTH);
    }

    @Test
    void rejectedWorker_yieldsErrorInsteadOfHanging() {
        ChunkStream stream = ChunkStream.open(task -> { throw new RejectedExecutionException("full"); },
                sink -> sink.emit("never"));

        List<StreamChunk> chunks = drain(stream);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getType()).isEqualTo(StreamChunk.Type.ERROR);
    }

    @Test
    void close_stopsABlockedProducer() throws Exception {
        CountDownLatch producerExited = new CountDownLatch(1);
        ChunkStream stream = ChunkStream.open(pool, 1, sink -> {
            try {
                while (true) sink.emit("x");
            } finally {
                producerExited.countDown();
            }
        });

        assertThat(stream.next().getText()).isEqualTo("x");
        stream.close();

        assertThat(producerExited.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    void close_releasesAConsumerWaitingForTheNextChunk() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ChunkStream stream = ChunkStream.open(pool, sink -> release.await());
        CountDownLatch waiting = new CountDownLatch(1);

        Future<Boolean> consumer = pool.submit(() -> {
            waiting.countDown();
            return stream.hasNext();
        });
        assertThat(waiting.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        stream.close();

        assertThat(consumer.get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(stream.hasNext()).isFalse();
        release.countDown();
    }
}
