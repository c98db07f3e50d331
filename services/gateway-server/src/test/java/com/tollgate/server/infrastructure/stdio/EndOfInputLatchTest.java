package com.tollgate.server.infrastructure.stdio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EndOfInputLatch")
class EndOfInputLatchTest {

    @Test
    @DisplayName("stays open while data remains")
    void openWhileReading() throws Exception {
        EndOfInputLatch latch = new EndOfInputLatch(
                new ByteArrayInputStream("line\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(latch.read(new byte[2], 0, 2)).isEqualTo(2);

        assertThat(latch.isEnded()).isFalse();
        assertThat(latch.await(10, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    @DisplayName("releases waiters at end of input")
    void releasesAtEnd() throws Exception {
        EndOfInputLatch latch = new EndOfInputLatch(
                new ByteArrayInputStream("line\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(latch.readAllBytes()).hasSize(5);

        assertThat(latch.isEnded()).isTrue();
        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("releases waiters when the stream fails")
    void releasesOnFailure() {
        EndOfInputLatch latch = new EndOfInputLatch(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("stdin gone");
            }
        });

        assertThatThrownBy(latch::read).isInstanceOf(IOException.class);
        assertThat(latch.isEnded()).isTrue();
    }

    @Test
    @DisplayName("releases waiters on close")
    void releasesOnClose() throws Exception {
        EndOfInputLatch latch = new EndOfInputLatch(new ByteArrayInputStream(new byte[8]));

        latch.close();

        assertThat(latch.isEnded()).isTrue();
    }
}
