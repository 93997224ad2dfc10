package dev.repodocs.relay;

import dev.repodocs.domain.valueobject.RawChunk;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputStreamSinkTest {

    @Test
    void writesChunksAndRejectsWritesAfterClose() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OutputStreamSink sink = new OutputStreamSink(out);

        sink.write(RawChunk.wrap("event: done\n".getBytes(StandardCharsets.UTF_8)));
        sink.close();
        sink.close();

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("event: done\n");
        assertThatThrownBy(() -> sink.write(RawChunk.wrap(new byte[]{1})))
                .isInstanceOf(IOException.class);
    }
}
