package io.imagerollout.inventory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpDiskImageQueryTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>("{\"disk_image\":\"XDP07SLHS-230401.vhd\"}");

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/disk-image", exchange -> {
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testQueryDiskImage_ReadsIdentifier() throws Exception {
        assertThat(query("disk-image").queryDiskImage("127.0.0.1", Duration.ofSeconds(5)))
                .contains("XDP07SLHS-230401.vhd");
    }

    @Test
    void testQueryDiskImage_NotFoundIsEmpty() throws Exception {
        status.set(404);
        body.set("");

        assertThat(query("/disk-image").queryDiskImage("127.0.0.1", Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void testQueryDiskImage_BlankIdentifierIsEmpty() throws Exception {
        body.set("{\"disk_image\":\"  \"}");

        assertThat(query("/disk-image").queryDiskImage("127.0.0.1", Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void testQueryDiskImage_ServerErrorFails() {
        status.set(503);

        assertThatThrownBy(() -> query("/disk-image").queryDiskImage("127.0.0.1", Duration.ofSeconds(5)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("503");
    }

    private HttpDiskImageQuery query(String path) {
        return new HttpDiskImageQuery(new ObjectMapper(), server.getAddress().getPort(), path, Duration.ofSeconds(5));
    }
}
