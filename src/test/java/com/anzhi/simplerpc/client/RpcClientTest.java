package com.anzhi.simplerpc.client;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.error.CodecException;
import com.anzhi.simplerpc.error.RpcException;
import com.anzhi.simplerpc.error.RpcTimeoutException;
import com.anzhi.simplerpc.server.Arith;
import com.anzhi.simplerpc.server.RpcServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RpcClientTest {

    private RpcServer server;

    @BeforeEach
    public void setUp() throws Exception {
        server = new RpcServer();
        server.register(new Arith());
        server.start(0);
    }

    @AfterEach
    public void tearDown() {
        server.shutdown();
    }

    @Test
    public void testCallTimeoutAbandonsCall() throws Exception {
        try (RpcClient client = RpcClient.dial(server.getAddress())) {
            assertThatThrownBy(() -> client.call("Arith.sleep", 500, Integer.class, Duration.ofMillis(50)))
                    .isInstanceOf(RpcTimeoutException.class)
                    .hasMessageContaining("timeout");

            // 迟到的响应被丢弃，不影响后续调用
            Thread.sleep(600);
            assertThat(client.call("Arith.sum", new Arith.Args(1, 1), Integer.class)).isEqualTo(2);
        }
    }

    @Test
    public void testSeqStartsAtOne() throws Exception {
        try (RpcClient client = RpcClient.dial(server.getAddress())) {
            CompletableFuture<Integer> first = client.go("Arith.sum", new Arith.Args(1, 2), Integer.class);
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(3);
        }
    }

    @Test
    public void testClosedClientRejectsCalls() throws Exception {
        RpcClient client = RpcClient.dial(server.getAddress());
        assertThat(client.isAvailable()).isTrue();

        client.close();
        client.close();

        assertThat(client.isAvailable()).isFalse();
        assertThatThrownBy(() -> client.call("Arith.sum", new Arith.Args(1, 2), Integer.class))
                .isInstanceOf(RpcException.class)
                .hasMessage("connection is shut down");
    }

    @Test
    public void testCloseFailsPendingCalls() throws Exception {
        RpcClient client = RpcClient.dial(server.getAddress());
        CompletableFuture<Integer> pending = client.go("Arith.sleep", 1000, Integer.class);

        client.close();

        assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RpcException.class)
                .hasRootCauseMessage("connection is shut down");
    }

    @Test
    public void testServerShutdownFailsPendingCalls() throws Exception {
        try (RpcClient client = RpcClient.dial(server.getAddress())) {
            CompletableFuture<Integer> pending = client.go("Arith.sleep", 2000, Integer.class);
            Thread.sleep(100);

            server.shutdown();

            assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(RpcException.class);
            assertThat(client.isAvailable()).isFalse();
        }
    }

    @Test
    public void testUnsupportedCodecFailsBeforeConnecting() {
        Option option = Option.defaults().withCodecType("application/x-unknown");

        assertThatThrownBy(() -> RpcClient.dial(server.getAddress(), option))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("application/x-unknown");
    }

    @Test
    public void testDialRefused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        assertThatThrownBy(() -> RpcClient.dial("127.0.0.1:" + port))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("dial 127.0.0.1:" + port);
    }

    @Test
    public void testBadAddressFormat() {
        assertThatThrownBy(() -> RpcClient.dial("localhost"))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("host:port");
    }
}
