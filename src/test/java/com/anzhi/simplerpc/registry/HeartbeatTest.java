package com.anzhi.simplerpc.registry;

import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class HeartbeatTest {

    @Test
    public void testDefaultPeriodIsBelowRegistryTimeout() {
        assertThat(Heartbeat.defaultPeriod()).isEqualTo(Duration.ofMinutes(4));
    }

    @Test
    public void testHeartbeatKeepsServerAlive() throws Exception {
        RegistryServer server = new RegistryServer(new SimpleRegistry(Duration.ofMillis(500)));
        server.start(0);
        Heartbeat heartbeat = Heartbeat.start(server.getUrl(), "127.0.0.1:9001", Duration.ofMillis(100));
        try {
            assertThat(heartbeat.isRunning()).isTrue();
            assertThat(server.getRegistry().listAlive()).containsExactly("127.0.0.1:9001");

            // 多个注册中心超时周期之后依然存活
            Thread.sleep(1500);
            assertThat(server.getRegistry().listAlive()).containsExactly("127.0.0.1:9001");
        } finally {
            heartbeat.stop();
            server.shutdown();
        }
        assertThat(heartbeat.isRunning()).isFalse();
    }

    @Test
    public void testZeroPeriodUsesDefault() throws Exception {
        RegistryServer server = new RegistryServer(new SimpleRegistry());
        server.start(0);
        Heartbeat heartbeat = Heartbeat.start(server.getUrl(), "127.0.0.1:9001", Duration.ZERO);
        try {
            assertThat(heartbeat.getPeriod()).isEqualTo(Heartbeat.defaultPeriod());
            assertThat(heartbeat.getAddr()).isEqualTo("127.0.0.1:9001");
        } finally {
            heartbeat.stop();
            server.shutdown();
        }
    }

    @Test
    public void testFailedHeartbeatStopsSending() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        RegistryClient client = new RegistryClient("http://127.0.0.1:" + port + SimpleRegistry.DEFAULT_PATH,
                Duration.ofSeconds(2));

        Heartbeat heartbeat = Heartbeat.start(client, "127.0.0.1:9001", Duration.ofMillis(100));

        assertThat(heartbeat.isRunning()).isFalse();
    }
}
