package com.anzhi.simplerpc;

import com.anzhi.simplerpc.discovery.RegistryDiscovery;
import com.anzhi.simplerpc.discovery.SelectMode;
import com.anzhi.simplerpc.discovery.XClient;
import com.anzhi.simplerpc.registry.Heartbeat;
import com.anzhi.simplerpc.registry.RegistryServer;
import com.anzhi.simplerpc.registry.SimpleRegistry;
import com.anzhi.simplerpc.server.RpcServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 演示：一个注册中心、两个服务实例、一个带负载均衡的客户端，全部运行在同一个 JVM 里。
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final int DEFAULT_REGISTRY_PORT = 9999;
    private static final String DEFAULT_SERVER_PORTS = "0,0";

    public static class Args {
        private int num1;
        private int num2;

        public Args() {
        }

        public Args(int num1, int num2) {
            this.num1 = num1;
            this.num2 = num2;
        }

        public int getNum1() { return num1; }
        public void setNum1(int num1) { this.num1 = num1; }
        public int getNum2() { return num2; }
        public void setNum2(int num2) { this.num2 = num2; }
    }

    public static class Foo {
        public int sum(Args args, int reply) {
            return args.getNum1() + args.getNum2();
        }

        public int sleep(Args args, int reply) throws InterruptedException {
            Thread.sleep(args.getNum1() * 1000L);
            return args.getNum1() + args.getNum2();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        int registryPort = getEnvInt("REGISTRY_PORT", DEFAULT_REGISTRY_PORT);
        String serverPorts = System.getenv().getOrDefault("SERVER_PORTS", DEFAULT_SERVER_PORTS);

        // ==================== 步骤 1: 启动注册中心 ====================
        RegistryServer registry = new RegistryServer(new SimpleRegistry());
        registry.start(registryPort);
        String registryUrl = registry.getUrl();

        // ==================== 步骤 2: 启动服务实例并发送心跳 ====================
        List<RpcServer> servers = new ArrayList<>();
        List<Heartbeat> heartbeats = new ArrayList<>();
        for (String port : serverPorts.split(",")) {
            RpcServer server = new RpcServer();
            server.register(new Foo());
            server.start(Integer.parseInt(port.trim()));
            servers.add(server);
            heartbeats.add(Heartbeat.start(registryUrl, server.getAddress(), Duration.ZERO));
        }
        logger.info("All RPC servers are ready!");

        // ==================== 步骤 3: 通过注册中心发现实例并调用 ====================
        RegistryDiscovery discovery = new RegistryDiscovery(registryUrl);
        try (XClient xc = new XClient(discovery, SelectMode.RANDOM)) {
            for (int i = 0; i < 5; i++) {
                int reply = xc.call("Foo.sum", new Args(i, i * i), Integer.class);
                logger.info("call Foo.sum success: {} + {} = {}", i, i * i, reply);
            }
            for (int i = 0; i < 5; i++) {
                int reply = xc.broadcast("Foo.sum", new Args(i, i * i), Integer.class);
                logger.info("broadcast Foo.sum success: {} + {} = {}", i, i * i, reply);
            }
        }

        // 处理超时的调用
        Option option = Option.defaults().withHandleTimeout(Duration.ofMillis(500));
        try (XClient xc = new XClient(discovery, SelectMode.ROUND_ROBIN, option)) {
            try {
                xc.call("Foo.sleep", new Args(2, 0), Integer.class);
            } catch (Exception e) {
                logger.info("call Foo.sleep failed as expected: {}", e.getMessage());
            }
        }

        // 优雅地关闭
        logger.info("Simulation finished. Shutting down...");
        heartbeats.forEach(Heartbeat::stop);
        servers.forEach(RpcServer::shutdown);
        registry.shutdown();
        System.exit(0);
    }

    private static int getEnvInt(String name, int defaultValue) {
        String value = System.getenv(name);
        if (value != null) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                logger.warn("Invalid {}={}, using default {}", name, value, defaultValue);
            }
        }
        return defaultValue;
    }
}
