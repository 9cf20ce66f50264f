package com.anzhi.simplerpc.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ServiceTest {

    public static class Args {
        public int a;
        public int b;

        public Args() {
        }

        public Args(int a, int b) {
            this.a = a;
            this.b = b;
        }
    }

    public static class Calc {
        public int sum(Args args, int reply) {
            return args.a + args.b;
        }

        public void names(Integer n, List<String> reply) {
            for (int i = 0; i < n; i++) {
                reply.add("n" + i);
            }
        }

        public Map<String, Integer> index(String key, Map<String, Integer> reply) {
            reply.put(key, key.length());
            return reply;
        }

        public int fail(Args args, int reply) {
            throw new IllegalStateException("boom");
        }

        // 以下都不是 RPC 方法
        public int one(Args args) {
            return 0;
        }

        public int three(Args args, int reply, int extra) {
            return 0;
        }

        public String mismatch(Args args, int reply) {
            return "";
        }

        public int hidden(Secret secret, int reply) {
            return 0;
        }

        public static int staticSum(Args args, int reply) {
            return 0;
        }

        private int privateSum(Args args, int reply) {
            return 0;
        }
    }

    static class Secret {
    }

    static class PackagePrivate {
        public int sum(Args args, int reply) {
            return 0;
        }
    }

    @Test
    public void testOnlyEligibleMethodsAreRegistered() {
        Service service = Service.of(new Calc());

        assertThat(service.getName()).isEqualTo("Calc");
        assertThat(service.getMethodNames()).containsExactlyInAnyOrder("sum", "names", "index", "fail");
    }

    @Test
    public void testCallIncrementsCounterOnce() throws Exception {
        Service service = Service.of(new Calc());
        MethodEntry<?, ?> sum = service.getMethod("sum");

        Object reply = service.call(sum, new Args(3, 4), sum.newReply());

        assertThat(reply).isEqualTo(7);
        assertThat(sum.getNumCalls()).isEqualTo(1);
        assertThat(service.getMethod("names").getNumCalls()).isZero();
    }

    @Test
    public void testArgAndReplySlotsAreInitialised() {
        Service service = Service.of(new Calc());

        assertThat(service.getMethod("sum").newArg()).isInstanceOf(Args.class);
        assertThat(service.getMethod("sum").newReply()).isEqualTo(0);
        assertThat(service.getMethod("names").newArg()).isEqualTo(0);
        assertThat(service.getMethod("names").newReply()).isInstanceOf(ArrayList.class);
        assertThat(service.getMethod("index").newArg()).isEqualTo("");
        assertThat(service.getMethod("index").newReply()).isInstanceOf(HashMap.class);
    }

    @Test
    public void testVoidMethodFillsReplyInPlace() throws Exception {
        Service service = Service.of(new Calc());
        MethodEntry<?, ?> names = service.getMethod("names");
        Object slot = names.newReply();

        Object reply = service.call(names, 2, slot);

        assertThat(reply).isSameAs(slot);
        assertThat(reply).isEqualTo(List.of("n0", "n1"));
    }

    @Test
    public void testMethodErrorPropagates() {
        Service service = Service.of(new Calc());
        MethodEntry<?, ?> fail = service.getMethod("fail");

        assertThatThrownBy(() -> service.call(fail, new Args(), 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertThat(fail.getNumCalls()).isEqualTo(1);
    }

    @Test
    public void testUnexportedReceiverIsRejected() {
        assertThatThrownBy(() -> Service.of(new PackagePrivate()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a valid service name");
        assertThatThrownBy(() -> Service.of(new Object() {
        })).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testBuilderRegistersExplicitHandlers() throws Exception {
        Service service = Service.builder("Echo")
                .method("upper", String.class, String.class, (arg, reply) -> arg.toUpperCase())
                .method("len", String.class, int.class, (arg, reply) -> arg.length())
                .build();
        MethodEntry<?, ?> len = service.getMethod("len");

        assertThat(len.getReplyType()).isEqualTo(Integer.class);
        assertThat(service.call(service.getMethod("upper"), "abc", "")).isEqualTo("ABC");
        assertThat(service.call(len, "abcd", 0)).isEqualTo(4);
    }

    @Test
    public void testBuilderRejectsDuplicateMethod() {
        Service.Builder builder = Service.builder("Echo")
                .method("upper", String.class, String.class, (arg, reply) -> arg);

        assertThatThrownBy(() -> builder.method("upper", String.class, String.class, (arg, reply) -> arg))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Echo.upper");
    }
}
