package com.anzhi.simplerpc.discovery;

import com.anzhi.simplerpc.error.RpcException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MultiServersDiscoveryTest {

    private static final List<String> SERVERS = List.of("127.0.0.1:9001", "127.0.0.1:9002", "127.0.0.1:9003");

    @Test
    public void testRoundRobinVisitsEachServerOncePerCycle() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS, new Random(42));

        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picked.add(discovery.get(SelectMode.ROUND_ROBIN));
        }

        assertThat(picked.subList(0, 3)).containsExactlyInAnyOrderElementsOf(SERVERS);
        assertThat(picked.subList(3, 6)).isEqualTo(picked.subList(0, 3));
        // 从随机位置开始，之后按列表顺序前进
        int start = SERVERS.indexOf(picked.get(0));
        for (int i = 0; i < 6; i++) {
            assertThat(picked.get(i)).isEqualTo(SERVERS.get((start + i) % SERVERS.size()));
        }
    }

    @Test
    public void testRoundRobinSurvivesShrinkingList() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS, new Random(7));
        discovery.get(SelectMode.ROUND_ROBIN);
        discovery.get(SelectMode.ROUND_ROBIN);

        discovery.update(List.of("127.0.0.1:9009"));

        for (int i = 0; i < 3; i++) {
            assertThat(discovery.get(SelectMode.ROUND_ROBIN)).isEqualTo("127.0.0.1:9009");
        }
    }

    @Test
    public void testRandomPicksMember() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS);

        for (int i = 0; i < 20; i++) {
            assertThat(discovery.get(SelectMode.RANDOM)).isIn(SERVERS);
        }
    }

    @Test
    public void testEmptyListFailsInBothModes() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(Collections.emptyList());

        assertThatThrownBy(() -> discovery.get(SelectMode.RANDOM))
                .isInstanceOf(RpcException.class)
                .hasMessage("rpc discovery: no available servers");
        assertThatThrownBy(() -> discovery.get(SelectMode.ROUND_ROBIN))
                .isInstanceOf(RpcException.class)
                .hasMessage("rpc discovery: no available servers");
    }

    @Test
    public void testUnsupportedMode() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS);

        assertThatThrownBy(() -> discovery.get(null))
                .isInstanceOf(RpcException.class)
                .hasMessage("rpc discovery: not supported select mode");
    }

    @Test
    public void testGetAllReturnsCopy() {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS);

        List<String> all = discovery.getAll();
        all.clear();

        assertThat(discovery.getAll()).isEqualTo(SERVERS);
    }

    @Test
    public void testUpdateReplacesList() throws InterruptedException {
        MultiServersDiscovery discovery = new MultiServersDiscovery(SERVERS);

        discovery.refresh();
        discovery.update(List.of("127.0.0.1:9004"));

        assertThat(discovery.getAll()).containsExactly("127.0.0.1:9004");
    }
}
