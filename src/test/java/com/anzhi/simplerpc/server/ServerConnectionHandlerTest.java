package com.anzhi.simplerpc.server;

import com.anzhi.simplerpc.Option;
import com.anzhi.simplerpc.codec.CodecType;
import com.anzhi.simplerpc.codec.HandshakeSerializer;
import com.anzhi.simplerpc.codec.Header;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 用原始 socket 观察连接级别的行为：握手失败、坏帧、超时后只回一次响应。
 */
public class ServerConnectionHandlerTest {

    private static final CBORMapper CBOR = new CBORMapper();

    private RpcServer server;
    private Socket socket;
    private DataOutputStream out;
    private DataInputStream in;

    @BeforeEach
    public void setUp() throws Exception {
        server = new RpcServer();
        server.register(new Arith());
        int port = server.start("127.0.0.1", 0).getPort();
        socket = new Socket("127.0.0.1", port);
        socket.setSoTimeout(5000);
        out = new DataOutputStream(socket.getOutputStream());
        in = new DataInputStream(socket.getInputStream());
    }

    @AfterEach
    public void tearDown() throws IOException {
        socket.close();
        server.shutdown();
    }

    @Test
    public void testUnknownCodecClosesWithoutResponse() throws IOException {
        writeFrame(HandshakeSerializer.serialize(
                new Option(Option.MAGIC_NUMBER, "application/x-unknown", Duration.ofSeconds(1), Duration.ZERO)));

        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testBadMagicClosesWithoutResponse() throws IOException {
        writeFrame(HandshakeSerializer.serialize(
                new Option(0x123456, CodecType.BINARY, Duration.ofSeconds(1), Duration.ZERO)));

        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testGarbledOptionClosesWithoutResponse() throws IOException {
        writeFrame("{not json".getBytes());

        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testMalformedHeaderClosesConnection() throws IOException {
        handshake(Duration.ZERO);
        writeFrame(new byte[]{(byte) 0xff, 0x00, 0x13});

        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testPeerHalfCloseWaitsForInFlightRequest() throws IOException {
        handshake(Duration.ZERO);
        writeFrame(CBOR.writeValueAsBytes(new Header("Arith.sleep", 1)));
        writeFrame(CBOR.writeValueAsBytes(200));
        socket.shutdownOutput();

        // 读到 EOF 以后依然等正在处理的请求回复完再关闭
        Header header = readHeader();
        assertThat(header.getSeq()).isEqualTo(1);
        assertThat(header.getError()).isEmpty();
        assertThat(readBody(Integer.class)).isEqualTo(200);
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testTimedOutRequestGetsExactlyOneResponse() throws IOException {
        handshake(Duration.ofMillis(50));
        writeFrame(CBOR.writeValueAsBytes(new Header("Arith.sleep", 7)));
        writeFrame(CBOR.writeValueAsBytes(300));

        Header header = readHeader();
        assertThat(header.getSeq()).isEqualTo(7);
        assertThat(header.getError()).isEqualTo("rpc server: request handle timeout: expect within 50ms");
        in.readFully(new byte[in.readInt()]);

        // 方法 300ms 后才结束，它的结果不能再写出来
        socket.setSoTimeout(800);
        assertThatThrownBy(in::readInt).isInstanceOf(SocketTimeoutException.class);
    }

    @Test
    public void testHugeHandleTimeoutStillServes() throws IOException {
        handshake(Duration.ofDays(365L * 400));
        writeFrame(CBOR.writeValueAsBytes(new Header("Arith.sum", 1)));
        writeFrame(CBOR.writeValueAsBytes(new Arith.Args(3, 4)));

        Header header = readHeader();
        assertThat(header.getError()).isEmpty();
        assertThat(readBody(Integer.class)).isEqualTo(7);

        // 关闭写方向后连接能正常排空并关闭
        socket.shutdownOutput();
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    public void testTimeoutConversionSaturates() {
        assertThat(ServerConnectionHandler.toNanos(Duration.ofMillis(5))).isEqualTo(5_000_000L);
        assertThat(ServerConnectionHandler.toNanos(Duration.ofDays(365L * 400))).isEqualTo(Long.MAX_VALUE);
        assertThat(ServerConnectionHandler.format(Duration.ofMillis(1500))).isEqualTo("1500ms");
        assertThat(ServerConnectionHandler.format(Duration.ofSeconds(2))).isEqualTo("2s");
        assertThat(ServerConnectionHandler.format(Duration.ofNanos(2500))).isEqualTo("2us");
    }

    @Test
    public void testResponsesKeepRequestSeq() throws IOException {
        handshake(Duration.ZERO);
        for (int seq = 1; seq <= 3; seq++) {
            writeFrame(CBOR.writeValueAsBytes(new Header("Arith.sum", seq)));
            writeFrame(CBOR.writeValueAsBytes(new Arith.Args(seq, seq)));
        }
        int answered = 0;
        for (int i = 0; i < 3; i++) {
            Header header = readHeader();
            assertThat(header.getError()).isEmpty();
            assertThat(readBody(Integer.class)).isEqualTo(2 * header.getSeq());
            answered++;
        }
        assertThat(answered).isEqualTo(3);
    }

    private void handshake(Duration handleTimeout) throws IOException {
        writeFrame(HandshakeSerializer.serialize(Option.defaults().withHandleTimeout(handleTimeout)));
    }

    private void writeFrame(byte[] data) throws IOException {
        out.writeInt(data.length);
        out.write(data);
        out.flush();
    }

    private Header readHeader() throws IOException {
        return readBody(Header.class);
    }

    private <T> T readBody(Class<T> type) throws IOException {
        byte[] data = new byte[in.readInt()];
        in.readFully(data);
        return CBOR.readValue(data, type);
    }
}
