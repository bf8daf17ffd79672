package com.a2a.bootstrap;

import com.a2a.framework.NativeFramework;
import com.a2a.message.wire.WireShape;
import com.a2a.provider.echo.EchoProvider;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentGatewayTest {

    private final AgentGateway gateway = new AgentGateway(new NativeFramework(new EchoProvider()));

    @Test
    void reply_chatCompletions() throws Exception {
        String body = "{\"model\":\"x\",\"messages\":["
                + "{\"role\":\"user\",\"content\":\"first\"},"
                + "{\"role\":\"assistant\",\"content\":\"ok\"},"
                + "{\"role\":\"user\",\"content\":\"  ping  \"}]}";

        assertEquals("Hello, you said: ping", gateway.reply(body).get(10, TimeUnit.SECONDS));
    }

    @Test
    void reply_jsonRpc() throws Exception {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"message/send\",\"params\":{\"message\":"
                + "{\"role\":\"user\",\"messageId\":\"m\",\"parts\":[{\"kind\":\"text\",\"text\":\"ping\"}]}}}";

        assertEquals("Hello, you said: ping", gateway.reply(body).get(10, TimeUnit.SECONDS));
    }

    @Test
    void reply_a2aEnvelope() throws Exception {
        String body = "{\"method\":\"message/send\",\"params\":{\"message\":"
                + "{\"role\":\"user\",\"messageId\":\"m\",\"parts\":[{\"type\":\"text\",\"text\":\"ping\"}]}}}";

        assertEquals("Hello, you said: ping", gateway.reply(WireShape.A2A, body).get(10, TimeUnit.SECONDS));
    }

    @Test
    void reply_noUserTextGreetsWorld() throws Exception {
        assertEquals("Hello, World!", gateway.reply("{\"messages\":[]}").get(10, TimeUnit.SECONDS));
    }

    @Test
    void reply_rejectsUnsupportedPayload() {
        assertThrows(IllegalArgumentException.class, () -> gateway.reply("{\"hello\":\"world\"}"));
        assertThrows(IllegalArgumentException.class, () -> gateway.reply("not json"));
    }
}
