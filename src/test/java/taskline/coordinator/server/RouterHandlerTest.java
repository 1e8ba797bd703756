package taskline.coordinator.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.*;
import taskline.coordinator.api.Controller;
import taskline.coordinator.config.CoordinatorConfig;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    @Test
    void validationMessageIsEscapedIntoJsonBody() throws Exception {
        String message = "bad \"text\" field\non two lines";
        EmbeddedChannel channel = new EmbeddedChannel(new RouterHandler(CoordinatorConfig.defaults())
                .registerController(new ThrowingController(new IllegalArgumentException(message))));

        FullHttpResponse response = roundTrip(channel, HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals(message, RouterHandler.mapper().readTree(bodyOf(response)).get("error").asText());
    }

    @Test
    void unexpectedErrorIsInternalError() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(new RouterHandler(CoordinatorConfig.defaults())
                .registerController(new ThrowingController(new IllegalStateException("secret detail"))));

        FullHttpResponse response = roundTrip(channel, HttpMethod.POST, "/boom");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertEquals("internal error", RouterHandler.mapper().readTree(bodyOf(response)).get("error").asText());
    }

    @Test
    void unknownRouteIsNotFound() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(new RouterHandler(CoordinatorConfig.defaults()));

        FullHttpResponse response = roundTrip(channel, HttpMethod.GET, "/nowhere?x=1");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("not found", RouterHandler.mapper().readTree(bodyOf(response)).get("error").asText());
    }

    @Test
    void internalRouteWithoutKeyIsForbidden() throws Exception {
        EmbeddedChannel channel = new EmbeddedChannel(
                new RouterHandler(CoordinatorConfig.defaults().withAgentKey("secret")));

        FullHttpResponse response = roundTrip(channel, HttpMethod.POST, "/internal/v1/tasks/t1/started");

        assertEquals(HttpResponseStatus.FORBIDDEN, response.status());
        assertEquals("forbidden", RouterHandler.mapper().readTree(bodyOf(response)).get("error").asText());
    }

    private static FullHttpResponse roundTrip(EmbeddedChannel channel, HttpMethod method, String uri) {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri));
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response);
        assertEquals("application/json; charset=utf-8", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        return response;
    }

    private static String bodyOf(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    private static final class ThrowingController implements Controller {

        private final RuntimeException error;

        ThrowingController(RuntimeException error) {
            this.error = error;
        }

        @Override
        public boolean matches(HttpMethod method, String path) {
            return path.equals("/boom");
        }

        @Override
        public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
            throw error;
        }
    }
}
