package docintel.tasks.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import docintel.tasks.api.Controller;
import docintel.tasks.api.Controller.ControllerResponse;
import docintel.tasks.store.TaskStoreException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches each aggregated HTTP request to the first {@link Controller} that matches it.
 *
 * Error mapping for exceptions that escape a controller:
 * {@link IllegalArgumentException} is 400, {@link TaskStoreException} is 503, anything else is 500.
 * Unmatched requests get a JSON 404.
 *
 * Stateless per channel, so one instance is shared by the whole pipeline.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Add a controller; earlier registrations win when two match the same request.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();

        ControllerResponse response;
        try {
            response = dispatch(ctx, req, method, path);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (TaskStoreException e) {
            log.warn("Task store unavailable for {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.unavailable("task store unavailable");
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error("internal error");
        }
        send(ctx, response);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }
        log.debug("No route for {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    private void send(ChannelHandlerContext ctx, ControllerResponse response) {
        String body = response.body() == null ? "" : response.body();
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Shared ObjectMapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
