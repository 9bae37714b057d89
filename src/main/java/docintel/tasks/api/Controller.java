package docintel.tasks.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One group of HTTP routes. The router asks each registered controller in turn
 * whether it owns a request and hands the first match the full request.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Build the response for a request this controller matched.
     * Validation problems may be thrown as {@link IllegalArgumentException}; the router answers 400.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Status, content type and body to write back.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse notFound(String message) {
            return errorBody(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorBody(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorBody(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        /** 503, used when the task store backend is failing */
        public static ControllerResponse unavailable(String message) {
            return errorBody(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        /** {@code {"error": message}} with the given status */
        public static ControllerResponse errorBody(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, JSON, "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
