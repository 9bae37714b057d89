package docintel.tasks.api.v1;

import docintel.tasks.api.Controller;
import docintel.tasks.cache.ResultCache;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result cache administration.
 * DELETE /api/v1/cache - Drop all cached results
 */
public class CacheController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final ResultCache resultCache;

    public CacheController(ResultCache resultCache) {
        this.resultCache = resultCache;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.DELETE) && "/api/v1/cache".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!resultCache.isEnabled()) {
            return ControllerResponse.badRequest("Caching is not enabled");
        }
        try {
            resultCache.clear();
            return ControllerResponse.json("{\"message\":\"Cache cleared successfully\"}");
        } catch (Exception e) {
            log.error("Cache clear failed", e);
            return ControllerResponse.error("cache clear failed");
        }
    }
}
