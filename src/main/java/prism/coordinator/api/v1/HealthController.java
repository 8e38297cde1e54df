package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.HealthResponse;
import prism.coordinator.model.Device;
import prism.coordinator.service.DeviceRegistry;
import prism.coordinator.store.Database;
import prism.coordinator.stream.ProgressStream;

import java.io.IOException;
import java.time.Instant;

/**
 * GET /api/v1/health - Liveness of the coordinator and its database.
 */
public class HealthController implements Controller {

    private final Database database;
    private final DeviceRegistry deviceRegistry;
    private final ProgressStream progressStream;

    public HealthController(Database database, DeviceRegistry deviceRegistry, ProgressStream progressStream) {
        this.database = database;
        this.deviceRegistry = deviceRegistry;
        this.progressStream = progressStream;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        boolean dbHealthy = database.isHealthy();
        long online = dbHealthy ? deviceRegistry.listAll().stream().filter(Device::isOnline).count() : 0;

        HealthResponse response = new HealthResponse(
                dbHealthy ? "ok" : "degraded",
                dbHealthy,
                online,
                progressStream.activeSubscriptions(),
                Instant.now());

        return ControllerResponse.json(
                dbHealthy ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                Requests.json(response));
    }
}
