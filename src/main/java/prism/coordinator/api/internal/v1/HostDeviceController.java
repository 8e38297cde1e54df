package prism.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.internal.v1.dto.DeviceReport;
import prism.coordinator.api.internal.v1.dto.OperationResponse;
import prism.coordinator.api.internal.v1.dto.SweepRequest;
import prism.coordinator.api.v1.dto.DeviceDto;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.server.RouterHandler;
import prism.coordinator.service.DeviceRegistry;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Device liveness endpoints used by worker hosts.
 *
 * GET /internal/v1/devices - All devices
 * POST /internal/v1/devices - Upsert by serial and report liveness
 * PUT /internal/v1/devices/{id} - Rename and report liveness
 * POST /internal/v1/hosts/{host}/sweep - Mark unobserved devices offline
 */
public class HostDeviceController implements Controller {

    private static final String DEVICES_PATH = "/internal/v1/devices";
    private static final Pattern DEVICE_PATTERN = Pattern.compile("^/internal/v1/devices/([^/]+)$");
    private static final Pattern SWEEP_PATTERN = Pattern.compile("^/internal/v1/hosts/([^/]+)/sweep$");

    private final DeviceRegistry deviceRegistry;

    public HostDeviceController(DeviceRegistry deviceRegistry) {
        this.deviceRegistry = deviceRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (DEVICES_PATH.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (DEVICE_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.PUT);
        }
        return method.equals(HttpMethod.POST) && SWEEP_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (DEVICES_PATH.equals(path)) {
            if (req.method().equals(HttpMethod.GET)) {
                return ControllerResponse.json(Requests.json(
                        deviceRegistry.listAll().stream().map(DeviceDto::from).toList()));
            }
            DeviceReport report = Requests.body(req, DeviceReport.class);
            if (report.deviceUuid() == null || report.deviceUuid().isBlank()) {
                throw new IllegalArgumentException("device_uuid is required");
            }
            Device device = deviceRegistry.upsert(report.deviceUuid(), report.deviceName());
            device = deviceRegistry.reportLiveness(device.id(), statusOf(report),
                    RouterHandler.hostOf(ctx, report.host()));
            return ControllerResponse.json(Requests.json(DeviceDto.from(device)));
        }

        Matcher m = DEVICE_PATTERN.matcher(path);
        if (m.matches()) {
            DeviceReport report = Requests.body(req, DeviceReport.class);
            Device device = deviceRegistry.update(m.group(1), report.deviceName(), statusOf(report),
                    RouterHandler.hostOf(ctx, report.host()));
            return ControllerResponse.json(Requests.json(DeviceDto.from(device)));
        }

        m = SWEEP_PATTERN.matcher(path);
        if (m.matches()) {
            SweepRequest body = Requests.body(req, SweepRequest.class);
            String host = RouterHandler.hostOf(ctx, m.group(1));
            List<String> observed = body.onlineDeviceIds() != null ? body.onlineDeviceIds() : List.of();
            int swept = deviceRegistry.sweep(host, observed);
            return ControllerResponse.json(Requests.json(OperationResponse.counted(swept)));
        }

        return ControllerResponse.notFound("unknown device endpoint");
    }

    private static DeviceStatus statusOf(DeviceReport report) {
        return report.lastStatus() == null ? DeviceStatus.ONLINE : DeviceStatus.fromWire(report.lastStatus());
    }
}
