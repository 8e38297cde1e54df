package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.DeviceDto;
import prism.coordinator.api.v1.dto.RegisterDeviceRequest;
import prism.coordinator.model.Device;
import prism.coordinator.service.DeviceRegistry;
import prism.coordinator.service.NotFoundException;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the device registry (public API).
 *
 * GET /api/v1/devices - List devices
 * POST /api/v1/devices - Register a device
 * GET /api/v1/devices/{serialOrId} - Look up one device
 */
public class DeviceController implements Controller {

    private static final Pattern DEVICES_PATTERN = Pattern.compile("^/api/v1/devices$");
    private static final Pattern DEVICE_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)$");

    private final DeviceRegistry deviceRegistry;

    public DeviceController(DeviceRegistry deviceRegistry) {
        this.deviceRegistry = deviceRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (DEVICES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.GET) && DEVICE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (DEVICES_PATTERN.matcher(path).matches()) {
            if (req.method().equals(HttpMethod.GET)) {
                return ControllerResponse.json(Requests.json(
                        deviceRegistry.listAll().stream().map(DeviceDto::from).toList()));
            }
            RegisterDeviceRequest body = Requests.body(req, RegisterDeviceRequest.class);
            Device device = deviceRegistry.register(body.deviceId(), body.deviceUuid(), body.deviceName());
            return ControllerResponse.json(HttpResponseStatus.CREATED, Requests.json(DeviceDto.from(device)));
        }

        Matcher m = DEVICE_PATTERN.matcher(path);
        if (m.matches()) {
            String key = m.group(1);
            Device device = deviceRegistry.lookup(key).orElseThrow(() -> NotFoundException.of("device", key));
            return ControllerResponse.json(Requests.json(DeviceDto.from(device)));
        }
        return ControllerResponse.notFound("unknown device endpoint");
    }
}
