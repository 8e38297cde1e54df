package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.ConfigurationDto;
import prism.coordinator.model.Configuration;
import prism.coordinator.service.ConfigurationService;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for trace configurations (public API).
 *
 * POST /api/v1/configs - Create
 * GET /api/v1/configs - List
 * GET /api/v1/configs/{id} - Read
 * PUT /api/v1/configs/{id} - Overwrite in place
 */
public class ConfigurationController implements Controller {

    private static final Pattern CONFIGS_PATTERN = Pattern.compile("^/api/v1/configs$");
    private static final Pattern CONFIG_BY_ID_PATTERN = Pattern.compile("^/api/v1/configs/([^/]+)$");

    private final ConfigurationService configurationService;

    public ConfigurationController(ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (CONFIGS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (CONFIG_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (CONFIGS_PATTERN.matcher(path).matches()) {
            if (req.method().equals(HttpMethod.GET)) {
                return ControllerResponse.json(Requests.json(
                        configurationService.list().stream().map(ConfigurationDto::from).toList()));
            }
            ConfigurationDto body = Requests.body(req, ConfigurationDto.class);
            Configuration created = configurationService.save(null, body.configName(), body.configText(),
                    body.tracingTool(), body.defaultDuration());
            return ControllerResponse.json(HttpResponseStatus.CREATED, Requests.json(ConfigurationDto.from(created)));
        }

        Matcher m = CONFIG_BY_ID_PATTERN.matcher(path);
        if (m.matches()) {
            String configId = m.group(1);
            if (req.method().equals(HttpMethod.GET)) {
                return ControllerResponse.json(Requests.json(
                        ConfigurationDto.from(configurationService.require(configId))));
            }
            configurationService.require(configId);
            ConfigurationDto body = Requests.body(req, ConfigurationDto.class);
            Configuration saved = configurationService.save(configId, body.configName(), body.configText(),
                    body.tracingTool(), body.defaultDuration());
            return ControllerResponse.json(Requests.json(ConfigurationDto.from(saved)));
        }

        return ControllerResponse.notFound("unknown configuration endpoint");
    }
}
