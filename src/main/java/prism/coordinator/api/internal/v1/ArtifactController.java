package prism.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.internal.v1.dto.UploadResponse;
import prism.coordinator.api.v1.dto.ConfigurationDto;
import prism.coordinator.api.v1.dto.TraceDto;
import prism.coordinator.model.Trace;
import prism.coordinator.server.RouterHandler;
import prism.coordinator.service.ConfigurationService;
import prism.coordinator.service.TraceService;
import prism.coordinator.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Endpoints a worker needs to run and persist a trace.
 *
 * GET /internal/v1/configs/{id} - Configuration to run
 * POST /internal/v1/storage/upload?bucket=&object_name= - Raw artifact upload
 * POST /internal/v1/traces - Record trace metadata
 */
public class ArtifactController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ArtifactController.class);

    private static final Pattern CONFIG_PATTERN = Pattern.compile("^/internal/v1/configs/([^/]+)$");
    private static final String UPLOAD_PATH = "/internal/v1/storage/upload";
    private static final String TRACES_PATH = "/internal/v1/traces";

    private final ConfigurationService configurationService;
    private final TraceService traceService;
    private final ObjectStore objectStore;

    public ArtifactController(ConfigurationService configurationService, TraceService traceService,
            ObjectStore objectStore) {
        this.configurationService = configurationService;
        this.traceService = traceService;
        this.objectStore = objectStore;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return CONFIG_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && (UPLOAD_PATH.equals(path) || TRACES_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        Matcher m = CONFIG_PATTERN.matcher(path);
        if (m.matches()) {
            return ControllerResponse.json(Requests.json(
                    ConfigurationDto.from(configurationService.require(m.group(1)))));
        }

        if (UPLOAD_PATH.equals(path)) {
            String bucket = Requests.query(req, "bucket").orElse(ObjectStore.TRACES_BUCKET);
            String objectName = Requests.query(req, "object_name")
                    .orElseThrow(() -> new IllegalArgumentException("object_name is required"));
            byte[] content = Requests.rawBody(req);
            objectStore.upload(bucket, objectName, content);
            log.info("Stored {}/{} ({} bytes)", bucket, objectName, content.length);
            return ControllerResponse.json(HttpResponseStatus.CREATED,
                    Requests.json(new UploadResponse(bucket, objectName, content.length)));
        }

        TraceDto body = Requests.body(req, TraceDto.class);
        Trace trace = traceService.create(body.traceName(), body.traceFilename(), body.deviceId(),
                RouterHandler.hostOf(ctx, body.hostName()), body.configurationId(), body.traceTimestamp());
        return ControllerResponse.json(HttpResponseStatus.CREATED, Requests.json(TraceDto.from(trace)));
    }
}
