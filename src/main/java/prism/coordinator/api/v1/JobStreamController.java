package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.server.ChannelEventSink;
import prism.coordinator.stream.ProgressStream;
import prism.coordinator.stream.SseFrames;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /api/v1/jobs/{jobId}/stream - Server-sent progress events.
 * Resumes after {@code ?since=} or the {@code Last-Event-ID} header.
 */
public class JobStreamController implements Controller {

    private static final Pattern STREAM_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/stream$");

    private final ProgressStream progressStream;

    public JobStreamController(ProgressStream progressStream) {
        this.progressStream = progressStream;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && STREAM_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = STREAM_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown stream endpoint");
        }
        String jobId = m.group(1);

        String resume = Requests.query(req, "since").orElse(req.headers().get("Last-Event-ID"));
        Instant since = SseFrames.parseResumePoint(resume);

        // throws NotFoundException before anything is written
        progressStream.subscribe(jobId, since, new ChannelEventSink(ctx.channel()));
        return ControllerResponse.STREAMING;
    }
}
