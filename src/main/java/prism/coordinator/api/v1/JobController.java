package prism.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.v1.dto.CreateJobRequest;
import prism.coordinator.api.v1.dto.CreateJobResponse;
import prism.coordinator.api.v1.dto.JobResponse;
import prism.coordinator.model.Configuration;
import prism.coordinator.model.JobRequest;
import prism.coordinator.service.ConfigurationService;
import prism.coordinator.service.JobService;
import prism.coordinator.service.NotFoundException;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job requests (public API).
 *
 * POST /api/v1/jobs - Create a new job
 * GET /api/v1/jobs?limit=N - Recent jobs
 * GET /api/v1/jobs/{jobId} - Get job with its devices
 */
public class JobController implements Controller {

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final JobService jobService;
    private final ConfigurationService configurationService;

    public JobController(JobService jobService, ConfigurationService configurationService) {
        this.jobService = jobService;
        this.configurationService = configurationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (JOBS_PATTERN.matcher(path).matches()) {
            if (req.method().equals(HttpMethod.POST)) {
                return handleCreateJob(req);
            }
            return handleListJobs(req);
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (jobMatcher.matches()) {
            String jobId = jobMatcher.group(1);
            JobRequest job = jobService.getJob(jobId).orElseThrow(() -> NotFoundException.of("job", jobId));
            return ControllerResponse.json(Requests.json(JobResponse.from(job)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs - Create a new job
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws IOException {
        CreateJobRequest request = Requests.body(req, CreateJobRequest.class);
        request.validate();

        int duration = request.duration() != null
                ? request.duration()
                : defaultDuration(request.configId());

        JobRequest job = jobService.createJob(request.configId(), request.deviceIds(), duration);

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                Requests.json(CreateJobResponse.from(job)));
    }

    /**
     * GET /api/v1/jobs - Recent jobs, newest first
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws IOException {
        int limit = Requests.queryInt(req, "limit", 0);
        return ControllerResponse.json(Requests.json(
                jobService.listRecent(limit).stream().map(JobResponse::from).toList()));
    }

    private int defaultDuration(String configId) {
        Configuration configuration = configurationService.require(configId);
        if (configuration.defaultDuration() == null) {
            throw new IllegalArgumentException("duration is required");
        }
        return configuration.defaultDuration();
    }
}
