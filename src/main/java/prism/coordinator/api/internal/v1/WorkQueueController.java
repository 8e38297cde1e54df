package prism.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import prism.coordinator.api.Controller;
import prism.coordinator.api.Requests;
import prism.coordinator.api.internal.v1.dto.*;
import prism.coordinator.api.v1.dto.JobResponse;
import prism.coordinator.model.*;
import prism.coordinator.server.RouterHandler;
import prism.coordinator.service.JobService;
import prism.coordinator.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dispatch queue and job progress endpoints used by worker hosts.
 *
 * GET /internal/v1/jobs/pending - Claimable job devices, oldest job first
 * GET /internal/v1/jobs/{jobId} - Job with devices, for aggregate recompute
 * POST /internal/v1/job-devices/{id}/status - Claim (running) or finish
 * POST /internal/v1/jobs/{jobId}/updates - Append a progress event
 * POST /internal/v1/jobs/{jobId}/status - Write the aggregate status
 */
public class WorkQueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkQueueController.class);

    private static final String PENDING_PATH = "/internal/v1/jobs/pending";
    private static final Pattern JOB_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)$");
    private static final Pattern JOB_DEVICE_STATUS_PATTERN = Pattern
            .compile("^/internal/v1/job-devices/([^/]+)/status$");
    private static final Pattern JOB_UPDATES_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/updates$");
    private static final Pattern JOB_STATUS_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/status$");

    private final JobService jobService;

    public WorkQueueController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return PENDING_PATH.equals(path) || JOB_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return JOB_DEVICE_STATUS_PATTERN.matcher(path).matches()
                    || JOB_UPDATES_PATTERN.matcher(path).matches()
                    || JOB_STATUS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws IOException {
        if (PENDING_PATH.equals(path)) {
            return ControllerResponse.json(Requests.json(
                    jobService.listPendingJobDevices().stream().map(PendingJobDeviceDto::from).toList()));
        }

        Matcher m = JOB_PATTERN.matcher(path);
        if (m.matches()) {
            String jobId = m.group(1);
            JobRequest job = jobService.getJob(jobId).orElseThrow(() -> NotFoundException.of("job", jobId));
            return ControllerResponse.json(Requests.json(JobResponse.from(job)));
        }

        m = JOB_DEVICE_STATUS_PATTERN.matcher(path);
        if (m.matches()) {
            return handleJobDeviceStatus(ctx, req, m.group(1));
        }

        m = JOB_UPDATES_PATTERN.matcher(path);
        if (m.matches()) {
            JobUpdateRequest body = Requests.body(req, JobUpdateRequest.class);
            JobUpdate stored = jobService.appendJobUpdate(
                    m.group(1), body.deviceId(), body.status(), body.message(), body.traceId());
            return ControllerResponse.json(HttpResponseStatus.CREATED, Requests.json(JobUpdateDto.from(stored)));
        }

        m = JOB_STATUS_PATTERN.matcher(path);
        if (m.matches()) {
            JobStatusRequest body = Requests.body(req, JobStatusRequest.class);
            boolean changed = jobService.updateJobStatus(
                    m.group(1), JobStatus.fromWire(body.status()), body.resultSummary());
            return ControllerResponse.json(Requests.json(changed
                    ? OperationResponse.success("updated")
                    : OperationResponse.unchanged("already_terminal")));
        }

        return ControllerResponse.notFound("unknown work queue endpoint");
    }

    /**
     * {@code running} is the claim: 409 when another host won it.
     */
    private ControllerResponse handleJobDeviceStatus(ChannelHandlerContext ctx, FullHttpRequest req,
            String jobDeviceId) throws IOException {
        JobDeviceStatusRequest body = Requests.body(req, JobDeviceStatusRequest.class);
        JobDeviceStatus status = JobDeviceStatus.fromWire(body.status());

        if (status == JobDeviceStatus.RUNNING) {
            String host = RouterHandler.hostOf(ctx, body.host());
            ClaimResult result = jobService.claim(jobDeviceId, host);
            return switch (result) {
                case CLAIMED -> ControllerResponse.json(Requests.json(OperationResponse.success("claimed")));
                case LOST -> ControllerResponse.conflict("job device already claimed: " + jobDeviceId);
                case NOT_FOUND -> throw NotFoundException.of("job device", jobDeviceId);
            };
        }

        JobDeviceUpdateResult result = jobService.updateJobDeviceStatus(jobDeviceId, status);
        if (result == JobDeviceUpdateResult.NOT_FOUND) {
            throw NotFoundException.of("job device", jobDeviceId);
        }
        log.debug("Job device {} -> {}: {}", jobDeviceId, status.wireName(), result);
        String outcome = result.name().toLowerCase(Locale.ROOT);
        return ControllerResponse.json(Requests.json(result == JobDeviceUpdateResult.UPDATED
                ? OperationResponse.success(outcome)
                : OperationResponse.unchanged(outcome)));
    }
}
