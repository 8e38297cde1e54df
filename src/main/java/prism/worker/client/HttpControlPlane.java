package prism.worker.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import prism.coordinator.api.internal.v1.dto.DeviceReport;
import prism.coordinator.api.internal.v1.dto.JobDeviceStatusRequest;
import prism.coordinator.api.internal.v1.dto.JobStatusRequest;
import prism.coordinator.api.internal.v1.dto.JobUpdateRequest;
import prism.coordinator.api.internal.v1.dto.OperationResponse;
import prism.coordinator.api.internal.v1.dto.PendingJobDeviceDto;
import prism.coordinator.api.internal.v1.dto.SweepRequest;
import prism.coordinator.api.v1.dto.ConfigurationDto;
import prism.coordinator.api.v1.dto.DeviceDto;
import prism.coordinator.api.v1.dto.JobResponse;
import prism.coordinator.api.v1.dto.TraceDto;
import prism.coordinator.model.ClaimResult;
import prism.coordinator.model.Configuration;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.JobRequest;
import prism.coordinator.model.JobStatus;
import prism.coordinator.model.PendingJobDevice;
import prism.coordinator.model.Trace;
import prism.worker.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link ControlPlane} over the coordinator's {@code /internal/v1} HTTP API.
 * Reuses the coordinator's DTOs so both ends agree on the wire names.
 */
public class HttpControlPlane implements ControlPlane {

    private static final Logger log = LoggerFactory.getLogger(HttpControlPlane.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final String JSON = "application/json";

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final String hostName;
    private final String hostKey;
    private final Duration requestTimeout;

    public HttpControlPlane(WorkerConfig config) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .build(), config);
    }

    HttpControlPlane(HttpClient http, WorkerConfig config) {
        this.http = http;
        this.json = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.baseUrl = stripTrailingSlash(config.coordinatorUrl());
        this.hostName = config.hostName();
        this.hostKey = config.hasHostKey() ? config.hostKey() : null;
        this.requestTimeout = config.requestTimeout();
    }

    @Override
    public List<PendingJobDevice> pendingWork() {
        HttpResponse<String> resp = expectOk(send("GET", "/internal/v1/jobs/pending", null));
        List<PendingJobDeviceDto> dtos = read(resp, new TypeReference<List<PendingJobDeviceDto>>() {
        });
        List<PendingJobDevice> items = new ArrayList<>(dtos.size());
        for (PendingJobDeviceDto dto : dtos) {
            items.add(dto.toModel());
        }
        return items;
    }

    @Override
    public ClaimResult claim(String jobDeviceId) {
        HttpResponse<String> resp = send("POST", "/internal/v1/job-devices/" + segment(jobDeviceId) + "/status",
                new JobDeviceStatusRequest(JobDeviceStatus.RUNNING.wireName(), hostName));
        return switch (resp.statusCode()) {
            case 200 -> ClaimResult.CLAIMED;
            case 409 -> ClaimResult.LOST;
            case 404 -> ClaimResult.NOT_FOUND;
            default -> throw failure("claim " + jobDeviceId, resp);
        };
    }

    @Override
    public void finishJobDevice(String jobDeviceId, JobDeviceStatus status) {
        HttpResponse<String> resp = expectOk(send("POST",
                "/internal/v1/job-devices/" + segment(jobDeviceId) + "/status",
                new JobDeviceStatusRequest(status.wireName(), hostName)));
        OperationResponse result = read(resp, OperationResponse.class);
        if (!result.ok()) {
            log.warn("Job device {} not moved to {}: {}", jobDeviceId, status.wireName(), result.result());
        }
    }

    @Override
    public void postUpdate(String jobId, String deviceId, String status, String message, String traceId) {
        expectOk(send("POST", "/internal/v1/jobs/" + segment(jobId) + "/updates",
                new JobUpdateRequest(deviceId, status, message, traceId)));
    }

    @Override
    public Optional<JobRequest> job(String jobId) {
        HttpResponse<String> resp = send("GET", "/internal/v1/jobs/" + segment(jobId), null);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(read(expectOk(resp), JobResponse.class).toModel());
    }

    @Override
    public void postJobStatus(String jobId, JobStatus status, String resultSummary) {
        expectOk(send("POST", "/internal/v1/jobs/" + segment(jobId) + "/status",
                new JobStatusRequest(status.wireName(), resultSummary)));
    }

    @Override
    public Device reportDevice(String serial, String name, DeviceStatus status) {
        HttpResponse<String> resp = expectOk(send("POST", "/internal/v1/devices",
                new DeviceReport(name, serial, Instant.now(), status.wireName(), hostName)));
        return read(resp, DeviceDto.class).toModel();
    }

    @Override
    public int sweep(Collection<String> observed) {
        HttpResponse<String> resp = expectOk(send("POST", "/internal/v1/hosts/" + segment(hostName) + "/sweep",
                new SweepRequest(List.copyOf(observed))));
        OperationResponse result = read(resp, OperationResponse.class);
        return result.count() != null ? result.count() : 0;
    }

    @Override
    public Optional<Configuration> configuration(String configId) {
        HttpResponse<String> resp = send("GET", "/internal/v1/configs/" + segment(configId), null);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(read(expectOk(resp), ConfigurationDto.class).toModel());
    }

    @Override
    public void upload(String bucket, String objectName, byte[] content) {
        String path = "/internal/v1/storage/upload?bucket=" + query(bucket) + "&object_name=" + query(objectName);
        HttpRequest req = request(path)
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofByteArray(content))
                .build();
        expectOk(execute(req, "POST " + path));
        log.debug("Uploaded {}/{} ({} bytes)", bucket, objectName, content.length);
    }

    @Override
    public Trace createTrace(String name, String filename, String deviceId, String configurationId,
            Instant timestamp) {
        HttpResponse<String> resp = expectOk(send("POST", "/internal/v1/traces",
                new TraceDto(null, name, timestamp, filename, deviceId, hostName, configurationId)));
        return read(resp, TraceDto.class).toModel();
    }

    private HttpResponse<String> send(String method, String path, Object body) {
        HttpRequest.Builder builder = request(path).header("Accept", JSON);
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            String payload;
            try {
                payload = json.writeValueAsString(body);
            } catch (JsonProcessingException e) {
                throw new ControlPlaneException("Cannot encode request for " + path, e);
            }
            builder.header("Content-Type", JSON)
                    .method(method, HttpRequest.BodyPublishers.ofString(payload));
        }
        return execute(builder.build(), method + " " + path);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout);
        if (hostKey != null) {
            builder.header("Authorization", "Bearer " + hostKey);
        }
        return builder;
    }

    private HttpResponse<String> execute(HttpRequest req, String label) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            log.debug("{} -> {}", label, resp.statusCode());
            return resp;
        } catch (IOException e) {
            throw new ControlPlaneException(label + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlPlaneException(label + " interrupted", e);
        }
    }

    private HttpResponse<String> expectOk(HttpResponse<String> resp) {
        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            throw failure(resp.request().method() + " " + resp.request().uri().getPath(), resp);
        }
        return resp;
    }

    private static ControlPlaneException failure(String label, HttpResponse<String> resp) {
        String body = resp.body();
        if (body != null && body.length() > 200) {
            body = body.substring(0, 200);
        }
        return new ControlPlaneException(label + " returned " + resp.statusCode() + ": " + body, resp.statusCode());
    }

    private <T> T read(HttpResponse<String> resp, Class<T> type) {
        try {
            return json.readValue(resp.body(), type);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneException("Malformed response from " + resp.request().uri().getPath(), e);
        }
    }

    private <T> T read(HttpResponse<String> resp, TypeReference<T> type) {
        try {
            return json.readValue(resp.body(), type);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneException("Malformed response from " + resp.request().uri().getPath(), e);
        }
    }

    private static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String query(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
