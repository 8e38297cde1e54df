package prism.worker.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON body of a simpleperf configuration.
 *
 * @param debugAppId package to profile, or {@code system} for a system-wide record
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimpleperfOptions(
        @JsonProperty("debug_app_id") String debugAppId,
        @JsonProperty("events") List<String> events,
        @JsonProperty("frequency") Integer frequency,
        @JsonProperty("call_graph") String callGraph,
        @JsonProperty("record_command") String recordCommand,
        @JsonProperty("extra_args") List<String> extraArgs) {

    public boolean systemWide() {
        return "system".equalsIgnoreCase(debugAppId);
    }

    /** simpleperf command line writing to {@code output} */
    List<String> commandLine(String output, int durationSeconds) {
        if (debugAppId == null || debugAppId.isBlank()) {
            throw new IllegalArgumentException("debug_app_id is required");
        }
        List<String> args = new ArrayList<>();
        args.add("simpleperf");
        args.add(recordCommand != null ? recordCommand : "record");
        if (systemWide()) {
            args.add("-a");
        } else {
            args.add("--app");
            args.add(debugAppId);
        }
        args.add("-o");
        args.add(output);
        args.add("--duration");
        args.add(Integer.toString(durationSeconds));
        String graph = callGraph != null ? callGraph : "dwarf";
        if (!"none".equalsIgnoreCase(graph)) {
            args.add("-g");
            args.add("--call-graph");
            args.add(graph);
        }
        args.add("-f");
        args.add(Integer.toString(frequency != null ? frequency : 4000));
        for (String event : events != null && !events.isEmpty() ? events : List.of("cpu-cycles")) {
            args.add("-e");
            args.add(event);
        }
        if (extraArgs != null) {
            args.addAll(extraArgs);
        }
        return args;
    }
}
