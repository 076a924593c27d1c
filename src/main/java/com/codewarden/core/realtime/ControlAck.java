package com.codewarden.core.realtime;

import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.RealtimeAnalysisResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outbound message on the control channel: a per-request acknowledgment or
 * an unsolicited {@code realtime_analysis} broadcast. Error acknowledgments
 * carry only {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlAck(String type, String path, Object result, String error) {

    public static ControlAck watchStarted(String path) {
        return new ControlAck("watch_started", path, null, null);
    }

    public static ControlAck watchStopped(String path) {
        return new ControlAck("watch_stopped", path, null, null);
    }

    public static ControlAck analysisResult(AnalysisReport report) {
        return new ControlAck("analysis_result", null, report, null);
    }

    public static ControlAck realtimeAnalysis(RealtimeAnalysisResult result) {
        return new ControlAck("realtime_analysis", null, result, null);
    }

    public static ControlAck error(String message) {
        return new ControlAck(null, null, null, message);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
