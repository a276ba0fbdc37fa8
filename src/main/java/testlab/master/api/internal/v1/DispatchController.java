package testlab.master.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import testlab.master.api.Controller;
import testlab.master.api.internal.v1.dto.OutcomeRequest;
import testlab.master.api.v1.dto.OperationResponse;
import testlab.master.model.OutcomeResult;
import testlab.master.server.RouterHandler;
import testlab.master.service.JobService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Callbacks from an external dispatch gateway (internal API).
 *
 * POST /internal/v1/jobs/{jobId}/devices/{hostname}/started
 * POST /internal/v1/jobs/{jobId}/devices/{hostname}/outcome
 *
 * Repeated callbacks answer ALREADY_TERMINAL with 200.
 */
public class DispatchController implements Controller {

    private static final Pattern CALLBACK_PATTERN =
            Pattern.compile("^/internal/v1/jobs/(\\d+)/devices/([^/]+)/(started|outcome)$");

    private final JobService jobService;

    public DispatchController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && CALLBACK_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = CALLBACK_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown callback endpoint");
        }
        long jobId = Long.parseLong(m.group(1));
        String hostname = m.group(2);

        OutcomeResult result;
        if ("started".equals(m.group(3))) {
            result = jobService.reportStarted(jobId, hostname);
        } else {
            OutcomeRequest request = RouterHandler.readBody(req, OutcomeRequest.class);
            result = jobService.reportOutcome(jobId, hostname, request.toOutcome());
        }

        return switch (result) {
            case RECORDED, ALREADY_TERMINAL -> ControllerResponse.json(
                    RouterHandler.toJson(OperationResponse.success(result)));
            case NOT_FOUND -> ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.toJson(OperationResponse.error(result, "job not found")));
            case WRONG_DEVICE -> ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.toJson(OperationResponse.error(result, hostname + " is not part of job " + jobId)));
        };
    }
}
