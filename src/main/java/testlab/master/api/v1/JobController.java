package testlab.master.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import testlab.master.api.Controller;
import testlab.master.api.v1.dto.CreateJobRequest;
import testlab.master.api.v1.dto.JobResponse;
import testlab.master.api.v1.dto.OperationResponse;
import testlab.master.model.CancelResult;
import testlab.master.model.Job;
import testlab.master.server.RouterHandler;
import testlab.master.service.JobQueue;
import testlab.master.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job submission and control (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs?limit=N - Most recent jobs
 * GET /api/v1/jobs/{jobId} - Job status, with group members for MultiNode jobs
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job (the whole group for MultiNode)
 * POST /api/v1/jobs/{jobId}/resubmit - Queue a copy of a finished job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/(\\d+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern.compile("^/api/v1/jobs/(\\d+)/(cancel|resubmit)$");
    private static final int DEFAULT_LIST_LIMIT = 50;

    private final JobService jobService;
    private final JobQueue jobQueue;

    public JobController(JobService jobService, JobQueue jobQueue) {
        this.jobService = jobService;
        this.jobQueue = jobQueue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST) ? handleSubmit(req) : handleList(req);
        }

        Matcher action = JOB_ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            long jobId = Long.parseLong(action.group(1));
            return "cancel".equals(action.group(2)) ? handleCancel(jobId) : handleResubmit(jobId);
        }

        Matcher byId = JOB_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            return handleGet(Long.parseLong(byId.group(1)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    private ControllerResponse handleSubmit(FullHttpRequest req) {
        CreateJobRequest request = RouterHandler.readBody(req, CreateJobRequest.class);
        Job job = jobService.submit(request.toJob());
        log.info("Job {} submitted over HTTP by {}", job.id(), job.submitter());
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.toJson(JobResponse.from(job)));
    }

    private ControllerResponse handleList(FullHttpRequest req) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        int limit = DEFAULT_LIST_LIMIT;
        List<String> limitParam = query.parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            limit = Integer.parseInt(limitParam.get(0));
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
        }
        List<JobResponse> jobs = jobQueue.recent(limit).stream().map(JobResponse::from).toList();
        return ControllerResponse.json(RouterHandler.toJson(jobs));
    }

    private ControllerResponse handleGet(long jobId) {
        return jobService.find(jobId)
                .map(job -> JobResponse.from(job, jobService.findGroup(jobId).orElse(null)))
                .map(response -> ControllerResponse.json(RouterHandler.toJson(response)))
                .orElseGet(() -> ControllerResponse.notFound("job not found: " + jobId));
    }

    private ControllerResponse handleCancel(long jobId) {
        CancelResult result = jobService.cancel(jobId);
        if (result == CancelResult.NOT_FOUND) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.toJson(OperationResponse.error(result, "job not found")));
        }
        return ControllerResponse.json(RouterHandler.toJson(OperationResponse.success(result)));
    }

    private ControllerResponse handleResubmit(long jobId) {
        Job copy = jobService.resubmit(jobId);
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.toJson(JobResponse.from(copy)));
    }
}
