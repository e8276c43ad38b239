package ai.pipestream.s3manager.http;

import ai.pipestream.s3manager.access.AccessPolicy;
import ai.pipestream.s3manager.task.CancelResult;
import ai.pipestream.s3manager.task.TaskDispatcher;
import ai.pipestream.s3manager.task.TaskKind;
import ai.pipestream.s3manager.task.TaskParameters;
import ai.pipestream.s3manager.task.TaskSnapshot;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Background task API.
 * <p>
 * Start endpoints answer {@code 202} with a task id as soon as the task is queued; clients
 * then poll {@code /{id}/progress} until the status is terminal.
 */
@Path("/api/tasks")
@Produces(MediaType.APPLICATION_JSON)
public class TaskResource {

    static final String USER_HEADER = "x-user-id";

    @Inject
    TaskDispatcher dispatcher;

    @Inject
    AccessPolicy accessPolicy;

    @POST
    @Path("/bucket-delete/{bucket}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Response startBucketDelete(@PathParam("bucket") String bucket,
                                      BucketDeleteRequest request,
                                      @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        String account = request != null ? request.storageAccount() : null;
        TaskSnapshot task = dispatcher.start(TaskKind.BUCKET_DELETE, TaskParameters.forBucket(account, bucket), caller);
        return accepted(task, "Deletion of bucket " + bucket + " started");
    }

    @POST
    @Path("/prefix-delete/{bucket}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Response startPrefixDelete(@PathParam("bucket") String bucket,
                                      PrefixDeleteRequest request,
                                      @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        PrefixDeleteRequest body = request != null ? request : new PrefixDeleteRequest(null, null);
        TaskSnapshot task = dispatcher.start(TaskKind.PREFIX_DELETE,
                TaskParameters.forPrefix(body.storageAccount(), bucket, body.prefix()), caller);
        return accepted(task, "Deletion of " + bucket + "/" + body.prefix() + " started");
    }

    @POST
    @Path("/bulk-delete")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Response startBulkDelete(BulkDeleteRequest request, @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        BulkDeleteRequest body = request != null ? request : new BulkDeleteRequest(null, null, null);
        TaskSnapshot task = dispatcher.start(TaskKind.BULK_DELETE,
                TaskParameters.forKeys(body.storageAccount(), body.bucketName(), body.keys()), caller);
        return accepted(task, "Deletion of " + body.keys().size() + " items started");
    }

    @POST
    @Path("/calculate-size")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Response startCalculateSize(CalculateSizeRequest request, @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        CalculateSizeRequest body = request != null ? request : new CalculateSizeRequest(null, null, null);
        TaskSnapshot task = dispatcher.start(TaskKind.CALCULATE_SIZE,
                TaskParameters.forPrefix(body.storageAccount(), body.bucketName(), body.prefix()), caller);
        return accepted(task, "Size calculation for " + body.bucketName() + " started");
    }

    @GET
    @Path("/{taskId}/progress")
    public TaskProgressResponse progress(@PathParam("taskId") String taskId,
                                         @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        return TaskProgressResponse.from(dispatcher.progress(taskId, caller));
    }

    @DELETE
    @Path("/{taskId}/cancel")
    public CancelTaskResponse cancel(@PathParam("taskId") String taskId,
                                     @HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        CancelResult result = dispatcher.cancel(taskId, caller);
        if (result == CancelResult.ALREADY_TERMINAL) {
            return new CancelTaskResponse(taskId, "already_done", "Task already finished");
        }
        return new CancelTaskResponse(taskId, "cancel_requested",
                "Task will stop at its next checkpoint; work already done is kept");
    }

    @GET
    @Path("/active")
    public ActiveTasksResponse active(@HeaderParam(USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        List<TaskProgressResponse> tasks = dispatcher.active(caller).stream()
                .map(TaskProgressResponse::from)
                .collect(Collectors.toList());
        return new ActiveTasksResponse(tasks, tasks.size());
    }

    private static Response accepted(TaskSnapshot task, String message) {
        return Response.status(Response.Status.ACCEPTED)
                .entity(StartTaskResponse.started(task.id(), message))
                .build();
    }
}
