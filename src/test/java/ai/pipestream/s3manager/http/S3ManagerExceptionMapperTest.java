package ai.pipestream.s3manager.http;

import ai.pipestream.s3manager.exception.AccessDeniedException;
import ai.pipestream.s3manager.exception.InvalidRequestException;
import ai.pipestream.s3manager.exception.ObjectStoreException;
import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;
import ai.pipestream.s3manager.exception.TaskNotFoundException;
import ai.pipestream.s3manager.exception.TaskRejectedException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class S3ManagerExceptionMapperTest {

    private final S3ManagerExceptionMapper mapper = new S3ManagerExceptionMapper();

    @Test
    void clientErrors() {
        assertEquals(Response.Status.BAD_REQUEST,
                S3ManagerExceptionMapper.statusFor(InvalidRequestException.missingField("deletePrefix", "prefix")));
        assertEquals(Response.Status.BAD_REQUEST,
                S3ManagerExceptionMapper.statusFor(new StorageAccountNotFoundException("nowhere")));
        assertEquals(Response.Status.FORBIDDEN,
                S3ManagerExceptionMapper.statusFor(AccessDeniedException.forTask("bob", "t-1")));
        assertEquals(Response.Status.NOT_FOUND,
                S3ManagerExceptionMapper.statusFor(new TaskNotFoundException("t-1")));
        assertEquals(Response.Status.NOT_FOUND,
                S3ManagerExceptionMapper.statusFor(ObjectStoreException.bucketNotFound("listObjects", "gone")));
    }

    @Test
    void serverErrors() {
        assertEquals(Response.Status.SERVICE_UNAVAILABLE,
                S3ManagerExceptionMapper.statusFor(new TaskRejectedException("t-1",
                        new RejectedExecutionException("shut down"))));
        assertEquals(Response.Status.BAD_GATEWAY,
                S3ManagerExceptionMapper.statusFor(ObjectStoreException.unavailable("listObjects", "b",
                        new IllegalStateException("connection refused"))));
    }

    @Test
    void bodyCarriesErrorCodeAndDetail() {
        Response response = mapper.toResponse(new TaskNotFoundException("t-1"));

        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals(404, response.getStatus());
        assertEquals("TASK_NOT_FOUND", body.errorCode());
        assertTrue(body.message().contains("t-1"));
    }
}
