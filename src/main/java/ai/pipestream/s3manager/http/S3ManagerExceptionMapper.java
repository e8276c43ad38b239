package ai.pipestream.s3manager.http;

import ai.pipestream.s3manager.exception.AccessDeniedException;
import ai.pipestream.s3manager.exception.InvalidRequestException;
import ai.pipestream.s3manager.exception.ObjectStoreException;
import ai.pipestream.s3manager.exception.S3ManagerException;
import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;
import ai.pipestream.s3manager.exception.TaskNotFoundException;
import ai.pipestream.s3manager.exception.TaskRejectedException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps the service exception hierarchy to HTTP status codes with an {@link ErrorResponse} body.
 */
@Provider
public class S3ManagerExceptionMapper implements ExceptionMapper<S3ManagerException> {

    private static final Logger LOG = Logger.getLogger(S3ManagerExceptionMapper.class);

    @Override
    public Response toResponse(S3ManagerException exception) {
        Response.Status status = statusFor(exception);
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            LOG.errorf(exception, "Request failed: %s", exception.getMessage());
        } else {
            LOG.debugf("Request rejected with %d: %s", status.getStatusCode(), exception.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getErrorCode(), exception.getDetail()))
                .build();
    }

    static Response.Status statusFor(S3ManagerException exception) {
        if (exception instanceof InvalidRequestException || exception instanceof StorageAccountNotFoundException) {
            return Response.Status.BAD_REQUEST;
        }
        if (exception instanceof AccessDeniedException) {
            return Response.Status.FORBIDDEN;
        }
        if (exception instanceof TaskNotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (exception instanceof TaskRejectedException) {
            return Response.Status.SERVICE_UNAVAILABLE;
        }
        if (exception instanceof ObjectStoreException storeException) {
            return storeException.getReason() == ObjectStoreException.Reason.NOT_FOUND
                    ? Response.Status.NOT_FOUND
                    : Response.Status.BAD_GATEWAY;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
}
