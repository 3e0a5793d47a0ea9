package br.edu.ifba.exception;

import br.edu.ifba.videorag.media.MediaTaskException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * A media task failing inside a request, such as a submitted video path that does not exist.
 */
@Provider
public class MediaTaskExceptionMapper implements ExceptionMapper<MediaTaskException> {

    private static final Logger LOG = Logger.getLogger(MediaTaskExceptionMapper.class);
    private static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final MediaTaskException exception) {
        LOG.warnf("Media task '%s' failed: %s", exception.getTaskName(), exception.getMessage());

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Unprocessable Entity",
            UNPROCESSABLE_ENTITY,
            "Task '" + exception.getTaskName() + "' failed: " + exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(UNPROCESSABLE_ENTITY)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
