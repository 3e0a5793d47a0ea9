package br.edu.ifba.videorag.chat;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the model endpoints into exceptions that carry the response body,
 * so failed calls are diagnosable from the log.
 */
public class LlmChatClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmChatClientExceptionMapper.class);
    private static final int MAX_BODY_IN_MESSAGE = 1000;

    @Override
    public RuntimeException toThrowable(final Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read error response body", e);
        }

        final int status = response.getStatus();
        final String statusInfo = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("Model API error %d %s: %s", status, statusInfo,
            responseBody == null || responseBody.isEmpty() ? "(empty body)" : responseBody);

        final String body = responseBody != null && responseBody.length() > MAX_BODY_IN_MESSAGE
            ? responseBody.substring(0, MAX_BODY_IN_MESSAGE) + "..."
            : responseBody;
        final String errorMessage = String.format(
            "Model API returned %d %s%s",
            status,
            statusInfo,
            body != null ? " - " + body : ""
        );

        return new WebApplicationException(errorMessage, response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
