package br.edu.ifba.videorag.media;

import br.edu.ifba.videorag.chat.LlmChatClientExceptionMapper;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;
import org.jboss.resteasy.reactive.PartType;
import org.jboss.resteasy.reactive.RestForm;

import java.io.File;
import java.util.concurrent.CompletionStage;

/**
 * OpenAI-compatible {@code /audio/transcriptions} endpoint, asked for a plain-text transcript.
 */
@RegisterRestClient(configKey = "speech-to-text")
@RegisterProvider(LlmChatClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface SpeechToTextClient {

    @POST
    @Path("/audio/transcriptions")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Produces(MediaType.TEXT_PLAIN)
    CompletionStage<String> transcribe(
        @RestForm("file") @PartType(MediaType.APPLICATION_OCTET_STREAM) File file,
        @RestForm("model") String model,
        @RestForm("response_format") String responseFormat,
        @RestForm("language") String language);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("speech-to-text.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
