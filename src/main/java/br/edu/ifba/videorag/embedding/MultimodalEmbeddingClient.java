package br.edu.ifba.videorag.embedding;

import br.edu.ifba.videorag.chat.LlmChatClientExceptionMapper;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Encoder service embedding video and text into one space.
 * The response maps a modality name ({@code vision}, {@code text}) to one vector per input.
 */
@RegisterRestClient(configKey = "multimodal-embedding")
@RegisterProvider(LlmChatClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface MultimodalEmbeddingClient {

    @POST
    @Path("/encode")
    CompletionStage<Map<String, List<List<Double>>>> encode(MultimodalEmbeddingRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("multimodal-embedding.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
