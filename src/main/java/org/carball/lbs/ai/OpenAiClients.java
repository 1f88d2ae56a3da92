package org.carball.lbs.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.client.OpenAiApi;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.carball.lbs.config.LlmConfig;
import retrofit2.Retrofit;

import java.time.Duration;

/**
 * Builds {@link OpenAiService} instances pointed at any OpenAI-compatible endpoint, such as a
 * local Ollama server.
 */
@Slf4j
public final class OpenAiClients {

    private OpenAiClients() {
    }

    public static boolean aiDisabled() {
        return "true".equals(System.getProperty("skip.ai"));
    }

    public static OpenAiService create(LlmConfig config) {
        String baseUrl = config.getBaseUrl().endsWith("/") ? config.getBaseUrl() : config.getBaseUrl() + "/";
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());

        ObjectMapper mapper = OpenAiService.defaultObjectMapper();
        OkHttpClient client = OpenAiService.defaultClient(config.getApiKey(), timeout);
        Retrofit retrofit = OpenAiService.defaultRetrofit(client, mapper)
                .newBuilder()
                .baseUrl(baseUrl)
                .build();

        log.debug("Created OpenAI-compatible client for {} (timeout {}s)", baseUrl, config.getTimeoutSeconds());
        return new OpenAiService(retrofit.create(OpenAiApi.class), client.dispatcher().executorService());
    }
}
