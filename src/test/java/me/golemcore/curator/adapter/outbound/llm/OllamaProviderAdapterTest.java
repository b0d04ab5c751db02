package me.golemcore.curator.adapter.outbound.llm;

import feign.Request;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.domain.model.ProviderReply;
import me.golemcore.curator.domain.service.ContextWindowManager;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import me.golemcore.curator.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OllamaProviderAdapterTest {

    private FeignClientFactory feignClientFactory;
    private OllamaProviderAdapter.OllamaApi api;
    private OllamaProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        feignClientFactory = mock(FeignClientFactory.class);
        api = mock(OllamaProviderAdapter.OllamaApi.class);
        when(feignClientFactory.create(eq(OllamaProviderAdapter.OllamaApi.class), anyString())).thenReturn(api);
        when(feignClientFactory.requestOptions(any(Duration.class))).thenAnswer(invocation -> new Request.Options(
                10, TimeUnit.SECONDS, invocation.<Duration>getArgument(0).toMillis(), TimeUnit.MILLISECONDS, true));
        adapter = new OllamaProviderAdapter(feignClientFactory, new ContextWindowManager(new CuratorProperties()));
    }

    @Test
    void needsNoCredential() {
        assertEquals("ollama", adapter.getProviderType());
        assertFalse(adapter.requiresCredential());
    }

    @Test
    void mapsParametersToOptions() {
        when(api.generate(any(), any())).thenReturn(response("ok", 12, 3));
        GenerationParameters parameters = GenerationParameters.builder()
                .temperature(0.7)
                .topP(0.95)
                .stopSequence("###")
                .build();

        adapter.generate(call(parameters, null));

        ArgumentCaptor<OllamaProviderAdapter.GenerateRequest> captor = ArgumentCaptor
                .forClass(OllamaProviderAdapter.GenerateRequest.class);
        verify(api).generate(captor.capture(), any(Request.Options.class));
        OllamaProviderAdapter.GenerateRequest request = captor.getValue();
        assertEquals("llama3.1", request.getModel());
        assertFalse(request.isStream());
        assertEquals(0.7, request.getOptions().getTemperature());
        assertEquals(0.95, request.getOptions().getTopP());
        assertEquals(2048, request.getOptions().getNumPredict());
        assertEquals(List.of("###"), request.getOptions().getStop());
    }

    @Test
    void returnsEvalCounts() {
        when(api.generate(any(), any())).thenReturn(response("Photosynthesis converts light", 42, 7));

        ProviderReply reply = adapter.generate(call(GenerationParameters.defaults(), null));

        assertEquals("Photosynthesis converts light", reply.getText());
        assertEquals(42, reply.getInputTokens());
        assertEquals(7, reply.getOutputTokens());
    }

    @Test
    void usesDefaultBaseUrlAndCachesClient() {
        when(api.generate(any(), any())).thenReturn(response("ok", 1, 1));

        adapter.generate(call(GenerationParameters.defaults(), null));
        adapter.generate(call(GenerationParameters.defaults(), null));

        verify(feignClientFactory, times(1)).create(OllamaProviderAdapter.OllamaApi.class,
                OllamaProviderAdapter.DEFAULT_BASE_URL);
    }

    @Test
    void sharesClientAcrossCallTimeoutsAndPassesTimeoutPerRequest() {
        when(api.generate(any(), any())).thenReturn(response("ok", 1, 1));

        for (int i = 0; i < 50; i++) {
            adapter.generate(call(GenerationParameters.defaults(), null, Duration.ofMillis(119000 + i)));
        }

        verify(feignClientFactory, times(1)).create(OllamaProviderAdapter.OllamaApi.class,
                OllamaProviderAdapter.DEFAULT_BASE_URL);
        ArgumentCaptor<Request.Options> options = ArgumentCaptor.forClass(Request.Options.class);
        verify(api, times(50)).generate(any(), options.capture());
        assertEquals(119000, options.getAllValues().get(0).readTimeoutMillis());
        assertEquals(119049, options.getAllValues().get(49).readTimeoutMillis());
    }

    @Test
    void usesConfiguredBaseUrl() {
        when(api.generate(any(), any())).thenReturn(response("ok", 1, 1));

        adapter.generate(call(GenerationParameters.defaults(), "http://gpu-box:11434"));

        verify(feignClientFactory).create(OllamaProviderAdapter.OllamaApi.class, "http://gpu-box:11434");
    }

    @Test
    void emptyResponseIsProviderUnavailable() {
        when(api.generate(any(), any())).thenReturn(new OllamaProviderAdapter.GenerateResponse());

        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.generate(call(GenerationParameters.defaults(), null)));

        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, error.getKind());
    }

    @Test
    void refusedConnectionIsProviderUnavailable() {
        when(api.generate(any(), any())).thenThrow(new RuntimeException(new ConnectException("Connection refused")));

        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.generate(call(GenerationParameters.defaults(), null)));

        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, error.getKind());
        assertEquals("local", error.getProvider());
    }

    private static ProviderCall call(GenerationParameters parameters, String baseUrl) {
        return call(parameters, baseUrl, Duration.ofSeconds(120));
    }

    private static ProviderCall call(GenerationParameters parameters, String baseUrl, Duration timeout) {
        return ProviderCall.builder()
                .prompt("Summarize the water cycle")
                .model("llama3.1")
                .parameters(parameters)
                .provider(ProviderConfig.builder().name("local").type("ollama").baseUrl(baseUrl).build())
                .timeout(timeout)
                .maxOutputTokens(2048)
                .build();
    }

    private static OllamaProviderAdapter.GenerateResponse response(String text, int promptEval, int eval) {
        OllamaProviderAdapter.GenerateResponse response = new OllamaProviderAdapter.GenerateResponse();
        response.setModel("llama3.1");
        response.setResponse(text);
        response.setDone(true);
        response.setPromptEvalCount(promptEval);
        response.setEvalCount(eval);
        return response;
    }
}
