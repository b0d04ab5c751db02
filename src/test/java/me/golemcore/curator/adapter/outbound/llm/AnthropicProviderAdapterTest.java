package me.golemcore.curator.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.curator.domain.exception.ProviderException;
import me.golemcore.curator.domain.model.ErrorKind;
import me.golemcore.curator.domain.model.GenerationParameters;
import me.golemcore.curator.domain.model.ProviderCall;
import me.golemcore.curator.domain.model.ProviderConfig;
import me.golemcore.curator.domain.model.ProviderReply;
import me.golemcore.curator.domain.service.ContextWindowManager;
import me.golemcore.curator.infrastructure.config.CuratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AnthropicProviderAdapterTest {

    private ChatModel chatModel;
    private AnthropicProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        adapter = new AnthropicProviderAdapter(new ContextWindowManager(new CuratorProperties())) {
            @Override
            protected ChatModel createChatModel(ProviderCall call) {
                return chatModel;
            }
        };
    }

    @Test
    void returnsReplyWithUsage() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Lesson outline"))
                .tokenUsage(new TokenUsage(300, 90))
                .build());

        ProviderReply reply = adapter.generate(call(GenerationParameters.defaults()));

        assertEquals("anthropic", adapter.getProviderType());
        assertEquals("Lesson outline", reply.getText());
        assertEquals(300, reply.getInputTokens());
        assertEquals(90, reply.getOutputTokens());
    }

    @Test
    void overloadedServerIsTransient() {
        when(chatModel.chat(anyList())).thenThrow(new HttpException(529, "Overloaded"));

        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.generate(call(GenerationParameters.defaults())));

        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, error.getKind());
    }

    @Test
    void socketTimeoutIsTransient() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException(new SocketTimeoutException("read timed out")));

        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.generate(call(GenerationParameters.defaults())));

        assertEquals(ErrorKind.TRANSIENT_NETWORK_ERROR, error.getKind());
    }

    @Test
    void invalidRequestIsNotRetryable() {
        when(chatModel.chat(anyList())).thenThrow(new HttpException(400, "prompt is too long: 210000 tokens"));

        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.generate(call(GenerationParameters.defaults())));

        assertEquals(ErrorKind.INVALID_REQUEST, error.getKind());
        assertFalse(error.getKind().isRetryable());
    }

    @Test
    void buildsAnthropicModelWithoutExplicitMaxTokens() {
        AnthropicProviderAdapter real = new AnthropicProviderAdapter(
                new ContextWindowManager(new CuratorProperties()));

        ChatModel model = real.createChatModel(call(GenerationParameters.builder().temperature(0.5).build()));

        assertInstanceOf(AnthropicChatModel.class, model);
    }

    private static ProviderCall call(GenerationParameters parameters) {
        return ProviderCall.builder()
                .prompt("Outline a lesson on fractions")
                .model("claude-3-5-sonnet-latest")
                .parameters(parameters)
                .provider(ProviderConfig.builder().name("anthropic").type("anthropic").build())
                .apiKey("sk-ant-test")
                .timeout(Duration.ofSeconds(30))
                .maxOutputTokens(8192)
                .build();
    }
}
