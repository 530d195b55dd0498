package com.jreinhal.querygate.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.query.QueryIntent;
import com.jreinhal.querygate.util.SimpleCircuitBreaker;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;

@ExtendWith(MockitoExtension.class)
class ChatClientIntentTranslatorTest {

    private static final List<ResourceMenuEntry> MENU = List.of(new ResourceMenuEntry("sites", "Sites", List.of("site_name")));

    @Mock
    private ChatClient.Builder chatClientBuilder;

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;

    private final IntentPromptBuilder promptBuilder = new IntentPromptBuilder(100, 500);
    private final IntentParser parser = new IntentParser();

    @BeforeEach
    void setUp() {
        when(chatClientBuilder.build()).thenReturn(chatClient);
        lenient().when(chatClient.prompt()).thenReturn(requestSpec);
        lenient().when(requestSpec.system(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.user(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.call()).thenReturn(callResponseSpec);
    }

    private ChatClientIntentTranslator translator(String apiKey, long timeoutMs) {
        return new ChatClientIntentTranslator(chatClientBuilder, promptBuilder, parser, apiKey, timeoutMs, 2, 60);
    }

    @Test
    @DisplayName("Missing or placeholder API key leaves the translator unconfigured and never calls the model")
    void notConfigured() {
        ChatClientIntentTranslator unset = translator("unset", 1000);
        ChatClientIntentTranslator blank = translator("  ", 1000);

        assertThat(unset.isConfigured()).isFalse();
        assertThat(blank.isConfigured()).isFalse();
        assertThatThrownBy(() -> unset.translate("show sites", MENU)).isInstanceOf(IntentTranslationException.class);
        verify(chatClient, never()).prompt();
    }

    @Test
    @DisplayName("Model reply is parsed into an intent")
    void translatesReply() {
        when(callResponseSpec.content()).thenReturn("```json\n{\"collectionKey\":\"sites\",\"filter\":{\"site_name\":\"Pune\"}}\n```");

        QueryIntent intent = translator("sk-test", 5000).translate("show the Pune site", MENU);

        assertThat(intent.resourceKey()).isEqualTo("sites");
        verify(requestSpec).user("<USER_QUESTION>show the Pune site</USER_QUESTION>");
    }

    @Test
    @DisplayName("Blank reply is malformed, not a translation failure")
    void blankReplyIsMalformed() {
        when(callResponseSpec.content()).thenReturn(" ");

        assertThatThrownBy(() -> translator("sk-test", 5000).translate("show sites", MENU))
                .isInstanceOf(MalformedIntentException.class);
    }

    @Test
    @DisplayName("Slow model call times out")
    void timesOut() {
        when(callResponseSpec.content()).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return "{}";
        });

        assertThatThrownBy(() -> translator("sk-test", 50).translate("show sites", MENU))
                .isInstanceOf(IntentTranslationException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("Repeated failures open the circuit and stop further model calls")
    void failuresOpenCircuit() {
        when(callResponseSpec.content()).thenThrow(new RuntimeException("connection refused"));
        ChatClientIntentTranslator translator = translator("sk-test", 5000);

        assertThatThrownBy(() -> translator.translate("q1", MENU)).isInstanceOf(IntentTranslationException.class);
        assertThatThrownBy(() -> translator.translate("q2", MENU)).isInstanceOf(IntentTranslationException.class);
        assertThat(translator.circuitState()).isEqualTo(SimpleCircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> translator.translate("q3", MENU))
                .isInstanceOf(IntentTranslationException.class)
                .hasMessageContaining("circuit");
        verify(chatClient, times(2)).prompt();
    }
}
